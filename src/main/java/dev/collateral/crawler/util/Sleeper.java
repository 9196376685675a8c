package dev.collateral.crawler.util;

import java.time.Duration;

/** Suspends the current thread. Replaced in tests so backoff and polling run instantly. */
@FunctionalInterface
public interface Sleeper {
	Sleeper SYSTEM = duration -> {
		if (!duration.isZero() && !duration.isNegative()) {
			Thread.sleep(duration.toMillis());
		}
	};

	void sleep(Duration duration) throws InterruptedException;
}
