package dev.collateral.crawler.orchestrator;

import java.time.Duration;

/**
 * Bounded retry with exponential backoff.
 *
 * @param ceiling Maximum number of attempts per asset
 * @param baseDelay Delay before the first retry
 */
public record RetryPolicy(int ceiling, Duration baseDelay) {

	/** Whether no further attempt is allowed after {@code failedAttempts} failures */
	public boolean exhausted(int failedAttempts) {
		return failedAttempts >= ceiling;
	}

	/**
	 * Delay before the next attempt.
	 *
	 * @param failedAttempts Number of failed attempts so far, at least 1
	 * @return {@code baseDelay * 2^(failedAttempts - 1)}
	 */
	public Duration backoff(int failedAttempts) {
		int exponent = Math.min(Math.max(failedAttempts - 1, 0), 16);
		return baseDelay.multipliedBy(1L << exponent);
	}
}
