package dev.collateral.crawler.session;

import java.time.Duration;

/** A bounded wait, such as CAD generation or a download, ran out of time */
public class FetchTimeoutException extends FetchException {
	public FetchTimeoutException(String operation, Duration timeout) {
		super(operation + " did not finish within " + timeout.toSeconds() + "s");
	}

	public FetchTimeoutException(String message, Throwable cause) {
		super(message, cause);
	}
}
