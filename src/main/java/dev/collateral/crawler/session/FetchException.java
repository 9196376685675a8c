package dev.collateral.crawler.session;

/** Retrieving an asset from the portal failed. Retried up to the retry ceiling. */
public class FetchException extends Exception {
	public FetchException(String message) {
		super(message);
	}

	public FetchException(String message, Throwable cause) {
		super(message, cause);
	}
}
