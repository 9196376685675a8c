package dev.collateral.crawler.session;

/**
 * The portal asked for authentication in the middle of a run. Recoverable by logging in again,
 * fatal when the session keeps expiring.
 */
public class SessionExpiredException extends Exception {
	public SessionExpiredException(String message) {
		super(message);
	}

	public SessionExpiredException(String message, Throwable cause) {
		super(message, cause);
	}
}
