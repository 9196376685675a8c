package dev.collateral.crawler.session;

/** The portal rejected the credentials. Never retried, aborts the run. */
public class AuthenticationException extends Exception {
	public AuthenticationException(String message) {
		super(message);
	}

	public AuthenticationException(String message, Throwable cause) {
		super(message, cause);
	}
}
