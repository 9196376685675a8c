package dev.collateral.crawler.packaging;

/** Moving a validated download to its canonical location failed */
public class PackagingException extends Exception {
	public PackagingException(String message) {
		super(message);
	}

	public PackagingException(String message, Throwable cause) {
		super(message, cause);
	}
}
