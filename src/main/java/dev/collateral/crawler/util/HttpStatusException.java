package dev.collateral.crawler.util;

import java.io.IOException;

/** An HTTP request was answered with a non-2xx status */
public class HttpStatusException extends IOException {
	private final int statusCode;

	public HttpStatusException(String url, int statusCode) {
		super("HTTP status " + statusCode + " for " + url);
		this.statusCode = statusCode;
	}

	public int statusCode() {
		return statusCode;
	}

	/** 401 and 403, the server wants a (new) login */
	public boolean authRequired() {
		return statusCode == 401 || statusCode == 403;
	}

	/** 4xx answers other than 408 and 429 will not change on retry */
	public boolean clientError() {
		return statusCode >= 400 && statusCode < 500 && statusCode != 408 && statusCode != 429;
	}
}
