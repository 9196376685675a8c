package dev.collateral.crawler.validate;

import dev.collateral.crawler.model.AssetKind;

/** A downloaded file did not pass validation for its asset kind */
public class ValidationException extends Exception {
	private final AssetKind kind;

	public ValidationException(AssetKind kind, String reason) {
		super("Invalid " + kind.label() + ": " + reason);
		this.kind = kind;
	}

	public AssetKind kind() {
		return kind;
	}
}
