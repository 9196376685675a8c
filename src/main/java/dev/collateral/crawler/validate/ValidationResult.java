package dev.collateral.crawler.validate;

/**
 * Outcome of validating a downloaded file.
 *
 * @param valid Whether the file passed
 * @param reason Short diagnostic for logs, never null
 * @param signature Container type that was recognized, null when validation failed
 */
public record ValidationResult(boolean valid, String reason, String signature) {

	public static ValidationResult ok(String signature) {
		return new ValidationResult(true, "ok", signature);
	}

	public static ValidationResult fail(String reason) {
		return new ValidationResult(false, reason, null);
	}

	@Override
	public String toString() {
		return valid ? "VALID (%s)".formatted(signature) : "INVALID - %s".formatted(reason);
	}
}
