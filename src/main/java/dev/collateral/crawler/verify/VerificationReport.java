package dev.collateral.crawler.verify;

import java.util.List;

/**
 * Findings for one product directory.
 *
 * @param product The model code, i.e. the directory name
 * @param issues Problems that remain
 * @param fixes Repairs that were made, or would be made in a dry run
 */
public record VerificationReport(String product, List<String> issues, List<String> fixes) {

	public VerificationReport {
		issues = List.copyOf(issues);
		fixes = List.copyOf(fixes);
	}

	public boolean ok() {
		return issues.isEmpty();
	}

	@Override
	public String toString() {
		return product + ": " + (ok() ? "OK" : "WARN");
	}
}
