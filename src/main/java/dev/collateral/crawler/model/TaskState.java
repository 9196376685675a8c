package dev.collateral.crawler.model;

/** Lifecycle of a single (product, asset kind) download */
public enum TaskState {
	PENDING,
	REQUESTED,
	DOWNLOADED,
	VALIDATED,
	FINALIZED,
	FAILED,
	PERMANENTLY_FAILED,
	/** Already finalized by an earlier run according to the ledger */
	SKIPPED,
	/** Optional asset the portal does not offer for this product */
	UNAVAILABLE;

	public boolean terminal() {
		return this == FINALIZED || this == PERMANENTLY_FAILED || this == SKIPPED || this == UNAVAILABLE;
	}
}
