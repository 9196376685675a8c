package dev.collateral.crawler.orchestrator;

import dev.collateral.crawler.session.CadGenerationProtocol;
import dev.collateral.crawler.session.SessionTracker;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Settings of one crawl run.
 *
 * @param outputRoot Root of the canonical output layout
 * @param ledgerFile The resume ledger
 * @param downloadDir Scratch directory for downloads in progress
 * @param overwrite Fetch assets again even when the ledger says they are done
 * @param maxProducts Stop after this many products, 0 for no limit
 * @param operationTimeout Upper bound for downloads and CAD generation
 * @param retryCeiling Attempts per asset before it is given up
 * @param baseDelay Backoff before the first retry, doubled for every further retry
 * @param productDelay Pause between two products
 * @param reauthLimit Re-authentications allowed after consecutive session expiries
 * @param cadFormat Format profile selected in the CAD generation portal
 * @param keepDownloads Keep the scratch directories after a product is done
 * @param minSize Smallest acceptable asset size in bytes
 */
public record RunConfig(
		Path outputRoot,
		Path ledgerFile,
		Path downloadDir,
		boolean overwrite,
		int maxProducts,
		Duration operationTimeout,
		int retryCeiling,
		Duration baseDelay,
		Duration productDelay,
		int reauthLimit,
		String cadFormat,
		boolean keepDownloads,
		long minSize) {

	public static final String DEFAULT_LEDGER_NAME = ".crawl-ledger.jsonl";
	public static final String DEFAULT_DOWNLOAD_DIR_NAME = ".downloads";

	public RetryPolicy retryPolicy() {
		return new RetryPolicy(retryCeiling, baseDelay);
	}

	public static Builder builder(Path outputRoot) {
		return new Builder(outputRoot);
	}

	/** Builder starting from the defaults of the command line */
	public static class Builder {
		private final Path outputRoot;
		private Path ledgerFile;
		private Path downloadDir;
		private boolean overwrite;
		private int maxProducts;
		private Duration operationTimeout = Duration.ofMinutes(5);
		private int retryCeiling = 3;
		private Duration baseDelay = Duration.ofSeconds(2);
		private Duration productDelay = Duration.ZERO;
		private int reauthLimit = SessionTracker.DEFAULT_REAUTH_LIMIT;
		private String cadFormat = CadGenerationProtocol.DEFAULT_FORMAT;
		private boolean keepDownloads;
		private long minSize = 1;

		private Builder(Path outputRoot) {
			this.outputRoot = outputRoot;
		}

		public Builder ledgerFile(Path ledgerFile) {
			this.ledgerFile = ledgerFile;
			return this;
		}

		public Builder downloadDir(Path downloadDir) {
			this.downloadDir = downloadDir;
			return this;
		}

		public Builder overwrite(boolean overwrite) {
			this.overwrite = overwrite;
			return this;
		}

		public Builder maxProducts(int maxProducts) {
			this.maxProducts = maxProducts;
			return this;
		}

		public Builder operationTimeout(Duration operationTimeout) {
			this.operationTimeout = operationTimeout;
			return this;
		}

		public Builder retryCeiling(int retryCeiling) {
			this.retryCeiling = retryCeiling;
			return this;
		}

		public Builder baseDelay(Duration baseDelay) {
			this.baseDelay = baseDelay;
			return this;
		}

		public Builder productDelay(Duration productDelay) {
			this.productDelay = productDelay;
			return this;
		}

		public Builder reauthLimit(int reauthLimit) {
			this.reauthLimit = reauthLimit;
			return this;
		}

		public Builder cadFormat(String cadFormat) {
			this.cadFormat = cadFormat;
			return this;
		}

		public Builder keepDownloads(boolean keepDownloads) {
			this.keepDownloads = keepDownloads;
			return this;
		}

		public Builder minSize(long minSize) {
			this.minSize = minSize;
			return this;
		}

		public RunConfig build() {
			return new RunConfig(
					outputRoot,
					ledgerFile != null ? ledgerFile : outputRoot.resolve(DEFAULT_LEDGER_NAME),
					downloadDir != null ? downloadDir : outputRoot.resolve(DEFAULT_DOWNLOAD_DIR_NAME),
					overwrite,
					maxProducts,
					operationTimeout,
					Math.max(1, retryCeiling),
					baseDelay,
					productDelay,
					reauthLimit,
					cadFormat,
					keepDownloads,
					minSize);
		}
	}
}
