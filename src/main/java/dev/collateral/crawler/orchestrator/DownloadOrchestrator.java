package dev.collateral.crawler.orchestrator;

import dev.collateral.crawler.ledger.ResumeLedger;
import dev.collateral.crawler.model.AssetCatalog;
import dev.collateral.crawler.model.AssetKind;
import dev.collateral.crawler.model.DownloadTask;
import dev.collateral.crawler.model.LedgerEntry;
import dev.collateral.crawler.model.Product;
import dev.collateral.crawler.model.TaskState;
import dev.collateral.crawler.packaging.PackagedArtifact;
import dev.collateral.crawler.packaging.Packager;
import dev.collateral.crawler.packaging.PackagingException;
import dev.collateral.crawler.session.AuthenticationException;
import dev.collateral.crawler.session.FetchException;
import dev.collateral.crawler.session.SessionCapability;
import dev.collateral.crawler.session.SessionExpiredException;
import dev.collateral.crawler.session.SessionTracker;
import dev.collateral.crawler.util.FileUtils;
import dev.collateral.crawler.util.Sleeper;
import dev.collateral.crawler.validate.ArtifactValidator;
import dev.collateral.crawler.validate.ValidationException;
import dev.collateral.crawler.validate.ValidationResult;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives the download of all assets of a sequence of products through one session.
 *
 * <p>For every product the assets are processed in {@link AssetCatalog#processingOrder()}. An asset
 * is skipped when the ledger knows it and its canonical file is still intact. Otherwise it is
 * fetched, validated, packaged and committed to the ledger, in that order, with bounded retries.
 * A failing asset never stops the other assets of the product, only authentication failures and a
 * session that keeps expiring abort the run.
 */
public class DownloadOrchestrator {
	private static final Logger logger = LoggerFactory.getLogger(DownloadOrchestrator.class);

	private final SessionCapability session;
	private final SessionTracker tracker;
	private final ResumeLedger ledger;
	private final ArtifactValidator validator;
	private final Packager packager;
	private final RunConfig config;
	private final RetryPolicy retryPolicy;
	private final Sleeper sleeper;

	public DownloadOrchestrator(
			SessionCapability session,
			SessionTracker tracker,
			ResumeLedger ledger,
			ArtifactValidator validator,
			Packager packager,
			RunConfig config,
			Sleeper sleeper) {
		this.session = session;
		this.tracker = tracker;
		this.ledger = ledger;
		this.validator = validator;
		this.packager = packager;
		this.config = config;
		this.retryPolicy = config.retryPolicy();
		this.sleeper = sleeper;
	}

	/**
	 * Process products until the source is exhausted, the product limit is reached or a fatal error
	 * occurs. Model codes seen before in this run are skipped.
	 *
	 * @param products The products in processing order
	 * @return The summary, never null
	 */
	public RunSummary run(Iterable<Product> products) {
		List<ProductSummary> done = new ArrayList<>();
		Set<String> seen = new HashSet<>();
		try {
			Iterator<Product> it = products.iterator();
			while (true) {
				// checked before hasNext(), a paged source would fetch the next page
				if (config.maxProducts() > 0 && done.size() >= config.maxProducts()) {
					logger.info("Reached limit of {} products, stopping", config.maxProducts());
					break;
				}
				if (!it.hasNext()) {
					break;
				}
				Product product = it.next();
				if (!seen.add(product.modelCode())) {
					logger.warn("Skipping duplicate product {}", product);
					continue;
				}
				checkInterrupted();
				if (!done.isEmpty()) {
					sleeper.sleep(config.productDelay());
				}
				done.add(processProduct(product));
			}
		} catch (AuthenticationException | SessionExpiredException e) {
			logger.error("Run aborted: {}", e.getMessage());
			return finish(RunSummary.aborted(done, e));
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.warn("Run interrupted after {} products", done.size());
			return finish(RunSummary.aborted(done, e));
		} catch (UncheckedIOException e) {
			logger.error("Run aborted, product enumeration failed: {}", e.getMessage());
			return finish(RunSummary.aborted(done, e));
		}
		return finish(RunSummary.completed(done));
	}

	/**
	 * Process all assets of one product.
	 *
	 * @throws AuthenticationException if the credentials were rejected
	 * @throws SessionExpiredException if the session kept expiring
	 * @throws InterruptedException if the thread was interrupted, the product is left incomplete
	 */
	public ProductSummary processProduct(Product product)
			throws AuthenticationException, SessionExpiredException, InterruptedException {
		logger.info("Processing {}{}", product, product.series() != null ? " (" + product.series() + ")" : "");
		Map<AssetKind, DownloadTask> tasks = new EnumMap<>(AssetKind.class);
		for (AssetKind kind : AssetCatalog.processingOrder()) {
			tasks.put(kind, new DownloadTask(product, kind));
		}

		Path workRoot = config.downloadDir().resolve(product.modelCode());
		try {
			for (DownloadTask task : tasks.values()) {
				if (!config.overwrite()) {
					trustedFile(product, task.kind()).ifPresent(task::skipped);
				}
			}
			if (tasks.values().stream().anyMatch(t -> !t.state().terminal())) {
				markUnavailable(product, tasks);
				if (session.supportsBatch()) {
					runBatch(product, tasks, workRoot);
				}
				for (DownloadTask task : tasks.values()) {
					runTask(task, workRoot);
				}
			}
		} finally {
			if (!config.keepDownloads()) {
				FileUtils.deleteDirectory(workRoot);
			}
		}

		ProductSummary summary = ProductSummary.of(product.modelCode(), tasks.values());
		if (summary.complete()) {
			writeCompleteMarker(product);
		}
		logger.info("{}", summary);
		return summary;
	}

	/** Optional kinds the portal does not list are not requested at all */
	private void markUnavailable(Product product, Map<AssetKind, DownloadTask> tasks)
			throws AuthenticationException, SessionExpiredException, InterruptedException {
		if (tasks.values().stream().noneMatch(t -> t.kind().optional() && t.state() == TaskState.PENDING)) {
			return;
		}
		Set<AssetKind> offered = offeredAssets(product);
		if (offered == null) {
			return;
		}
		for (DownloadTask task : tasks.values()) {
			if (task.kind().optional() && task.state() == TaskState.PENDING && !offered.contains(task.kind())) {
				logger.debug("{} {} is not offered", product, task.kind().label());
				task.unavailable();
			}
		}
	}

	// null when the listing could not be retrieved, every kind is attempted then
	private Set<AssetKind> offeredAssets(Product product)
			throws AuthenticationException, SessionExpiredException, InterruptedException {
		while (true) {
			try {
				tracker.ensureAuthenticated();
				Set<AssetKind> offered = session.listAssets(product);
				tracker.confirmActive();
				return offered;
			} catch (SessionExpiredException e) {
				tracker.markExpired(e);
			} catch (FetchException e) {
				logger.warn("Could not list assets of {}, trying all kinds: {}", product, e.getMessage());
				return null;
			}
		}
	}

	/**
	 * Request the pending required kinds in one combined download. Kinds that are missing from the
	 * delivery or fail validation count as one failed attempt and continue on the individual path.
	 */
	private void runBatch(Product product, Map<AssetKind, DownloadTask> tasks, Path workRoot)
			throws AuthenticationException, SessionExpiredException, InterruptedException {
		Set<AssetKind> wanted = EnumSet.noneOf(AssetKind.class);
		for (AssetKind kind : AssetCatalog.batchGroup()) {
			if (tasks.get(kind).state() == TaskState.PENDING) {
				wanted.add(kind);
			}
		}
		if (wanted.isEmpty()) {
			return;
		}
		checkInterrupted();
		wanted.forEach(kind -> tasks.get(kind).requested());

		Map<AssetKind, Path> delivered;
		try {
			Path workDir = FileUtils.freshDirectory(workRoot.resolve("batch"));
			tracker.ensureAuthenticated();
			delivered = session.fetchBatch(product, wanted, workDir);
			tracker.confirmActive();
		} catch (SessionExpiredException e) {
			wanted.forEach(kind -> tasks.get(kind).resubmit("session expired"));
			tracker.markExpired(e);
			return;
		} catch (FetchException | IOException e) {
			logger.warn("Combined download for {} failed: {}", product, e.getMessage());
			wanted.forEach(kind -> tasks.get(kind).failed("combined download failed: " + e.getMessage()));
			return;
		}

		for (AssetKind kind : wanted) {
			DownloadTask task = tasks.get(kind);
			Path file = delivered.get(kind);
			if (file == null) {
				logger.info("{} {} missing from combined download", product, kind.label());
				task.failed("missing from combined download");
				continue;
			}
			accept(task, file);
		}
	}

	private void runTask(DownloadTask task, Path workRoot)
			throws AuthenticationException, SessionExpiredException, InterruptedException {
		while (!task.state().terminal()) {
			if (task.state() == TaskState.FAILED) {
				if (retryPolicy.exhausted(task.attempts())) {
					task.permanentlyFailed();
					logger.warn(
							"Giving up on {} {} after {} attempts: {}",
							task.product(),
							task.kind().label(),
							task.attempts(),
							task.lastFailure());
					return;
				}
				logger.info(
						"Retrying {} {} (attempt {}/{})",
						task.product(),
						task.kind().label(),
						task.attempts() + 1,
						retryPolicy.ceiling());
				sleeper.sleep(retryPolicy.backoff(task.attempts()));
			}
			checkInterrupted();
			attempt(task, workRoot);
		}
	}

	private void attempt(DownloadTask task, Path workRoot)
			throws AuthenticationException, SessionExpiredException, InterruptedException {
		task.requested();
		Path workDir;
		try {
			workDir = FileUtils.freshDirectory(workRoot.resolve(task.kind().label() + "-" + (task.attempts() + 1)));
		} catch (IOException e) {
			task.failed("could not prepare download directory: " + e.getMessage());
			return;
		}
		Path file;
		try {
			tracker.ensureAuthenticated();
			file = session.fetch(task.product(), task.kind(), workDir);
			tracker.confirmActive();
		} catch (SessionExpiredException e) {
			task.resubmit("session expired");
			tracker.markExpired(e);
			return;
		} catch (FetchException e) {
			logger.warn("Fetching {} {} failed: {}", task.product(), task.kind().label(), e.getMessage());
			task.failed(e.getMessage());
			return;
		}
		accept(task, file);
	}

	/** Validate, package and commit a delivered file. Failures are recorded on the task. */
	private void accept(DownloadTask task, Path file) {
		Product product = task.product();
		AssetKind kind = task.kind();
		try {
			if (file == null || !Files.isRegularFile(file)) {
				throw new FetchException("no file was delivered");
			}
			task.downloaded(file);
			ValidationResult result = validator.validate(file, kind);
			if (!result.valid()) {
				throw new ValidationException(kind, result.reason());
			}
			task.validated();
			PackagedArtifact artifact = packager.pack(product, kind, file);
			ledger.markCompleted(product.modelCode(), kind, artifact.relativePath(), artifact.fingerprint());
			task.finalized(artifact.path());
			logger.info("Finalized {}", artifact.relativePath());
		} catch (FetchException | ValidationException | PackagingException e) {
			logger.warn("{} {}: {}", product, kind.label(), e.getMessage());
			task.failed(e.getMessage());
		} catch (IOException e) {
			logger.warn("Could not record {} {} in the ledger: {}", product, kind.label(), e.getMessage());
			task.failed("ledger commit failed: " + e.getMessage());
		}
	}

	/** The canonical file of a ledger entry, if the entry exists and the file is still intact */
	private Optional<Path> trustedFile(Product product, AssetKind kind) {
		Optional<LedgerEntry> entry = ledger.entry(product.modelCode(), kind);
		if (entry.isEmpty()) {
			return Optional.empty();
		}
		Path file = packager.outputRoot().resolve(entry.get().path());
		try {
			if (Files.isRegularFile(file) && Files.size(file) == entry.get().size()) {
				logger.debug("Skipping {} {} (already finalized)", product, kind.label());
				return Optional.of(file);
			}
		} catch (IOException e) {
			logger.debug("Could not inspect {}: {}", file, e.getMessage());
		}
		logger.warn("Ledger entry for {} {} no longer matches {}, fetching again", product, kind.label(), file);
		return Optional.empty();
	}

	private void writeCompleteMarker(Product product) {
		Path marker = packager.outputRoot().resolve(product.modelCode()).resolve(AssetCatalog.COMPLETE_MARKER);
		if (Files.exists(marker)) {
			return;
		}
		try {
			FileUtils.ensureDirectory(marker.getParent());
			Files.writeString(marker, Instant.now().toString() + "\n");
		} catch (IOException e) {
			logger.warn("Could not write completion marker for {}: {}", product, e.getMessage());
		}
	}

	private RunSummary finish(RunSummary summary) {
		try {
			ledger.flush();
		} catch (IOException e) {
			logger.error("Failed to flush ledger {}: {}", ledger.file(), e.getMessage());
		}
		logger.info("Run finished: {}", summary);
		return summary;
	}

	private static void checkInterrupted() throws InterruptedException {
		if (Thread.interrupted()) {
			throw new InterruptedException("Run interrupted");
		}
	}
}
