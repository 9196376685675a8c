package dev.collateral.crawler.verify;

import dev.collateral.crawler.ledger.ResumeLedger;
import dev.collateral.crawler.model.AssetCatalog;
import dev.collateral.crawler.model.AssetKind;
import dev.collateral.crawler.model.Fingerprint;
import dev.collateral.crawler.model.LedgerEntry;
import dev.collateral.crawler.orchestrator.RunConfig;
import dev.collateral.crawler.util.ArchiveUtils;
import dev.collateral.crawler.util.FileUtils;
import dev.collateral.crawler.util.HashUtils;
import dev.collateral.crawler.validate.ArtifactValidator;
import dev.collateral.crawler.validate.ValidationResult;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Audits and repairs an output tree after a crawl. Per product directory it removes duplicate
 * files of the same kind (keeping the largest), deletes invalid PDFs, strips everything but CAD
 * files from the DXF and STEP archives and reports missing required assets and images.
 *
 * <p>A cleaned archive is recorded again in the resume ledger of its output root, so the next crawl
 * still trusts it. A dry run only reports what would be repaired.
 */
public class OutputVerifier {
	private static final Logger logger = LoggerFactory.getLogger(OutputVerifier.class);

	private final ArtifactValidator validator = new ArtifactValidator();
	private final boolean dryRun;
	private final boolean includeIncomplete;
	private final Path ledgerFile;

	public OutputVerifier(boolean dryRun, boolean includeIncomplete) {
		this(dryRun, includeIncomplete, null);
	}

	/**
	 * @param dryRun Report repairs without making them
	 * @param includeIncomplete Also check directories without completion marker
	 * @param ledgerFile Resume ledger to update for every root, null for the default ledger of each root
	 */
	public OutputVerifier(boolean dryRun, boolean includeIncomplete, Path ledgerFile) {
		this.dryRun = dryRun;
		this.includeIncomplete = includeIncomplete;
		this.ledgerFile = ledgerFile;
	}

	/**
	 * Verify every product directory below the given roots. Roots that do not exist are skipped.
	 *
	 * @return One report per verified product directory, ordered by root and name
	 */
	public List<VerificationReport> verifyRoots(List<Path> roots) throws IOException {
		List<VerificationReport> reports = new ArrayList<>();
		for (Path root : roots) {
			if (!Files.isDirectory(root)) {
				logger.warn("Skipping missing output root {}", root);
				continue;
			}
			List<Path> productDirs;
			try (Stream<Path> children = Files.list(root)) {
				productDirs = children.filter(Files::isDirectory)
						.filter(dir -> !dir.getFileName().toString().startsWith("."))
						.sorted()
						.collect(Collectors.toList());
			}
			Path ledgerPath = ledgerFile != null ? ledgerFile : root.resolve(RunConfig.DEFAULT_LEDGER_NAME);
			try (ResumeLedger ledger = openLedger(ledgerPath)) {
				for (Path dir : productDirs) {
					if (!includeIncomplete && !Files.exists(dir.resolve(AssetCatalog.COMPLETE_MARKER))) {
						logger.debug("Skipping {} (not marked complete)", dir);
						continue;
					}
					reports.add(verifyProduct(dir, ledger));
				}
			}
		}
		return reports;
	}

	public VerificationReport verifyProduct(Path productDir) throws IOException {
		return verifyProduct(productDir, null);
	}

	/**
	 * Verify one product directory.
	 *
	 * @param productDir Directory named after the product model code
	 * @param ledger Ledger to record repaired files in, may be null
	 */
	public VerificationReport verifyProduct(Path productDir, ResumeLedger ledger) throws IOException {
		String product = productDir.getFileName().toString();
		List<String> issues = new ArrayList<>();
		List<String> fixes = new ArrayList<>();

		Map<AssetKind, List<Path>> buckets = collectByKind(productDir);
		removeDuplicates(buckets, fixes);

		for (AssetKind kind : AssetCatalog.processingOrder()) {
			if (kind.required() && buckets.get(kind).isEmpty()) {
				issues.add("Missing required " + suffixOf(kind));
			}
		}

		for (Map.Entry<AssetKind, List<Path>> bucket : buckets.entrySet()) {
			AssetKind kind = bucket.getKey();
			for (Path file : bucket.getValue()) {
				if (kind.pdf()) {
					checkPdf(file, kind, issues, fixes);
				} else if (kind.archive()) {
					checkCadArchive(file, kind, ledger, issues, fixes);
				}
			}
		}

		if (!hasImage(productDir.resolve(AssetCatalog.IMAGES_DIR))) {
			issues.add("Missing or invalid product image in " + AssetCatalog.IMAGES_DIR + "/");
		}

		VerificationReport report = new VerificationReport(product, issues, fixes);
		logger.debug("{}", report);
		return report;
	}

	// Files of the product directory grouped by the kind their name ends with
	private Map<AssetKind, List<Path>> collectByKind(Path productDir) throws IOException {
		Map<AssetKind, List<Path>> buckets = new LinkedHashMap<>();
		for (AssetKind kind : AssetCatalog.processingOrder()) {
			if (kind != AssetKind.IMAGE) {
				buckets.put(kind, new ArrayList<>());
			}
		}
		try (Stream<Path> children = Files.list(productDir)) {
			for (Path file : children.filter(Files::isRegularFile).sorted().collect(Collectors.toList())) {
				String name = file.getFileName().toString();
				for (AssetKind kind : buckets.keySet()) {
					if (name.endsWith(suffixOf(kind))) {
						buckets.get(kind).add(file);
						break;
					}
				}
			}
		}
		return buckets;
	}

	private void removeDuplicates(Map<AssetKind, List<Path>> buckets, List<String> fixes) throws IOException {
		for (Map.Entry<AssetKind, List<Path>> bucket : buckets.entrySet()) {
			List<Path> files = bucket.getValue();
			if (files.size() <= 1) {
				continue;
			}
			Path keep = files.stream().max(Comparator.comparingLong(OutputVerifier::sizeOf)).orElseThrow();
			List<Path> remove = files.stream().filter(f -> !f.equals(keep)).collect(Collectors.toList());
			for (Path file : remove) {
				delete(file);
			}
			fixes.add((dryRun ? "Would remove" : "Removed") + " duplicate " + suffixOf(bucket.getKey()) + ": "
					+ remove.stream().map(p -> p.getFileName().toString()).collect(Collectors.joining(", ")));
			bucket.setValue(new ArrayList<>(List.of(keep)));
		}
	}

	private void checkPdf(Path file, AssetKind kind, List<String> issues, List<String> fixes) throws IOException {
		ValidationResult result = validator.validate(file, kind);
		if (result.valid()) {
			return;
		}
		issues.add("Invalid PDF: " + file.getFileName() + " (" + result.reason() + ")");
		delete(file);
		fixes.add((dryRun ? "Would delete" : "Deleted") + " invalid PDF: " + file.getFileName());
	}

	private void checkCadArchive(
			Path zip, AssetKind kind, ResumeLedger ledger, List<String> issues, List<String> fixes) {
		Set<String> extensions = AssetCatalog.cadExtensions(kind);
		String label = kind == AssetKind.DXF ? "DXF" : "STEP";
		List<String> entries;
		try {
			entries = ArchiveUtils.listEntries(zip);
		} catch (IOException e) {
			issues.add("Corrupt " + label + " zip: " + zip.getFileName());
			return;
		}
		List<String> cadEntries = entries.stream()
				.filter(n -> extensions.contains(FileUtils.extension(n)))
				.collect(Collectors.toList());
		if (cadEntries.isEmpty()) {
			issues.add(label + " zip has no " + extensions.stream().sorted().map(e -> "." + e)
					.collect(Collectors.joining("/")) + " entry: " + zip.getFileName());
			return;
		}
		boolean needsCleaning = cadEntries.size() != entries.size() || cadEntries.stream().anyMatch(n -> n.contains("/"));
		if (!needsCleaning) {
			return;
		}
		if (dryRun) {
			fixes.add("Would clean " + label + " zip " + zip.getFileName());
			return;
		}
		ArchiveUtils.RetainResult result;
		try {
			result = ArchiveUtils.retainEntries(zip, extensions);
		} catch (IOException e) {
			issues.add("Could not clean " + label + " zip " + zip.getFileName() + ": " + e.getMessage());
			return;
		}
		if (!result.changed()) {
			return;
		}
		fixes.add("Cleaned " + label + " zip: kept " + result.kept());
		try {
			recordRepair(ledger, zip, kind);
		} catch (IOException e) {
			issues.add("Could not update ledger for " + zip.getFileName() + ": " + e.getMessage());
		}
	}

	// Refresh the ledger entry whose canonical file was rewritten in place
	private void recordRepair(ResumeLedger ledger, Path file, AssetKind kind) throws IOException {
		if (ledger == null) {
			return;
		}
		Path productDir = file.getParent();
		String model = productDir.getFileName().toString();
		Optional<LedgerEntry> entry = ledger.entry(model, kind);
		if (entry.isEmpty()) {
			return;
		}
		Path recorded = productDir.getParent().resolve(entry.get().path()).toAbsolutePath().normalize();
		if (!recorded.equals(file.toAbsolutePath().normalize())) {
			return;
		}
		ValidationResult check = validator.validate(file, kind);
		if (!check.valid()) {
			logger.warn("Repaired {} no longer validates ({}), leaving ledger entry as is", file, check.reason());
			return;
		}
		ledger.markCompleted(model, kind, entry.get().path(),
				new Fingerprint(Files.size(file), HashUtils.sha256(file), check.signature()));
		logger.info("Updated ledger entry of {} {}", model, kind.label());
	}

	private ResumeLedger openLedger(Path file) throws IOException {
		if (dryRun || !Files.isRegularFile(file)) {
			return null;
		}
		ResumeLedger ledger = new ResumeLedger(file);
		ledger.load();
		return ledger;
	}

	private boolean hasImage(Path imagesDir) throws IOException {
		if (!Files.isDirectory(imagesDir)) {
			return false;
		}
		try (Stream<Path> images = Files.list(imagesDir)) {
			return images.filter(Files::isRegularFile)
					.filter(p -> AssetCatalog.IMAGE_EXTENSIONS.contains(FileUtils.extension(p.getFileName().toString())))
					.anyMatch(p -> sizeOf(p) > 0);
		}
	}

	private void delete(Path file) throws IOException {
		if (dryRun) {
			return;
		}
		Files.deleteIfExists(file);
		logger.info("Deleted {}", file);
	}

	private static String suffixOf(AssetKind kind) {
		return kind.suffix() + "." + kind.extension();
	}

	private static long sizeOf(Path file) {
		try {
			return Files.size(file);
		} catch (IOException e) {
			return -1;
		}
	}
}
