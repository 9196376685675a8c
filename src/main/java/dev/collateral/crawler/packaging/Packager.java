package dev.collateral.crawler.packaging;

import dev.collateral.crawler.model.AssetCatalog;
import dev.collateral.crawler.model.AssetKind;
import dev.collateral.crawler.model.Fingerprint;
import dev.collateral.crawler.model.Product;
import dev.collateral.crawler.util.ArchiveUtils;
import dev.collateral.crawler.util.FileUtils;
import dev.collateral.crawler.util.HashUtils;
import dev.collateral.crawler.validate.ArtifactValidator;
import dev.collateral.crawler.validate.ValidationResult;
import java.io.File;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves validated downloads into the canonical output layout. A canonical path either does not
 * exist or holds a complete file: every artifact is first written to a temporary sibling, checked
 * again and then renamed into place.
 */
public class Packager {
	private static final Logger logger = LoggerFactory.getLogger(Packager.class);

	private static final String PART_MARKER = ".part-";

	private final Path outputRoot;
	private final ArtifactValidator validator;
	private final PromotionHook hook;

	public Packager(Path outputRoot, ArtifactValidator validator) {
		this(outputRoot, validator, PromotionHook.NONE);
	}

	public Packager(Path outputRoot, ArtifactValidator validator, PromotionHook hook) {
		this.outputRoot = outputRoot;
		this.validator = validator;
		this.hook = hook;
	}

	public Path outputRoot() {
		return outputRoot;
	}

	/**
	 * Canonical location of an asset.
	 *
	 * @param product The product
	 * @param kind The asset kind
	 * @param source The delivered file, used to pick the image extension, may be null
	 * @return {@code <root>/<model>/<model><suffix>.<ext>}, images below {@code Images/}
	 */
	public Path canonicalPath(Product product, AssetKind kind, Path source) {
		String sourceName = source == null ? null : source.getFileName().toString();
		String ext = AssetCatalog.extensionFor(kind, sourceName);
		return outputRoot.resolve(AssetCatalog.canonicalRelativePath(product.modelCode(), kind, ext));
	}

	/** Path of a canonical file relative to the output root, always with forward slashes */
	public String relativize(Path canonical) {
		return outputRoot.relativize(canonical).toString().replace(File.separatorChar, '/');
	}

	/**
	 * Promote a validated download to its canonical path. CAD kinds end up as zip archives, a raw
	 * CAD file is wrapped into a new archive under its original name.
	 *
	 * @param product The product
	 * @param kind The asset kind
	 * @param source The validated download, left in place
	 * @return The promoted artifact
	 * @throws PackagingException if the artifact could not be written or failed verification. No
	 *     temporary file remains in that case.
	 */
	public PackagedArtifact pack(Product product, AssetKind kind, Path source) throws PackagingException {
		Path target = canonicalPath(product, kind, source);
		Path temp = null;
		try {
			Path dir = target.getParent();
			FileUtils.ensureDirectory(dir);
			removeStaleParts(target);
			temp = dir.resolve(target.getFileName() + PART_MARKER
					+ UUID.randomUUID().toString().substring(0, 8));

			if (kind.archive() && !ArchiveUtils.isZip(source)) {
				logger.debug("Wrapping {} into {}", source.getFileName(), target.getFileName());
				ArchiveUtils.wrapInZip(source, source.getFileName().toString(), temp);
			} else {
				Files.copy(source, temp);
			}

			ValidationResult check = validator.validate(temp, kind);
			if (!check.valid()) {
				throw new PackagingException(
						"Packaged " + kind.label() + " for " + product + " failed verification: " + check.reason());
			}
			Fingerprint fingerprint = new Fingerprint(Files.size(temp), HashUtils.sha256(temp), check.signature());

			hook.beforePromote(temp, target);
			FileUtils.moveIntoPlace(temp, target);
			temp = null;

			logger.debug("Promoted {} ({} bytes)", target, fingerprint.size());
			return new PackagedArtifact(target, relativize(target), fingerprint);
		} catch (IOException e) {
			throw new PackagingException("Failed to package " + kind.label() + " for " + product + " into " + target
					+ ": " + e.getMessage(), e);
		} finally {
			if (temp != null) {
				deleteTemp(temp);
			}
		}
	}

	// Leftovers of a run that was killed between temp write and rename
	private void removeStaleParts(Path target) throws IOException {
		String prefix = target.getFileName() + PART_MARKER;
		try (DirectoryStream<Path> stream = Files.newDirectoryStream(
				target.getParent(), p -> p.getFileName().toString().startsWith(prefix))) {
			for (Path stale : stream) {
				logger.info("Removing stale partial file {}", stale);
				Files.deleteIfExists(stale);
			}
		}
	}

	private void deleteTemp(Path temp) {
		try {
			Files.deleteIfExists(temp);
		} catch (IOException e) {
			logger.warn("Could not remove temporary file {}: {}", temp, e.getMessage());
		}
	}
}
