package dev.collateral.crawler.packaging;

import dev.collateral.crawler.model.Fingerprint;
import java.nio.file.Path;

/**
 * A file promoted to its canonical location.
 *
 * @param path Absolute canonical path
 * @param relativePath Canonical path relative to the output root, with forward slashes
 * @param fingerprint Fingerprint of the promoted file
 */
public record PackagedArtifact(Path path, String relativePath, Fingerprint fingerprint) {}
