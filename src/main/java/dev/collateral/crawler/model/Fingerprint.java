package dev.collateral.crawler.model;

/**
 * Content fingerprint of a finalized asset, used to decide whether a file from an earlier run can
 * be trusted without fetching it again.
 *
 * @param size Size of the canonical file in bytes
 * @param sha256 Hex encoded SHA-256 of the canonical file
 * @param signature Container type the validator recognized, e.g. {@code pdf} or {@code zip}
 */
public record Fingerprint(long size, String sha256, String signature) {}
