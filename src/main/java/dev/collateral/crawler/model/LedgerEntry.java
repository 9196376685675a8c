package dev.collateral.crawler.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/** One completion record of the resume ledger */
@JsonPropertyOrder({"model", "kind", "path", "size", "sha256", "signature", "completed_at"})
public record LedgerEntry(
		@JsonProperty("model") String modelCode,
		@JsonProperty("kind") AssetKind kind,
		@JsonProperty("path") String path,
		@JsonProperty("size") long size,
		@JsonProperty("sha256") String sha256,
		@JsonProperty("signature") String signature,
		@JsonProperty("completed_at") String completedAt) {

	public static LedgerEntry of(String modelCode, AssetKind kind, String path, Fingerprint fingerprint, String at) {
		return new LedgerEntry(
				modelCode, kind, path, fingerprint.size(), fingerprint.sha256(), fingerprint.signature(), at);
	}

	@JsonIgnore
	public Fingerprint fingerprint() {
		return new Fingerprint(size, sha256, signature);
	}
}
