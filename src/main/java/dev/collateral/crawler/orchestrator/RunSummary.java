package dev.collateral.crawler.orchestrator;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Result of a crawl run. A run always ends with a summary, also when it was aborted by a fatal
 * error, in which case {@link #abortCause()} holds that error.
 */
@JsonPropertyOrder({
	"success",
	"aborted",
	"abort_reason",
	"products_processed",
	"products_complete",
	"assets_finalized",
	"assets_skipped",
	"assets_unavailable",
	"assets_failed",
	"products"
})
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunSummary(
		@JsonProperty("products") List<ProductSummary> products, @JsonIgnore Exception abortCause) {

	public RunSummary {
		products = List.copyOf(products);
	}

	public static RunSummary completed(List<ProductSummary> products) {
		return new RunSummary(products, null);
	}

	public static RunSummary aborted(List<ProductSummary> products, Exception cause) {
		return new RunSummary(products, cause);
	}

	/**
	 * Combine the summaries of several workers. Products are ordered by model code, the first abort
	 * cause wins.
	 */
	public static RunSummary merge(List<RunSummary> summaries) {
		List<ProductSummary> products = new ArrayList<>();
		Exception cause = null;
		for (RunSummary summary : summaries) {
			products.addAll(summary.products());
			if (cause == null) {
				cause = summary.abortCause();
			}
		}
		products.sort(Comparator.comparing(ProductSummary::modelCode));
		return new RunSummary(products, cause);
	}

	@JsonProperty("aborted")
	public boolean aborted() {
		return abortCause != null;
	}

	@JsonProperty("abort_reason")
	public String abortReason() {
		if (abortCause == null) {
			return null;
		}
		return abortCause.getMessage() != null ? abortCause.getMessage() : abortCause.getClass().getSimpleName();
	}

	/** Not aborted and no asset failed */
	@JsonProperty("success")
	public boolean success() {
		return !aborted() && assetsFailed() == 0;
	}

	@JsonProperty("products_processed")
	public int productsProcessed() {
		return products.size();
	}

	@JsonProperty("products_complete")
	public int productsComplete() {
		return (int) products.stream().filter(ProductSummary::complete).count();
	}

	@JsonProperty("assets_finalized")
	public int assetsFinalized() {
		return products.stream().mapToInt(ProductSummary::finalized).sum();
	}

	@JsonProperty("assets_skipped")
	public int assetsSkipped() {
		return products.stream().mapToInt(ProductSummary::skipped).sum();
	}

	@JsonProperty("assets_unavailable")
	public int assetsUnavailable() {
		return products.stream().mapToInt(ProductSummary::unavailable).sum();
	}

	@JsonProperty("assets_failed")
	public int assetsFailed() {
		return products.stream().mapToInt(ProductSummary::failed).sum();
	}

	/** 0 on success, 1 when assets failed, 2 when the run was aborted */
	public int exitCode() {
		if (aborted()) {
			return 2;
		}
		return assetsFailed() > 0 ? 1 : 0;
	}

	@Override
	public String toString() {
		String counts = "%d products, %d assets finalized, %d skipped, %d unavailable, %d failed"
				.formatted(productsProcessed(), assetsFinalized(), assetsSkipped(), assetsUnavailable(), assetsFailed());
		if (aborted()) {
			return "ABORTED - %s (%s)".formatted(abortReason(), counts);
		}
		return (success() ? "SUCCESS (%s)" : "FAILED (%s)").formatted(counts);
	}
}
