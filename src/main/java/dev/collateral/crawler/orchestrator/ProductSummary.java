package dev.collateral.crawler.orchestrator;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import dev.collateral.crawler.model.AssetKind;
import dev.collateral.crawler.model.DownloadTask;
import dev.collateral.crawler.model.TaskState;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/** Outcome of all assets of one product */
@JsonPropertyOrder({"model", "complete", "assets"})
public record ProductSummary(
		@JsonProperty("model") String modelCode, @JsonProperty("assets") List<AssetOutcome> assets) {

	public ProductSummary {
		assets = List.copyOf(assets);
	}

	public static ProductSummary of(String modelCode, Collection<DownloadTask> tasks) {
		return new ProductSummary(modelCode, tasks.stream().map(AssetOutcome::of).toList());
	}

	public Optional<AssetOutcome> outcome(AssetKind kind) {
		return assets.stream().filter(a -> a.kind() == kind).findFirst();
	}

	public TaskState state(AssetKind kind) {
		return outcome(kind).map(AssetOutcome::state).orElse(null);
	}

	/** Every required asset is in place */
	@JsonProperty("complete")
	public boolean complete() {
		return assets.stream().filter(a -> a.kind().required()).allMatch(AssetOutcome::done);
	}

	public int finalized() {
		return count(TaskState.FINALIZED);
	}

	public int skipped() {
		return count(TaskState.SKIPPED);
	}

	public int unavailable() {
		return count(TaskState.UNAVAILABLE);
	}

	/** Assets given up on, including those cut short by an interruption */
	public int failed() {
		return (int) assets.stream()
				.filter(a -> !a.done() && a.state() != TaskState.UNAVAILABLE)
				.count();
	}

	private int count(TaskState state) {
		return (int) assets.stream().filter(a -> a.state() == state).count();
	}

	@Override
	public String toString() {
		return "%s: %d finalized, %d skipped, %d unavailable, %d failed"
				.formatted(modelCode, finalized(), skipped(), unavailable(), failed());
	}
}
