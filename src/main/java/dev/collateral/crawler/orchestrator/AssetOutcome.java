package dev.collateral.crawler.orchestrator;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import dev.collateral.crawler.model.AssetKind;
import dev.collateral.crawler.model.DownloadTask;
import dev.collateral.crawler.model.TaskState;

/** Final state of one asset of one product */
@JsonPropertyOrder({"kind", "state", "attempts", "path", "reason"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AssetOutcome(
		@JsonProperty("kind") AssetKind kind,
		@JsonProperty("state") TaskState state,
		@JsonProperty("attempts") int attempts,
		@JsonProperty("path") String path,
		@JsonProperty("reason") String reason) {

	public static AssetOutcome of(DownloadTask task) {
		String reason = task.state() == TaskState.FINALIZED || task.state() == TaskState.SKIPPED
				? null
				: task.lastFailure();
		return new AssetOutcome(
				task.kind(),
				task.state(),
				task.attempts(),
				task.finalPath() != null ? task.finalPath().toString() : null,
				reason);
	}

	/** Finalized in this run or already present from an earlier one */
	public boolean done() {
		return state == TaskState.FINALIZED || state == TaskState.SKIPPED;
	}
}
