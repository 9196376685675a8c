package dev.collateral.crawler.model;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Mutable download state of one asset of one product. Transitions that the lifecycle does not
 * allow throw {@link IllegalStateException}.
 */
public class DownloadTask {
	private static final Map<TaskState, Set<TaskState>> TRANSITIONS = Map.of(
			TaskState.PENDING, EnumSet.of(TaskState.REQUESTED, TaskState.SKIPPED, TaskState.UNAVAILABLE),
			TaskState.REQUESTED, EnumSet.of(TaskState.DOWNLOADED, TaskState.FAILED, TaskState.PENDING),
			TaskState.DOWNLOADED, EnumSet.of(TaskState.VALIDATED, TaskState.FAILED),
			TaskState.VALIDATED, EnumSet.of(TaskState.FINALIZED, TaskState.FAILED),
			TaskState.FAILED, EnumSet.of(TaskState.REQUESTED, TaskState.PERMANENTLY_FAILED));

	private final Product product;
	private final AssetKind kind;
	private TaskState state = TaskState.PENDING;
	private int attempts;
	private Path downloadedFile;
	private Path finalPath;
	private String lastFailure;

	public DownloadTask(Product product, AssetKind kind) {
		this.product = product;
		this.kind = kind;
	}

	public void requested() {
		moveTo(TaskState.REQUESTED);
	}

	public void downloaded(Path file) {
		moveTo(TaskState.DOWNLOADED);
		this.downloadedFile = file;
	}

	public void validated() {
		moveTo(TaskState.VALIDATED);
	}

	public void finalized(Path canonicalPath) {
		moveTo(TaskState.FINALIZED);
		this.finalPath = canonicalPath;
	}

	public void skipped(Path canonicalPath) {
		moveTo(TaskState.SKIPPED);
		this.finalPath = canonicalPath;
	}

	public void unavailable() {
		moveTo(TaskState.UNAVAILABLE);
	}

	/** Record a failed attempt */
	public void failed(String reason) {
		moveTo(TaskState.FAILED);
		attempts++;
		lastFailure = reason;
		downloadedFile = null;
	}

	/**
	 * Put a request that was cut short by an expired session back in line. Unlike {@link
	 * #failed(String)} this does not count as an attempt.
	 */
	public void resubmit(String reason) {
		moveTo(TaskState.PENDING);
		lastFailure = reason;
		downloadedFile = null;
	}

	public void permanentlyFailed() {
		moveTo(TaskState.PERMANENTLY_FAILED);
	}

	private void moveTo(TaskState next) {
		Set<TaskState> allowed = TRANSITIONS.getOrDefault(state, Set.of());
		if (!allowed.contains(next)) {
			throw new IllegalStateException(
					"Illegal transition " + state + " -> " + next + " for " + product.modelCode() + " " + kind);
		}
		state = next;
	}

	public Product product() {
		return product;
	}

	public AssetKind kind() {
		return kind;
	}

	public TaskState state() {
		return state;
	}

	/** Number of failed attempts so far */
	public int attempts() {
		return attempts;
	}

	public Path downloadedFile() {
		return downloadedFile;
	}

	public Path finalPath() {
		return finalPath;
	}

	public String lastFailure() {
		return lastFailure;
	}

	@Override
	public String toString() {
		return product.modelCode() + "/" + kind.label() + " [" + state + "]";
	}
}
