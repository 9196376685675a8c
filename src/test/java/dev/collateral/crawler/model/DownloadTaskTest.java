package dev.collateral.crawler.model;

import static org.assertj.core.api.Assertions.*;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class DownloadTaskTest {

	@Test
	void testSuccessfulLifecycle() {
		// Given
		DownloadTask task = new DownloadTask(Product.of("LDR2-32RD2"), AssetKind.CATALOG);

		// When
		task.requested();
		task.downloaded(Path.of("work/C_LDR2.pdf"));
		task.validated();
		task.finalized(Path.of("output/LDR2-32RD2/LDR2-32RD2_Catalog.pdf"));

		// Then
		assertThat(task.state()).isEqualTo(TaskState.FINALIZED);
		assertThat(task.state().terminal()).isTrue();
		assertThat(task.attempts()).isEqualTo(0);
		assertThat(task.finalPath()).isEqualTo(Path.of("output/LDR2-32RD2/LDR2-32RD2_Catalog.pdf"));
	}

	@Test
	void testFailedAttemptsAreCounted() {
		// Given
		DownloadTask task = new DownloadTask(Product.of("LDR2-32RD2"), AssetKind.STEP);

		// When
		task.requested();
		task.failed("timeout");
		task.requested();
		task.downloaded(Path.of("work/model.stp"));
		task.failed("corrupt zip archive");
		task.permanentlyFailed();

		// Then
		assertThat(task.state()).isEqualTo(TaskState.PERMANENTLY_FAILED);
		assertThat(task.attempts()).isEqualTo(2);
		assertThat(task.lastFailure()).isEqualTo("corrupt zip archive");
		assertThat(task.downloadedFile()).isNull();
	}

	@Test
	void testResubmitDoesNotCountAsAttempt() {
		// Given
		DownloadTask task = new DownloadTask(Product.of("LDR2-32RD2"), AssetKind.CATALOG);

		// When
		task.requested();
		task.resubmit("session expired");

		// Then
		assertThat(task.state()).isEqualTo(TaskState.PENDING);
		assertThat(task.attempts()).isEqualTo(0);
		assertThat(task.lastFailure()).isEqualTo("session expired");
		task.requested();
		assertThat(task.state()).isEqualTo(TaskState.REQUESTED);
	}

	@Test
	void testFinalizingRequiresValidation() {
		// Given
		DownloadTask task = new DownloadTask(Product.of("LDR2-32RD2"), AssetKind.DIMENSION);
		task.requested();
		task.downloaded(Path.of("work/d.pdf"));

		// When/Then
		assertThatThrownBy(() -> task.finalized(Path.of("out.pdf")))
				.isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("DOWNLOADED -> FINALIZED");
	}

	@Test
	void testTerminalStatesCannotBeLeft() {
		// Given
		DownloadTask skipped = new DownloadTask(Product.of("A"), AssetKind.MANUAL);
		skipped.skipped(Path.of("A/A_Manual.pdf"));
		DownloadTask unavailable = new DownloadTask(Product.of("A"), AssetKind.IMAGE);
		unavailable.unavailable();

		// When/Then
		assertThatThrownBy(skipped::requested).isInstanceOf(IllegalStateException.class);
		assertThatThrownBy(unavailable::requested).isInstanceOf(IllegalStateException.class);
		assertThat(skipped.toString()).isEqualTo("A/manual [SKIPPED]");
	}

	@Test
	void testProductModelCodeIsSanitized() {
		assertThat(Product.of(" LDR2/32:RD2 ").modelCode()).isEqualTo("LDR2-32-RD2");
		assertThat(Product.of("LDR2-32RD2").toString()).isEqualTo("LDR2-32RD2");
		assertThat(Product.of("A").withDiscoveryOrder(4).discoveryOrder()).isEqualTo(4);
		assertThatThrownBy(() -> Product.of("  ")).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> Product.of("..")).isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> Product.of(".")).isInstanceOf(IllegalArgumentException.class);
	}
}
