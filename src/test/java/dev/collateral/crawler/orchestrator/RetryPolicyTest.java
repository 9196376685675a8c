package dev.collateral.crawler.orchestrator;

import static org.assertj.core.api.Assertions.*;

import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {

	@Test
	void testBackoffDoubles() {
		// Given
		RetryPolicy policy = new RetryPolicy(5, Duration.ofSeconds(2));

		// When/Then
		assertThat(policy.backoff(1)).isEqualTo(Duration.ofSeconds(2));
		assertThat(policy.backoff(2)).isEqualTo(Duration.ofSeconds(4));
		assertThat(policy.backoff(3)).isEqualTo(Duration.ofSeconds(8));
	}

	@Test
	void testBackoffIsCapped() {
		// Given
		RetryPolicy policy = new RetryPolicy(100, Duration.ofMillis(1));

		// When/Then
		assertThat(policy.backoff(60)).isEqualTo(Duration.ofMillis(1L << 16));
	}

	@Test
	void testExhaustedAtCeiling() {
		// Given
		RetryPolicy policy = new RetryPolicy(3, Duration.ofSeconds(1));

		// When/Then
		assertThat(policy.exhausted(0)).isFalse();
		assertThat(policy.exhausted(2)).isFalse();
		assertThat(policy.exhausted(3)).isTrue();
	}

	@Test
	void testConfigDefaults() {
		// When
		RunConfig config = RunConfig.builder(Path.of("out")).retryCeiling(0).build();

		// Then
		assertThat(config.ledgerFile()).isEqualTo(Path.of("out", RunConfig.DEFAULT_LEDGER_NAME));
		assertThat(config.downloadDir()).isEqualTo(Path.of("out", RunConfig.DEFAULT_DOWNLOAD_DIR_NAME));
		assertThat(config.retryCeiling()).isEqualTo(1);
		assertThat(config.retryPolicy().baseDelay()).isEqualTo(Duration.ofSeconds(2));
		assertThat(config.productDelay()).isEqualTo(Duration.ZERO);
		assertThat(config.cadFormat()).isEqualTo("STEP AP214");
		assertThat(config.maxProducts()).isEqualTo(0);
		assertThat(config.overwrite()).isFalse();
	}
}
