package dev.collateral.crawler.orchestrator;

import static org.assertj.core.api.Assertions.*;

import dev.collateral.crawler.ledger.ResumeLedger;
import dev.collateral.crawler.model.Product;
import dev.collateral.crawler.packaging.Packager;
import dev.collateral.crawler.session.AuthenticationException;
import dev.collateral.crawler.session.Credentials;
import dev.collateral.crawler.session.SessionTracker;
import dev.collateral.crawler.validate.ArtifactValidator;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.IntFunction;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WorkerPoolTest {

	private static final Credentials CREDENTIALS = new Credentials("buyer", "secret");

	@TempDir
	Path tempDir;

	@Test
	void testEveryProductIsHandledByExactlyOneWorker() throws Exception {
		// Given
		RunConfig config = RunConfig.builder(tempDir).build();
		List<FakeSession> sessions = Collections.synchronizedList(new ArrayList<>());
		List<Product> products = products(6);

		// When
		RunSummary summary;
		try (ResumeLedger ledger = new ResumeLedger(config.ledgerFile())) {
			ledger.load();
			WorkerPool pool = new WorkerPool(3, index -> {
				FakeSession session = new FakeSession();
				sessions.add(session);
				return orchestrator(session, ledger, config);
			});
			summary = pool.run(products, 0);
			assertThat(ledger.size()).isEqualTo(6 * 7);
		}

		// Then
		assertThat(summary.success()).isTrue();
		assertThat(summary.productsProcessed()).isEqualTo(6);
		assertThat(summary.products())
				.extracting(ProductSummary::modelCode)
				.containsExactly("P-1", "P-2", "P-3", "P-4", "P-5", "P-6");
		List<String> fetched = new ArrayList<>();
		sessions.forEach(s -> fetched.addAll(s.fetched()));
		assertThat(fetched).hasSize(6 * 7).doesNotHaveDuplicates();
	}

	@Test
	void testProductLimitSpansAllWorkers() {
		// Given
		RunConfig config = RunConfig.builder(tempDir).build();

		// When
		RunSummary summary = runPool(2, config, index -> new FakeSession(), products(5), 3);

		// Then
		assertThat(summary.productsProcessed()).isEqualTo(3);
	}

	@Test
	void testRejectedLoginAbortsAllWorkers() {
		// Given
		RunConfig config = RunConfig.builder(tempDir).build();

		// When
		RunSummary summary = runPool(2, config, index -> new FakeSession().rejectLogin(), products(4), 0);

		// Then
		assertThat(summary.aborted()).isTrue();
		assertThat(summary.abortCause()).isInstanceOf(AuthenticationException.class);
		assertThat(summary.productsProcessed()).isEqualTo(0);
		assertThat(summary.exitCode()).isEqualTo(2);
	}

	@Test
	void testWorkerThatCannotStartAbortsRun() {
		// Given
		RunConfig config = RunConfig.builder(tempDir).build();
		WorkerPool pool = new WorkerPool(2, index -> {
			throw new IllegalStateException("Manifest unreachable");
		});

		// When
		RunSummary summary = pool.run(products(2), 0);

		// Then
		assertThat(summary.aborted()).isTrue();
		assertThat(summary.abortReason()).isEqualTo("Manifest unreachable");
	}

	@Test
	void testAtLeastOneWorkerIsRequired() {
		assertThatThrownBy(() -> new WorkerPool(0, index -> null))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void testSharedFeedSkipsDuplicatesAndHonorsLimit() {
		// Given
		List<Product> products = List.of(Product.of("A"), Product.of("A"), Product.of("B"), Product.of("C"));
		WorkerPool.SharedFeed feed = new WorkerPool.SharedFeed(products.iterator(), 2);

		// When/Then
		assertThat(feed.poll()).isEqualTo(Product.of("A"));
		assertThat(feed.poll()).isEqualTo(Product.of("B"));
		assertThat(feed.poll()).isNull();
	}

	@Test
	void testClosedFeedHandsOutNothing() {
		// Given
		WorkerPool.SharedFeed feed = new WorkerPool.SharedFeed(products(3).iterator(), 0);

		// When
		feed.close();

		// Then
		assertThat(feed.poll()).isNull();
		assertThat(feed.iterator().hasNext()).isFalse();
	}

	private RunSummary runPool(
			int workers, RunConfig config, IntFunction<FakeSession> sessions, List<Product> products, int max) {
		try (ResumeLedger ledger = new ResumeLedger(config.ledgerFile())) {
			ledger.load();
			WorkerPool pool = new WorkerPool(workers, index -> orchestrator(sessions.apply(index), ledger, config));
			return pool.run(products, max);
		} catch (Exception e) {
			throw new AssertionError(e);
		}
	}

	private static DownloadOrchestrator orchestrator(FakeSession session, ResumeLedger ledger, RunConfig config) {
		ArtifactValidator validator = new ArtifactValidator();
		return new DownloadOrchestrator(
				session,
				new SessionTracker(session, CREDENTIALS),
				ledger,
				validator,
				new Packager(config.outputRoot(), validator),
				config,
				duration -> {});
	}

	private static List<Product> products(int count) {
		List<Product> products = new ArrayList<>();
		for (int i = 1; i <= count; i++) {
			products.add(new Product("P-" + i, null, null, i - 1));
		}
		return products;
	}
}
