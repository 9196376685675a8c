package dev.collateral.crawler.orchestrator;

import dev.collateral.crawler.model.Product;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs several orchestrators in parallel, each with its own session, over one shared product
 * feed. Every product is handed to exactly one worker. When a worker aborts, the feed is closed
 * and the other workers stop after their current product.
 */
public class WorkerPool {
	private static final Logger logger = LoggerFactory.getLogger(WorkerPool.class);

	/** Creates the orchestrator of one worker, including its session */
	@FunctionalInterface
	public interface WorkerFactory {
		DownloadOrchestrator create(int workerIndex) throws Exception;
	}

	private final int workers;
	private final WorkerFactory factory;

	public WorkerPool(int workers, WorkerFactory factory) {
		if (workers < 1) {
			throw new IllegalArgumentException("At least one worker is needed");
		}
		this.workers = workers;
		this.factory = factory;
	}

	/**
	 * Process all products.
	 *
	 * @param products The products in processing order
	 * @param maxProducts Maximum number of products over all workers, 0 for no limit
	 * @return The merged summary of all workers
	 */
	public RunSummary run(Iterable<Product> products, int maxProducts) {
		SharedFeed feed = new SharedFeed(products.iterator(), maxProducts);
		logger.info("Starting {} workers", workers);
		ExecutorService executor = Executors.newFixedThreadPool(workers);
		try {
			List<Future<RunSummary>> futures = new ArrayList<>();
			for (int i = 0; i < workers; i++) {
				final int index = i;
				futures.add(executor.submit(() -> {
					RunSummary summary;
					try {
						summary = factory.create(index).run(feed);
					} catch (Exception e) {
						logger.error("Worker {} could not be started: {}", index, e.getMessage());
						summary = RunSummary.aborted(List.of(), e);
					}
					if (summary.aborted()) {
						feed.close();
					}
					return summary;
				}));
			}

			List<RunSummary> results = new ArrayList<>();
			for (Future<RunSummary> future : futures) {
				try {
					results.add(future.get());
				} catch (ExecutionException e) {
					logger.error("Worker failed: {}", e.getCause().getMessage());
					feed.close();
					results.add(RunSummary.aborted(List.of(), new Exception(e.getCause())));
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
					feed.close();
					executor.shutdownNow();
					results.add(RunSummary.aborted(List.of(), e));
					break;
				}
			}
			return RunSummary.merge(results);
		} finally {
			executor.shutdown();
			try {
				if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
					logger.warn("Workers did not stop within a minute");
				}
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
		}
	}

	/**
	 * Thread safe view of a product iterator. Hands out every model code at most once and at most
	 * {@code limit} products in total.
	 */
	static class SharedFeed implements Iterable<Product> {
		private final Iterator<Product> source;
		private final int limit;
		private final Set<String> seen = new HashSet<>();
		private volatile boolean closed;
		private int handedOut;

		SharedFeed(Iterator<Product> source, int limit) {
			this.source = source;
			this.limit = limit;
		}

		/** Next product, or null when the feed is exhausted or closed */
		synchronized Product poll() {
			while (!closed && (limit <= 0 || handedOut < limit) && source.hasNext()) {
				Product product = source.next();
				if (seen.add(product.modelCode())) {
					handedOut++;
					return product;
				}
				logger.warn("Skipping duplicate product {}", product);
			}
			return null;
		}

		void close() {
			closed = true;
		}

		@Override
		public Iterator<Product> iterator() {
			return new Iterator<>() {
				private Product next;

				@Override
				public boolean hasNext() {
					if (next == null) {
						next = poll();
					}
					return next != null;
				}

				@Override
				public Product next() {
					if (!hasNext()) {
						throw new NoSuchElementException();
					}
					Product product = next;
					next = null;
					return product;
				}
			};
		}
	}
}
