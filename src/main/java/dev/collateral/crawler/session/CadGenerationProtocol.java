package dev.collateral.crawler.session;

import dev.collateral.crawler.model.Product;
import dev.collateral.crawler.util.Sleeper;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives the CAD generation portal: select the format profile on the first visit for a product,
 * start generation, poll until the model is ready and download it. The portal context is always
 * closed afterwards.
 */
public class CadGenerationProtocol {
	private static final Logger logger = LoggerFactory.getLogger(CadGenerationProtocol.class);

	public static final String DEFAULT_FORMAT = "STEP AP214";
	public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(2);

	private final String formatProfile;
	private final Duration timeout;
	private final Duration pollInterval;
	private final Sleeper sleeper;
	private final Set<String> visited = ConcurrentHashMap.newKeySet();

	public CadGenerationProtocol(Duration timeout) {
		this(DEFAULT_FORMAT, timeout, DEFAULT_POLL_INTERVAL, Sleeper.SYSTEM);
	}

	public CadGenerationProtocol(String formatProfile, Duration timeout, Duration pollInterval, Sleeper sleeper) {
		if (pollInterval.isZero() || pollInterval.isNegative()) {
			throw new IllegalArgumentException("Poll interval must be positive");
		}
		this.formatProfile = formatProfile;
		this.timeout = timeout;
		this.pollInterval = pollInterval;
		this.sleeper = sleeper;
	}

	/**
	 * Generate and download a CAD model.
	 *
	 * @param portal The opened portal context, closed by this method
	 * @param product The product the model is generated for
	 * @param workDir Directory to download into
	 * @return The downloaded model
	 * @throws FetchTimeoutException if generation did not complete within the timeout
	 */
	public Path generate(CadPortal portal, Product product, Path workDir)
			throws FetchException, SessionExpiredException, InterruptedException {
		try (portal) {
			if (!visited.contains(product.modelCode())) {
				logger.debug("Selecting format {} for {}", formatProfile, product);
				portal.selectFormat(formatProfile);
				visited.add(product.modelCode());
			}
			portal.startGeneration();
			Duration waited = Duration.ZERO;
			while (!portal.generationComplete()) {
				if (waited.compareTo(timeout) >= 0) {
					throw new FetchTimeoutException("CAD generation for " + product, timeout);
				}
				sleeper.sleep(pollInterval);
				waited = waited.plus(pollInterval);
			}
			logger.debug("CAD generation for {} finished after ~{}s", product, waited.toSeconds());
			return portal.download(workDir);
		}
	}

	public String formatProfile() {
		return formatProfile;
	}
}
