package dev.collateral.crawler.session;

import dev.collateral.crawler.model.AssetCatalog;
import dev.collateral.crawler.model.AssetKind;
import dev.collateral.crawler.model.Product;
import dev.collateral.crawler.util.ArchiveUtils;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a {@link BrowserDriver} into a {@link SessionCapability}. CAD portal redirects are
 * resolved through the {@link CadGenerationProtocol} and combined downloads are unpacked and
 * sorted by file name, so callers only ever see one file per asset kind.
 */
public class DriverSession implements SessionCapability {
	private static final Logger logger = LoggerFactory.getLogger(DriverSession.class);

	private final BrowserDriver driver;
	private final CadGenerationProtocol cadProtocol;

	public DriverSession(BrowserDriver driver, CadGenerationProtocol cadProtocol) {
		this.driver = driver;
		this.cadProtocol = cadProtocol;
	}

	@Override
	public void login(Credentials credentials) throws AuthenticationException, FetchException, InterruptedException {
		driver.login(credentials);
	}

	@Override
	public Set<AssetKind> listAssets(Product product)
			throws FetchException, SessionExpiredException, InterruptedException {
		return driver.listAssets(product);
	}

	@Override
	public Path fetch(Product product, AssetKind kind, Path workDir)
			throws FetchException, SessionExpiredException, InterruptedException {
		AssetResponse response = driver.requestAsset(product, kind, workDir);
		if (response.isDelivered()) {
			return response.file();
		}
		if (response.isRedirect()) {
			logger.debug("{} {} is served by the CAD portal", product, kind.label());
			CadPortal portal = driver.openCadPortal(product, response.cadPortalRef());
			return cadProtocol.generate(portal, product, workDir);
		}
		throw new FetchException("Portal delivered nothing for " + product + " " + kind.label());
	}

	@Override
	public boolean supportsBatch() {
		return driver.supportsBatch();
	}

	@Override
	public Map<AssetKind, Path> fetchBatch(Product product, Set<AssetKind> kinds, Path workDir)
			throws FetchException, SessionExpiredException, InterruptedException {
		Path delivery = driver.requestBatch(product, kinds, workDir);
		List<Path> files;
		try {
			String name = delivery.getFileName().toString();
			if (ArchiveUtils.isZip(delivery) || ArchiveUtils.isTarName(name)) {
				files = ArchiveUtils.extract(delivery, workDir.resolve("unpacked"));
			} else {
				files = List.of(delivery);
			}
		} catch (IOException e) {
			throw new FetchException("Combined download for " + product + " could not be unpacked: " + e.getMessage(), e);
		}
		return sortDelivery(product, kinds, files);
	}

	/**
	 * Assign delivered files to the requested kinds by file name. When several files map to the same
	 * kind the largest one wins.
	 */
	private Map<AssetKind, Path> sortDelivery(Product product, Set<AssetKind> kinds, List<Path> files)
			throws FetchException {
		Map<AssetKind, Path> sorted = new EnumMap<>(AssetKind.class);
		try {
			for (Path file : files) {
				Optional<AssetKind> kind = AssetCatalog.classify(file.getFileName().toString(), product.modelCode());
				if (kind.isEmpty() || !kinds.contains(kind.get())) {
					logger.debug("Ignoring {} in combined download for {}", file.getFileName(), product);
					continue;
				}
				Path current = sorted.get(kind.get());
				if (current == null || Files.size(file) > Files.size(current)) {
					sorted.put(kind.get(), file);
				}
			}
		} catch (IOException e) {
			throw new FetchException("Failed to inspect combined download for " + product, e);
		}
		logger.debug("Combined download for {} delivered {}", product, sorted.keySet());
		return sorted;
	}
}
