package dev.collateral.crawler.portal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.collateral.crawler.model.Product;
import dev.collateral.crawler.session.CadPortal;
import dev.collateral.crawler.session.FetchException;
import dev.collateral.crawler.session.SessionExpiredException;
import java.nio.file.Path;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** CAD generation portal reached through the endpoints of a {@link PortalManifest} */
class ManifestCadPortal implements CadPortal {
	private static final Logger logger = LoggerFactory.getLogger(ManifestCadPortal.class);

	private static final ObjectMapper mapper = new ObjectMapper();

	private final ManifestDriver driver;
	private final PortalManifest.CadEndpoints endpoints;
	private final Product product;
	private final String ref;

	ManifestCadPortal(ManifestDriver driver, PortalManifest.CadEndpoints endpoints, Product product, String ref) {
		this.driver = driver;
		this.endpoints = endpoints;
		this.product = product;
		this.ref = ref;
		logger.debug("Entering CAD portal for {} ({})", product, ref);
	}

	@Override
	public void selectFormat(String formatProfile) throws FetchException, SessionExpiredException, InterruptedException {
		if (endpoints.formatUrl() == null) {
			return;
		}
		String url = url(endpoints.formatUrl());
		ManifestDriver.call(
				"CAD format selection for " + product,
				() -> driver.http().postForm(url, Map.of("format", formatProfile)));
	}

	@Override
	public void startGeneration() throws FetchException, SessionExpiredException, InterruptedException {
		String url = url(require(endpoints.generateUrl(), "generate_url"));
		ManifestDriver.call("CAD generation for " + product, () -> driver.http().postForm(url, Map.of()));
	}

	@Override
	public boolean generationComplete() throws FetchException, SessionExpiredException, InterruptedException {
		String url = url(require(endpoints.statusUrl(), "status_url"));
		JsonNode status = ManifestDriver.call(
				"CAD generation status for " + product, () -> mapper.readTree(driver.http().downloadString(url)));
		if (status.path("failed").asBoolean(false)) {
			throw new FetchException("CAD generation failed for " + product + ": "
					+ status.path("message").asText("no reason given"));
		}
		return status.path("complete").asBoolean(false);
	}

	@Override
	public Path download(Path targetDir) throws FetchException, SessionExpiredException, InterruptedException {
		String url = url(require(endpoints.downloadUrl(), "download_url"));
		return ManifestDriver.call("CAD download for " + product, () -> driver.http().downloadFile(url, targetDir));
	}

	@Override
	public void close() {
		logger.debug("Leaving CAD portal for {}", product);
	}

	private String url(String template) {
		return driver.resolve(template.replace("{ref}", ManifestDriver.encode(ref)));
	}

	private String require(String template, String name) throws FetchException {
		if (template == null) {
			throw new FetchException("CAD portal endpoint " + name + " is not configured");
		}
		return template;
	}
}
