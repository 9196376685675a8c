package dev.collateral.crawler.portal;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.collateral.crawler.model.AssetKind;
import dev.collateral.crawler.model.Product;
import dev.collateral.crawler.portal.PortalManifest.ManifestProduct;
import dev.collateral.crawler.session.AssetResponse;
import dev.collateral.crawler.session.AuthenticationException;
import dev.collateral.crawler.session.BrowserDriver;
import dev.collateral.crawler.session.CadPortal;
import dev.collateral.crawler.session.Credentials;
import dev.collateral.crawler.session.FetchException;
import dev.collateral.crawler.session.FetchTimeoutException;
import dev.collateral.crawler.session.SessionExpiredException;
import dev.collateral.crawler.util.FileUtils;
import dev.collateral.crawler.util.HttpStatusException;
import dev.collateral.crawler.util.HttpUtils;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** A {@link BrowserDriver} for portals described by a {@link PortalManifest} */
public class ManifestDriver implements BrowserDriver {
	private static final Logger logger = LoggerFactory.getLogger(ManifestDriver.class);

	private static final ObjectMapper mapper = new ObjectMapper();

	@FunctionalInterface
	interface HttpCall<T> {
		T get() throws IOException, InterruptedException;
	}

	private final PortalManifest manifest;
	private final URI base;
	private final HttpUtils http;
	private final Map<String, ManifestProduct> products = new LinkedHashMap<>();

	public ManifestDriver(PortalManifest manifest, URI base, HttpUtils http) {
		this.manifest = manifest;
		this.base = base;
		this.http = http;
		for (ManifestProduct product : manifest.products()) {
			String key = product.model() == null ? "" : FileUtils.sanitizeFilename(product.model());
			if (key.isEmpty()) {
				logger.warn("Skipping manifest product without usable model code: '{}'", product.model());
				continue;
			}
			products.putIfAbsent(key, product);
		}
	}

	/**
	 * Read a manifest from a local file or an http(s) URL.
	 *
	 * @param location File path or URL of the manifest
	 * @param http HTTP client, also used by the returned driver
	 * @return A driver for the described portal
	 * @throws IOException if the manifest can not be read, or a local manifest lacks a base URL
	 */
	public static ManifestDriver open(String location, HttpUtils http) throws IOException, InterruptedException {
		boolean remote = location.startsWith("http://") || location.startsWith("https://");
		PortalManifest manifest = remote
				? mapper.readValue(http.downloadString(location), PortalManifest.class)
				: mapper.readValue(Path.of(location).toFile(), PortalManifest.class);
		URI base;
		if (manifest.baseUrl() != null) {
			base = remote ? URI.create(location).resolve(manifest.baseUrl()) : URI.create(manifest.baseUrl());
		} else if (remote) {
			base = URI.create(location);
		} else {
			throw new IOException("Manifest " + location + " has no base_url");
		}
		if (!base.isAbsolute()) {
			throw new IOException("Manifest base URL must be absolute: " + base);
		}
		logger.info("Loaded manifest {} with {} products", location, manifest.products().size());
		return new ManifestDriver(manifest, base, http);
	}

	/** The products of the manifest in listing order */
	public List<Product> products() {
		List<Product> result = new ArrayList<>();
		for (ManifestProduct entry : products.values()) {
			result.add(new Product(entry.model(), entry.page(), entry.series(), result.size()));
		}
		return result;
	}

	@Override
	public void login(Credentials credentials) throws AuthenticationException, FetchException, InterruptedException {
		if (manifest.loginUrl() == null) {
			logger.debug("Manifest has no login URL, continuing without login");
			return;
		}
		String url = resolve(manifest.loginUrl());
		try {
			http.postForm(url, Map.of("username", credentials.username(), "password", credentials.password()));
		} catch (HttpStatusException e) {
			if (e.authRequired()) {
				throw new AuthenticationException("Login rejected for " + credentials.username(), e);
			}
			throw new FetchException("Login failed: " + e.getMessage(), e);
		} catch (HttpTimeoutException e) {
			throw new FetchTimeoutException("Login timed out", e);
		} catch (IOException e) {
			throw new FetchException("Login failed: " + e.getMessage(), e);
		}
	}

	@Override
	public Set<AssetKind> listAssets(Product product) throws FetchException {
		ManifestProduct entry = entry(product);
		Set<AssetKind> kinds = EnumSet.noneOf(AssetKind.class);
		for (String label : entry.assets().keySet()) {
			try {
				kinds.add(AssetKind.fromLabel(label));
			} catch (IllegalArgumentException e) {
				logger.warn("Ignoring unknown asset kind '{}' for {}", label, product);
			}
		}
		return kinds;
	}

	@Override
	public AssetResponse requestAsset(Product product, AssetKind kind, Path workDir)
			throws FetchException, SessionExpiredException, InterruptedException {
		String url = entry(product).assets().get(kind.label());
		if (url == null) {
			throw new FetchException("Portal offers no " + kind.label() + " for " + product);
		}
		if (url.startsWith(PortalManifest.CAD_PREFIX)) {
			return AssetResponse.redirect(url.substring(PortalManifest.CAD_PREFIX.length()));
		}
		String resolved = resolve(url);
		return AssetResponse.delivered(
				call("Download of " + kind.label() + " for " + product, () -> http.downloadFile(resolved, workDir)));
	}

	@Override
	public boolean supportsBatch() {
		return manifest.batchUrl() != null;
	}

	@Override
	public Path requestBatch(Product product, Set<AssetKind> kinds, Path workDir)
			throws FetchException, SessionExpiredException, InterruptedException {
		entry(product);
		String labels = kinds.stream().map(AssetKind::label).collect(Collectors.joining(","));
		String url = resolve(manifest.batchUrl()
				.replace("{model}", encode(product.modelCode()))
				.replace("{kinds}", encode(labels)));
		return call("Combined download for " + product, () -> http.downloadFile(url, workDir));
	}

	@Override
	public CadPortal openCadPortal(Product product, String cadPortalRef) throws FetchException {
		if (manifest.cadPortal() == null) {
			throw new FetchException("Manifest has no CAD portal, can not generate model for " + product);
		}
		return new ManifestCadPortal(this, manifest.cadPortal(), product, cadPortalRef);
	}

	HttpUtils http() {
		return http;
	}

	String resolve(String url) {
		return base.resolve(url).toString();
	}

	static String encode(String value) {
		return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
	}

	/** Run an HTTP call, mapping auth challenges and timeouts to the session exceptions */
	static <T> T call(String what, HttpCall<T> call)
			throws FetchException, SessionExpiredException, InterruptedException {
		try {
			return call.get();
		} catch (HttpStatusException e) {
			if (e.authRequired()) {
				throw new SessionExpiredException(what + " requires authentication (HTTP " + e.statusCode() + ")", e);
			}
			throw new FetchException(what + " failed: " + e.getMessage(), e);
		} catch (HttpTimeoutException e) {
			throw new FetchTimeoutException(what + " timed out", e);
		} catch (IOException e) {
			throw new FetchException(what + " failed: " + e.getMessage(), e);
		}
	}

	private ManifestProduct entry(Product product) throws FetchException {
		ManifestProduct entry = products.get(product.modelCode());
		if (entry == null) {
			throw new FetchException("Product " + product + " is not listed in the manifest");
		}
		return entry;
	}
}
