package dev.collateral.crawler.portal;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Describes a portal that serves product assets over plain HTTP. URLs may be relative to {@code
 * base_url}. An asset URL of the form {@code cad:<ref>} means the asset has to be produced by the
 * CAD generation portal first.
 *
 * <pre>
 * {
 *   "base_url": "https://portal.example.com/",
 *   "login_url": "login",
 *   "batch_url": "batch/{model}?kinds={kinds}",
 *   "products": [
 *     {"model": "LDR2-32RD2", "series": "LDR2", "page": "catalog?page=1",
 *      "assets": {"catalog": "files/C_LDR2.pdf", "step": "cad:LDR2-32RD2"}}
 *   ],
 *   "cad_portal": {"format_url": "cad/{ref}/format", "generate_url": "cad/{ref}/generate",
 *                  "status_url": "cad/{ref}/status", "download_url": "cad/{ref}/download"}
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PortalManifest(
		@JsonProperty("base_url") String baseUrl,
		@JsonProperty("login_url") String loginUrl,
		@JsonProperty("batch_url") String batchUrl,
		@JsonProperty("products") List<ManifestProduct> products,
		@JsonProperty("cad_portal") CadEndpoints cadPortal) {

	public static final String CAD_PREFIX = "cad:";

	public PortalManifest {
		products = products == null ? List.of() : List.copyOf(products);
	}

	/** One product and the URLs of its assets, keyed by asset kind label */
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record ManifestProduct(
			@JsonProperty("model") String model,
			@JsonProperty("series") String series,
			@JsonProperty("page") String page,
			@JsonProperty("assets") Map<String, String> assets) {

		public ManifestProduct {
			assets = assets == null
					? Map.of()
					: assets.entrySet().stream()
							.filter(e -> e.getValue() != null && !e.getValue().isBlank())
							.collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));
		}
	}

	/** URL templates of the CAD generation portal, {@code {ref}} is replaced by the portal reference */
	@JsonIgnoreProperties(ignoreUnknown = true)
	public record CadEndpoints(
			@JsonProperty("format_url") String formatUrl,
			@JsonProperty("generate_url") String generateUrl,
			@JsonProperty("status_url") String statusUrl,
			@JsonProperty("download_url") String downloadUrl) {}
}
