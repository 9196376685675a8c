package dev.collateral.crawler.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.collateral.crawler.model.Product;
import dev.collateral.crawler.util.FileUtils;
import dev.collateral.crawler.util.HttpUtils;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Paginated product listing served as JSON. The URL template contains a {@code {page}}
 * placeholder. A page is either an array or an object with a {@code products} array, whose items
 * are model code strings or objects with {@code model}, {@code series} and {@code page} fields.
 */
public class HttpCatalogSource extends PaginatedProductSource {
	private static final Logger logger = LoggerFactory.getLogger(HttpCatalogSource.class);

	private static final ObjectMapper mapper = new ObjectMapper();

	private final String urlTemplate;
	private final HttpUtils http;

	public HttpCatalogSource(String urlTemplate, HttpUtils http) {
		if (!urlTemplate.contains("{page}")) {
			throw new IllegalArgumentException("Catalog URL needs a {page} placeholder: " + urlTemplate);
		}
		this.urlTemplate = urlTemplate;
		this.http = http;
	}

	@Override
	protected List<Product> fetchPage(int pageNumber) throws Exception {
		String url = urlTemplate.replace("{page}", String.valueOf(pageNumber));
		JsonNode root = mapper.readTree(http.downloadString(url));
		JsonNode items = root.isArray() ? root : root.path("products");
		List<Product> products = new ArrayList<>();
		for (JsonNode item : items) {
			String model = item.isTextual() ? item.asText() : item.path("model").asText("");
			if (FileUtils.sanitizeFilename(model).isEmpty()) {
				logger.warn("Skipping listing item without model on {}: {}", url, item);
				continue;
			}
			String page = item.hasNonNull("page") ? item.get("page").asText() : url;
			String series = item.hasNonNull("series") ? item.get("series").asText() : null;
			products.add(new Product(model, page, series, 0));
		}
		return products;
	}
}
