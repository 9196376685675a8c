package dev.collateral.crawler.source;

import dev.collateral.crawler.model.Product;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A product listing spread over numbered pages. Pages are fetched while iterating, the listing
 * ends at the first empty page. Products are numbered across pages in listing order.
 */
public abstract class PaginatedProductSource implements ProductSource {
	private static final Logger logger = LoggerFactory.getLogger(PaginatedProductSource.class);

	@Override
	public Iterator<Product> iterator() {
		return new PaginatedIterator<>() {
			private int discovered;

			@Override
			protected List<Product> fetchPage(int pageNumber) throws Exception {
				List<Product> page = PaginatedProductSource.this.fetchPage(pageNumber);
				if (page == null) {
					return null;
				}
				List<Product> numbered = new ArrayList<>(page.size());
				for (Product product : page) {
					numbered.add(product.withDiscoveryOrder(discovered++));
				}
				logger.debug("Listing page {} returned {} products", pageNumber, numbered.size());
				return numbered;
			}

			@Override
			protected void handleFetchError(int pageNumber, Exception e) {
				logger.error("Failed to fetch listing page {}, stopping enumeration: {}", pageNumber, e.getMessage());
			}
		};
	}

	/**
	 * Fetch one page of the listing.
	 *
	 * @param pageNumber 1-based page number
	 * @return The products on the page, empty or null past the last page
	 */
	protected abstract List<Product> fetchPage(int pageNumber) throws Exception;
}
