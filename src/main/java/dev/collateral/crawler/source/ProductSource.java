package dev.collateral.crawler.source;

import dev.collateral.crawler.model.Product;

/**
 * Ordered, finite enumeration of products. Every call to {@link #iterator()} starts over from the
 * beginning, products are fetched lazily while iterating.
 */
public interface ProductSource extends Iterable<Product> {}
