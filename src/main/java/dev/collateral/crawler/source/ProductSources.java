package dev.collateral.crawler.source;

import dev.collateral.crawler.model.Product;
import dev.collateral.crawler.util.FileUtils;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.StreamSupport;

/** Factory methods and decorators for {@link ProductSource}s */
public final class ProductSources {

	private ProductSources() {}

	/** A fixed list of products, numbered in list order */
	public static ProductSource of(List<Product> products) {
		List<Product> numbered = new ArrayList<>();
		for (Product product : products) {
			numbered.add(product.withDiscoveryOrder(numbered.size()));
		}
		List<Product> copy = List.copyOf(numbered);
		return copy::iterator;
	}

	/** Products for the given model codes, in the given order */
	public static ProductSource ofCodes(Collection<String> modelCodes) {
		return of(modelCodes.stream().map(Product::of).collect(Collectors.toList()));
	}

	/**
	 * Stop after the first {@code max} products.
	 *
	 * @param max Maximum number of products, 0 or less for no limit
	 */
	public static ProductSource limit(ProductSource source, int max) {
		if (max <= 0) {
			return source;
		}
		return () -> StreamSupport.stream(source.spliterator(), false)
				.limit(max)
				.iterator();
	}

	/** Only products of the given series, compared ignoring case */
	public static ProductSource series(ProductSource source, String series) {
		return () -> StreamSupport.stream(source.spliterator(), false)
				.filter(p -> p.series() != null && p.series().equalsIgnoreCase(series.trim()))
				.iterator();
	}

	/** Only products whose model code is in the given collection */
	public static ProductSource only(ProductSource source, Collection<String> modelCodes) {
		Set<String> wanted = modelCodes.stream()
				.map(FileUtils::sanitizeFilename)
				.map(String::toUpperCase)
				.collect(Collectors.toSet());
		return () -> StreamSupport.stream(source.spliterator(), false)
				.filter(p -> wanted.contains(p.modelCode().toUpperCase()))
				.iterator();
	}
}
