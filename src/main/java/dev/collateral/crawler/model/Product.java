package dev.collateral.crawler.model;

import dev.collateral.crawler.util.FileUtils;
import java.util.Objects;

/**
 * A product discovered in the vendor catalog.
 *
 * @param modelCode Model code, unique within a run and safe to use as a directory name
 * @param sourceLocator Catalog page the product was found on, may be null
 * @param series Series the product belongs to, may be null
 * @param discoveryOrder Position in the enumeration, products are processed in this order
 */
public record Product(String modelCode, String sourceLocator, String series, int discoveryOrder) {

	public Product {
		Objects.requireNonNull(modelCode, "modelCode");
		modelCode = FileUtils.sanitizeFilename(modelCode);
		if (modelCode.isEmpty()) {
			throw new IllegalArgumentException("Model code must not be blank");
		}
	}

	public static Product of(String modelCode) {
		return new Product(modelCode, null, null, 0);
	}

	public Product withDiscoveryOrder(int order) {
		return new Product(modelCode, sourceLocator, series, order);
	}

	@Override
	public String toString() {
		return modelCode;
	}
}
