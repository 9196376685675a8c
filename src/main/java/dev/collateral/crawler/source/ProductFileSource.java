package dev.collateral.crawler.source;

import dev.collateral.crawler.model.Product;
import dev.collateral.crawler.util.FileUtils;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Products listed in a file. Plain text files hold one model code or product URL per line, {@code
 * .csv} and {@code .tsv} files the same in their first column. Blank lines and lines starting with
 * {@code #} are ignored. For URLs the last path segment is taken as the model code.
 */
public class ProductFileSource implements ProductSource {
	private final Path file;

	public ProductFileSource(Path file) {
		this.file = file;
	}

	/**
	 * Read all model codes from the file.
	 *
	 * @throws IOException if the file can not be read
	 */
	public List<String> modelCodes() throws IOException {
		String name = file.getFileName().toString().toLowerCase();
		boolean tabular = name.endsWith(".csv") || name.endsWith(".tsv");
		List<String> codes = new ArrayList<>();
		for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
			String value = line.strip();
			if (value.isEmpty() || value.startsWith("#")) {
				continue;
			}
			if (tabular) {
				value = firstColumn(value, name.endsWith(".tsv") ? '\t' : ',');
			}
			value = fromUrl(value);
			if (!FileUtils.sanitizeFilename(value).isEmpty()) {
				codes.add(value);
			}
		}
		return codes;
	}

	@Override
	public Iterator<Product> iterator() {
		try {
			return ProductSources.ofCodes(modelCodes()).iterator();
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to read product file " + file, e);
		}
	}

	private static String firstColumn(String line, char separator) {
		int end = line.indexOf(separator);
		String column = end < 0 ? line : line.substring(0, end);
		column = column.strip();
		if (column.length() >= 2 && column.startsWith("\"") && column.endsWith("\"")) {
			column = column.substring(1, column.length() - 1).strip();
		}
		return column;
	}

	static String fromUrl(String value) {
		if (!value.startsWith("http://") && !value.startsWith("https://")) {
			return value;
		}
		String path = URI.create(value).getPath();
		if (path == null) {
			return "";
		}
		while (path.endsWith("/")) {
			path = path.substring(0, path.length() - 1);
		}
		return path.substring(path.lastIndexOf('/') + 1);
	}
}
