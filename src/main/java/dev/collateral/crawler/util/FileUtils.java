package dev.collateral.crawler.util;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Utility class for file operations */
public class FileUtils {
	private static final Logger logger = LoggerFactory.getLogger(FileUtils.class);

	private FileUtils() {
		// Utility class
	}

	/** Ensure a directory exists, creating it if necessary */
	public static void ensureDirectory(Path directory) throws IOException {
		if (!Files.exists(directory)) {
			Files.createDirectories(directory);
		}
	}

	/** Delete and recreate a directory so it is empty */
	public static Path freshDirectory(Path directory) throws IOException {
		deleteDirectory(directory);
		Files.createDirectories(directory);
		return directory;
	}

	// Recursively delete a directory and all its contents
	// ignoring any exceptions to ensure best effort cleanup
	public static void deleteDirectory(Path directory) {
		if (Files.exists(directory)) {
			try (Stream<Path> paths = Files.walk(directory)) {
				paths.sorted(Comparator.reverseOrder()) // delete children before parents
						.forEach(path -> {
							try {
								Files.delete(path);
							} catch (IOException e) {
								logger.debug("Could not delete {}: {}", path, e.getMessage());
							}
						});
			} catch (IOException e) {
				logger.debug("Could not clean up {}: {}", directory, e.getMessage());
			}
		}
	}

	/**
	 * Move a file into place, atomically where the file system allows it. The target is replaced if
	 * it already exists.
	 */
	public static void moveIntoPlace(Path source, Path target) throws IOException {
		try {
			Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
		} catch (AtomicMoveNotSupportedException e) {
			Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
		}
	}

	/**
	 * Make a name safe to use as a single path segment. Names that consist of dots only would
	 * point at the current or parent directory and come back empty.
	 */
	public static String sanitizeFilename(String name) {
		String result = name.replace("/", "-").replace("\\", "-").replace(":", "-");
		result = result.replaceAll("\\s+", " ").trim();
		return result.matches("\\.+") ? "" : result;
	}

	/** Return the extension of a file name in lower case without the dot, or an empty string */
	public static String extension(String filename) {
		int dot = filename.lastIndexOf('.');
		if (dot < 0 || dot == filename.length() - 1) {
			return "";
		}
		return filename.substring(dot + 1).toLowerCase();
	}

	/** Read up to {@code count} bytes from the start of a file */
	public static byte[] readHead(Path file, int count) throws IOException {
		try (var in = Files.newInputStream(file)) {
			return in.readNBytes(count);
		}
	}
}
