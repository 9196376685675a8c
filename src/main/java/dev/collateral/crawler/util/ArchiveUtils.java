package dev.collateral.crawler.util;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.zip.GZIPInputStream;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Utilities for reading, writing and rewriting the archives the portal delivers. */
public class ArchiveUtils {
	private static final Logger logger = LoggerFactory.getLogger(ArchiveUtils.class);

	private static final byte[] ZIP_LOCAL_HEADER = {'P', 'K', 3, 4};
	private static final byte[] ZIP_EMPTY_ARCHIVE = {'P', 'K', 5, 6};

	private ArchiveUtils() {
		// Utility class
	}

	/**
	 * Check whether a file starts with a zip signature. Only the header is inspected, the archive
	 * may still be corrupt further in.
	 */
	public static boolean isZip(Path file) throws IOException {
		byte[] head = FileUtils.readHead(file, 4);
		return startsWith(head, ZIP_LOCAL_HEADER) || startsWith(head, ZIP_EMPTY_ARCHIVE);
	}

	/** Check whether a file name looks like a tar archive, compressed or not */
	public static boolean isTarName(String filename) {
		String lower = filename.toLowerCase();
		return lower.endsWith(".tar") || lower.endsWith(".tar.gz") || lower.endsWith(".tgz");
	}

	/**
	 * List the names of all file entries in a zip archive.
	 *
	 * @param zip The zip file
	 * @return Entry names in archive order, directories excluded
	 * @throws IOException if the archive can not be opened or read
	 */
	public static List<String> listEntries(Path zip) throws IOException {
		List<String> names = new ArrayList<>();
		try (ZipFile zipFile = ZipFile.builder().setPath(zip).get()) {
			for (ZipArchiveEntry entry : Collections.list(zipFile.getEntries())) {
				if (!entry.isDirectory()) {
					names.add(entry.getName());
				}
			}
		}
		return names;
	}

	/**
	 * Write a new zip archive holding a single file.
	 *
	 * @param source The file to store
	 * @param entryName The name of the entry inside the archive
	 * @param target The archive to create, replaced if it exists
	 */
	public static void wrapInZip(Path source, String entryName, Path target) throws IOException {
		try (ZipArchiveOutputStream out = new ZipArchiveOutputStream(target)) {
			ZipArchiveEntry entry = new ZipArchiveEntry(entryName);
			entry.setSize(Files.size(source));
			entry.setLastModifiedTime(Files.getLastModifiedTime(source));
			out.putArchiveEntry(entry);
			Files.copy(source, out);
			out.closeArchiveEntry();
			out.finish();
		}
	}

	/**
	 * Extract an archive into a directory. Zip, tar and gzipped tar archives are supported. Entry
	 * paths that would escape the target directory are skipped.
	 *
	 * @param archive The archive to extract
	 * @param targetDir The directory to extract into
	 * @return The extracted regular files
	 */
	public static List<Path> extract(Path archive, Path targetDir) throws IOException {
		Files.createDirectories(targetDir);
		if (isZip(archive)) {
			return extractZip(archive, targetDir);
		}
		String name = archive.getFileName().toString();
		if (isTarName(name)) {
			return extractTar(archive, targetDir, !name.toLowerCase().endsWith(".tar"));
		}
		throw new IOException("Unsupported archive format: " + name);
	}

	private static List<Path> extractZip(Path archive, Path targetDir) throws IOException {
		List<Path> files = new ArrayList<>();
		try (ZipFile zipFile = ZipFile.builder().setPath(archive).get()) {
			for (ZipArchiveEntry entry : Collections.list(zipFile.getEntries())) {
				if (entry.isDirectory()) {
					continue;
				}
				Path target = resolveEntry(targetDir, entry.getName());
				if (target == null) {
					continue;
				}
				Files.createDirectories(target.getParent());
				try (InputStream in = zipFile.getInputStream(entry)) {
					Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
				}
				files.add(target);
			}
		}
		return files;
	}

	private static List<Path> extractTar(Path archive, Path targetDir, boolean gzipped) throws IOException {
		List<Path> files = new ArrayList<>();
		try (InputStream fis = Files.newInputStream(archive);
				InputStream in = gzipped ? new GZIPInputStream(fis) : fis;
				TarArchiveInputStream tis = new TarArchiveInputStream(in)) {

			TarArchiveEntry entry;
			while ((entry = tis.getNextEntry()) != null) {
				if (!entry.isFile()) {
					continue;
				}
				Path target = resolveEntry(targetDir, entry.getName());
				if (target == null) {
					continue;
				}
				Files.createDirectories(target.getParent());
				Files.copy(tis, target, StandardCopyOption.REPLACE_EXISTING);
				files.add(target);
			}
		}
		return files;
	}

	/**
	 * Rewrite a zip archive so that it only holds entries with one of the given extensions. Kept
	 * entries are flattened to their file names. The archive is left untouched when it holds no
	 * matching entry or nothing else.
	 *
	 * @param zip The archive to clean
	 * @param extensions Lower case extensions without dot, e.g. {@code dxf}
	 * @return The outcome, listing the kept entry names
	 */
	public static RetainResult retainEntries(Path zip, Set<String> extensions) throws IOException {
		Set<String> kept = new LinkedHashSet<>();
		List<String> all = new ArrayList<>();
		Path rebuilt = zip.resolveSibling(zip.getFileName() + ".rebuild");
		try (ZipFile zipFile = ZipFile.builder().setPath(zip).get()) {
			List<ZipArchiveEntry> matching = new ArrayList<>();
			for (ZipArchiveEntry entry : Collections.list(zipFile.getEntries())) {
				if (entry.isDirectory()) {
					continue;
				}
				all.add(entry.getName());
				if (extensions.contains(FileUtils.extension(entry.getName()))) {
					matching.add(entry);
				}
			}
			if (matching.isEmpty()) {
				return new RetainResult(false, List.of());
			}
			if (matching.size() == all.size() && all.stream().noneMatch(n -> n.contains("/"))) {
				return new RetainResult(false, List.copyOf(all));
			}
			try (OutputStream os = Files.newOutputStream(rebuilt);
					ZipArchiveOutputStream out = new ZipArchiveOutputStream(os)) {
				for (ZipArchiveEntry entry : matching) {
					String flatName = Path.of(entry.getName()).getFileName().toString();
					if (!kept.add(flatName)) {
						logger.debug("Dropping duplicate entry {} from {}", entry.getName(), zip);
						continue;
					}
					out.putArchiveEntry(new ZipArchiveEntry(flatName));
					try (InputStream in = zipFile.getInputStream(entry)) {
						in.transferTo(out);
					}
					out.closeArchiveEntry();
				}
				out.finish();
			}
		} catch (IOException e) {
			Files.deleteIfExists(rebuilt);
			throw e;
		}
		FileUtils.moveIntoPlace(rebuilt, zip);
		return new RetainResult(true, List.copyOf(kept));
	}

	/** Outcome of {@link #retainEntries(Path, Set)} */
	public record RetainResult(boolean changed, List<String> kept) {}

	private static Path resolveEntry(Path targetDir, String entryName) {
		Path target = targetDir.resolve(entryName).normalize();
		if (!target.startsWith(targetDir.normalize())) {
			logger.warn("Skipping archive entry outside of target directory: {}", entryName);
			return null;
		}
		return target;
	}

	private static boolean startsWith(byte[] data, byte[] prefix) {
		if (data.length < prefix.length) {
			return false;
		}
		for (int i = 0; i < prefix.length; i++) {
			if (data[i] != prefix[i]) {
				return false;
			}
		}
		return true;
	}
}
