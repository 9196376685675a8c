package dev.collateral.crawler.validate;

import dev.collateral.crawler.model.AssetKind;
import dev.collateral.crawler.util.ArchiveUtils;
import dev.collateral.crawler.util.FileUtils;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Checks that a downloaded file is structurally sound for its asset kind. Validation only reads
 * the file, it never changes the file system or the ledger.
 */
public class ArtifactValidator {
	private static final byte[] PDF_MAGIC = "%PDF".getBytes(StandardCharsets.US_ASCII);

	private static final List<ImageSignature> IMAGE_SIGNATURES = List.of(
			new ImageSignature("png", 0, new byte[] {(byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A}),
			new ImageSignature("jpeg", 0, new byte[] {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF}),
			new ImageSignature("gif", 0, "GIF87a".getBytes(StandardCharsets.US_ASCII)),
			new ImageSignature("gif", 0, "GIF89a".getBytes(StandardCharsets.US_ASCII)),
			new ImageSignature("webp", 8, "WEBP".getBytes(StandardCharsets.US_ASCII)),
			new ImageSignature("bmp", 0, "BM".getBytes(StandardCharsets.US_ASCII)));

	private final long minSize;

	public ArtifactValidator() {
		this(1);
	}

	/**
	 * @param minSize Smallest acceptable file size in bytes, at least 1
	 */
	public ArtifactValidator(long minSize) {
		this.minSize = Math.max(1, minSize);
	}

	/**
	 * Validate a file for the given kind.
	 *
	 * @param file The downloaded file
	 * @param kind The asset kind it was requested as
	 * @return pass or fail with a short reason
	 */
	public ValidationResult validate(Path file, AssetKind kind) {
		try {
			if (!Files.isRegularFile(file)) {
				return ValidationResult.fail("file does not exist");
			}
			long size = Files.size(file);
			if (size == 0) {
				return ValidationResult.fail("file is empty");
			}
			if (size < minSize) {
				return ValidationResult.fail("file too small (" + size + " bytes, minimum " + minSize + ")");
			}
			return switch (kind) {
				case CATALOG, DIMENSION, DATASHEET, MANUAL -> validatePdf(file);
				case DXF, STEP -> validateCad(file);
				case IMAGE -> validateImage(file);
			};
		} catch (IOException e) {
			return ValidationResult.fail("unreadable: " + e.getMessage());
		}
	}

	private ValidationResult validatePdf(Path file) throws IOException {
		byte[] head = FileUtils.readHead(file, PDF_MAGIC.length);
		if (!Arrays.equals(head, PDF_MAGIC)) {
			return ValidationResult.fail("missing %PDF signature");
		}
		return ValidationResult.ok("pdf");
	}

	private ValidationResult validateCad(Path file) throws IOException {
		String name = file.getFileName().toString();
		if (!ArchiveUtils.isZip(file)) {
			if (FileUtils.extension(name).equals("zip")) {
				return ValidationResult.fail("not a zip archive");
			}
			// raw CAD file, the packager wraps it into a zip
			return ValidationResult.ok("raw");
		}
		List<String> entries;
		try {
			entries = ArchiveUtils.listEntries(file);
		} catch (IOException e) {
			return ValidationResult.fail("corrupt zip archive: " + e.getMessage());
		}
		if (entries.isEmpty()) {
			return ValidationResult.fail("zip archive has no entries");
		}
		return ValidationResult.ok("zip");
	}

	private ValidationResult validateImage(Path file) throws IOException {
		byte[] head = FileUtils.readHead(file, 16);
		for (ImageSignature signature : IMAGE_SIGNATURES) {
			if (signature.matches(head)) {
				return ValidationResult.ok(signature.type());
			}
		}
		return ValidationResult.fail("unrecognized image format");
	}

	private record ImageSignature(String type, int offset, byte[] magic) {
		boolean matches(byte[] head) {
			if (head.length < offset + magic.length) {
				return false;
			}
			for (int i = 0; i < magic.length; i++) {
				if (head[offset + i] != magic[i]) {
					return false;
				}
			}
			return true;
		}
	}
}
