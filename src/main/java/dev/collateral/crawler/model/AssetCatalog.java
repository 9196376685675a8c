package dev.collateral.crawler.model;

import dev.collateral.crawler.util.FileUtils;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Naming and ordering rules for product assets. Everything that decides where an asset ends up or
 * in which order assets are requested goes through here, so the packager and the orchestrator
 * always agree.
 */
public final class AssetCatalog {

	/** Directory below the product directory that holds the product image */
	public static final String IMAGES_DIR = "Images";

	/** Marker written into a product directory once all required assets are in place */
	public static final String COMPLETE_MARKER = ".complete";

	public static final Set<String> IMAGE_EXTENSIONS = Set.of("jpg", "jpeg", "png", "gif", "webp", "bmp");

	public static final Set<String> DXF_EXTENSIONS = Set.of("dxf");

	public static final Set<String> STEP_EXTENSIONS = Set.of("stp", "step");

	private static final List<AssetKind> PROCESSING_ORDER = List.of(
			AssetKind.CATALOG,
			AssetKind.DIMENSION,
			AssetKind.DXF,
			AssetKind.STEP,
			AssetKind.DATASHEET,
			AssetKind.MANUAL,
			AssetKind.IMAGE);

	// Checked in order, the first keyword found in the lower case file name wins
	private static final List<Keyword> KEYWORDS = List.of(
			new Keyword("manual", AssetKind.MANUAL),
			new Keyword("catalog", AssetKind.CATALOG),
			new Keyword("dimension", AssetKind.DIMENSION),
			new Keyword("dxf", AssetKind.DXF),
			new Keyword("step", AssetKind.STEP),
			new Keyword("datasheet", AssetKind.DATASHEET),
			new Keyword("data sheet", AssetKind.DATASHEET));

	private AssetCatalog() {}

	/** All kinds in the order they are requested for a product */
	public static List<AssetKind> processingOrder() {
		return PROCESSING_ORDER;
	}

	/** The required kinds that the portal retrieves together in one combined download */
	public static Set<AssetKind> batchGroup() {
		EnumSet<AssetKind> group = EnumSet.noneOf(AssetKind.class);
		Arrays.stream(AssetKind.values()).filter(AssetKind::required).forEach(group::add);
		return group;
	}

	/**
	 * Extension of the canonical file for a kind. Documents are always {@code pdf}, CAD kinds always
	 * {@code zip}, images keep the extension of the delivered file when it is a known image type.
	 *
	 * @param kind The asset kind
	 * @param sourceFileName Name of the delivered file, may be null
	 */
	public static String extensionFor(AssetKind kind, String sourceFileName) {
		if (kind == AssetKind.IMAGE && sourceFileName != null) {
			String ext = FileUtils.extension(sourceFileName);
			if (IMAGE_EXTENSIONS.contains(ext)) {
				return ext.equals("jpeg") ? "jpg" : ext;
			}
		}
		return kind.extension();
	}

	/** File name of a finalized asset, e.g. {@code LDR2-32RD2_Dimension.pdf} */
	public static String canonicalFileName(String modelCode, AssetKind kind, String extension) {
		return modelCode + kind.suffix() + "." + extension;
	}

	/**
	 * Path of a finalized asset relative to the output root, e.g. {@code
	 * LDR2-32RD2/LDR2-32RD2_DXF.zip} or {@code LDR2-32RD2/Images/LDR2-32RD2.jpg}.
	 */
	public static Path canonicalRelativePath(String modelCode, AssetKind kind, String extension) {
		Path productDir = Path.of(modelCode);
		if (kind == AssetKind.IMAGE) {
			productDir = productDir.resolve(IMAGES_DIR);
		}
		return productDir.resolve(canonicalFileName(modelCode, kind, extension));
	}

	/** Extensions a CAD kind may carry inside its zip container */
	public static Set<String> cadExtensions(AssetKind kind) {
		return switch (kind) {
			case DXF -> DXF_EXTENSIONS;
			case STEP -> STEP_EXTENSIONS;
			default -> Set.of();
		};
	}

	/**
	 * Guess which kind a delivered file holds from its name. Combined downloads from the portal
	 * contain files named by the vendor, e.g. {@code C_LDR2.pdf} for a catalog or {@code
	 * LDR2-32RD2_e.pdf} for a dimension drawing.
	 *
	 * @param fileName Name of the delivered file
	 * @param modelCode The product the file was delivered for
	 * @return The kind, or empty when the file is of no interest
	 */
	public static Optional<AssetKind> classify(String fileName, String modelCode) {
		String name = fileName.toLowerCase();
		String ext = FileUtils.extension(name);
		String model = modelCode.toLowerCase();
		for (Keyword keyword : KEYWORDS) {
			if (name.contains(keyword.text())) {
				return Optional.of(keyword.kind());
			}
		}
		if (name.startsWith("c_")) {
			return Optional.of(AssetKind.CATALOG);
		}
		if (name.startsWith("d_")) {
			return Optional.of(AssetKind.DIMENSION);
		}
		if (name.startsWith("m_")) {
			return Optional.of(AssetKind.MANUAL);
		}
		if (name.contains("data-sheet")) {
			return Optional.of(AssetKind.DATASHEET);
		}
		if (looksLikeDimension(name, model)) {
			return Optional.of(AssetKind.DIMENSION);
		}
		if (name.contains(model) && ext.equals("pdf")) {
			return Optional.of(AssetKind.DATASHEET);
		}
		if (STEP_EXTENSIONS.contains(ext)) {
			return Optional.of(AssetKind.STEP);
		}
		if (DXF_EXTENSIONS.contains(ext)) {
			return Optional.of(AssetKind.DXF);
		}
		return Optional.empty();
	}

	private static boolean looksLikeDimension(String name, String model) {
		int dot = name.indexOf('.');
		String stem = dot < 0 ? name : name.substring(0, dot);
		if (stem.contains("drawing")) {
			return true;
		}
		return stem.endsWith("_e") && stem.startsWith(model);
	}

	private record Keyword(String text, AssetKind kind) {}
}
