package dev.collateral.crawler.model;

import static org.assertj.core.api.Assertions.*;

import java.nio.file.Path;
import org.junit.jupiter.api.Test;

class AssetCatalogTest {

	private static final String MODEL = "LDR2-32RD2";

	@Test
	void testProcessingOrder() {
		assertThat(AssetCatalog.processingOrder())
				.containsExactly(
						AssetKind.CATALOG,
						AssetKind.DIMENSION,
						AssetKind.DXF,
						AssetKind.STEP,
						AssetKind.DATASHEET,
						AssetKind.MANUAL,
						AssetKind.IMAGE);
	}

	@Test
	void testBatchGroupHoldsRequiredKinds() {
		assertThat(AssetCatalog.batchGroup())
				.containsExactlyInAnyOrder(AssetKind.CATALOG, AssetKind.DIMENSION, AssetKind.DXF, AssetKind.STEP);
		assertThat(AssetCatalog.batchGroup()).allMatch(AssetKind::inBatchGroup);
	}

	@Test
	void testCanonicalPaths() {
		assertThat(AssetCatalog.canonicalRelativePath(MODEL, AssetKind.DIMENSION, "pdf"))
				.isEqualTo(Path.of(MODEL, MODEL + "_Dimension.pdf"));
		assertThat(AssetCatalog.canonicalRelativePath(MODEL, AssetKind.DXF, "zip"))
				.isEqualTo(Path.of(MODEL, MODEL + "_DXF.zip"));
		assertThat(AssetCatalog.canonicalRelativePath(MODEL, AssetKind.IMAGE, "jpg"))
				.isEqualTo(Path.of(MODEL, "Images", MODEL + ".jpg"));
	}

	@Test
	void testExtensionFor() {
		assertThat(AssetCatalog.extensionFor(AssetKind.CATALOG, "C_LDR2.PDF")).isEqualTo("pdf");
		assertThat(AssetCatalog.extensionFor(AssetKind.STEP, "LDR2-32RD2.stp")).isEqualTo("zip");
		assertThat(AssetCatalog.extensionFor(AssetKind.IMAGE, "photo.JPEG")).isEqualTo("jpg");
		assertThat(AssetCatalog.extensionFor(AssetKind.IMAGE, "photo.webp")).isEqualTo("webp");
		assertThat(AssetCatalog.extensionFor(AssetKind.IMAGE, "photo.tiff")).isEqualTo("png");
		assertThat(AssetCatalog.extensionFor(AssetKind.IMAGE, null)).isEqualTo("png");
	}

	@Test
	void testClassifyVendorFileNames() {
		assertThat(AssetCatalog.classify("C_LDR2.pdf", MODEL)).contains(AssetKind.CATALOG);
		assertThat(AssetCatalog.classify("D_LDR2.pdf", MODEL)).contains(AssetKind.DIMENSION);
		assertThat(AssetCatalog.classify("M_LDR2.pdf", MODEL)).contains(AssetKind.MANUAL);
		assertThat(AssetCatalog.classify("LDR2-32RD2_e.pdf", MODEL)).contains(AssetKind.DIMENSION);
		assertThat(AssetCatalog.classify("Drawing LDR2.pdf", MODEL)).contains(AssetKind.DIMENSION);
		assertThat(AssetCatalog.classify("LDR2-32RD2.pdf", MODEL)).contains(AssetKind.DATASHEET);
		assertThat(AssetCatalog.classify("LDR2 Data Sheet.pdf", MODEL)).contains(AssetKind.DATASHEET);
		assertThat(AssetCatalog.classify("LDR2-32RD2.stp", MODEL)).contains(AssetKind.STEP);
		assertThat(AssetCatalog.classify("LDR2-32RD2.step", MODEL)).contains(AssetKind.STEP);
		assertThat(AssetCatalog.classify("LDR2-32RD2.dxf", MODEL)).contains(AssetKind.DXF);
	}

	@Test
	void testClassifyKeywordsWinOverPrefixes() {
		assertThat(AssetCatalog.classify("C_Manual_LDR2.pdf", MODEL)).contains(AssetKind.MANUAL);
		assertThat(AssetCatalog.classify("Catalog_LDR2.pdf", MODEL)).contains(AssetKind.CATALOG);
	}

	@Test
	void testClassifyIgnoresUnrelatedFiles() {
		assertThat(AssetCatalog.classify("readme.txt", MODEL)).isEmpty();
		assertThat(AssetCatalog.classify("other-model.pdf", MODEL)).isEmpty();
	}

	@Test
	void testCadExtensions() {
		assertThat(AssetCatalog.cadExtensions(AssetKind.DXF)).containsExactly("dxf");
		assertThat(AssetCatalog.cadExtensions(AssetKind.STEP)).containsExactlyInAnyOrder("stp", "step");
		assertThat(AssetCatalog.cadExtensions(AssetKind.CATALOG)).isEmpty();
	}

	@Test
	void testKindLabels() {
		assertThat(AssetKind.fromLabel("step")).isEqualTo(AssetKind.STEP);
		assertThat(AssetKind.fromLabel(" Datasheet ")).isEqualTo(AssetKind.DATASHEET);
		assertThatThrownBy(() -> AssetKind.fromLabel("brochure"))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("brochure");
		assertThat(AssetKind.DATASHEET.required()).isFalse();
		assertThat(AssetKind.DATASHEET.optional()).isFalse();
		assertThat(AssetKind.MANUAL.optional()).isTrue();
	}
}
