package dev.collateral.crawler;

import static org.assertj.core.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.collateral.crawler.portal.LocalPortalServer;
import dev.collateral.crawler.portal.LocalPortalServer.Response;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class CrawlCommandTest {

	@TempDir
	Path tempDir;

	private LocalPortalServer portal;
	private Path manifest;
	private Path output;

	@BeforeEach
	void setUp() throws Exception {
		portal = new LocalPortalServer();
		portal.route("/login", Response.ok("welcome"));
		portal.route("/files/A_catalog.pdf", Response.ok("%PDF-1.4 catalog"));
		portal.route("/files/A_dimension.pdf", Response.ok("%PDF-1.4 dimension"));
		portal.route("/files/A_datasheet.pdf", Response.ok("%PDF-1.4 datasheet"));
		portal.route("/files/A.dxf", Response.ok("0\nSECTION\n0\nEOF\n"));
		portal.route("/files/A.stp", Response.ok("ISO-10303-21;"));
		byte[] png = new byte[SampleFiles.PNG_HEADER.length + 8];
		System.arraycopy(SampleFiles.PNG_HEADER, 0, png, 0, SampleFiles.PNG_HEADER.length);
		portal.route("/img/A.png", new Response(200, png, Map.of()));
		manifest = Files.writeString(tempDir.resolve("manifest.json"), """
				{
				  "base_url": "%s",
				  "login_url": "login",
				  "products": [
				    {"model": "A", "series": "S", "assets": {
				      "catalog": "files/A_catalog.pdf",
				      "dimension": "files/A_dimension.pdf",
				      "datasheet": "files/A_datasheet.pdf",
				      "dxf": "files/A.dxf",
				      "step": "files/A.stp",
				      "image": "img/A.png"
				    }}
				  ]
				}
				""".formatted(portal.baseUrl()));
		output = tempDir.resolve("output");
	}

	@AfterEach
	void tearDown() {
		portal.close();
	}

	@Test
	void testCrawlThenVerify() throws Exception {
		// Given
		Path report = tempDir.resolve("run.json");

		// When
		int crawlExit = execute(
				"crawl", "--manifest", manifest.toString(), "-o", output.toString(), "--delay", "0",
				"-u", "buyer", "-p", "secret", "--report", report.toString());
		int verifyExit = execute("verify", "-r", output.toString());

		// Then
		assertThat(crawlExit).isEqualTo(0);
		assertThat(verifyExit).isEqualTo(0);
		Path product = output.resolve("A");
		assertThat(product.resolve("A_Catalog.pdf")).hasContent("%PDF-1.4 catalog");
		assertThat(product.resolve("A_Datasheet.pdf")).exists();
		assertThat(product.resolve("A_DXF.zip")).exists();
		assertThat(product.resolve("A_STEP.zip")).exists();
		assertThat(product.resolve("Images/A.png")).exists();
		assertThat(product.resolve(".complete")).exists();
		JsonNode json = new ObjectMapper().readTree(Files.readString(report));
		assertThat(json.get("success").asBoolean()).isTrue();
		assertThat(json.get("products_complete").asInt()).isEqualTo(1);
	}

	@Test
	void testSecondCrawlDownloadsNothing() {
		// Given
		execute("crawl", "--manifest", manifest.toString(), "-o", output.toString(), "--delay", "0");
		int downloads = countDownloads();

		// When
		int exit = execute("crawl", "--manifest", manifest.toString(), "-o", output.toString(), "--delay", "0");

		// Then
		assertThat(exit).isEqualTo(0);
		assertThat(countDownloads()).isEqualTo(downloads);
	}

	@Test
	void testRejectedLoginExitsWithTwo() {
		// Given
		portal.route("/login", Response.status(401));

		// When
		int exit = execute("crawl", "--manifest", manifest.toString(), "-o", output.toString(), "--delay", "0");

		// Then
		assertThat(exit).isEqualTo(2);
		assertThat(output.resolve("A")).doesNotExist();
	}

	@Test
	void testUnreadableManifestExitsWithTwo() {
		assertThat(execute("crawl", "--manifest", tempDir.resolve("missing.json").toString())).isEqualTo(2);
	}

	@Test
	void testVerifyReportsIncompleteFolders() throws Exception {
		// Given
		SampleFiles.pdf(output.resolve("B").resolve("B_Catalog.pdf"));

		// When/Then
		assertThat(execute("verify", "-r", output.toString())).isEqualTo(0);
		assertThat(execute("verify", "-r", output.toString(), "--all")).isEqualTo(1);
	}

	private int countDownloads() {
		return (int) portal.requests().stream().filter(r -> r.startsWith("GET ")).count();
	}

	private static int execute(String... args) {
		return new CommandLine(new Main()).execute(args);
	}
}
