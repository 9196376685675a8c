package dev.collateral.crawler.util;

import static org.assertj.core.api.Assertions.*;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class HttpUtilsTest {

	@TempDir
	Path tempDir;

	private HttpServer server;
	private String baseUrl;
	private final List<Duration> sleeps = new ArrayList<>();
	private HttpUtils http;
	private final CountDownLatch release = new CountDownLatch(1);

	@BeforeEach
	void setUp() throws IOException {
		server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
		server.start();
		baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();
		http = new HttpUtils(Duration.ofSeconds(10), sleeps::add);
	}

	@AfterEach
	void tearDown() {
		release.countDown();
		server.stop(0);
	}

	@Test
	void testDownloadFileUsesContentDisposition() throws Exception {
		// Given
		server.createContext("/files/42", exchange -> {
			exchange.getResponseHeaders().add("Content-Disposition", "attachment; filename=\"C_LDR2.pdf\"");
			exchange.getResponseHeaders().add("Last-Modified", "Wed, 21 Oct 2015 07:28:00 GMT");
			respond(exchange, 200, "%PDF-1.4");
		});

		// When
		Path file = http.downloadFile(baseUrl + "/files/42", tempDir);

		// Then
		assertThat(file).isEqualTo(tempDir.resolve("C_LDR2.pdf"));
		assertThat(file).hasContent("%PDF-1.4");
		assertThat(Files.getLastModifiedTime(file).toInstant().toString()).isEqualTo("2015-10-21T07:28:00Z");
	}

	@Test
	void testDownloadFileFallsBackToUrlName() throws Exception {
		// Given
		server.createContext("/files/D_LDR2.pdf", exchange -> respond(exchange, 200, "%PDF-1.7"));

		// When
		Path file = http.downloadFile(baseUrl + "/files/D_LDR2.pdf?session=1", tempDir.resolve("work"));

		// Then
		assertThat(file).isEqualTo(tempDir.resolve("work").resolve("D_LDR2.pdf"));
	}

	@Test
	void testDownloadFileFailsOnErrorStatus() {
		// Given
		server.createContext("/missing", exchange -> respond(exchange, 404, "not found"));

		// When/Then
		assertThatThrownBy(() -> http.downloadFile(baseUrl + "/missing", tempDir))
				.isInstanceOfSatisfying(HttpStatusException.class, e -> {
					assertThat(e.statusCode()).isEqualTo(404);
					assertThat(e.clientError()).isTrue();
					assertThat(e.authRequired()).isFalse();
				});
		assertThat(tempDir.resolve("missing")).doesNotExist();
	}

	@Test
	void testStalledDownloadTimesOut() throws Exception {
		// Given
		server.createContext("/stall/C_LDR2.pdf", exchange -> {
			exchange.sendResponseHeaders(200, 1000);
			OutputStream out = exchange.getResponseBody();
			out.write("%PDF-1.4".getBytes(StandardCharsets.UTF_8));
			out.flush();
			try {
				release.await(30, TimeUnit.SECONDS);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
			exchange.close();
		});
		HttpUtils impatient = new HttpUtils(Duration.ofSeconds(1), sleeps::add);
		Path workDir = tempDir.resolve("work");
		long start = System.nanoTime();

		// When/Then
		assertThatThrownBy(() -> impatient.downloadFile(baseUrl + "/stall/C_LDR2.pdf", workDir))
				.isInstanceOf(HttpTimeoutException.class)
				.hasMessageContaining("did not finish within 1s");
		assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(10));
		assertThat(workDir.resolve("C_LDR2.pdf")).doesNotExist();
	}

	@Test
	void testDownloadFileKeepsDirectoryReferencesOut() throws Exception {
		// Given
		server.createContext("/files/up", exchange -> {
			exchange.getResponseHeaders().add("Content-Disposition", "attachment; filename=\"..\"");
			respond(exchange, 200, "%PDF-1.4");
		});
		Path workDir = tempDir.resolve("work");

		// When
		Path file = http.downloadFile(baseUrl + "/files/up", workDir);

		// Then
		assertThat(file).isEqualTo(workDir.resolve("download"));
		assertThat(file.getParent()).isEqualTo(workDir);
		assertThat(HttpUtils.safeFilename("../../etc/passwd")).isEqualTo("..-..-etc-passwd");
		assertThat(HttpUtils.safeFilename(null)).isEqualTo("download");
	}

	@Test
	void testDownloadStringRetriesServerErrors() throws Exception {
		// Given
		AtomicInteger calls = new AtomicInteger();
		server.createContext("/status", exchange -> {
			if (calls.incrementAndGet() < 3) {
				respond(exchange, 503, "busy");
			} else {
				respond(exchange, 200, "{\"complete\":true}");
			}
		});

		// When
		String body = http.downloadString(baseUrl + "/status");

		// Then
		assertThat(body).isEqualTo("{\"complete\":true}");
		assertThat(calls.get()).isEqualTo(3);
		assertThat(sleeps).containsExactly(Duration.ofSeconds(2), Duration.ofSeconds(4));
	}

	@Test
	void testDownloadStringDoesNotRetryClientErrors() {
		// Given
		AtomicInteger calls = new AtomicInteger();
		server.createContext("/secret", exchange -> {
			calls.incrementAndGet();
			respond(exchange, 401, "login first");
		});

		// When/Then
		assertThatThrownBy(() -> http.downloadString(baseUrl + "/secret"))
				.isInstanceOfSatisfying(HttpStatusException.class, e -> assertThat(e.authRequired()).isTrue());
		assertThat(calls.get()).isEqualTo(1);
		assertThat(sleeps).isEmpty();
	}

	@Test
	void testPostFormSendsEncodedBody() throws Exception {
		// Given
		AtomicReference<String> received = new AtomicReference<>();
		server.createContext("/login", exchange -> {
			received.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
			respond(exchange, 200, "welcome");
		});

		// When
		String body = http.postForm(baseUrl + "/login", Map.of("username", "buyer@example.com"));

		// Then
		assertThat(body).isEqualTo("welcome");
		assertThat(received.get()).isEqualTo("username=buyer%40example.com");
	}

	@Test
	void testFilenameParsing() {
		assertThat(HttpUtils.filenameFromDisposition("attachment; filename=LDR2.zip")).isEqualTo("LDR2.zip");
		assertThat(HttpUtils.filenameFromDisposition("attachment; filename*=UTF-8''LDR2%20e.pdf"))
				.isEqualTo("LDR2%20e.pdf");
		assertThat(HttpUtils.filenameFromDisposition("inline")).isNull();
		assertThat(HttpUtils.filenameFromUrl("https://portal.example.com/dl/C_LDR2.pdf?x=1")).isEqualTo("C_LDR2.pdf");
		assertThat(HttpUtils.filenameFromUrl("https://portal.example.com/dl/")).isEqualTo("download");
	}

	private static void respond(HttpExchange exchange, int status, String body) throws IOException {
		byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
		exchange.sendResponseHeaders(status, bytes.length);
		try (OutputStream out = exchange.getResponseBody()) {
			out.write(bytes);
		}
	}
}
