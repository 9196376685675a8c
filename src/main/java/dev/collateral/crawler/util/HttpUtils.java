package dev.collateral.crawler.util;

import java.io.IOException;
import java.net.CookieManager;
import java.net.CookiePolicy;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utility class for HTTP operations. Cookies are kept for the lifetime of the instance, so one
 * instance corresponds to one portal session.
 */
public class HttpUtils {
	private static final Logger logger = LoggerFactory.getLogger(HttpUtils.class);

	/** Functional interface for operations that can throw IOException and InterruptedException */
	@FunctionalInterface
	private interface IOSupplier<T> {
		T get() throws IOException, InterruptedException;
	}

	private static final int DEFAULT_MAX_RETRIES = 3;
	private static final Duration INITIAL_BACKOFF = Duration.ofSeconds(2);
	private static final Pattern CONTENT_DISPOSITION_FILENAME =
			Pattern.compile("filename\\*?=(?:UTF-8'')?\"?([^\";]+)\"?", Pattern.CASE_INSENSITIVE);

	private final HttpClient httpClient;
	private final Duration requestTimeout;
	private final Sleeper sleeper;

	public HttpUtils() {
		this(Duration.ofMinutes(5), Sleeper.SYSTEM);
	}

	/**
	 * @param requestTimeout Time allowed for a request, for file downloads the complete transfer
	 * @param sleeper Used for the backoff between retries
	 */
	public HttpUtils(Duration requestTimeout, Sleeper sleeper) {
		this.httpClient = HttpClient.newBuilder()
				.followRedirects(HttpClient.Redirect.NORMAL)
				.connectTimeout(Duration.ofSeconds(30))
				.cookieHandler(new CookieManager(null, CookiePolicy.ACCEPT_ALL))
				.build();
		this.requestTimeout = requestTimeout;
		this.sleeper = sleeper;
	}

	/**
	 * Download a file into a directory. The file name is taken from the Content-Disposition header
	 * or else from the last segment of the URL. Not retried, callers have their own retry policy.
	 * The whole transfer, body included, has to finish within the request timeout.
	 *
	 * @return The downloaded file
	 * @throws HttpStatusException for non-2xx answers
	 * @throws HttpTimeoutException if the transfer did not finish in time, no partial file is left
	 */
	public Path downloadFile(String url, Path targetDir) throws IOException, InterruptedException {
		Files.createDirectories(targetDir);
		HttpRequest request = request(url).GET().build();
		AtomicReference<Path> target = new AtomicReference<>();
		HttpResponse.BodyHandler<Path> handler = info -> {
			if (info.statusCode() < 200 || info.statusCode() >= 300) {
				return HttpResponse.BodySubscribers.replacing(null);
			}
			String filename = info.headers()
					.firstValue("Content-Disposition")
					.map(HttpUtils::filenameFromDisposition)
					.orElseGet(() -> filenameFromUrl(url));
			Path destination = targetDir.resolve(safeFilename(filename));
			target.set(destination);
			return HttpResponse.BodySubscribers.ofFile(
					destination,
					StandardOpenOption.CREATE,
					StandardOpenOption.WRITE,
					StandardOpenOption.TRUNCATE_EXISTING);
		};

		CompletableFuture<HttpResponse<Path>> future = httpClient.sendAsync(request, handler);
		HttpResponse<Path> response;
		try {
			response = future.get(requestTimeout.toMillis(), TimeUnit.MILLISECONDS);
		} catch (TimeoutException e) {
			future.cancel(true);
			deletePartial(target.get());
			throw new HttpTimeoutException(
					"Download of " + url + " did not finish within " + requestTimeout.toSeconds() + "s");
		} catch (InterruptedException e) {
			future.cancel(true);
			deletePartial(target.get());
			throw e;
		} catch (ExecutionException e) {
			deletePartial(target.get());
			if (e.getCause() instanceof IOException) {
				throw (IOException) e.getCause();
			}
			throw new IOException("Download of " + url + " failed: " + e.getCause().getMessage(), e.getCause());
		}
		checkStatus(url, response.statusCode());
		Path destination = response.body();

		// Preserve original file timestamp from Last-Modified header if available
		response.headers().firstValue("Last-Modified").ifPresent(lastModified -> {
			try {
				Instant instant = Instant.from(DateTimeFormatter.RFC_1123_DATE_TIME.parse(lastModified));
				Files.setLastModifiedTime(destination, FileTime.from(instant));
			} catch (Exception e) {
				logger.debug("Ignoring Last-Modified '{}' for {}", lastModified, url);
			}
		});
		return destination;
	}

	private static void deletePartial(Path file) {
		if (file == null) {
			return;
		}
		try {
			Files.deleteIfExists(file);
		} catch (IOException e) {
			logger.debug("Could not delete partial download {}: {}", file, e.getMessage());
		}
	}

	// Header and URL names are untrusted, they must stay a plain file name inside the target directory
	static String safeFilename(String filename) {
		String name = filename != null ? FileUtils.sanitizeFilename(filename) : "";
		return name.isEmpty() ? "download" : name;
	}

	/** Download content from a URL as a string, retrying transient failures */
	public String downloadString(String url) throws IOException, InterruptedException {
		return retry(() -> {
			HttpRequest request = request(url).GET().build();
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
			checkStatus(url, response.statusCode());
			return response.body();
		});
	}

	/** Post a url-encoded form and return the response body. Not retried. */
	public String postForm(String url, Map<String, String> form) throws IOException, InterruptedException {
		String body = form.entrySet().stream()
				.map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8) + "="
						+ URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
				.collect(Collectors.joining("&"));
		HttpRequest request = request(url)
				.header("Content-Type", "application/x-www-form-urlencoded")
				.POST(HttpRequest.BodyPublishers.ofString(body))
				.build();
		HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
		checkStatus(url, response.statusCode());
		return response.body();
	}

	private HttpRequest.Builder request(String url) {
		return HttpRequest.newBuilder().uri(URI.create(url)).timeout(requestTimeout);
	}

	private static void checkStatus(String url, int statusCode) throws HttpStatusException {
		if (statusCode < 200 || statusCode >= 300) {
			throw new HttpStatusException(url, statusCode);
		}
	}

	static String filenameFromDisposition(String header) {
		Matcher m = CONTENT_DISPOSITION_FILENAME.matcher(header);
		return m.find() ? m.group(1).trim() : null;
	}

	static String filenameFromUrl(String url) {
		String path = URI.create(url).getPath();
		if (path == null || path.isEmpty() || path.endsWith("/")) {
			return "download";
		}
		return path.substring(path.lastIndexOf('/') + 1);
	}

	/**
	 * Retry an operation with exponential backoff. Client errors are not retried.
	 *
	 * @param operation The operation to retry
	 * @return The result of the operation
	 * @throws IOException If all retry attempts fail
	 * @throws InterruptedException If the thread is interrupted during backoff
	 */
	private <T> T retry(IOSupplier<T> operation) throws IOException, InterruptedException {
		IOException lastException = null;
		for (int attempt = 0; attempt < DEFAULT_MAX_RETRIES; attempt++) {
			try {
				return operation.get();
			} catch (HttpStatusException e) {
				if (e.clientError()) {
					throw e;
				}
				lastException = e;
			} catch (IOException e) {
				lastException = e;
			}
			if (attempt < DEFAULT_MAX_RETRIES - 1) {
				// Exponential backoff: 2s, 4s, 8s, ...
				sleeper.sleep(INITIAL_BACKOFF.multipliedBy(1L << attempt));
			}
		}
		throw lastException;
	}
}
