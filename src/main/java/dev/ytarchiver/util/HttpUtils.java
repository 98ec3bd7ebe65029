package dev.ytarchiver.util;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.stream.Collectors;

/** Utility class for HTTP operations */
public class HttpUtils {

	/** Functional interface for operations that can throw IOException and InterruptedException */
	@FunctionalInterface
	private interface IOSupplier<T> {
		T get() throws IOException, InterruptedException;
	}

	/** Raised for non-2xx responses so callers can tell quota and auth errors from transport errors */
	public static class HttpStatusException extends IOException {
		private final int statusCode;

		public HttpStatusException(String url, int statusCode, String body) {
			super("HTTP status " + statusCode + " for " + stripKey(url) + (body != null && !body.isBlank() ? ": " + body.strip() : ""));
			this.statusCode = statusCode;
		}

		public int statusCode() {
			return statusCode;
		}

		public boolean isClientError() {
			return statusCode >= 400 && statusCode < 500;
		}
	}

	private final HttpClient httpClient;
	private final int maxRetries;
	private final Duration initialBackoff;

	private static final int DEFAULT_MAX_RETRIES = 3;
	private static final Duration INITIAL_BACKOFF = Duration.ofSeconds(2);

	public HttpUtils() {
		this(DEFAULT_MAX_RETRIES, INITIAL_BACKOFF);
	}

	/**
	 * @param maxRetries Total number of attempts per request, at least 1
	 * @param initialBackoff Pause after the first failed attempt, doubled after each further one
	 */
	public HttpUtils(int maxRetries, Duration initialBackoff) {
		if (maxRetries < 1) {
			throw new IllegalArgumentException("maxRetries must be at least 1: " + maxRetries);
		}
		this.httpClient = HttpClient.newBuilder()
				.followRedirects(HttpClient.Redirect.NORMAL)
				.connectTimeout(Duration.ofSeconds(30))
				.build();
		this.maxRetries = maxRetries;
		this.initialBackoff = initialBackoff;
	}

	/** Download content from a URL as a string */
	public String downloadString(String url) throws IOException, InterruptedException {
		return retry(() -> {
			HttpRequest request = HttpRequest.newBuilder()
					.uri(URI.create(url))
					.timeout(Duration.ofSeconds(60))
					.GET()
					.build();
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
			if (response.statusCode() < 200 || response.statusCode() >= 300) {
				throw new HttpStatusException(url, response.statusCode(), response.body());
			}
			return response.body();
		});
	}

	/** Build a URL from a base and query parameters, skipping null values */
	public static String url(String base, Map<String, String> params) {
		String query = params.entrySet().stream()
				.filter(e -> e.getValue() != null)
				.map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
				.collect(Collectors.joining("&"));
		return query.isEmpty() ? base : base + "?" + query;
	}

	private static String encode(String s) {
		return URLEncoder.encode(s, StandardCharsets.UTF_8);
	}

	/** Remove the API key from a URL before it ends up in a log or error message */
	static String stripKey(String url) {
		return url.replaceAll("([?&]key=)[^&]*", "$1***");
	}

	/**
	 * Retry an operation with exponential backoff. Client errors (4xx) are not retried, the same
	 * request would fail again and only waste quota.
	 *
	 * @param operation The operation to retry
	 * @return The result of the operation
	 * @throws IOException If all retry attempts fail
	 * @throws InterruptedException If the thread is interrupted during backoff
	 */
	private <T> T retry(IOSupplier<T> operation) throws IOException, InterruptedException {
		IOException lastException = null;
		for (int attempt = 0; attempt < maxRetries; attempt++) {
			try {
				return operation.get();
			} catch (HttpStatusException e) {
				if (e.isClientError()) {
					throw e;
				}
				lastException = e;
			} catch (IOException e) {
				lastException = e;
			}
			if (attempt < maxRetries - 1) {
				// Exponential backoff: 2s, 4s, 8s, ...
				long backoffMillis = initialBackoff.toMillis() * (1L << attempt);
				Thread.sleep(backoffMillis);
			}
		}
		throw lastException;
	}
}
