package org.pacificobservatory.newsdb.fetch;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;
import org.pacificobservatory.newsdb.descriptor.RateLimit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rate-limited, retrying HTTP client shared by all scrapers. Requests pass a per-host gate (bounded
 * concurrency and minimum spacing) and a global ceiling before they are sent. Transient failures
 * are retried with exponential backoff; permanent ones are reported immediately.
 */
public class FetchClient {
	private static final Logger logger = LoggerFactory.getLogger(FetchClient.class);
	private static final long CANCEL_POLL_MILLIS = 100;

	private final HttpClient httpClient;
	private final FetchSettings settings;
	private final Semaphore globalPermits;
	private final Map<String, HostGate> gates = new ConcurrentHashMap<>();
	private final Map<String, RateLimit> hostLimits = new ConcurrentHashMap<>();
	private final AtomicLong requestCount = new AtomicLong();

	public FetchClient(FetchSettings settings) {
		this.settings = settings;
		this.globalPermits = new Semaphore(settings.maxConcurrent(), true);
		this.httpClient = HttpClient.newBuilder()
				.followRedirects(HttpClient.Redirect.NORMAL)
				.connectTimeout(settings.connectTimeout())
				.build();
	}

	/**
	 * Override the politeness settings for one host. Only takes effect if registered before the
	 * first request to that host.
	 */
	public void configureHost(String host, RateLimit limit) {
		if (host != null && limit != null && !limit.isDefault()) {
			hostLimits.put(host.toLowerCase(Locale.ROOT), limit);
		}
	}

	/** Fetch a URL with a plain GET */
	public FetchResult fetch(String url) throws FetchException, InterruptedException {
		return fetch(FetchRequest.get(url));
	}

	public FetchResult fetch(FetchRequest request) throws FetchException, InterruptedException {
		return fetch(request, () -> false);
	}

	/**
	 * Perform a request, retrying transient failures until the attempts run out or {@code cancelled}
	 * reports true. A cancelled fetch sends no further attempts and rethrows the last failure.
	 *
	 * @return the 2xx response
	 * @throws TransientFetchException if every attempt made failed transiently
	 * @throws PermanentFetchException on a 4xx response or an invalid URL
	 * @throws InterruptedException if interrupted while waiting for a slot or a backoff
	 */
	public FetchResult fetch(FetchRequest request, BooleanSupplier cancelled)
			throws FetchException, InterruptedException {
		URI uri = toUri(request.url());
		RetryPolicy retry = settings.retry();
		TransientFetchException lastException = null;
		for (int attempt = 1; attempt <= retry.maxAttempts(); attempt++) {
			try {
				return attempt(request, uri);
			} catch (TransientFetchException e) {
				lastException = e;
				if (attempt < retry.maxAttempts()) {
					if (cancelled.getAsBoolean()) {
						logger.debug("Not retrying " + request.url() + " after attempt " + attempt + ", cancelled");
						throw e;
					}
					Duration backoff = retry.backoff(attempt);
					logger.debug("Attempt " + attempt + " for " + request.url() + " failed (" + e.getMessage()
							+ "), retrying in " + backoff.toMillis() + "ms");
					if (!pause(backoff, cancelled)) {
						logger.debug("Not retrying " + request.url() + ", cancelled during backoff");
						throw e;
					}
				}
			}
		}
		logger.warn("Giving up on " + request.url() + " after " + retry.maxAttempts() + " attempts: "
				+ lastException.getMessage());
		throw lastException;
	}

	/** Number of requests actually sent, including retries */
	public long requestCount() {
		return requestCount.get();
	}

	private FetchResult attempt(FetchRequest request, URI uri) throws FetchException, InterruptedException {
		HostGate gate = gateFor(uri.getHost());
		gate.enter();
		try {
			globalPermits.acquire();
			try {
				gate.awaitSlot();
				return send(request, uri);
			} finally {
				globalPermits.release();
			}
		} finally {
			gate.leave();
		}
	}

	private FetchResult send(FetchRequest request, URI uri) throws FetchException, InterruptedException {
		HttpRequest.Builder builder = HttpRequest.newBuilder()
				.uri(uri)
				.timeout(request.timeout() != null ? request.timeout() : settings.requestTimeout())
				.header("User-Agent", settings.userAgent());
		request.headers().forEach(builder::setHeader);
		if ("HEAD".equalsIgnoreCase(request.method())) {
			builder.method("HEAD", HttpRequest.BodyPublishers.noBody());
		} else {
			builder.GET();
		}

		HttpResponse<String> response;
		requestCount.incrementAndGet();
		try {
			response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
		} catch (HttpTimeoutException e) {
			throw new TransientFetchException(request.url(), "Timed out: " + e.getMessage(), e);
		} catch (IOException e) {
			throw new TransientFetchException(request.url(), "I/O error: " + e, e);
		} catch (IllegalArgumentException e) {
			throw new PermanentFetchException(request.url(), "Invalid request: " + e.getMessage(), e);
		}

		int status = response.statusCode();
		logger.trace(request.method() + " " + request.url() + " -> " + status);
		if (status >= 200 && status < 300) {
			return new FetchResult(
					status,
					response.body(),
					response.headers().map(),
					Instant.now(),
					response.uri().toString());
		}
		String message = "HTTP status " + status + " for " + request.url();
		if (status == 429 || status >= 500) {
			throw new TransientFetchException(request.url(), status, message);
		}
		throw new PermanentFetchException(request.url(), status, message);
	}

	/** Sleep for the backoff in short steps; false if cancelled meanwhile */
	private static boolean pause(Duration backoff, BooleanSupplier cancelled) throws InterruptedException {
		long deadline = System.nanoTime() + backoff.toNanos();
		long remaining;
		while ((remaining = deadline - System.nanoTime()) > 0) {
			if (cancelled.getAsBoolean()) {
				return false;
			}
			Thread.sleep(Math.max(1, Math.min(CANCEL_POLL_MILLIS, TimeUnit.NANOSECONDS.toMillis(remaining))));
		}
		return !cancelled.getAsBoolean();
	}

	private HostGate gateFor(String host) {
		String key = host.toLowerCase(Locale.ROOT);
		return gates.computeIfAbsent(key, h -> {
			RateLimit limit = hostLimits.get(h);
			int maxConcurrent = settings.maxPerHost();
			Duration minDelay = settings.minDelay();
			if (limit != null) {
				if (limit.maxConcurrent() > 0) {
					maxConcurrent = limit.maxConcurrent();
				}
				if (limit.minDelay() != null) {
					minDelay = limit.minDelay();
				}
			}
			return new HostGate(maxConcurrent, minDelay);
		});
	}

	private static URI toUri(String url) throws PermanentFetchException {
		if (url == null || url.isBlank()) {
			throw new PermanentFetchException(url, -1, "Missing URL");
		}
		try {
			URI uri = new URI(url.trim().replace(" ", "%20"));
			String scheme = uri.getScheme();
			if (scheme == null
					|| !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
					|| uri.getHost() == null) {
				throw new PermanentFetchException(url, -1, "Not an absolute http(s) URL: " + url);
			}
			return uri;
		} catch (URISyntaxException e) {
			throw new PermanentFetchException(url, "Malformed URL: " + url, e);
		}
	}
}
