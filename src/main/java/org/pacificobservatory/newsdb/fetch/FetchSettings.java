package org.pacificobservatory.newsdb.fetch;

import java.time.Duration;

/**
 * Process-wide fetch configuration.
 *
 * @param maxConcurrent ceiling of requests in flight across all hosts
 * @param maxPerHost ceiling of requests in flight per host, unless a descriptor overrides it
 * @param minDelay minimum spacing between requests to the same host
 */
public record FetchSettings(
		int maxConcurrent,
		int maxPerHost,
		Duration minDelay,
		Duration requestTimeout,
		Duration connectTimeout,
		RetryPolicy retry,
		String userAgent) {

	public static final String DEFAULT_USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) "
			+ "AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

	public static FetchSettings defaults() {
		return new FetchSettings(
				16,
				2,
				Duration.ofMillis(500),
				Duration.ofSeconds(30),
				Duration.ofSeconds(30),
				RetryPolicy.DEFAULT,
				DEFAULT_USER_AGENT);
	}

	public FetchSettings {
		if (maxConcurrent < 1 || maxPerHost < 1) {
			throw new IllegalArgumentException("concurrency limits must be positive");
		}
		if (minDelay == null || minDelay.isNegative()) {
			throw new IllegalArgumentException("minDelay must not be negative");
		}
	}

	public FetchSettings withRetry(RetryPolicy retry) {
		return new FetchSettings(maxConcurrent, maxPerHost, minDelay, requestTimeout, connectTimeout, retry, userAgent);
	}

	public FetchSettings withMinDelay(Duration minDelay) {
		return new FetchSettings(maxConcurrent, maxPerHost, minDelay, requestTimeout, connectTimeout, retry, userAgent);
	}

	public FetchSettings withLimits(int maxConcurrent, int maxPerHost) {
		return new FetchSettings(maxConcurrent, maxPerHost, minDelay, requestTimeout, connectTimeout, retry, userAgent);
	}
}
