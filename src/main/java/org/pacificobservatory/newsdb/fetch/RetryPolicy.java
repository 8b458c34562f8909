package org.pacificobservatory.newsdb.fetch;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * How often and how patiently transient failures are retried.
 *
 * @param maxAttempts total attempts including the first one
 * @param jitter fraction of the backoff added at random, 0 for none
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff, double jitter) {

	public static final RetryPolicy DEFAULT = new RetryPolicy(3, Duration.ofSeconds(2), Duration.ofSeconds(30), 0.5);

	public RetryPolicy {
		if (maxAttempts < 1) {
			throw new IllegalArgumentException("maxAttempts must be at least 1");
		}
		if (jitter < 0) {
			throw new IllegalArgumentException("jitter must not be negative");
		}
	}

	public RetryPolicy withMaxAttempts(int maxAttempts) {
		return new RetryPolicy(maxAttempts, initialBackoff, maxBackoff, jitter);
	}

	/** Delay before the attempt following {@code attempt} (1-based): 2s, 4s, 8s, ... plus jitter */
	public Duration backoff(int attempt) {
		long base = initialBackoff.toMillis() * (1L << Math.min(attempt - 1, 20));
		base = Math.min(base, maxBackoff.toMillis());
		long extra = jitter > 0 ? (long) (base * jitter * ThreadLocalRandom.current().nextDouble()) : 0;
		return Duration.ofMillis(base + extra);
	}
}
