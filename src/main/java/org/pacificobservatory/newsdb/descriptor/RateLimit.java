package org.pacificobservatory.newsdb.descriptor;

import java.time.Duration;

/**
 * Per-host politeness settings a descriptor may declare. A {@code null} delay or a non-positive
 * concurrency means "use the fetch client's default".
 */
public record RateLimit(Duration minDelay, int maxConcurrent) {

	public static final RateLimit DEFAULT = new RateLimit(null, 0);

	public boolean isDefault() {
		return minDelay == null && maxConcurrent <= 0;
	}
}
