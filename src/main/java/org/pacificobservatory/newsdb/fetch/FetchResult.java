package org.pacificobservatory.newsdb.fetch;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A successful response. {@code finalUrl} is where the body came from after redirects.
 */
public record FetchResult(
		int statusCode, String body, Map<String, List<String>> headers, Instant fetchedAt, String finalUrl) {

	public FetchResult {
		headers = headers == null ? Map.of() : headers;
	}

	/** First value of a response header, matched case-insensitively */
	public Optional<String> header(String name) {
		for (Map.Entry<String, List<String>> e : headers.entrySet()) {
			if (e.getKey() != null && e.getKey().equalsIgnoreCase(name) && !e.getValue().isEmpty()) {
				return Optional.of(e.getValue().get(0));
			}
		}
		return Optional.empty();
	}
}
