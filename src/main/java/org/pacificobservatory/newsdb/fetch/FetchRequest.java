package org.pacificobservatory.newsdb.fetch;

import java.time.Duration;
import java.util.Map;

/**
 * One HTTP request. A {@code null} timeout means the client's default.
 *
 * @param method GET or HEAD
 */
public record FetchRequest(String url, String method, Map<String, String> headers, Duration timeout) {

	public FetchRequest {
		headers = headers == null ? Map.of() : Map.copyOf(headers);
		method = method == null ? "GET" : method;
	}

	public static FetchRequest get(String url) {
		return new FetchRequest(url, "GET", Map.of(), null);
	}
}
