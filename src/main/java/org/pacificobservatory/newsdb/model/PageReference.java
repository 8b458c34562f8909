package org.pacificobservatory.newsdb.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Points at one listing page. The URL identifies the page for cycle detection; the token carries
 * whatever the pagination strategy needs to compute the following page (a page number, a
 * continuation token or an archive date).
 */
public record PageReference(
		@JsonProperty("url") String url,
		@JsonProperty("ordinal") int ordinal,
		@JsonProperty("token") String token) {

	public static PageReference of(String url, int ordinal) {
		return new PageReference(url, ordinal, null);
	}
}
