package org.pacificobservatory.newsdb.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** A validated article (or thumbnail) ready to be persisted, one JSON line per record */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({
	"source_id",
	"country",
	"external_id",
	"url",
	"title",
	"published_at",
	"date_inferred",
	"body",
	"tags",
	"fetched_at",
	"raw_fields"
})
public class NewsRecord {
	@JsonProperty("source_id")
	private String sourceId;

	@JsonProperty("country")
	private String country;

	@JsonProperty("external_id")
	private String externalId;

	@JsonProperty("url")
	private String url;

	@JsonProperty("title")
	private String title;

	@JsonProperty("published_at")
	private LocalDate publishedAt;

	@JsonProperty("date_inferred")
	private boolean dateInferred;

	@JsonProperty("body")
	private String body;

	@JsonProperty("tags")
	private List<String> tags;

	@JsonProperty("fetched_at")
	private Instant fetchedAt;

	@JsonProperty("raw_fields")
	private Map<String, Object> rawFields;

	public NewsRecord() {
		tags = new ArrayList<>();
		rawFields = new LinkedHashMap<>();
	}

	public String sourceId() {
		return sourceId;
	}

	public NewsRecord sourceId(String sourceId) {
		this.sourceId = sourceId;
		return this;
	}

	public String country() {
		return country;
	}

	public NewsRecord country(String country) {
		this.country = country;
		return this;
	}

	/** Canonical article URL, stable across runs */
	public String externalId() {
		return externalId;
	}

	public NewsRecord externalId(String externalId) {
		this.externalId = externalId;
		return this;
	}

	public String url() {
		return url;
	}

	public NewsRecord url(String url) {
		this.url = url;
		return this;
	}

	public String title() {
		return title;
	}

	public NewsRecord title(String title) {
		this.title = title;
		return this;
	}

	public LocalDate publishedAt() {
		return publishedAt;
	}

	public NewsRecord publishedAt(LocalDate publishedAt) {
		this.publishedAt = publishedAt;
		return this;
	}

	/** True when the publication date was not found and the fetch date was used instead */
	public boolean dateInferred() {
		return dateInferred;
	}

	public NewsRecord dateInferred(boolean dateInferred) {
		this.dateInferred = dateInferred;
		return this;
	}

	public String body() {
		return body;
	}

	public NewsRecord body(String body) {
		this.body = body;
		return this;
	}

	public List<String> tags() {
		return tags;
	}

	public NewsRecord tags(List<String> tags) {
		this.tags = tags != null ? new ArrayList<>(tags) : new ArrayList<>();
		return this;
	}

	public Instant fetchedAt() {
		return fetchedAt;
	}

	public NewsRecord fetchedAt(Instant fetchedAt) {
		this.fetchedAt = fetchedAt;
		return this;
	}

	public Map<String, Object> rawFields() {
		return rawFields;
	}

	public NewsRecord rawFields(Map<String, Object> rawFields) {
		this.rawFields = rawFields != null ? new LinkedHashMap<>(rawFields) : new LinkedHashMap<>();
		return this;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (o == null || getClass() != o.getClass()) return false;
		NewsRecord that = (NewsRecord) o;
		return Objects.equals(sourceId, that.sourceId) && Objects.equals(externalId, that.externalId);
	}

	@Override
	public int hashCode() {
		return Objects.hash(sourceId, externalId);
	}

	@Override
	public String toString() {
		return "NewsRecord{" + sourceId + ", " + externalId + ", " + publishedAt + ", '" + title + "'}";
	}

	public static NewsRecord create() {
		return new NewsRecord();
	}
}
