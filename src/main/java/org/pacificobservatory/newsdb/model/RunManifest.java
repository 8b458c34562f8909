package org.pacificobservatory.newsdb.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;

/**
 * Summary of one scraper run, written as the run's metadata unit. When the run ended before its
 * traversal was complete, {@code resumePage} is the first listing page whose items were not all
 * processed; the next run of the same source starts there.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({
	"source_id",
	"run_id",
	"state",
	"started_at",
	"ended_at",
	"counts",
	"cancelled",
	"dry_run",
	"resume_page",
	"last_seen_external_id",
	"error"
})
public record RunManifest(
		@JsonProperty("source_id") String sourceId,
		@JsonProperty("run_id") String runId,
		@JsonProperty("state") RunState state,
		@JsonProperty("started_at") Instant startedAt,
		@JsonProperty("ended_at") Instant endedAt,
		@JsonProperty("counts") Counts counts,
		@JsonProperty("cancelled") boolean cancelled,
		@JsonProperty("dry_run") boolean dryRun,
		@JsonProperty("resume_page") PageReference resumePage,
		@JsonProperty("last_seen_external_id") String lastSeenExternalId,
		@JsonProperty("error") String error) {

	@JsonPropertyOrder({"pages", "fetched", "validated", "rejected", "duplicate", "new", "failed"})
	public record Counts(
			@JsonProperty("pages") int pages,
			@JsonProperty("fetched") int fetched,
			@JsonProperty("validated") int validated,
			@JsonProperty("rejected") int rejected,
			@JsonProperty("duplicate") int duplicate,
			@JsonProperty("new") int created,
			@JsonProperty("failed") int failed) {

		public static final Counts ZERO = new Counts(0, 0, 0, 0, 0, 0, 0);
	}

	/** True when a later run should pick the traversal up at {@link #resumePage()} */
	@JsonIgnore
	public boolean isResumable() {
		return resumePage != null && resumePage.url() != null;
	}
}
