package org.pacificobservatory.newsdb.scraper;

import org.pacificobservatory.newsdb.model.RunManifest;
import org.pacificobservatory.newsdb.model.RunState;

/** Result of a scraper execution */
public record ScraperResult(String sourceId, RunManifest manifest, Exception error) {

	public static ScraperResult of(RunManifest manifest, Exception error) {
		return new ScraperResult(manifest.sourceId(), manifest, error);
	}

	/** Result for a scraper that could not even be started */
	public static ScraperResult failure(String sourceId, Exception error) {
		return new ScraperResult(sourceId, null, error);
	}

	public boolean success() {
		return manifest != null && manifest.state() == RunState.DONE;
	}

	public RunState state() {
		return manifest != null ? manifest.state() : RunState.FAILED;
	}

	public RunManifest.Counts counts() {
		return manifest != null ? manifest.counts() : RunManifest.Counts.ZERO;
	}

	@Override
	public String toString() {
		RunManifest.Counts c = counts();
		if (success()) {
			return "%s: SUCCESS%s (%d pages, %d fetched, %d new, %d duplicate, %d rejected, %d failed)"
					.formatted(
							sourceId,
							manifest.cancelled() ? " [cancelled]" : "",
							c.pages(),
							c.fetched(),
							c.created(),
							c.duplicate(),
							c.rejected(),
							c.failed());
		}
		return "%s: FAILED - %s".formatted(sourceId, error != null ? error.getMessage() : "Unknown error");
	}
}
