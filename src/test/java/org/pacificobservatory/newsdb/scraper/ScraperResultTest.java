package org.pacificobservatory.newsdb.scraper;

import static org.assertj.core.api.Assertions.*;

import java.io.IOException;
import org.junit.jupiter.api.Test;
import org.pacificobservatory.newsdb.model.RunManifest;
import org.pacificobservatory.newsdb.model.RunState;

class ScraperResultTest {

	private static RunManifest manifest(RunState state, boolean cancelled) {
		return new RunManifest(
				"example",
				"20240310T120000000Z",
				state,
				null,
				null,
				new RunManifest.Counts(3, 10, 9, 1, 2, 7, 0),
				cancelled,
				false,
				null,
				null,
				null);
	}

	@Test
	void testToString_Success() {
		ScraperResult result = ScraperResult.of(manifest(RunState.DONE, false), null);
		assertThat(result.success()).isTrue();
		assertThat(result).hasToString(
				"example: SUCCESS (3 pages, 10 fetched, 7 new, 2 duplicate, 1 rejected, 0 failed)");
	}

	@Test
	void testToString_Cancelled() {
		ScraperResult result = ScraperResult.of(manifest(RunState.DONE, true), null);
		assertThat(result.toString()).startsWith("example: SUCCESS [cancelled] (");
	}

	@Test
	void testToString_Failure() {
		ScraperResult result = ScraperResult.of(manifest(RunState.FAILED, false), new IOException("disk full"));
		assertThat(result.success()).isFalse();
		assertThat(result).hasToString("example: FAILED - disk full");
	}

	@Test
	void testFailure_WithoutManifest() {
		ScraperResult result = ScraperResult.failure("example", new IllegalStateException("boom"));
		assertThat(result.state()).isEqualTo(RunState.FAILED);
		assertThat(result.counts()).isEqualTo(RunManifest.Counts.ZERO);
		assertThat(result).hasToString("example: FAILED - boom");
	}
}
