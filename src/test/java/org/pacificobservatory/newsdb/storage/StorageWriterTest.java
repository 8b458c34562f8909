package org.pacificobservatory.newsdb.storage;

import static org.assertj.core.api.Assertions.*;

import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.pacificobservatory.newsdb.model.NewsRecord;
import org.pacificobservatory.newsdb.model.PageReference;
import org.pacificobservatory.newsdb.model.RecordKind;
import org.pacificobservatory.newsdb.model.RunManifest;
import org.pacificobservatory.newsdb.model.RunState;
import org.pacificobservatory.newsdb.util.JsonUtils;

class StorageWriterTest {

	private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-03-10T12:00:00.123Z"), ZoneOffset.UTC);

	@TempDir
	Path tempDir;

	private static NewsRecord record(String id) {
		return NewsRecord.create()
				.sourceId("example")
				.externalId("https://example.com/" + id)
				.url("https://example.com/" + id)
				.title("Story " + id)
				.publishedAt(LocalDate.of(2024, 3, 5))
				.fetchedAt(Instant.parse("2024-03-10T12:00:00Z"));
	}

	@Test
	void testWrite_CreatesJsonLinesUnit() throws Exception {
		// Given
		StorageLayout layout = new StorageLayout(tempDir, "example");
		StorageWriter writer = new StorageWriter(layout, "run1");

		// When
		Path unit = writer.write(List.of(record("a"), record("b")), RecordKind.ARTICLE);

		// Then
		assertThat(unit).isEqualTo(tempDir.resolve("example/articles/run1-1.jsonl"));
		List<String> lines = Files.readAllLines(unit);
		assertThat(lines).hasSize(2);
		assertThat(lines.get(0))
				.startsWith("{\"source_id\":\"example\",")
				.contains("\"published_at\":\"2024-03-05\"")
				.contains("\"fetched_at\":\"2024-03-10T12:00:00Z\"");
		List<NewsRecord> read = JsonUtils.readJsonLines(unit, NewsRecord.class);
		assertThat(read).containsExactly(record("a"), record("b"));
		assertThat(read.get(1).title()).isEqualTo("Story b");
		try (Stream<Path> files = Files.list(unit.getParent())) {
			assertThat(files).containsExactly(unit);
		}
	}

	@Test
	void testWrite_EachBatchIsNewUnit() throws Exception {
		// Given
		StorageWriter writer = new StorageWriter(new StorageLayout(tempDir, "example"), "run1");

		// When
		Path first = writer.write(List.of(record("a")), RecordKind.THUMBNAIL);
		Path second = writer.write(List.of(record("b")), RecordKind.THUMBNAIL);
		Path none = writer.write(List.of(), RecordKind.THUMBNAIL);

		// Then
		assertThat(first.getFileName().toString()).isEqualTo("run1-1.jsonl");
		assertThat(second.getFileName().toString()).isEqualTo("run1-2.jsonl");
		assertThat(none).isNull();
		assertThatThrownBy(() -> writer.write(List.of(record("c")), RecordKind.METADATA))
				.isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void testWrite_NeverOverwritesExistingUnit() throws Exception {
		// Given
		StorageLayout layout = new StorageLayout(tempDir, "example");
		new StorageWriter(layout, "run1").write(List.of(record("a")), RecordKind.ARTICLE);

		// When/Then
		StorageWriter again = new StorageWriter(layout, "run1");
		assertThatThrownBy(() -> again.write(List.of(record("b")), RecordKind.ARTICLE))
				.isInstanceOf(FileAlreadyExistsException.class);
		assertThat(Files.readString(layout.unitFile(RecordKind.ARTICLE, "run1", 1))).contains("example.com/a");
		try (Stream<Path> files = Files.list(layout.kindDir(RecordKind.ARTICLE))) {
			assertThat(files).hasSize(1);
		}
	}

	@Test
	void testWriteManifest_ReadBackThroughManifestStore() throws Exception {
		// Given
		StorageLayout layout = new StorageLayout(tempDir, "example");
		String runId = layout.newRunId(CLOCK);
		StorageWriter writer = new StorageWriter(layout, runId);
		RunManifest manifest = new RunManifest(
				"example",
				runId,
				RunState.DONE,
				CLOCK.instant(),
				CLOCK.instant(),
				new RunManifest.Counts(2, 4, 4, 0, 0, 4, 0),
				true,
				false,
				new PageReference("https://example.com/page/3", 2, "3"),
				"https://example.com/a",
				null);

		// When
		Path file = writer.writeManifest(manifest);

		// Then
		assertThat(file).isEqualTo(tempDir.resolve("example/metadata/" + runId + ".json"));
		String json = Files.readString(file);
		assertThat(json).contains("\"new\" : 4").contains("\"resume_page\"").doesNotContain("\"error\"");
		assertThat(new ManifestStore(layout).latest()).contains(manifest);
		assertThat(manifest.isResumable()).isTrue();
	}

	@Test
	void testNewRunId_UniqueWithinSameMillisecond() throws Exception {
		// Given
		StorageLayout layout = new StorageLayout(tempDir, "collide");

		// When
		String first = layout.newRunId(CLOCK);
		String second = layout.newRunId(CLOCK);

		// Then
		assertThat(first).isEqualTo("20240310T120000123Z");
		assertThat(second).startsWith("20240310T120000123Z-").isNotEqualTo(first);
	}

	@Test
	void testManifestStore_LatestByRunId() throws Exception {
		// Given
		StorageLayout layout = new StorageLayout(tempDir, "example");
		ManifestStore store = new ManifestStore(layout);
		assertThat(store.latest()).isEmpty();
		for (String runId : List.of("20240101T000000000Z", "20240301T000000000Z", "20240201T000000000Z")) {
			new StorageWriter(layout, runId).writeManifest(new RunManifest(
					"example", runId, RunState.DONE, null, null, RunManifest.Counts.ZERO, false, false, null, null,
					null));
		}

		// When/Then
		assertThat(store.all()).extracting(RunManifest::runId)
				.containsExactly("20240101T000000000Z", "20240201T000000000Z", "20240301T000000000Z");
		assertThat(store.latest().orElseThrow().runId()).isEqualTo("20240301T000000000Z");
	}
}
