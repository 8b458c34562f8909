package org.pacificobservatory.newsdb.storage;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;
import org.pacificobservatory.newsdb.model.RecordKind;

/**
 * Where a source's output lives:
 *
 * <pre>
 * &lt;root&gt;/&lt;source_id&gt;/articles/&lt;run_id&gt;-&lt;seq&gt;.jsonl
 * &lt;root&gt;/&lt;source_id&gt;/thumbnails/&lt;run_id&gt;-&lt;seq&gt;.jsonl
 * &lt;root&gt;/&lt;source_id&gt;/metadata/&lt;run_id&gt;.json
 * </pre>
 */
public class StorageLayout {

	private static final DateTimeFormatter RUN_ID_FORMAT =
			DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmssSSS'Z'").withZone(ZoneOffset.UTC);

	// run ids handed out by this process, so two runs of a source started in the same millisecond differ
	private static final Set<String> issuedRunIds = ConcurrentHashMap.newKeySet();

	private final Path root;
	private final String sourceId;

	public StorageLayout(Path root, String sourceId) {
		this.root = root;
		this.sourceId = sourceId;
	}

	public Path sourceDir() {
		return root.resolve(sourceId);
	}

	public Path kindDir(RecordKind kind) {
		return sourceDir().resolve(kind.directory());
	}

	public Path unitFile(RecordKind kind, String runId, int sequence) {
		return kindDir(kind).resolve(runId + "-" + sequence + ".jsonl");
	}

	public Path manifestFile(String runId) {
		return kindDir(RecordKind.METADATA).resolve(runId + ".json");
	}

	/**
	 * A new run id: the UTC start time to the millisecond, with a random suffix only if that id is
	 * already taken for this source.
	 */
	public String newRunId(Clock clock) {
		String base = RUN_ID_FORMAT.format(clock.instant());
		String runId = base;
		while (!issuedRunIds.add(sourceId + "/" + runId) || Files.exists(manifestFile(runId))) {
			runId = base + "-" + Integer.toHexString(ThreadLocalRandom.current().nextInt(0x1000, 0x10000));
		}
		return runId;
	}
}
