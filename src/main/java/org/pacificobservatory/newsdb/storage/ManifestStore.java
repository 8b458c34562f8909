package org.pacificobservatory.newsdb.storage;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import org.pacificobservatory.newsdb.model.RecordKind;
import org.pacificobservatory.newsdb.model.RunManifest;
import org.pacificobservatory.newsdb.util.FileUtils;
import org.pacificobservatory.newsdb.util.JsonUtils;

/** Reads the run manifests stored for a source */
public class ManifestStore {
	private final StorageLayout layout;

	public ManifestStore(StorageLayout layout) {
		this.layout = layout;
	}

	/** All manifests, sorted by file name */
	public List<RunManifest> all() throws IOException {
		List<RunManifest> manifests = new ArrayList<>();
		for (Path file : FileUtils.listFiles(layout.kindDir(RecordKind.METADATA), "*.json")) {
			manifests.add(JsonUtils.MAPPER.readValue(file.toFile(), RunManifest.class));
		}
		return manifests;
	}

	/**
	 * The most recent manifest, if the source has been run before. Ordered by start time, then run
	 * id, since a suffixed run id does not sort after the id it collided with.
	 */
	public Optional<RunManifest> latest() throws IOException {
		return all().stream()
				.max(Comparator.comparing(RunManifest::startedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
						.thenComparing(RunManifest::runId));
	}
}
