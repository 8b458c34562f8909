package org.pacificobservatory.newsdb.storage;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.pacificobservatory.newsdb.model.NewsRecord;
import org.pacificobservatory.newsdb.model.RecordKind;
import org.pacificobservatory.newsdb.model.RunManifest;
import org.pacificobservatory.newsdb.util.FileUtils;
import org.pacificobservatory.newsdb.util.JsonUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Appends batches of records for one run as new, immutable output units. Each unit becomes visible
 * in one atomic step; existing units are never touched.
 */
public class StorageWriter {
	private static final Logger logger = LoggerFactory.getLogger(StorageWriter.class);

	private final StorageLayout layout;
	private final String runId;
	private final AtomicInteger sequence = new AtomicInteger();

	public StorageWriter(StorageLayout layout, String runId) {
		this.layout = layout;
		this.runId = runId;
	}

	public String runId() {
		return runId;
	}

	/**
	 * Write a batch as a new JSON Lines unit.
	 *
	 * @return the unit written, or {@code null} for an empty batch
	 */
	public Path write(List<NewsRecord> batch, RecordKind kind) throws IOException {
		if (kind == RecordKind.METADATA) {
			throw new IllegalArgumentException("Metadata is written with writeManifest");
		}
		if (batch.isEmpty()) {
			return null;
		}
		Path unit = layout.unitFile(kind, runId, sequence.incrementAndGet());
		FileUtils.writeAtomically(unit, writer -> {
			for (NewsRecord record : batch) {
				writer.write(JsonUtils.MAPPER.writeValueAsString(record));
				writer.newLine();
			}
		});
		logger.debug("Wrote " + batch.size() + " " + kind.directory() + " to " + unit);
		return unit;
	}

	/** Write the run's manifest, once per run */
	public Path writeManifest(RunManifest manifest) throws IOException {
		Path file = layout.manifestFile(runId);
		FileUtils.writeAtomically(file, writer -> JsonUtils.PRETTY.writeValue(writer, manifest));
		return file;
	}
}
