package org.pacificobservatory.newsdb.storage;

import com.fasterxml.jackson.databind.JsonNode;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Set;
import org.pacificobservatory.newsdb.model.NewsRecord;
import org.pacificobservatory.newsdb.util.FileUtils;
import org.pacificobservatory.newsdb.util.JsonUtils;

/**
 * Remembers which external ids a source has already persisted. Loaded once per run from the stored
 * article units; all access goes through this object's lock.
 */
public class DedupTracker {
	private final Set<String> seen = new HashSet<>();

	/** Load the ids of every article already stored in the directory */
	public static DedupTracker load(Path articlesDir) throws IOException {
		DedupTracker tracker = new DedupTracker();
		for (Path unit : FileUtils.listFiles(articlesDir, "*.jsonl")) {
			try (BufferedReader reader = Files.newBufferedReader(unit, StandardCharsets.UTF_8)) {
				String line;
				while ((line = reader.readLine()) != null) {
					if (line.isBlank()) {
						continue;
					}
					JsonNode node = JsonUtils.MAPPER.readTree(line);
					String id = node.path("external_id").asText(null);
					if (id != null) {
						tracker.seen.add(id);
					}
				}
			}
		}
		return tracker;
	}

	public synchronized boolean isNew(String externalId) {
		return !seen.contains(externalId);
	}

	public boolean isNew(NewsRecord record) {
		return isNew(record.externalId());
	}

	public synchronized void markSeen(String externalId) {
		seen.add(externalId);
	}

	public void markSeen(NewsRecord record) {
		markSeen(record.externalId());
	}

	/**
	 * Check and mark in one step.
	 *
	 * @return true if the id was new and is now claimed by the caller
	 */
	public synchronized boolean claim(String externalId) {
		return seen.add(externalId);
	}

	public synchronized int size() {
		return seen.size();
	}
}
