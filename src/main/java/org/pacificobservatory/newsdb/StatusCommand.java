package org.pacificobservatory.newsdb;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Stream;
import org.pacificobservatory.newsdb.model.RunManifest;
import org.pacificobservatory.newsdb.storage.ManifestStore;
import org.pacificobservatory.newsdb.storage.StorageLayout;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/** Status command showing the latest run of every stored source */
@Command(
		name = "status",
		description = "Show the most recent run manifest of each source in the storage root",
		mixinStandardHelpOptions = true)
public class StatusCommand implements Callable<Integer> {

	@Option(
			names = {"-o", "--storage-root"},
			description = "Directory scraped records are stored in (default: data)",
			defaultValue = "data")
	private Path storageRoot;

	@Override
	public Integer call() throws Exception {
		if (!Files.isDirectory(storageRoot)) {
			System.err.println("Storage root not found: " + storageRoot.toAbsolutePath());
			return 1;
		}
		List<Path> sourceDirs;
		try (Stream<Path> dirs = Files.list(storageRoot)) {
			sourceDirs = dirs.filter(Files::isDirectory).sorted().toList();
		}

		System.out.println("Latest Runs");
		System.out.println("===========");
		for (Path dir : sourceDirs) {
			String sourceId = dir.getFileName().toString();
			var latest = new ManifestStore(new StorageLayout(storageRoot, sourceId)).latest();
			if (latest.isEmpty()) {
				continue;
			}
			RunManifest m = latest.get();
			System.out.printf(
					"  %s: %s at %s (%d new, %d duplicate, %d rejected, %d failed)%s%n",
					sourceId,
					m.state(),
					m.endedAt(),
					m.counts().created(),
					m.counts().duplicate(),
					m.counts().rejected(),
					m.counts().failed(),
					m.isResumable() ? " - resumes at " + m.resumePage().url() : "");
		}
		return 0;
	}
}
