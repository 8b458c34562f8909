package org.pacificobservatory.newsdb.util;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/** Utility class for file operations */
public class FileUtils {

	/** Operation writing the content of a file */
	@FunctionalInterface
	public interface ContentWriter {
		void write(BufferedWriter writer) throws IOException;
	}

	/** Ensure a directory exists, creating it if necessary */
	public static void ensureDirectory(Path directory) throws IOException {
		if (!Files.exists(directory)) {
			Files.createDirectories(directory);
		}
	}

	/**
	 * Write a new file so that readers see either nothing or the complete content. The content goes
	 * to a hidden temporary file in the target's directory which is then linked into place. Existing
	 * files are never overwritten.
	 *
	 * @throws FileAlreadyExistsException if the target already exists
	 */
	public static Path writeAtomically(Path target, ContentWriter content) throws IOException {
		Path dir = target.toAbsolutePath().getParent();
		ensureDirectory(dir);
		if (Files.exists(target)) {
			throw new FileAlreadyExistsException(target.toString());
		}
		Path tmp = Files.createTempFile(dir, "." + target.getFileName(), ".tmp");
		try {
			try (BufferedWriter writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
				content.write(writer);
			}
			// a hard link publishes the file atomically and fails if the target appeared meanwhile
			try {
				Files.createLink(target, tmp);
			} catch (UnsupportedOperationException e) {
				Files.move(tmp, target);
			}
			return target;
		} finally {
			Files.deleteIfExists(tmp);
		}
	}

	/** Visible (non-hidden) files in a directory matching a glob, sorted by name */
	public static List<Path> listFiles(Path directory, String glob) throws IOException {
		List<Path> files = new ArrayList<>();
		if (!Files.isDirectory(directory)) {
			return files;
		}
		try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, glob)) {
			for (Path p : stream) {
				if (Files.isRegularFile(p) && !p.getFileName().toString().startsWith(".")) {
					files.add(p);
				}
			}
		}
		files.sort(null);
		return files;
	}
}
