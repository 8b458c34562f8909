package org.pacificobservatory.newsdb.model;

/** Output streams kept per source, each in its own directory */
public enum RecordKind {
	ARTICLE("articles"),
	THUMBNAIL("thumbnails"),
	METADATA("metadata");

	private final String directory;

	RecordKind(String directory) {
		this.directory = directory;
	}

	public String directory() {
		return directory;
	}
}
