package org.pacificobservatory.newsdb.fetch;

/** A request that did not produce a usable response */
public abstract class FetchException extends Exception {
	private final String url;
	private final int statusCode;

	protected FetchException(String url, int statusCode, String message, Throwable cause) {
		super(message, cause);
		this.url = url;
		this.statusCode = statusCode;
	}

	public String url() {
		return url;
	}

	/** HTTP status of the failed response, or -1 if no response was received */
	public int statusCode() {
		return statusCode;
	}

	/** Whether repeating the request may succeed */
	public abstract boolean isTransient();
}
