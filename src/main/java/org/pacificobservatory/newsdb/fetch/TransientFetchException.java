package org.pacificobservatory.newsdb.fetch;

/** Timeouts, connection errors, 5xx and 429 responses; worth retrying */
public class TransientFetchException extends FetchException {

	public TransientFetchException(String url, int statusCode, String message) {
		super(url, statusCode, message, null);
	}

	public TransientFetchException(String url, String message, Throwable cause) {
		super(url, -1, message, cause);
	}

	@Override
	public boolean isTransient() {
		return true;
	}
}
