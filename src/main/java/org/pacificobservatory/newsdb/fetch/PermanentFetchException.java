package org.pacificobservatory.newsdb.fetch;

/** 4xx responses and malformed URLs; never retried */
public class PermanentFetchException extends FetchException {

	public PermanentFetchException(String url, int statusCode, String message) {
		super(url, statusCode, message, null);
	}

	public PermanentFetchException(String url, String message, Throwable cause) {
		super(url, -1, message, cause);
	}

	@Override
	public boolean isTransient() {
		return false;
	}

	/** 404 or 410, the page does not exist */
	public boolean isNotFound() {
		return statusCode() == 404 || statusCode() == 410;
	}
}
