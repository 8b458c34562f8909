package org.pacificobservatory.newsdb.validate;

/** A candidate record does not satisfy the record schema */
public class ValidationException extends Exception {
	private final String field;
	private final String reason;

	public ValidationException(String field, String reason) {
		super(field + ": " + reason);
		this.field = field;
		this.reason = reason;
	}

	public String field() {
		return field;
	}

	public String reason() {
		return reason;
	}
}
