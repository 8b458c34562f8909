package org.pacificobservatory.newsdb.descriptor;

/** Thrown when a site descriptor is missing, unreadable or malformed */
public class ConfigurationException extends Exception {

	public ConfigurationException(String message) {
		super(message);
	}

	public ConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}
}
