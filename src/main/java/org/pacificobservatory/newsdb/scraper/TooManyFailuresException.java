package org.pacificobservatory.newsdb.scraper;

/** A scraper exceeded its failure budget and aborts its run */
public class TooManyFailuresException extends RuntimeException {

	public TooManyFailuresException(String message) {
		super(message);
	}
}
