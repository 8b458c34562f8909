package org.pacificobservatory.newsdb.model;

/** States a scraper run moves through. FAILED can be entered from any state. */
public enum RunState {
	INIT,
	LISTING,
	DETAIL_FETCH,
	PERSIST,
	DONE,
	FAILED;

	public boolean isTerminal() {
		return this == DONE || this == FAILED;
	}
}
