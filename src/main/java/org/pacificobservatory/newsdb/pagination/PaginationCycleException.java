package org.pacificobservatory.newsdb.pagination;

import org.pacificobservatory.newsdb.model.PageReference;

/** A listing page was about to be visited a second time in the same traversal */
public class PaginationCycleException extends RuntimeException {
	private final PageReference page;

	public PaginationCycleException(PageReference page) {
		super("Listing page already visited: " + page.url());
		this.page = page;
	}

	public PageReference page() {
		return page;
	}
}
