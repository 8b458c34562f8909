package org.pacificobservatory.newsdb.model;

import java.util.List;

/**
 * A parsed listing page. {@code nextLink} and {@code continuationToken} are the raw pagination hints
 * found on the page; {@code nextPage} is what the pagination strategy decided to visit next and is
 * {@code null} at the end of history.
 */
public record ListingPage(
		PageReference reference,
		List<ItemReference> items,
		String nextLink,
		String continuationToken,
		PageReference nextPage) {

	public ListingPage {
		items = List.copyOf(items);
	}

	public static ListingPage empty(PageReference reference) {
		return new ListingPage(reference, List.of(), null, null, null);
	}

	public boolean isEmpty() {
		return items.isEmpty();
	}

	public String firstItemUrl() {
		return items.isEmpty() ? null : items.get(0).url();
	}

	public ListingPage withNextPage(PageReference next) {
		return new ListingPage(reference, items, nextLink, continuationToken, next);
	}
}
