package org.pacificobservatory.newsdb.pagination;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import org.pacificobservatory.newsdb.descriptor.SiteDescriptor;
import org.pacificobservatory.newsdb.fetch.FetchException;
import org.pacificobservatory.newsdb.fetch.PermanentFetchException;
import org.pacificobservatory.newsdb.model.ListingPage;
import org.pacificobservatory.newsdb.model.PageReference;

/**
 * Walks a source's listing pages one at a time. Pages are loaded lazily as the cursor advances;
 * after each page the strategist is asked for the next reference. The walk ends when the strategist
 * has nothing more, when the page bound is reached, or with a {@link PaginationCycleException} when
 * a page would be visited twice.
 */
public class ListingCursor {

	/** Fetches and parses one listing page */
	@FunctionalInterface
	public interface PageLoader {
		ListingPage load(PageReference page) throws FetchException, InterruptedException;
	}

	private final SiteDescriptor descriptor;
	private final PaginationStrategist strategist;
	private final PageLoader loader;
	private final int maxPages;
	private final Set<String> visited = new HashSet<>();

	private PageReference pending;
	private int pageCount = 0;
	private boolean maxPagesReached = false;

	/**
	 * @param start page to begin at, usually {@code strategist.firstPage(descriptor)} or a resume point
	 * @param maxPages page bound, 0 or less for unbounded
	 */
	public ListingCursor(
			SiteDescriptor descriptor,
			PaginationStrategist strategist,
			PageLoader loader,
			PageReference start,
			int maxPages) {
		this.descriptor = descriptor;
		this.strategist = strategist;
		this.loader = loader;
		this.pending = start;
		this.maxPages = maxPages;
	}

	/**
	 * Load the next listing page.
	 *
	 * @return the page with its next reference filled in, or empty when the traversal is over
	 * @throws PaginationCycleException if the next reference was already visited
	 * @throws FetchException if the page could not be fetched
	 */
	public Optional<ListingPage> next() throws FetchException, InterruptedException {
		if (pending == null) {
			return Optional.empty();
		}
		if (maxPages > 0 && pageCount >= maxPages) {
			maxPagesReached = true;
			pending = null;
			return Optional.empty();
		}
		PageReference current = pending;
		if (!visited.add(current.url())) {
			pending = null;
			throw new PaginationCycleException(current);
		}

		ListingPage page;
		try {
			page = loader.load(current);
		} catch (PermanentFetchException e) {
			if (!e.isNotFound() || !strategist.toleratesMissingPage(current)) {
				pending = null;
				throw e;
			}
			page = ListingPage.empty(current);
		}
		pageCount++;
		pending = strategist.nextPage(descriptor, page).orElse(null);
		return Optional.of(page.withNextPage(pending));
	}

	/** Listing pages loaded so far */
	public int pageCount() {
		return pageCount;
	}

	/** True if the traversal stopped because of the page bound rather than end of history */
	public boolean maxPagesReached() {
		return maxPagesReached;
	}

	/** Reference the cursor will load next, or {@code null} once finished */
	public PageReference pending() {
		return pending;
	}
}
