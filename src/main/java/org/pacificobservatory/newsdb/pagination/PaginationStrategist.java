package org.pacificobservatory.newsdb.pagination;

import java.util.Optional;
import org.pacificobservatory.newsdb.descriptor.PaginationRule;
import org.pacificobservatory.newsdb.descriptor.SiteDescriptor;
import org.pacificobservatory.newsdb.model.ListingPage;
import org.pacificobservatory.newsdb.model.PageReference;

/**
 * Decides which listing page comes after the current one. Implementations may keep state across
 * calls within one traversal, so a new instance is used per run.
 */
public interface PaginationStrategist {

	/** The page a traversal starts at when it does not resume */
	PageReference firstPage(SiteDescriptor descriptor);

	/**
	 * The page after {@code current}, or empty at the end of history.
	 *
	 * @param current the page just fetched and parsed
	 */
	Optional<PageReference> nextPage(SiteDescriptor descriptor, ListingPage current);

	/** Whether a 404/410 for this page means "no items here" rather than an error */
	default boolean toleratesMissingPage(PageReference page) {
		return false;
	}

	/** Create a fresh strategist for the descriptor's pagination type */
	static PaginationStrategist forRule(PaginationRule rule) {
		return switch (rule.type()) {
			case TEMPLATE -> new TemplateIncrementStrategy();
			case LINK -> new LinkFollowingStrategy();
			case TOKEN -> new TokenStrategy();
			case ARCHIVE -> new ArchiveStrategy();
		};
	}
}
