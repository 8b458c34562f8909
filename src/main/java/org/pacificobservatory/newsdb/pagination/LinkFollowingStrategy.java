package org.pacificobservatory.newsdb.pagination;

import java.util.Optional;
import org.pacificobservatory.newsdb.descriptor.PaginationRule;
import org.pacificobservatory.newsdb.descriptor.SiteDescriptor;
import org.pacificobservatory.newsdb.model.ListingPage;
import org.pacificobservatory.newsdb.model.PageReference;
import org.pacificobservatory.newsdb.util.UrlUtils;

/** Follows the "next page" link found on each listing page until there is none */
public class LinkFollowingStrategy implements PaginationStrategist {

	@Override
	public PageReference firstPage(SiteDescriptor descriptor) {
		PaginationRule rule = descriptor.pagination();
		String url = rule.startUrl() != null ? rule.startUrl() : descriptor.listingUrlTemplate();
		return PageReference.of(url, 0);
	}

	@Override
	public Optional<PageReference> nextPage(SiteDescriptor descriptor, ListingPage current) {
		String next = UrlUtils.resolve(current.reference().url(), current.nextLink());
		if (next == null || !UrlUtils.isHttpUrl(next)) {
			return Optional.empty();
		}
		return Optional.of(PageReference.of(next, current.reference().ordinal() + 1));
	}
}
