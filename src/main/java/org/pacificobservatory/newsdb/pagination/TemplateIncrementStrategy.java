package org.pacificobservatory.newsdb.pagination;

import java.util.Objects;
import java.util.Optional;
import org.pacificobservatory.newsdb.descriptor.PaginationRule;
import org.pacificobservatory.newsdb.descriptor.SiteDescriptor;
import org.pacificobservatory.newsdb.model.ListingPage;
import org.pacificobservatory.newsdb.model.PageReference;

/**
 * Numbered listing pages: {@code {num}} in the URL template runs from {@code start_page} in steps of
 * {@code step}. Stops on an empty page or when a page starts with the same item as the one before
 * it, which is what sites that clamp out-of-range page numbers do.
 */
public class TemplateIncrementStrategy implements PaginationStrategist {
	private String previousFirstItem;

	@Override
	public PageReference firstPage(SiteDescriptor descriptor) {
		PaginationRule rule = descriptor.pagination();
		if (rule.startUrl() != null) {
			return new PageReference(rule.startUrl(), 0, null);
		}
		return page(descriptor, rule.startPage(), 0);
	}

	@Override
	public Optional<PageReference> nextPage(SiteDescriptor descriptor, ListingPage current) {
		if (current.isEmpty()) {
			return Optional.empty();
		}
		String firstItem = current.firstItemUrl();
		if (previousFirstItem != null && Objects.equals(previousFirstItem, firstItem)) {
			return Optional.empty();
		}
		previousFirstItem = firstItem;

		PaginationRule rule = descriptor.pagination();
		PageReference ref = current.reference();
		int next = ref.token() == null ? rule.startPage() : Integer.parseInt(ref.token()) + rule.step();
		return Optional.of(page(descriptor, next, ref.ordinal() + 1));
	}

	@Override
	public boolean toleratesMissingPage(PageReference page) {
		return page.ordinal() > 0;
	}

	static PageReference page(SiteDescriptor descriptor, int number, int ordinal) {
		String url = descriptor.listingUrlTemplate().replace("{num}", Integer.toString(number));
		return new PageReference(url, ordinal, Integer.toString(number));
	}
}
