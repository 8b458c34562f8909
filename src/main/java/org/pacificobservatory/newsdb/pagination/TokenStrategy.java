package org.pacificobservatory.newsdb.pagination;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import org.pacificobservatory.newsdb.descriptor.PaginationRule;
import org.pacificobservatory.newsdb.descriptor.SiteDescriptor;
import org.pacificobservatory.newsdb.model.ListingPage;
import org.pacificobservatory.newsdb.model.PageReference;

/**
 * Cursor-style listings: each page hands out a continuation token which is substituted for
 * {@code {token}} in the URL template. A missing, blank or sentinel token ends the traversal.
 */
public class TokenStrategy implements PaginationStrategist {

	@Override
	public PageReference firstPage(SiteDescriptor descriptor) {
		PaginationRule rule = descriptor.pagination();
		if (rule.startUrl() != null) {
			return PageReference.of(rule.startUrl(), 0);
		}
		return PageReference.of(descriptor.listingUrlTemplate().replace("{token}", ""), 0);
	}

	@Override
	public Optional<PageReference> nextPage(SiteDescriptor descriptor, ListingPage current) {
		String token = current.continuationToken();
		if (token == null || token.isBlank()) {
			return Optional.empty();
		}
		token = token.trim();
		String sentinel = descriptor.pagination().sentinel();
		if (sentinel != null && sentinel.equals(token)) {
			return Optional.empty();
		}
		String url = descriptor
				.listingUrlTemplate()
				.replace("{token}", URLEncoder.encode(token, StandardCharsets.UTF_8));
		return Optional.of(new PageReference(url, current.reference().ordinal() + 1, token));
	}
}
