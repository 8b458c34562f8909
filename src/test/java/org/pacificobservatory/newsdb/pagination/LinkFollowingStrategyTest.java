package org.pacificobservatory.newsdb.pagination;

import static org.assertj.core.api.Assertions.*;

import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.pacificobservatory.newsdb.descriptor.DescriptorLoader;
import org.pacificobservatory.newsdb.descriptor.SiteDescriptor;
import org.pacificobservatory.newsdb.model.ListingPage;
import org.pacificobservatory.newsdb.model.PageReference;

class LinkFollowingStrategyTest {

	private static SiteDescriptor descriptor() throws Exception {
		return DescriptorLoader.parse(
				"""
				source_id: example
				base_url: https://example.com
				listing:
				  url_template: https://example.com/news/
				  item_selector: article
				  fields:
				    url: a::attr(href)
				pagination:
				  type: link
				  next_selector: a.next
				""",
				"example");
	}

	@Test
	void testFirstPage_IsListingUrl() throws Exception {
		assertThat(new LinkFollowingStrategy().firstPage(descriptor()))
				.isEqualTo(PageReference.of("https://example.com/news/", 0));
	}

	@Test
	void testNextPage_ResolvesRelativeLink() throws Exception {
		// Given
		SiteDescriptor descriptor = descriptor();
		PageReference first = PageReference.of("https://example.com/news/", 0);
		ListingPage page = new ListingPage(first, List.of(), "/news/?page=2", null, null);

		// When
		Optional<PageReference> next = new LinkFollowingStrategy().nextPage(descriptor, page);

		// Then
		assertThat(next).contains(PageReference.of("https://example.com/news/?page=2", 1));
	}

	@Test
	void testNextPage_NoLinkEndsTraversal() throws Exception {
		// Given
		SiteDescriptor descriptor = descriptor();
		ListingPage page = ListingPage.empty(PageReference.of("https://example.com/news/", 0));

		// When/Then
		assertThat(new LinkFollowingStrategy().nextPage(descriptor, page)).isEmpty();
	}

	@Test
	void testNextPage_IgnoresNonHttpLink() throws Exception {
		// Given
		SiteDescriptor descriptor = descriptor();
		PageReference first = PageReference.of("https://example.com/news/", 0);
		ListingPage page = new ListingPage(first, List.of(), "javascript:void(0)", null, null);

		// When/Then
		assertThat(new LinkFollowingStrategy().nextPage(descriptor, page)).isEmpty();
	}
}
