package org.pacificobservatory.newsdb.pagination;

import static org.assertj.core.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.pacificobservatory.newsdb.descriptor.DescriptorLoader;
import org.pacificobservatory.newsdb.descriptor.SiteDescriptor;
import org.pacificobservatory.newsdb.model.ItemReference;
import org.pacificobservatory.newsdb.model.ListingPage;
import org.pacificobservatory.newsdb.model.PageReference;
import org.pacificobservatory.newsdb.model.RawRecord;

class TemplateIncrementStrategyTest {

	static SiteDescriptor descriptor(String pagination) throws Exception {
		return DescriptorLoader.parse(
				"""
				source_id: example
				base_url: https://example.com
				listing:
				  url_template: https://example.com/news/page/{num}/
				  item_selector: article
				  fields:
				    url: a::attr(href)
				pagination:
				"""
						+ pagination,
				"example");
	}

	static ListingPage page(PageReference ref, String... itemUrls) {
		List<ItemReference> items = new ArrayList<>();
		for (String url : itemUrls) {
			items.add(new ItemReference(url, new RawRecord("example", null).put("url", url)));
		}
		return new ListingPage(ref, items, null, null, null);
	}

	@Test
	void testFirstPage_UsesStartPage() throws Exception {
		// Given
		SiteDescriptor descriptor = descriptor("  type: template\n  start_page: 3\n");

		// When
		PageReference first = new TemplateIncrementStrategy().firstPage(descriptor);

		// Then
		assertThat(first.url()).isEqualTo("https://example.com/news/page/3/");
		assertThat(first.ordinal()).isZero();
		assertThat(first.token()).isEqualTo("3");
	}

	@Test
	void testNextPage_AddsStep() throws Exception {
		// Given
		SiteDescriptor descriptor = descriptor("  type: template\n  start_page: 0\n  step: 25\n");
		TemplateIncrementStrategy strategy = new TemplateIncrementStrategy();
		PageReference first = strategy.firstPage(descriptor);

		// When
		Optional<PageReference> second = strategy.nextPage(descriptor, page(first, "https://example.com/a"));

		// Then
		assertThat(second).isPresent();
		assertThat(second.get().url()).isEqualTo("https://example.com/news/page/25/");
		assertThat(second.get().ordinal()).isEqualTo(1);
		assertThat(second.get().token()).isEqualTo("25");
	}

	@Test
	void testNextPage_StopsOnEmptyPage() throws Exception {
		// Given
		SiteDescriptor descriptor = descriptor("  type: template\n");
		TemplateIncrementStrategy strategy = new TemplateIncrementStrategy();

		// When
		Optional<PageReference> next = strategy.nextPage(descriptor, page(strategy.firstPage(descriptor)));

		// Then
		assertThat(next).isEmpty();
	}

	@Test
	void testNextPage_StopsWhenSiteRepeatsLastPage() throws Exception {
		// Given
		SiteDescriptor descriptor = descriptor("  type: template\n");
		TemplateIncrementStrategy strategy = new TemplateIncrementStrategy();
		PageReference first = strategy.firstPage(descriptor);
		PageReference second = strategy.nextPage(descriptor, page(first, "https://example.com/a")).orElseThrow();

		// When
		Optional<PageReference> third = strategy.nextPage(descriptor, page(second, "https://example.com/a"));

		// Then
		assertThat(third).isEmpty();
	}

	@Test
	void testFirstPage_StartUrlThenTemplate() throws Exception {
		// Given
		SiteDescriptor descriptor =
				descriptor("  type: template\n  start_page: 2\n  start_url: https://example.com/news/\n");
		TemplateIncrementStrategy strategy = new TemplateIncrementStrategy();

		// When
		PageReference first = strategy.firstPage(descriptor);
		PageReference second = strategy.nextPage(descriptor, page(first, "https://example.com/a")).orElseThrow();

		// Then
		assertThat(first.url()).isEqualTo("https://example.com/news/");
		assertThat(second.url()).isEqualTo("https://example.com/news/page/2/");
	}

	@Test
	void testToleratesMissingPage_OnlyAfterFirst() {
		TemplateIncrementStrategy strategy = new TemplateIncrementStrategy();
		assertThat(strategy.toleratesMissingPage(new PageReference("https://example.com/1", 0, "1"))).isFalse();
		assertThat(strategy.toleratesMissingPage(new PageReference("https://example.com/2", 1, "2"))).isTrue();
	}
}
