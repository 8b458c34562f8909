package org.pacificobservatory.newsdb.extract;

import static org.assertj.core.api.Assertions.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.jsoup.nodes.Document;
import org.junit.jupiter.api.Test;
import org.pacificobservatory.newsdb.descriptor.DescriptorLoader;
import org.pacificobservatory.newsdb.descriptor.SiteDescriptor;
import org.pacificobservatory.newsdb.fetch.FetchResult;
import org.pacificobservatory.newsdb.model.ListingPage;
import org.pacificobservatory.newsdb.model.PageReference;
import org.pacificobservatory.newsdb.model.RawRecord;

class ExtractorTest {

	private static final Instant FETCHED_AT = Instant.parse("2024-03-05T01:00:00Z");

	private static final String LISTING =
			"""
			<html><body>
			  <article>
			    <h2><a href="/news/budget-passed/">Budget passed</a></h2>
			    <time datetime="2024-03-04">4 March</time>
			    <img src="img/budget.jpg">
			  </article>
			  <article>
			    <h2><a href="https://example.com/news/second">Second story</a></h2>
			  </article>
			  <article><h2>No link</h2></article>
			  <div class="pager"><a class="next" href="/news/page/2/">Older</a></div>
			  <div class="more" data-cursor="c-42"></div>
			</body></html>
			""";

	private static final String ARTICLE =
			"""
			<html><body>
			  <h1> Budget  passed </h1>
			  <div class="entry"><p>First paragraph.</p><p></p><p>Second &amp; last.</p></div>
			  <ul class="tags"><li>Politics</li><li>Economy</li></ul>
			</body></html>
			""";

	private final Extractor extractor = new Extractor();

	private static SiteDescriptor descriptor(String pagination) throws Exception {
		return descriptor("https://example.com/news/page/{num}/", pagination);
	}

	private static SiteDescriptor descriptor(String template, String pagination) throws Exception {
		return DescriptorLoader.parse(
				"""
				source_id: example
				base_url: https://example.com
				listing:
				  url_template: %s
				  item_selector: article
				  fields:
				    url: h2 a::attr(href)
				    title: h2
				    published_at: time::attr(datetime)
				    image: img::attr(src)
				detail:
				  fields:
				    title: h1
				    body: div.entry p::all
				    tags: ul.tags li::all
				    byline: span.author
				cleaning:
				  title: clean_title
				  body: text
				  tags: tags
				pagination:
				"""
						.formatted(template)
						+ pagination,
				"example");
	}

	private static FetchResult result(String url, String body, Map<String, List<String>> headers) {
		return new FetchResult(200, body, headers, FETCHED_AT, url);
	}

	@Test
	void testParseListing_ItemsAndNextLink() throws Exception {
		// Given
		SiteDescriptor descriptor = descriptor("  type: link\n  next_selector: div.pager a.next\n");
		PageReference ref = PageReference.of("https://example.com/news/", 0);

		// When
		ListingPage page = extractor.parseListing(descriptor, ref, result(ref.url(), LISTING, Map.of()));

		// Then
		assertThat(page.items()).hasSize(3);
		assertThat(page.items().get(0).url()).isEqualTo("https://example.com/news/budget-passed/");
		RawRecord first = page.items().get(0).fields();
		assertThat(first.getString("title")).isEqualTo("Budget passed");
		assertThat(first.getString("published_at")).isEqualTo("2024-03-04");
		assertThat(first.getString("image")).isEqualTo("https://example.com/news/img/budget.jpg");
		assertThat(first.fetchedAt()).isEqualTo(FETCHED_AT);
		assertThat(page.items().get(1).url()).isEqualTo("https://example.com/news/second");
		assertThat(page.items().get(2).url()).isNull();
		assertThat(page.items().get(2).fields().has("url")).isFalse();
		assertThat(page.nextLink()).isEqualTo("https://example.com/news/page/2/");
		assertThat(page.nextPage()).isNull();
	}

	@Test
	void testParseListing_TokenFromSelectorOrHeader() throws Exception {
		// Given
		SiteDescriptor bySelector = descriptor(
				"https://example.com/news?after={token}",
				"  type: token\n  token_selector: div.more::attr(data-cursor)\n");
		SiteDescriptor byHeader = descriptor(
				"https://example.com/news?after={token}", "  type: token\n  token_header: X-Next-Cursor\n");
		PageReference ref = PageReference.of("https://example.com/news?after=", 0);
		Map<String, List<String>> headers = Map.of("x-next-cursor", List.of("h-7"));

		// When
		ListingPage fromSelector = extractor.parseListing(bySelector, ref, result(ref.url(), LISTING, headers));
		ListingPage fromHeader = extractor.parseListing(byHeader, ref, result(ref.url(), LISTING, headers));

		// Then
		assertThat(fromSelector.continuationToken()).isEqualTo("c-42");
		assertThat(fromHeader.continuationToken()).isEqualTo("h-7");
	}

	@Test
	void testExtract_DetailFields() throws Exception {
		// Given
		SiteDescriptor descriptor = descriptor("  type: template\n");
		Document document = extractor.parse(result("https://example.com/news/budget-passed/", ARTICLE, Map.of()));

		// When
		RawRecord record = extractor.extract(descriptor, document, FETCHED_AT);

		// Then
		assertThat(record.getString("title")).isEqualTo("Budget passed");
		assertThat(record.get("body")).isEqualTo(List.of("First paragraph.", "Second & last."));
		assertThat(record.get("tags")).isEqualTo(List.of("Politics", "Economy"));
		assertThat(record.has("byline")).isFalse();
		assertThat(record.fetchedAt()).isEqualTo(FETCHED_AT);
	}

	@Test
	void testClean_ReturnsCleanedCopy() throws Exception {
		// Given
		SiteDescriptor descriptor = descriptor("  type: template\n");
		RawRecord raw = new RawRecord("example", FETCHED_AT)
				.put("title", " - Budget   passed | ")
				.put("body", List.of("One.", "Two."))
				.put("tags", "Politics, Economy");

		// When
		RawRecord cleaned = extractor.clean(descriptor, raw, descriptor.baseUrl());

		// Then
		assertThat(cleaned.getString("title")).isEqualTo("Budget passed");
		assertThat(cleaned.get("body")).isEqualTo("One. Two.");
		assertThat(cleaned.get("tags")).isEqualTo(List.of("Politics", "Economy"));
		assertThat(raw.getString("title")).isEqualTo(" - Budget   passed | ");
	}
}
