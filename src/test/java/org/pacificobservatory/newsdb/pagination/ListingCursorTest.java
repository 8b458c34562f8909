package org.pacificobservatory.newsdb.pagination;

import static org.assertj.core.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.pacificobservatory.newsdb.TestSite;
import org.pacificobservatory.newsdb.descriptor.DescriptorLoader;
import org.pacificobservatory.newsdb.descriptor.SiteDescriptor;
import org.pacificobservatory.newsdb.extract.Extractor;
import org.pacificobservatory.newsdb.fetch.FetchClient;
import org.pacificobservatory.newsdb.fetch.PermanentFetchException;
import org.pacificobservatory.newsdb.model.ListingPage;

class ListingCursorTest {

	private TestSite site;
	private FetchClient client;
	private final Extractor extractor = new Extractor();

	@BeforeEach
	void setUp() throws Exception {
		site = TestSite.start();
		client = new FetchClient(TestSite.fastSettings());
	}

	@AfterEach
	void tearDown() {
		site.close();
	}

	private SiteDescriptor templateDescriptor() throws Exception {
		return DescriptorLoader.parse(
				"""
				source_id: example
				base_url: %s
				listing:
				  url_template: %s
				  item_selector: article
				  fields:
				    url: a::attr(href)
				pagination:
				  type: template
				"""
						.formatted(site.url("/"), site.url("/news/{num}")),
				"example");
	}

	private SiteDescriptor linkDescriptor() throws Exception {
		return DescriptorLoader.parse(
				"""
				source_id: example
				base_url: %s
				listing:
				  url_template: %s
				  item_selector: article
				  fields:
				    url: a::attr(href)
				pagination:
				  type: link
				  next_selector: a.next
				"""
						.formatted(site.url("/"), site.url("/news/1")),
				"example");
	}

	private static String listing(String next, String... items) {
		StringBuilder html = new StringBuilder("<html><body>");
		for (String item : items) {
			html.append("<article><a href=\"").append(item).append("\">x</a></article>");
		}
		if (next != null) {
			html.append("<a class=\"next\" href=\"").append(next).append("\">Next</a>");
		}
		return html.append("</body></html>").toString();
	}

	private ListingCursor cursor(SiteDescriptor descriptor, PaginationStrategist strategist, int maxPages) {
		return new ListingCursor(
				descriptor,
				strategist,
				ref -> extractor.parseListing(descriptor, ref, client.fetch(ref.url())),
				strategist.firstPage(descriptor),
				maxPages);
	}

	private static List<ListingPage> drain(ListingCursor cursor) throws Exception {
		List<ListingPage> pages = new ArrayList<>();
		Optional<ListingPage> page;
		while ((page = cursor.next()).isPresent()) {
			pages.add(page.get());
		}
		return pages;
	}

	@Test
	void testNext_WalksUntilEmptyPage() throws Exception {
		// Given
		site.page("/news/1", listing(null, "/a/1", "/a/2"))
				.page("/news/2", listing(null, "/a/3"))
				.page("/news/3", listing(null));
		SiteDescriptor descriptor = templateDescriptor();
		ListingCursor cursor = cursor(descriptor, new TemplateIncrementStrategy(), 0);

		// When
		List<ListingPage> pages = drain(cursor);

		// Then
		assertThat(pages).hasSize(3);
		assertThat(pages.get(0).items()).extracting(i -> i.url()).containsExactly(site.url("/a/1"), site.url("/a/2"));
		assertThat(pages.get(0).nextPage().url()).isEqualTo(site.url("/news/2"));
		assertThat(pages.get(2).nextPage()).isNull();
		assertThat(cursor.pageCount()).isEqualTo(3);
		assertThat(cursor.maxPagesReached()).isFalse();
		assertThat(cursor.pending()).isNull();
	}

	@Test
	void testNext_MissingLaterPageEndsTraversal() throws Exception {
		// Given
		site.page("/news/1", listing(null, "/a/1"));
		ListingCursor cursor = cursor(templateDescriptor(), new TemplateIncrementStrategy(), 0);

		// When
		List<ListingPage> pages = drain(cursor);

		// Then
		assertThat(pages).hasSize(2);
		assertThat(pages.get(1).isEmpty()).isTrue();
		assertThat(site.hits("/news/2")).isEqualTo(1);
	}

	@Test
	void testNext_MissingFirstPageFails() throws Exception {
		// Given
		ListingCursor cursor = cursor(templateDescriptor(), new TemplateIncrementStrategy(), 0);

		// When/Then
		assertThatThrownBy(cursor::next)
				.isInstanceOfSatisfying(PermanentFetchException.class, e -> assertThat(e.statusCode()).isEqualTo(404));
		assertThat(cursor.next()).isEmpty();
	}

	@Test
	void testNext_StopsAtMaxPages() throws Exception {
		// Given
		site.page("/news/1", listing(null, "/a/1"))
				.page("/news/2", listing(null, "/a/2"))
				.page("/news/3", listing(null, "/a/3"));
		ListingCursor cursor = cursor(templateDescriptor(), new TemplateIncrementStrategy(), 2);

		// When
		List<ListingPage> pages = drain(cursor);

		// Then
		assertThat(pages).hasSize(2);
		assertThat(cursor.maxPagesReached()).isTrue();
		assertThat(site.hits("/news/3")).isZero();
	}

	@Test
	void testNext_DetectsCycle() throws Exception {
		// Given
		site.page("/news/1", listing("/news/2", "/a/1")).page("/news/2", listing("/news/1", "/a/2"));
		ListingCursor cursor = cursor(linkDescriptor(), new LinkFollowingStrategy(), 0);

		// When
		cursor.next();
		cursor.next();

		// Then
		assertThatThrownBy(cursor::next)
				.isInstanceOfSatisfying(
						PaginationCycleException.class,
						e -> assertThat(e.page().url()).isEqualTo(site.url("/news/1")));
		assertThat(site.hits("/news/1")).isEqualTo(1);
		assertThat(cursor.pending()).isNull();
	}

	@Test
	void testNext_ResumesAtGivenPage() throws Exception {
		// Given
		site.page("/news/5", listing(null, "/a/9")).page("/news/6", listing(null));
		SiteDescriptor descriptor = templateDescriptor();
		TemplateIncrementStrategy strategy = new TemplateIncrementStrategy();
		ListingCursor cursor = new ListingCursor(
				descriptor,
				strategy,
				ref -> extractor.parseListing(descriptor, ref, client.fetch(ref.url())),
				TemplateIncrementStrategy.page(descriptor, 5, 4),
				0);

		// When
		List<ListingPage> pages = drain(cursor);

		// Then
		assertThat(pages).extracting(p -> p.reference().url())
				.containsExactly(site.url("/news/5"), site.url("/news/6"));
		assertThat(site.hits("/news/1")).isZero();
	}

	@Test
	void testNext_EmptyStartEndsImmediately() throws Exception {
		// Given
		ListingCursor cursor = new ListingCursor(
				templateDescriptor(), new TemplateIncrementStrategy(), ref -> ListingPage.empty(ref), null, 0);

		// When/Then
		assertThat(cursor.next()).isEmpty();
		assertThat(cursor.pageCount()).isZero();
	}
}
