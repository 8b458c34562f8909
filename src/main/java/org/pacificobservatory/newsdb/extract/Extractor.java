package org.pacificobservatory.newsdb.extract;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.pacificobservatory.newsdb.descriptor.FieldRule;
import org.pacificobservatory.newsdb.descriptor.PaginationRule;
import org.pacificobservatory.newsdb.descriptor.SiteDescriptor;
import org.pacificobservatory.newsdb.fetch.FetchResult;
import org.pacificobservatory.newsdb.model.ItemReference;
import org.pacificobservatory.newsdb.model.ListingPage;
import org.pacificobservatory.newsdb.model.PageReference;
import org.pacificobservatory.newsdb.model.RawRecord;
import org.pacificobservatory.newsdb.util.UrlUtils;

/**
 * Applies a descriptor's field rules to fetched HTML. Extraction is best effort and has no side
 * effects: a selector that matches nothing leaves the field out of the result.
 */
public class Extractor {

	private static final Set<String> URL_ATTRIBUTES = Set.of("href", "src", "data-src", "action");

	/** Parse a fetched body, using the final URL as base for relative links */
	public Document parse(FetchResult result) {
		return Jsoup.parse(result.body(), result.finalUrl());
	}

	/** Extract the detail fields of an article page */
	public RawRecord extract(SiteDescriptor descriptor, Document document) {
		return extract(descriptor, document, null);
	}

	/** Extract the detail fields of an article page fetched at the given time */
	public RawRecord extract(SiteDescriptor descriptor, Document document, Instant fetchedAt) {
		return extractFields(descriptor.sourceId(), document, descriptor.detailFields(), fetchedAt);
	}

	/**
	 * Split a listing page into item references and pick up the pagination hints it carries. The
	 * returned page has no next page yet; that is decided by the pagination strategy.
	 */
	public ListingPage parseListing(SiteDescriptor descriptor, PageReference reference, FetchResult result) {
		Document document = parse(result);
		List<ItemReference> items = new ArrayList<>();
		for (Element element : document.select(descriptor.itemSelector())) {
			RawRecord fields =
					extractFields(descriptor.sourceId(), element, descriptor.listingFields(), result.fetchedAt());
			String url = UrlUtils.resolve(document.location(), fields.getString("url"));
			fields.put("url", url);
			items.add(new ItemReference(url, fields));
		}

		PaginationRule pagination = descriptor.pagination();
		String nextLink = null;
		if (pagination.nextSelector() != null) {
			nextLink = link(document, pagination.nextSelector());
		}
		String token = null;
		if (pagination.tokenSelector() != null) {
			Object value = apply(document, pagination.tokenSelector());
			token = value instanceof String s ? s : null;
		}
		if (token == null && pagination.tokenHeader() != null) {
			token = result.header(pagination.tokenHeader()).orElse(null);
		}
		return new ListingPage(reference, items, nextLink, token, null);
	}

	/** Copy of the record with the configured cleaning functions run over the fields they name */
	public RawRecord clean(SiteDescriptor descriptor, RawRecord record, String baseUrl) {
		RawRecord cleaned = record.copy();
		for (Map.Entry<String, CleaningFunction> e : descriptor.cleaning().entrySet()) {
			Object value = cleaned.get(e.getKey());
			if (value != null) {
				cleaned.put(e.getKey(), e.getValue().apply(value, baseUrl));
			}
		}
		return cleaned;
	}

	private RawRecord extractFields(String sourceId, Element root, Map<String, FieldRule> rules, Instant fetchedAt) {
		RawRecord record = new RawRecord(sourceId, fetchedAt);
		for (Map.Entry<String, FieldRule> e : rules.entrySet()) {
			record.put(e.getKey(), apply(root, e.getValue()));
		}
		return record;
	}

	/** Value selected by the rule: a string, a list of strings for {@code ::all}, or {@code null} */
	Object apply(Element root, FieldRule rule) {
		if (rule.mode() == FieldRule.Mode.ALL) {
			List<String> texts = new ArrayList<>();
			for (Element e : root.select(rule.selector())) {
				String text = e.text().trim();
				if (!text.isEmpty()) {
					texts.add(text);
				}
			}
			return texts.isEmpty() ? null : texts;
		}
		Element element = root.selectFirst(rule.selector());
		if (element == null) {
			return null;
		}
		String value = switch (rule.mode()) {
			case ATTR -> attribute(element, rule.attribute());
			case HTML -> element.html();
			default -> element.text();
		};
		return value == null || value.isBlank() ? null : value.trim();
	}

	private String link(Document document, FieldRule rule) {
		if (rule.mode() == FieldRule.Mode.ATTR) {
			Object value = apply(document, rule);
			return value instanceof String s ? s : null;
		}
		// a plain selector points at the anchor itself
		Element element = document.selectFirst(rule.selector());
		if (element == null) {
			return null;
		}
		String href = element.absUrl("href");
		return href.isEmpty() ? null : href;
	}

	private String attribute(Element element, String name) {
		String value = element.attr(name);
		if (value.isBlank()) {
			return null;
		}
		if (URL_ATTRIBUTES.contains(name)) {
			String absolute = element.absUrl(name);
			if (!absolute.isEmpty()) {
				return absolute;
			}
		}
		return value;
	}
}
