package org.pacificobservatory.newsdb.descriptor;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.pacificobservatory.newsdb.extract.CleaningFunction;

/**
 * Declarative definition of one news source. Loaded once by {@link DescriptorLoader} and read-only
 * for the duration of a run.
 *
 * @param sourceId unique id, also the storage directory name
 * @param listingUrlTemplate listing URL, possibly with {@code {num}}, {@code {token}} or date
 *     placeholders depending on the pagination type
 * @param itemSelector CSS selector of one item element on a listing page
 * @param listingFields rules applied to each item element; always contains {@code url}
 * @param detailFields rules applied to the article page; empty when the listing carries everything
 * @param cleaning cleaning function per field name
 * @param requiredFields fields that must be present in addition to the record schema's own
 * @param origin the file the descriptor was read from, or {@code null}
 */
public record SiteDescriptor(
		String sourceId,
		String name,
		String country,
		String baseUrl,
		String listingUrlTemplate,
		String itemSelector,
		Map<String, FieldRule> listingFields,
		Map<String, FieldRule> detailFields,
		PaginationRule pagination,
		RateLimit rateLimit,
		Map<String, CleaningFunction> cleaning,
		List<String> requiredFields,
		Path origin) {

	public SiteDescriptor {
		listingFields = Map.copyOf(listingFields);
		detailFields = Map.copyOf(detailFields);
		cleaning = Map.copyOf(cleaning);
		requiredFields = List.copyOf(requiredFields);
		if (rateLimit == null) {
			rateLimit = RateLimit.DEFAULT;
		}
	}

	public boolean hasDetailPages() {
		return !detailFields.isEmpty();
	}
}
