package org.pacificobservatory.newsdb.validate;

import java.time.LocalDate;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * What a record must contain to be persisted. {@code external_id}, {@code title} and a publication
 * date (or a fetch time to fall back on) are always required; other fields are listed in
 * {@code requiredFields}.
 *
 * @param earliestDate oldest acceptable publication date
 * @param maxFutureDays how many days past today a publication date may lie
 */
public record RecordSchema(Set<String> requiredFields, LocalDate earliestDate, int maxFutureDays) {

	public static final LocalDate EARLIEST_DATE = LocalDate.of(1990, 1, 1);
	public static final int DEFAULT_MAX_FUTURE_DAYS = 30;

	public RecordSchema {
		requiredFields = Set.copyOf(requiredFields);
	}

	/** Articles need a body on top of the always required fields */
	public static RecordSchema article() {
		return new RecordSchema(Set.of("body"), EARLIEST_DATE, DEFAULT_MAX_FUTURE_DAYS);
	}

	/** Thumbnails, the listing-level view of an article */
	public static RecordSchema thumbnail() {
		return new RecordSchema(Set.of(), EARLIEST_DATE, DEFAULT_MAX_FUTURE_DAYS);
	}

	public RecordSchema requiring(Collection<String> fields) {
		Set<String> all = new LinkedHashSet<>(requiredFields);
		all.addAll(fields);
		return new RecordSchema(all, earliestDate, maxFutureDays);
	}

	public RecordSchema withMaxFutureDays(int days) {
		return new RecordSchema(requiredFields, earliestDate, days);
	}
}
