package org.pacificobservatory.newsdb.validate;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.pacificobservatory.newsdb.extract.Cleaning;
import org.pacificobservatory.newsdb.extract.DateNormalizer;
import org.pacificobservatory.newsdb.model.NewsRecord;
import org.pacificobservatory.newsdb.model.RawRecord;
import org.pacificobservatory.newsdb.util.UrlUtils;

/** Turns raw extracted fields into a {@link NewsRecord}, or rejects them */
public class Validator {

	private static final Set<String> CORE_FIELDS = Set.of("url", "title", "published_at", "body", "tags");

	private final Clock clock;

	public Validator() {
		this(Clock.systemUTC());
	}

	public Validator(Clock clock) {
		this.clock = clock;
	}

	/**
	 * Validate and normalize a raw record.
	 *
	 * @throws ValidationException naming the first field that is missing or invalid
	 */
	public NewsRecord validate(RawRecord raw, RecordSchema schema) throws ValidationException {
		String url = raw.getString("url");
		if (url == null || url.isBlank()) {
			throw new ValidationException("url", "missing");
		}
		url = url.trim();
		if (!UrlUtils.isHttpUrl(url)) {
			throw new ValidationException("url", "not an absolute http(s) URL: " + url);
		}
		String externalId = UrlUtils.canonicalize(url);
		if (externalId == null) {
			throw new ValidationException("external_id", "cannot be derived from " + url);
		}

		String title = Cleaning.text(raw.getString("title"));
		if (title.isEmpty()) {
			throw new ValidationException("title", "missing or blank");
		}

		NewsRecord record = NewsRecord.create()
				.sourceId(raw.sourceId())
				.externalId(externalId)
				.url(url)
				.title(title)
				.fetchedAt(raw.fetchedAt());
		resolveDate(raw, schema, record);

		if (raw.has("body")) {
			record.body(Cleaning.text(raw.getString("body")));
		}
		if (raw.has("tags")) {
			record.tags(Cleaning.tags(tagValues(raw.get("tags"))));
		}

		for (String field : schema.requiredFields()) {
			boolean present = switch (field) {
				case "body" -> record.body() != null && !record.body().isEmpty();
				case "tags" -> !record.tags().isEmpty();
				case "url", "title", "published_at", "external_id" -> true;
				default -> raw.has(field);
			};
			if (!present) {
				throw new ValidationException(field, "required field missing");
			}
		}

		Map<String, Object> extra = new LinkedHashMap<>();
		for (Map.Entry<String, Object> e : raw.fields().entrySet()) {
			if (!CORE_FIELDS.contains(e.getKey())) {
				extra.put(e.getKey(), e.getValue());
			}
		}
		return record.rawFields(extra);
	}

	private void resolveDate(RawRecord raw, RecordSchema schema, NewsRecord record) throws ValidationException {
		String value = raw.getString("published_at");
		if (value == null || value.isBlank()) {
			Instant fetchedAt = raw.fetchedAt();
			if (fetchedAt == null) {
				throw new ValidationException("published_at", "missing and no fetch time to fall back on");
			}
			record.publishedAt(fetchedAt.atZone(ZoneOffset.UTC).toLocalDate()).dateInferred(true);
			return;
		}
		Optional<LocalDate> parsed = DateNormalizer.parse(value);
		if (parsed.isEmpty()) {
			throw new ValidationException("published_at", "unparseable date '" + value + "'");
		}
		LocalDate date = parsed.get();
		if (date.isBefore(schema.earliestDate())) {
			throw new ValidationException("published_at", date + " is before " + schema.earliestDate());
		}
		LocalDate latest = LocalDate.now(clock).plusDays(schema.maxFutureDays());
		if (date.isAfter(latest)) {
			throw new ValidationException("published_at", date + " is after " + latest);
		}
		record.publishedAt(date).dateInferred(false);
	}

	private static List<String> tagValues(Object value) {
		List<String> values = new ArrayList<>();
		if (value instanceof List<?> list) {
			for (Object o : list) {
				values.add(String.valueOf(o));
			}
		} else if (value != null) {
			values.add(value.toString());
		}
		return values;
	}
}
