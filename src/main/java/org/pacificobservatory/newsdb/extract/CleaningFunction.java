package org.pacificobservatory.newsdb.extract;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Named normalizers a descriptor can attach to a field under {@code cleaning:} */
public enum CleaningFunction {
	DATE,
	TITLE,
	TEXT,
	TAGS,
	URL;

	/**
	 * Apply the function to a raw field value.
	 *
	 * @param value a string or a list of strings
	 * @param baseUrl URL relative links are resolved against
	 * @return the cleaned value, a list for {@link #TAGS} and a string otherwise
	 */
	public Object apply(Object value, String baseUrl) {
		if (this == TAGS) {
			return Cleaning.tags(asList(value));
		}
		String s = asString(value);
		return switch (this) {
			case DATE -> DateNormalizer.normalize(s);
			case TITLE -> Cleaning.title(s);
			case TEXT -> Cleaning.text(s);
			case URL -> Cleaning.url(s, baseUrl);
			default -> s;
		};
	}

	/** Look a function up by the name used in descriptors, or {@code null} if unknown */
	public static CleaningFunction fromName(String name) {
		if (name == null) {
			return null;
		}
		return switch (name.trim().toLowerCase(Locale.ROOT)) {
			case "date", "mixed_dates", "handle_mixed_dates", "normalize_date" -> DATE;
			case "title", "clean_title" -> TITLE;
			case "text", "html_text", "clean_html_text" -> TEXT;
			case "tags", "normalize_tags" -> TAGS;
			case "url", "clean_url" -> URL;
			default -> null;
		};
	}

	private static List<String> asList(Object value) {
		List<String> list = new ArrayList<>();
		if (value instanceof List<?> l) {
			for (Object o : l) {
				list.add(String.valueOf(o));
			}
		} else if (value != null) {
			list.add(value.toString());
		}
		return list;
	}

	private static String asString(Object value) {
		if (value instanceof List<?> l) {
			List<String> parts = new ArrayList<>();
			for (Object o : l) {
				parts.add(String.valueOf(o));
			}
			return String.join(" ", parts);
		}
		return value == null ? null : value.toString();
	}
}
