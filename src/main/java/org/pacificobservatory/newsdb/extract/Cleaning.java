package org.pacificobservatory.newsdb.extract;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import org.jsoup.parser.Parser;
import org.pacificobservatory.newsdb.util.UrlUtils;

/** Text normalizers shared by the cleaning functions */
public class Cleaning {

	private static final Pattern WHITESPACE = Pattern.compile("\\s+");
	private static final Pattern TAG_DELIMITERS = Pattern.compile("[,;|\\n]");
	private static final Pattern TITLE_EDGES = Pattern.compile("^[\\s\\-|•]+|[\\s\\-|•]+$");

	/** Unescape HTML entities and collapse whitespace */
	public static String text(String text) {
		if (text == null) {
			return "";
		}
		String unescaped = Parser.unescapeEntities(text, false).replace('\u00A0', ' ');
		return WHITESPACE.matcher(unescaped).replaceAll(" ").trim();
	}

	/** Like {@link #text(String)}, also trimming separator characters around the title */
	public static String title(String title) {
		return TITLE_EDGES.matcher(text(title)).replaceAll("");
	}

	/** Split delimited tag strings into distinct, trimmed tags keeping their order */
	public static List<String> tags(List<String> values) {
		Set<String> tags = new LinkedHashSet<>();
		for (String value : values) {
			if (value == null) {
				continue;
			}
			for (String part : TAG_DELIMITERS.split(value)) {
				String tag = text(part);
				if (!tag.isEmpty()) {
					tags.add(tag);
				}
			}
		}
		return new ArrayList<>(tags);
	}

	/** Make a link absolute against the base URL, keeping it unchanged if it cannot be resolved */
	public static String url(String url, String baseUrl) {
		if (url == null) {
			return "";
		}
		String trimmed = url.trim();
		String resolved = UrlUtils.resolve(baseUrl, trimmed);
		return resolved != null ? resolved : trimmed;
	}
}
