package org.pacificobservatory.newsdb.extract;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jsoup.parser.Parser;

/**
 * Turns the many date spellings found on news sites into a {@link LocalDate}. Prefixes such as
 * "Published:" or a "By Author," byline are stripped first; if no known format matches the whole
 * string, date-looking fragments inside it are tried.
 */
public class DateNormalizer {

	private static final Pattern LEADING_JUNK = Pattern.compile("^[-•*+|\\s]+");
	private static final Pattern TRAILING_JUNK = Pattern.compile("[-•*+|\\s]+$");
	private static final Pattern LABEL_PREFIX = Pattern.compile(
			"^(Published|Posted|Date|On|Updated|Last\\s+modified|Modified):\\s*", Pattern.CASE_INSENSITIVE);
	private static final Pattern BYLINE_PREFIX = Pattern.compile("^By\\s+[^,]+,?\\s*", Pattern.CASE_INSENSITIVE);
	private static final Pattern WHITESPACE = Pattern.compile("\\s+");
	private static final Pattern ORDINAL_SUFFIX = Pattern.compile("(\\d{1,2})(st|nd|rd|th)\\b", Pattern.CASE_INSENSITIVE);

	private static final List<Pattern> FRAGMENTS = List.of(
			Pattern.compile("([A-Za-z]+\\.?\\s+\\d{1,2},?\\s+\\d{4})"),
			Pattern.compile("(\\d{1,2}\\s+[A-Za-z]+\\.?\\s+\\d{4})"),
			Pattern.compile("(\\d{4}[-/]\\d{1,2}[-/]\\d{1,2})"),
			Pattern.compile("(\\d{1,2}[/-]\\d{1,2}[/-]\\d{4})"));

	// Day-first before month-first, matching how most of the covered sites write dates.
	// Parsed strictly so that impossible days such as 31/04 are rejected rather than clamped.
	private static final List<String> PATTERNS = List.of(
			"uuuu-M-d",
			"uuuu/M/d",
			"d/M/uuuu",
			"M/d/uuuu",
			"d-M-uuuu",
			"M-d-uuuu",
			"MMMM d, uuuu",
			"MMM d, uuuu",
			"d MMMM uuuu",
			"d MMM uuuu",
			"MMMM d uuuu",
			"MMM d uuuu",
			"EEEE, MMMM d, uuuu",
			"EEEE MMMM d, uuuu",
			"EEE, MMMM d, uuuu",
			"EEE MMMM d, uuuu",
			"EEEE, MMM d, uuuu",
			"EEEE MMM d, uuuu",
			"EEEE, d MMMM uuuu",
			"EEE, d MMM uuuu",
			"MMMM d, uuuu H:mm",
			"MMM d, uuuu H:mm",
			"MMMM d, uuuu H:mm:ss",
			"MMM d, uuuu H:mm:ss",
			"MMMM d, uuuu h:mm a",
			"MMM d, uuuu h:mm a",
			"uuuu-MM-dd HH:mm:ss",
			"uuuu-MM-dd HH:mm",
			"d.M.uuuu",
			"M.d.uuuu",
			"uuuu.M.d",
			"d-MMM-uuuu",
			"d-MMMM-uuuu");

	private static final List<DateTimeFormatter> FORMATTERS = buildFormatters();

	private static List<DateTimeFormatter> buildFormatters() {
		List<DateTimeFormatter> formatters = new ArrayList<>();
		formatters.add(DateTimeFormatter.ISO_DATE_TIME);
		for (String pattern : PATTERNS) {
			formatters.add(new DateTimeFormatterBuilder()
					.parseCaseInsensitive()
					.appendPattern(pattern)
					.toFormatter(Locale.ENGLISH)
					.withResolverStyle(ResolverStyle.STRICT));
		}
		return formatters;
	}

	/**
	 * Parse a raw date string.
	 *
	 * @return the date, or empty if nothing in the string looks like a date
	 */
	public static Optional<LocalDate> parse(String raw) {
		String cleaned = clean(raw);
		if (cleaned.isEmpty()) {
			return Optional.empty();
		}
		Optional<LocalDate> date = tryFormats(cleaned);
		if (date.isPresent()) {
			return date;
		}
		for (Pattern fragment : FRAGMENTS) {
			Matcher m = fragment.matcher(cleaned);
			if (m.find()) {
				date = tryFormats(m.group(1).trim());
				if (date.isPresent()) {
					return date;
				}
			}
		}
		return Optional.empty();
	}

	/** ISO {@code yyyy-MM-dd} form of the date, or the cleaned input when it cannot be parsed */
	public static String normalize(String raw) {
		return parse(raw).map(DateTimeFormatter.ISO_LOCAL_DATE::format).orElseGet(() -> clean(raw));
	}

	static String clean(String raw) {
		if (raw == null) {
			return "";
		}
		String cleaned = Parser.unescapeEntities(raw, false).replace('\u00A0', ' ').trim();
		cleaned = LEADING_JUNK.matcher(cleaned).replaceFirst("");
		cleaned = TRAILING_JUNK.matcher(cleaned).replaceFirst("");
		cleaned = LABEL_PREFIX.matcher(cleaned).replaceFirst("");
		cleaned = BYLINE_PREFIX.matcher(cleaned).replaceFirst("");
		cleaned = ORDINAL_SUFFIX.matcher(cleaned).replaceAll("$1");
		return WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
	}

	private static Optional<LocalDate> tryFormats(String text) {
		for (DateTimeFormatter formatter : FORMATTERS) {
			try {
				return Optional.of(formatter.parse(text, LocalDate::from));
			} catch (DateTimeParseException e) {
				// try the next format
			}
		}
		return Optional.empty();
	}
}
