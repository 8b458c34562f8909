package org.pacificobservatory.newsdb.descriptor;

import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jsoup.select.QueryParser;
import org.jsoup.select.Selector;

/**
 * A CSS selector plus the way the value is taken from the matched element(s). Expressions are
 * written as {@code selector::mode}, for example {@code h1.title::text}, {@code a::attr(href)},
 * {@code div.content::html} or {@code div.content p::all}. Without a suffix the text of the first
 * match is used.
 */
public record FieldRule(String selector, Mode mode, String attribute) {

	public enum Mode {
		/** Whitespace-normalized text of the first match */
		TEXT,
		/** Attribute value of the first match, made absolute for URL attributes */
		ATTR,
		/** Inner HTML of the first match */
		HTML,
		/** Text of every match, as a list */
		ALL
	}

	private static final Pattern ATTR_SUFFIX = Pattern.compile("^(.*)::attr\\(\\s*([^)\\s]+)\\s*\\)$");

	public static FieldRule text(String selector) {
		return new FieldRule(selector, Mode.TEXT, null);
	}

	public static FieldRule attr(String selector, String attribute) {
		return new FieldRule(selector, Mode.ATTR, attribute);
	}

	/**
	 * Parse a field expression and check that its selector is valid CSS.
	 *
	 * @param expression the expression as written in a descriptor
	 * @return the parsed rule
	 * @throws ConfigurationException if the expression is blank or the selector does not parse
	 */
	public static FieldRule parse(String expression) throws ConfigurationException {
		if (expression == null || expression.isBlank()) {
			throw new ConfigurationException("Empty field selector");
		}
		String expr = expression.trim();
		FieldRule rule;
		Matcher m = ATTR_SUFFIX.matcher(expr);
		if (m.matches()) {
			rule = new FieldRule(m.group(1).trim(), Mode.ATTR, m.group(2));
		} else if (expr.endsWith("::text")) {
			rule = new FieldRule(strip(expr, "::text"), Mode.TEXT, null);
		} else if (expr.endsWith("::html")) {
			rule = new FieldRule(strip(expr, "::html"), Mode.HTML, null);
		} else if (expr.endsWith("::all")) {
			rule = new FieldRule(strip(expr, "::all"), Mode.ALL, null);
		} else if (expr.contains("::")) {
			throw new ConfigurationException("Unknown extraction suffix in selector '" + expression + "'");
		} else {
			rule = new FieldRule(expr, Mode.TEXT, null);
		}
		if (rule.selector().isEmpty()) {
			throw new ConfigurationException("Missing CSS selector in '" + expression + "'");
		}
		try {
			QueryParser.parse(rule.selector());
		} catch (Selector.SelectorParseException | IllegalArgumentException e) {
			throw new ConfigurationException("Invalid CSS selector '" + rule.selector() + "': " + e.getMessage(), e);
		}
		return rule;
	}

	private static String strip(String expr, String suffix) {
		return expr.substring(0, expr.length() - suffix.length()).trim();
	}

	@Override
	public String toString() {
		return switch (mode) {
			case TEXT -> selector + "::text";
			case ATTR -> selector + "::attr(" + attribute + ")";
			case HTML -> selector + "::html";
			case ALL -> selector + "::all";
		};
	}
}
