package org.pacificobservatory.newsdb.descriptor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import org.pacificobservatory.newsdb.extract.CleaningFunction;

/**
 * Reads YAML site descriptors and checks them before any network activity happens. Everything that
 * can be wrong with a descriptor is reported as a {@link ConfigurationException} naming the file
 * and the offending key.
 */
public class DescriptorLoader {

	private static final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
	private static final Pattern SOURCE_ID = Pattern.compile("[a-z0-9][a-z0-9_.-]*");

	/** Legacy field names accepted in descriptors */
	private static final Map<String, String> FIELD_ALIASES = Map.of("date", "published_at", "link", "url");

	/** Load and validate the descriptor in the given file */
	public static SiteDescriptor load(Path file) throws ConfigurationException {
		JsonNode root;
		try {
			root = yamlMapper.readTree(Files.readString(file));
		} catch (JsonProcessingException e) {
			throw new ConfigurationException(file + ": invalid YAML: " + e.getOriginalMessage(), e);
		} catch (IOException e) {
			throw new ConfigurationException(file + ": cannot read descriptor: " + e.getMessage(), e);
		}
		if (root == null || !root.isObject()) {
			throw new ConfigurationException(file + ": descriptor must be a YAML mapping");
		}
		try {
			return fromTree(root, defaultSourceId(file), file);
		} catch (ConfigurationException e) {
			throw new ConfigurationException(file + ": " + e.getMessage(), e);
		}
	}

	/** Source id used when a descriptor does not name one: the file name without extension */
	public static String defaultSourceId(Path file) {
		return file.getFileName().toString().replaceFirst("\\.ya?ml$", "");
	}

	/** Load a descriptor from YAML text, used by tests and tools that keep descriptors elsewhere */
	public static SiteDescriptor parse(String yaml, String defaultId) throws ConfigurationException {
		try {
			JsonNode root = yamlMapper.readTree(yaml);
			if (root == null || !root.isObject()) {
				throw new ConfigurationException("descriptor must be a YAML mapping");
			}
			return fromTree(root, defaultId, null);
		} catch (JsonProcessingException e) {
			throw new ConfigurationException("invalid YAML: " + e.getOriginalMessage(), e);
		}
	}

	static SiteDescriptor fromTree(JsonNode root, String defaultId, Path origin) throws ConfigurationException {
		String sourceId = text(root, "source_id", defaultId);
		if (sourceId == null || !SOURCE_ID.matcher(sourceId).matches()) {
			throw new ConfigurationException("source_id '" + sourceId
					+ "' must be lower-case letters, digits, '_', '-' or '.'");
		}
		String name = text(root, "name", sourceId);

		String country = text(root, "country", null);
		if (country != null) {
			country = country.trim().toUpperCase(Locale.ROOT);
			if (country.length() != 2) {
				throw new ConfigurationException("country must be a two letter code, got '" + country + "'");
			}
		}

		String baseUrl = requireText(root, "base_url");
		requireHttpUrl("base_url", baseUrl);

		JsonNode listing = requireObject(root, "listing");
		String template = requireText(listing, "url_template");
		String itemSelector = requireText(listing, "item_selector");
		FieldRule.parse(itemSelector);
		Map<String, FieldRule> listingFields = fieldRules(listing.get("fields"), "listing.fields");
		if (!listingFields.containsKey("url")) {
			throw new ConfigurationException("listing.fields must define 'url'");
		}

		JsonNode detail = root.get("detail");
		Map<String, FieldRule> detailFields =
				detail == null || detail.isNull() ? Map.of() : fieldRules(detail.get("fields"), "detail.fields");

		PaginationRule pagination = pagination(requireObject(root, "pagination"), template);
		RateLimit rateLimit = rateLimit(root.get("rate_limit"));
		Map<String, CleaningFunction> cleaning = cleaning(root.get("cleaning"));

		List<String> required = new ArrayList<>();
		JsonNode requiredNode = root.get("required_fields");
		if (requiredNode != null && !requiredNode.isNull()) {
			if (!requiredNode.isArray()) {
				throw new ConfigurationException("required_fields must be a list");
			}
			for (JsonNode n : requiredNode) {
				required.add(alias(n.asText()));
			}
		}

		return new SiteDescriptor(
				sourceId,
				name,
				country,
				baseUrl,
				template,
				itemSelector,
				listingFields,
				detailFields,
				pagination,
				rateLimit,
				cleaning,
				required,
				origin);
	}

	private static PaginationRule pagination(JsonNode node, String template) throws ConfigurationException {
		PaginationRule.Type type = PaginationRule.Type.fromName(text(node, "type", null));
		int startPage = intValue(node, "start_page", 1);
		int step = intValue(node, "step", 1);
		int maxPages = intValue(node, "max_pages", 0);
		if (step <= 0) {
			throw new ConfigurationException("pagination.step must be positive");
		}
		if (maxPages < 0) {
			throw new ConfigurationException("pagination.max_pages must not be negative");
		}
		FieldRule nextSelector = optionalRule(node, "next_selector");
		FieldRule tokenSelector = optionalRule(node, "token_selector");
		String tokenHeader = text(node, "token_header", null);
		String sentinel = text(node, "sentinel", null);
		String startUrl = text(node, "start_url", null);
		if (startUrl != null) {
			requireHttpUrl("pagination.start_url", startUrl);
		}
		boolean stopWhenAllSeen = node.path("stop_when_all_seen").asBoolean(false);
		LocalDate startDate = date(node, "start_date");
		LocalDate endDate = date(node, "end_date");
		PaginationRule.Granularity granularity = PaginationRule.Granularity.MONTHLY;
		String granularityName = text(node, "granularity", null);
		if (granularityName != null) {
			try {
				granularity = PaginationRule.Granularity.valueOf(granularityName.trim().toUpperCase(Locale.ROOT));
			} catch (IllegalArgumentException e) {
				throw new ConfigurationException("pagination.granularity must be 'monthly' or 'daily'", e);
			}
		}

		switch (type) {
			case TEMPLATE -> requirePlaceholder(template, "{num}", type);
			case LINK -> {
				if (nextSelector == null) {
					throw new ConfigurationException("link pagination requires pagination.next_selector");
				}
			}
			case TOKEN -> {
				requirePlaceholder(template, "{token}", type);
				if (tokenSelector == null && tokenHeader == null) {
					throw new ConfigurationException(
							"token pagination requires pagination.token_selector or pagination.token_header");
				}
			}
			case ARCHIVE -> {
				requirePlaceholder(template, "{year}", type);
				if (!template.contains("{month}") && !template.contains("{MM}")) {
					throw new ConfigurationException("archive pagination requires a {month} or {MM} placeholder");
				}
				if (granularity == PaginationRule.Granularity.DAILY
						&& !template.contains("{day}")
						&& !template.contains("{dd}")) {
					throw new ConfigurationException("daily archive pagination requires a {day} or {dd} placeholder");
				}
				if (startDate == null) {
					throw new ConfigurationException("archive pagination requires pagination.start_date");
				}
				if (endDate != null && endDate.isBefore(startDate)) {
					throw new ConfigurationException("pagination.end_date is before pagination.start_date");
				}
			}
		}
		return new PaginationRule(
				type,
				startPage,
				step,
				nextSelector,
				tokenSelector,
				tokenHeader,
				sentinel,
				startDate,
				endDate,
				granularity,
				maxPages,
				startUrl,
				stopWhenAllSeen);
	}

	private static RateLimit rateLimit(JsonNode node) throws ConfigurationException {
		if (node == null || node.isNull()) {
			return RateLimit.DEFAULT;
		}
		Duration minDelay = null;
		if (node.has("min_delay_ms")) {
			long ms = node.get("min_delay_ms").asLong(-1);
			if (ms < 0) {
				throw new ConfigurationException("rate_limit.min_delay_ms must not be negative");
			}
			minDelay = Duration.ofMillis(ms);
		}
		int maxConcurrent = intValue(node, "max_concurrent", 0);
		if (maxConcurrent < 0) {
			throw new ConfigurationException("rate_limit.max_concurrent must not be negative");
		}
		return new RateLimit(minDelay, maxConcurrent);
	}

	private static Map<String, CleaningFunction> cleaning(JsonNode node) throws ConfigurationException {
		Map<String, CleaningFunction> result = new LinkedHashMap<>();
		if (node == null || node.isNull()) {
			return result;
		}
		if (!node.isObject()) {
			throw new ConfigurationException("cleaning must be a mapping of field to function");
		}
		Iterator<Map.Entry<String, JsonNode>> it = node.fields();
		while (it.hasNext()) {
			Map.Entry<String, JsonNode> e = it.next();
			CleaningFunction fn = CleaningFunction.fromName(e.getValue().asText());
			if (fn == null) {
				throw new ConfigurationException(
						"unknown cleaning function '" + e.getValue().asText() + "' for field " + e.getKey());
			}
			result.put(alias(e.getKey()), fn);
		}
		return result;
	}

	private static Map<String, FieldRule> fieldRules(JsonNode node, String where) throws ConfigurationException {
		if (node == null || !node.isObject() || node.isEmpty()) {
			throw new ConfigurationException(where + " must be a non-empty mapping of field to selector");
		}
		Map<String, FieldRule> rules = new LinkedHashMap<>();
		Iterator<Map.Entry<String, JsonNode>> it = node.fields();
		while (it.hasNext()) {
			Map.Entry<String, JsonNode> e = it.next();
			try {
				rules.put(alias(e.getKey()), FieldRule.parse(e.getValue().asText(null)));
			} catch (ConfigurationException ex) {
				throw new ConfigurationException(where + "." + e.getKey() + ": " + ex.getMessage(), ex);
			}
		}
		return rules;
	}

	private static FieldRule optionalRule(JsonNode node, String key) throws ConfigurationException {
		String value = text(node, key, null);
		if (value == null) {
			return null;
		}
		try {
			return FieldRule.parse(value);
		} catch (ConfigurationException e) {
			throw new ConfigurationException("pagination." + key + ": " + e.getMessage(), e);
		}
	}

	private static LocalDate date(JsonNode node, String key) throws ConfigurationException {
		String value = text(node, key, null);
		if (value == null) {
			return null;
		}
		try {
			return LocalDate.parse(value.trim());
		} catch (DateTimeParseException e) {
			throw new ConfigurationException("pagination." + key + " must be an ISO date (yyyy-MM-dd)", e);
		}
	}

	private static void requirePlaceholder(String template, String placeholder, PaginationRule.Type type)
			throws ConfigurationException {
		if (!template.contains(placeholder)) {
			throw new ConfigurationException(type.name().toLowerCase(Locale.ROOT)
					+ " pagination requires a " + placeholder + " placeholder in listing.url_template");
		}
	}

	private static void requireHttpUrl(String key, String value) throws ConfigurationException {
		try {
			URI uri = new URI(value);
			String scheme = uri.getScheme();
			if (scheme == null
					|| !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
					|| uri.getHost() == null) {
				throw new ConfigurationException(key + " must be an absolute http(s) URL, got '" + value + "'");
			}
		} catch (URISyntaxException e) {
			throw new ConfigurationException(key + " is not a valid URL: " + e.getMessage(), e);
		}
	}

	private static JsonNode requireObject(JsonNode node, String key) throws ConfigurationException {
		JsonNode child = node.get(key);
		if (child == null || !child.isObject()) {
			throw new ConfigurationException("missing required section '" + key + "'");
		}
		return child;
	}

	private static String requireText(JsonNode node, String key) throws ConfigurationException {
		String value = text(node, key, null);
		if (value == null || value.isBlank()) {
			throw new ConfigurationException("missing required key '" + key + "'");
		}
		return value.trim();
	}

	private static String text(JsonNode node, String key, String defaultValue) {
		JsonNode child = node.get(key);
		if (child == null || child.isNull() || !child.isValueNode()) {
			return defaultValue;
		}
		String value = child.asText();
		return value.isBlank() ? defaultValue : value;
	}

	private static int intValue(JsonNode node, String key, int defaultValue) throws ConfigurationException {
		JsonNode child = node.get(key);
		if (child == null || child.isNull()) {
			return defaultValue;
		}
		if (!child.canConvertToInt()) {
			throw new ConfigurationException(key + " must be an integer");
		}
		return child.asInt();
	}

	private static String alias(String field) {
		return FIELD_ALIASES.getOrDefault(field, field);
	}
}
