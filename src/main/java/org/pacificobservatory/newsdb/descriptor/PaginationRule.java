package org.pacificobservatory.newsdb.descriptor;

import java.time.LocalDate;
import java.util.Locale;

/** How a source's listing pages follow each other */
public record PaginationRule(
		Type type,
		int startPage,
		int step,
		FieldRule nextSelector,
		FieldRule tokenSelector,
		String tokenHeader,
		String sentinel,
		LocalDate startDate,
		LocalDate endDate,
		Granularity granularity,
		int maxPages,
		String startUrl,
		boolean stopWhenAllSeen) {

	public enum Type {
		TEMPLATE,
		LINK,
		TOKEN,
		ARCHIVE;

		/** Accepts the type names used by descriptors, including the legacy "pagination" */
		public static Type fromName(String name) throws ConfigurationException {
			if (name == null) {
				throw new ConfigurationException("Pagination type is required");
			}
			return switch (name.trim().toLowerCase(Locale.ROOT)) {
				case "template", "pagination", "increment" -> TEMPLATE;
				case "link", "next", "next_link" -> LINK;
				case "token", "cursor" -> TOKEN;
				case "archive" -> ARCHIVE;
				default -> throw new ConfigurationException("Unknown pagination type: " + name);
			};
		}
	}

	public enum Granularity {
		MONTHLY,
		DAILY
	}
}
