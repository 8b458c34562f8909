package org.pacificobservatory.newsdb.pagination;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Optional;
import org.pacificobservatory.newsdb.descriptor.PaginationRule;
import org.pacificobservatory.newsdb.descriptor.SiteDescriptor;
import org.pacificobservatory.newsdb.model.ListingPage;
import org.pacificobservatory.newsdb.model.PageReference;

/**
 * Date archives such as {@code /2024/03/}: walks from {@code start_date} to {@code end_date} (today
 * when absent) one month or one day at a time. Empty or missing archive pages do not stop the walk.
 *
 * <p>Supported placeholders are {@code {year}}, {@code {month}}, {@code {day}} and the zero-padded
 * {@code {MM}} and {@code {dd}}.
 */
public class ArchiveStrategy implements PaginationStrategist {
	private final Clock clock;

	public ArchiveStrategy() {
		this(Clock.systemUTC());
	}

	public ArchiveStrategy(Clock clock) {
		this.clock = clock;
	}

	@Override
	public PageReference firstPage(SiteDescriptor descriptor) {
		PaginationRule rule = descriptor.pagination();
		return page(descriptor, align(rule, rule.startDate()), 0);
	}

	@Override
	public Optional<PageReference> nextPage(SiteDescriptor descriptor, ListingPage current) {
		PaginationRule rule = descriptor.pagination();
		LocalDate date = LocalDate.parse(current.reference().token());
		LocalDate next = rule.granularity() == PaginationRule.Granularity.DAILY ? date.plusDays(1) : date.plusMonths(1);
		LocalDate end = rule.endDate() != null ? rule.endDate() : LocalDate.now(clock);
		if (next.isAfter(align(rule, end))) {
			return Optional.empty();
		}
		return Optional.of(page(descriptor, next, current.reference().ordinal() + 1));
	}

	@Override
	public boolean toleratesMissingPage(PageReference page) {
		return true;
	}

	private static LocalDate align(PaginationRule rule, LocalDate date) {
		return rule.granularity() == PaginationRule.Granularity.DAILY ? date : date.withDayOfMonth(1);
	}

	private static PageReference page(SiteDescriptor descriptor, LocalDate date, int ordinal) {
		String url = descriptor
				.listingUrlTemplate()
				.replace("{year}", Integer.toString(date.getYear()))
				.replace("{MM}", String.format("%02d", date.getMonthValue()))
				.replace("{month}", Integer.toString(date.getMonthValue()))
				.replace("{dd}", String.format("%02d", date.getDayOfMonth()))
				.replace("{day}", Integer.toString(date.getDayOfMonth()));
		return new PageReference(url, ordinal, date.toString());
	}
}
