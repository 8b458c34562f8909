package org.pacificobservatory.newsdb.scraper;

import java.nio.file.Path;
import java.time.Clock;
import org.pacificobservatory.newsdb.descriptor.SiteDescriptor;
import org.pacificobservatory.newsdb.fetch.FetchClient;
import org.slf4j.Logger;

/**
 * Configuration record for scraper instances: the source's descriptor, where to store output, the
 * shared fetch client, the logger to report through and the per-run options.
 *
 * @param maxPages listing page bound for this run, 0 to use the descriptor's
 * @param detailThreads size of the detail fetch worker pool
 * @param maxFailureCount abort the run after this many failed items, 0 for no limit
 * @param maxFutureDays how far in the future a publication date may lie
 */
public record ScraperConfig(
		SiteDescriptor descriptor,
		Path storageRoot,
		FetchClient fetchClient,
		Logger logger,
		boolean dryRun,
		boolean fromStart,
		int maxPages,
		int detailThreads,
		int maxFailureCount,
		int maxFutureDays,
		CancellationSignal cancellation,
		Clock clock) {}
