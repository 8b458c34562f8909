package org.pacificobservatory.newsdb;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.pacificobservatory.newsdb.descriptor.ConfigurationException;
import org.pacificobservatory.newsdb.descriptor.SiteDescriptor;
import org.pacificobservatory.newsdb.fetch.FetchClient;
import org.pacificobservatory.newsdb.fetch.FetchSettings;
import org.pacificobservatory.newsdb.scraper.CancellationSignal;
import org.pacificobservatory.newsdb.scraper.Scraper;
import org.pacificobservatory.newsdb.scraper.ScraperFactory;
import org.pacificobservatory.newsdb.scraper.ScraperResult;
import org.pacificobservatory.newsdb.util.NamedThreadFactory;
import org.pacificobservatory.newsdb.validate.RecordSchema;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/** Scrape command running one, several or all configured news sources */
@Command(
		name = "scrape",
		description = "Scrape news sources described by site descriptors and store new articles",
		mixinStandardHelpOptions = true)
public class ScrapeCommand implements Callable<Integer> {
	private static final long SHUTDOWN_GRACE_SECONDS = 60;

	@Option(
			names = {"-d", "--descriptors"},
			description = "Directory holding <country>/<source_id>.yaml descriptors (default: descriptors)",
			defaultValue = "descriptors")
	private Path descriptorsDir;

	@Option(
			names = {"-o", "--storage-root"},
			description = "Directory to store scraped records in (default: data)",
			defaultValue = "data")
	private Path storageRoot;

	@Option(
			names = {"-s", "--sources"},
			description = "Comma-separated list of source IDs to run (if not specified, all sources run)",
			split = ",")
	private List<String> sourceIds;

	@Option(
			names = {"--country"},
			description = "Only run sources of this country (the descriptor sub-directory name)")
	private String country;

	@Option(
			names = {"-l", "--list"},
			description = "List all available source IDs and exit")
	private boolean listSources;

	@Option(
			names = {"--dry-run"},
			description = "Fetch, extract and validate but do not write anything")
	private boolean dryRun;

	@Option(
			names = {"--from-start"},
			description = "Ignore the resume point of an interrupted run and start at the first listing page")
	private boolean fromStart;

	@Option(
			names = {"--max-pages"},
			description = "Maximum number of listing pages per source (default: descriptor setting)",
			defaultValue = "0")
	private int maxPages;

	@Option(
			names = {"-t", "--threads"},
			description = "Maximum number of sources scraped in parallel (default: number of processors)",
			defaultValue = "-1")
	private int maxThreads;

	@Option(
			names = {"--detail-threads"},
			description = "Article fetch workers per source (default: 4)",
			defaultValue = "4")
	private int detailThreads;

	@Option(
			names = {"--max-concurrent"},
			description = "Maximum number of requests in flight across all hosts (default: 16)",
			defaultValue = "16")
	private int maxConcurrent;

	@Option(
			names = {"--per-host"},
			description = "Maximum number of requests in flight per host (default: 2)",
			defaultValue = "2")
	private int maxPerHost;

	@Option(
			names = {"--min-delay"},
			description = "Minimum delay in milliseconds between requests to one host (default: 500)",
			defaultValue = "500")
	private long minDelayMillis;

	@Option(
			names = {"--max-attempts"},
			description = "Attempts per request before a transient error is final (default: 3)",
			defaultValue = "3")
	private int maxAttempts;

	@Option(
			names = {"--max-failures"},
			description = "Maximum number of failed articles per source before aborting that source (default: 10)",
			defaultValue = "10")
	private int maxFailures;

	@Option(
			names = {"--max-future-days"},
			description = "Reject articles dated more than this many days ahead (default: 30)",
			defaultValue = "" + RecordSchema.DEFAULT_MAX_FUTURE_DAYS)
	private int maxFutureDays;

	@Override
	public Integer call() throws Exception {
		ScraperFactory.Descriptors loaded;
		try {
			loaded = ScraperFactory.loadDescriptors(descriptorsDir, country);
		} catch (ConfigurationException e) {
			System.err.println("Configuration error: " + e.getMessage());
			return 2;
		}
		Map<String, SiteDescriptor> descriptors = loaded.valid();

		// Handle list command
		if (listSources) {
			listAvailableSources(loaded);
			return 0;
		}

		// Determine thread count
		var threadCount = maxThreads > 0 ? maxThreads : Runtime.getRuntime().availableProcessors();

		System.out.println("News Scraper - Scrape");
		System.out.println("=====================");
		System.out.println("Descriptor directory: " + descriptorsDir.toAbsolutePath());
		System.out.println("Storage root: " + storageRoot.toAbsolutePath());
		System.out.println("Max parallel sources: " + threadCount);
		if (dryRun) {
			System.out.println("Dry run enabled - nothing will be written");
		}
		System.out.println();

		FetchSettings defaults = FetchSettings.defaults();
		FetchSettings settings = defaults.withLimits(maxConcurrent, maxPerHost)
				.withMinDelay(Duration.ofMillis(minDelayMillis))
				.withRetry(defaults.retry().withMaxAttempts(maxAttempts));
		FetchClient fetchClient = new FetchClient(settings);

		CancellationSignal cancellation = new CancellationSignal();
		CountDownLatch finished = new CountDownLatch(1);
		Thread shutdownHook = new Thread(() -> {
			System.err.println("Cancellation requested, finishing in-flight work...");
			cancellation.cancel();
			try {
				if (!finished.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
					System.err.println("In-flight work did not finish within " + SHUTDOWN_GRACE_SECONDS + " seconds");
				}
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
		});
		Runtime.getRuntime().addShutdownHook(shutdownHook);

		var fact = ScraperFactory.create(
				storageRoot,
				fetchClient,
				cancellation,
				dryRun,
				fromStart,
				maxPages,
				detailThreads,
				maxFailures,
				maxFutureDays);
		if (sourceIds == null) {
			var all = new TreeSet<>(descriptors.keySet());
			all.addAll(loaded.invalid().keySet());
			sourceIds = new ArrayList<>(all);
		}
		var scrapers = new LinkedHashMap<String, Scraper>();
		var broken = new LinkedHashMap<String, ConfigurationException>();
		for (var sourceId : sourceIds) {
			var descriptor = descriptors.get(sourceId);
			if (descriptor == null) {
				var error = loaded.invalid().get(sourceId);
				if (error != null) {
					System.err.println("Configuration error: " + error.getMessage());
					broken.put(sourceId, error);
				} else {
					System.err.println("Warning: Unknown source ID: " + sourceId);
				}
				continue;
			}
			scrapers.put(sourceId, fact.createScraper(descriptor));
		}
		if (scrapers.isEmpty() && broken.isEmpty()) {
			System.out.println("No sources to run.");
			finished.countDown();
			removeShutdownHook(shutdownHook);
			return 0;
		}

		System.out.println("Running sources: " + String.join(", ", scrapers.keySet()));
		System.out.println("Total sources: " + scrapers.size());
		System.out.println();

		long startTime = System.currentTimeMillis();

		// Execute scrapers in parallel
		ExecutorService executor = Executors.newFixedThreadPool(threadCount, new NamedThreadFactory("scraper"));
		var results = new LinkedHashMap<String, ScraperResult>();
		try {
			var futures = new LinkedHashMap<String, Future<ScraperResult>>();
			for (var scraperEntry : scrapers.entrySet()) {
				futures.put(scraperEntry.getKey(), executor.submit(scraperEntry.getValue()));
			}

			// Wait for all scrapers to complete and collect results
			for (var entry : futures.entrySet()) {
				try {
					results.put(entry.getKey(), entry.getValue().get());
				} catch (ExecutionException e) {
					System.err.println("Scraper execution failed: " + e.getCause().getMessage());
					Exception cause = e.getCause() instanceof Exception ex ? ex : e;
					results.put(entry.getKey(), ScraperResult.failure(entry.getKey(), cause));
				}
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			System.err.println("Scraper execution interrupted");
			cancellation.cancel();
		} finally {
			executor.shutdownNow();
			finished.countDown();
			removeShutdownHook(shutdownHook);
		}
		// Sources with a broken descriptor count as failed runs
		broken.forEach((sourceId, error) -> results.put(sourceId, ScraperResult.failure(sourceId, error)));

		// Allow time for async logging to flush before printing summary
		try {
			Thread.sleep(200);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}

		return printSummary(results, startTime);
	}

	private int printSummary(Map<String, ScraperResult> results, long startTime) {
		System.out.println();
		System.out.println("Execution Summary");
		System.out.println("=================");

		var successful = 0;
		var failed = 0;
		var totalNew = 0;
		var totalDuplicate = 0;
		var totalRejected = 0;
		var totalFailedItems = 0;

		for (var result : results.values()) {
			System.out.println(result);
			if (result.success()) {
				successful++;
			} else {
				failed++;
			}
			totalNew += result.counts().created();
			totalDuplicate += result.counts().duplicate();
			totalRejected += result.counts().rejected();
			totalFailedItems += result.counts().failed();
		}

		System.out.println();
		System.out.println("Total sources: " + results.size());
		System.out.println("Successful: " + successful);
		System.out.println("Failed: " + failed);
		System.out.println("New articles: " + totalNew);
		System.out.println("Duplicates skipped: " + totalDuplicate);
		System.out.println("Rejected records: " + totalRejected);
		System.out.println("Failed articles: " + totalFailedItems);

		var duration = (System.currentTimeMillis() - startTime) / 1000.0;
		System.out.println();
		System.out.println("All sources completed in " + duration + " seconds");

		if (failed == 0 && totalRejected > 0) {
			System.out.println();
			System.out.println("Warning: " + totalRejected + " records were rejected by validation");
		}
		return failed > 0 ? 1 : 0;
	}

	private void removeShutdownHook(Thread hook) {
		try {
			Runtime.getRuntime().removeShutdownHook(hook);
		} catch (IllegalStateException e) {
			// JVM is already shutting down and the hook has run
			System.err.println("Shutdown in progress");
		}
	}

	private void listAvailableSources(ScraperFactory.Descriptors loaded) {
		System.out.println("Available Sources:");
		System.out.println("==================");

		for (var descriptor : loaded.valid().values()) {
			System.out.println("  - " + descriptor.sourceId() + " (" + descriptor.name()
					+ (descriptor.country() != null ? ", " + descriptor.country() : "") + ")");
		}
		for (var entry : loaded.invalid().entrySet()) {
			System.out.println("  - " + entry.getKey() + " [invalid: " + entry.getValue().getMessage() + "]");
		}

		System.out.println();
		System.out.println("Total: " + loaded.valid().size() + " sources");
	}
}
