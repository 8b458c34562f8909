package org.pacificobservatory.newsdb.scraper;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.jsoup.nodes.Document;
import org.pacificobservatory.newsdb.descriptor.SiteDescriptor;
import org.pacificobservatory.newsdb.extract.Extractor;
import org.pacificobservatory.newsdb.fetch.FetchClient;
import org.pacificobservatory.newsdb.fetch.FetchException;
import org.pacificobservatory.newsdb.fetch.FetchRequest;
import org.pacificobservatory.newsdb.fetch.FetchResult;
import org.pacificobservatory.newsdb.fetch.TransientFetchException;
import org.pacificobservatory.newsdb.model.ItemReference;
import org.pacificobservatory.newsdb.model.ListingPage;
import org.pacificobservatory.newsdb.model.NewsRecord;
import org.pacificobservatory.newsdb.model.PageReference;
import org.pacificobservatory.newsdb.model.RawRecord;
import org.pacificobservatory.newsdb.model.RecordKind;
import org.pacificobservatory.newsdb.model.RunCounters;
import org.pacificobservatory.newsdb.model.RunManifest;
import org.pacificobservatory.newsdb.model.RunState;
import org.pacificobservatory.newsdb.pagination.ListingCursor;
import org.pacificobservatory.newsdb.pagination.PaginationCycleException;
import org.pacificobservatory.newsdb.pagination.PaginationStrategist;
import org.pacificobservatory.newsdb.storage.DedupTracker;
import org.pacificobservatory.newsdb.storage.ManifestStore;
import org.pacificobservatory.newsdb.storage.StorageLayout;
import org.pacificobservatory.newsdb.storage.StorageWriter;
import org.pacificobservatory.newsdb.util.NamedThreadFactory;
import org.pacificobservatory.newsdb.util.UrlUtils;
import org.pacificobservatory.newsdb.validate.RecordSchema;
import org.pacificobservatory.newsdb.validate.ValidationException;
import org.pacificobservatory.newsdb.validate.Validator;
import org.slf4j.Logger;

/**
 * Scrapes one news source described by a {@link SiteDescriptor}. A run moves through
 * {@code INIT -> LISTING -> DETAIL_FETCH -> PERSIST -> DONE}, or to {@code FAILED} on an
 * unrecoverable error, and always ends with a {@link RunManifest} carrying its counts.
 *
 * <p>Listing pages are walked sequentially; article pages are fetched on a bounded worker pool.
 * Errors on single items are counted and skipped, errors on listing pages fail the run. An instance
 * holds the state of one run and is not reused.
 */
public class NewspaperScraper implements Scraper {
	protected final SiteDescriptor descriptor;
	protected final Logger logger;

	private final FetchClient fetchClient;
	private final StorageLayout layout;
	private final CancellationSignal cancellation;
	private final Clock clock;
	private final boolean dryRun;
	private final boolean fromStart;
	private final int maxPages;
	private final int detailThreads;
	private final int maxFailureCount;

	private final Extractor extractor = new Extractor();
	private final Validator validator;
	private final RecordSchema articleSchema;
	private final RecordSchema thumbnailSchema;

	private final RunCounters counters = new RunCounters();
	private final List<RunState> transitions = new CopyOnWriteArrayList<>();
	private volatile RunState state;

	// items of the detail phase that were skipped because of cancellation, by listing position
	private final Set<Integer> skippedItems = new ConcurrentSkipListSet<>();
	private List<PendingItem> pendingItems = List.of();
	private PageReference startPage;
	private PageReference unvisitedPage;
	private String newestExternalId;

	/** An article found during listing, with the page it was listed on */
	private record PendingItem(int index, ItemReference item, PageReference page) {}

	/** An article and its thumbnail ready to be written */
	private record Accepted(NewsRecord article, NewsRecord thumbnail) {}

	public NewspaperScraper(ScraperConfig config) {
		this.descriptor = config.descriptor();
		this.logger = config.logger();
		this.fetchClient = config.fetchClient();
		this.layout = new StorageLayout(config.storageRoot(), descriptor.sourceId());
		this.cancellation = config.cancellation() != null ? config.cancellation() : new CancellationSignal();
		this.clock = config.clock() != null ? config.clock() : Clock.systemUTC();
		this.dryRun = config.dryRun();
		this.fromStart = config.fromStart();
		this.maxPages = config.maxPages() > 0 ? config.maxPages() : descriptor.pagination().maxPages();
		this.detailThreads = Math.max(1, config.detailThreads());
		this.maxFailureCount = config.maxFailureCount();
		this.validator = new Validator(clock);
		this.articleSchema = RecordSchema.article()
				.requiring(descriptor.requiredFields())
				.withMaxFutureDays(config.maxFutureDays());
		this.thumbnailSchema = RecordSchema.thumbnail().withMaxFutureDays(config.maxFutureDays());
	}

	@Override
	public String sourceId() {
		return descriptor.sourceId();
	}

	/** States this scraper has gone through, in order */
	public List<RunState> transitions() {
		return List.copyOf(transitions);
	}

	@Override
	public ScraperResult call() {
		Instant startedAt = clock.instant();
		String runId = layout.newRunId(clock);
		StorageWriter writer = new StorageWriter(layout, runId);
		Exception error = null;
		transition(RunState.INIT);
		try {
			log("Starting scraper run " + runId + (dryRun ? " (dry run)" : ""));
			DedupTracker dedup = DedupTracker.load(layout.kindDir(RecordKind.ARTICLE));
			startPage = resumePoint().orElse(null);

			transition(RunState.LISTING);
			pendingItems = traverseListings(dedup);

			transition(RunState.DETAIL_FETCH);
			List<Accepted> accepted = processItems(pendingItems, dedup);

			transition(RunState.PERSIST);
			persist(writer, accepted);

			transition(RunState.DONE);
			RunManifest.Counts c = counters.snapshot();
			log("Completed" + (cancellation.isCancelled() ? " (cancelled)" : "") + ". " + c.pages() + " pages, "
					+ c.fetched() + " fetched, " + c.created() + " new, " + c.duplicate() + " duplicate, "
					+ c.rejected() + " rejected, " + c.failed() + " failed.");
		} catch (TooManyFailuresException e) {
			warn("Aborted due to too many failures (" + counters.failed.get() + " failed items)");
			error = e;
			transition(RunState.FAILED);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			warn("Interrupted in state " + state);
			error = e;
			transition(RunState.FAILED);
		} catch (Exception e) {
			warn("Failed with error in state " + state + ": " + e.getMessage());
			error = e;
			transition(RunState.FAILED);
		}

		RunManifest manifest = manifest(runId, startedAt, error);
		if (!dryRun) {
			try {
				writer.writeManifest(manifest);
			} catch (IOException e) {
				logger.error("Failed to write run manifest: " + e.getMessage());
				if (error == null) {
					error = e;
					transition(RunState.FAILED);
					manifest = manifest(runId, startedAt, error);
				}
			}
		}
		return ScraperResult.of(manifest, error);
	}

	/** Where the listing traversal starts: the previous run's resume page, or the first page */
	private Optional<PageReference> resumePoint() throws IOException {
		if (fromStart) {
			return Optional.empty();
		}
		Optional<RunManifest> previous = new ManifestStore(layout).latest();
		if (previous.isPresent() && previous.get().isResumable()) {
			PageReference page = previous.get().resumePage();
			log("Resuming traversal at " + page.url() + " (left by run " + previous.get().runId() + ")");
			return Optional.of(page);
		}
		return Optional.empty();
	}

	private List<PendingItem> traverseListings(DedupTracker dedup) throws FetchException, InterruptedException {
		PaginationStrategist strategist = PaginationStrategist.forRule(descriptor.pagination());
		PageReference first = startPage != null ? startPage : strategist.firstPage(descriptor);
		ListingCursor cursor = new ListingCursor(descriptor, strategist, this::loadListingPage, first, maxPages);

		List<PendingItem> pending = new ArrayList<>();
		Set<String> queued = new HashSet<>();
		while (true) {
			if (cancellation.isCancelled()) {
				unvisitedPage = cursor.pending();
				log("Cancelled during listing, stopping traversal");
				break;
			}
			Optional<ListingPage> next;
			try {
				next = cursor.next();
			} catch (PaginationCycleException e) {
				warn("Stopping traversal: " + e.getMessage());
				break;
			} catch (TransientFetchException e) {
				if (!cancellation.isCancelled()) {
					throw e;
				}
				unvisitedPage = cursor.pending();
				log("Cancelled while fetching " + unvisitedPage.url() + ", stopping traversal");
				break;
			}
			if (next.isEmpty()) {
				if (cursor.maxPagesReached()) {
					log("Reached page limit of " + maxPages + " listing pages");
				}
				break;
			}
			ListingPage page = next.get();
			counters.pages.incrementAndGet();
			fine("Listing page " + page.reference().url() + ": " + page.items().size() + " items");

			int known = 0;
			for (ItemReference item : page.items()) {
				String externalId = UrlUtils.canonicalize(item.url());
				if (externalId == null) {
					counters.rejected.incrementAndGet();
					logger.debug("Rejected listing item without a usable URL on " + page.reference().url());
					continue;
				}
				if (newestExternalId == null) {
					newestExternalId = externalId;
				}
				if (!dedup.isNew(externalId)) {
					known++;
					skip(externalId);
					continue;
				}
				if (!queued.add(externalId)) {
					skip(externalId);
					continue;
				}
				pending.add(new PendingItem(pending.size(), item, page.reference()));
			}
			if (descriptor.pagination().stopWhenAllSeen() && !page.isEmpty() && known == page.items().size()) {
				log("Every item on " + page.reference().url() + " was stored before, stopping traversal");
				break;
			}
		}
		log("Listing done: " + counters.pages.get() + " pages, " + pending.size() + " new items to fetch");
		return pending;
	}

	private ListingPage loadListingPage(PageReference page) throws FetchException, InterruptedException {
		FetchResult result = fetchClient.fetch(FetchRequest.get(page.url()), cancellation::isCancelled);
		return extractor.parseListing(descriptor, page, result);
	}

	private List<Accepted> processItems(List<PendingItem> items, DedupTracker dedup) throws Exception {
		Queue<Accepted> accepted = new ConcurrentLinkedQueue<>();
		if (items.isEmpty()) {
			return List.of();
		}
		int threads = Math.min(detailThreads, items.size());
		ExecutorService executor =
				Executors.newFixedThreadPool(threads, new NamedThreadFactory("detail-" + sourceId()));
		try {
			List<Future<?>> futures = new ArrayList<>();
			for (PendingItem item : items) {
				futures.add(executor.submit(() -> {
					processItem(item, dedup, accepted);
					return null;
				}));
			}
			for (Future<?> future : futures) {
				try {
					future.get();
				} catch (ExecutionException e) {
					Throwable cause = e.getCause();
					if (cause instanceof Exception ex) {
						throw ex;
					}
					throw e;
				}
			}
		} finally {
			executor.shutdownNow();
		}
		return new ArrayList<>(accepted);
	}

	private void processItem(PendingItem pending, DedupTracker dedup, Queue<Accepted> accepted)
			throws InterruptedException {
		if (cancellation.isCancelled()) {
			skippedItems.add(pending.index());
			return;
		}
		ItemReference item = pending.item();
		RawRecord raw = item.fields();
		String baseUrl = pending.page().url();
		if (descriptor.hasDetailPages()) {
			FetchResult result;
			try {
				result = fetchClient.fetch(FetchRequest.get(item.url()), cancellation::isCancelled);
			} catch (TransientFetchException e) {
				if (cancellation.isCancelled()) {
					// retries were cut short, leave the item to the next run
					skippedItems.add(pending.index());
					return;
				}
				fail("Failed to fetch article " + item.url(), e);
				return;
			} catch (FetchException e) {
				fail("Failed to fetch article " + item.url(), e);
				return;
			}
			counters.fetched.incrementAndGet();
			Document document = extractor.parse(result);
			raw = raw.overlay(extractor.extract(descriptor, document, result.fetchedAt()));
			baseUrl = result.finalUrl();
		}
		raw = extractor.clean(descriptor, raw, baseUrl);

		NewsRecord article;
		try {
			article = validator.validate(raw, articleSchema).country(descriptor.country());
		} catch (ValidationException e) {
			counters.rejected.incrementAndGet();
			logger.debug("Rejected " + item.url() + ": " + e.getMessage());
			return;
		}
		counters.validated.incrementAndGet();
		if (!dedup.claim(article.externalId())) {
			skip(article.externalId());
			return;
		}
		counters.created.incrementAndGet();
		accepted.add(new Accepted(article, thumbnail(pending)));
	}

	/** The listing-level view of an item, or {@code null} if the listing did not show enough */
	private NewsRecord thumbnail(PendingItem pending) {
		RawRecord fields = extractor.clean(descriptor, pending.item().fields(), pending.page().url());
		try {
			return validator.validate(fields, thumbnailSchema).country(descriptor.country());
		} catch (ValidationException e) {
			fine("No thumbnail for " + pending.item().url() + ": " + e.getMessage());
			return null;
		}
	}

	private void persist(StorageWriter writer, List<Accepted> accepted) throws IOException {
		List<NewsRecord> articles = new ArrayList<>();
		List<NewsRecord> thumbnails = new ArrayList<>();
		for (Accepted a : accepted) {
			articles.add(a.article());
			if (a.thumbnail() != null) {
				thumbnails.add(a.thumbnail());
			}
		}
		if (dryRun) {
			log("Dry run, not writing " + articles.size() + " articles and " + thumbnails.size() + " thumbnails");
			return;
		}
		writer.write(articles, RecordKind.ARTICLE);
		writer.write(thumbnails, RecordKind.THUMBNAIL);
	}

	private RunManifest manifest(String runId, Instant startedAt, Exception error) {
		return new RunManifest(
				sourceId(),
				runId,
				state,
				startedAt,
				clock.instant(),
				counters.snapshot(),
				cancellation.isCancelled(),
				dryRun,
				nextResumePage(),
				newestExternalId,
				error != null ? error.getClass().getSimpleName() + ": " + error.getMessage() : null);
	}

	/**
	 * A failed run persists nothing, so the next run starts where this one started. A cancelled run
	 * continues at the first page holding an item it skipped, or at the first page it did not visit.
	 */
	private PageReference nextResumePage() {
		if (state == RunState.FAILED) {
			return startPage;
		}
		if (!cancellation.isCancelled()) {
			return null;
		}
		return pendingItemsPage().orElse(unvisitedPage);
	}

	private Optional<PageReference> pendingItemsPage() {
		if (skippedItems.isEmpty()) {
			return Optional.empty();
		}
		int first = skippedItems.iterator().next();
		for (PendingItem item : pendingItems) {
			if (item.index() == first) {
				return Optional.of(item.page());
			}
		}
		return Optional.empty();
	}

	private void transition(RunState next) {
		if (state != null) {
			logger.debug(state + " -> " + next);
		}
		state = next;
		transitions.add(next);
	}

	/** Log a informative message */
	protected void log(String message) {
		logger.info(message);
	}

	/** Log a trace message */
	protected void fine(String message) {
		logger.trace(message);
	}

	/** Log a warning message */
	protected void warn(String message) {
		logger.warn(message);
	}

	protected void skip(String externalId) {
		logger.debug("Skipping " + externalId + " (already stored)");
		counters.duplicate.incrementAndGet();
	}

	/** Log failure to process a single item, aborting once the failure budget is used up */
	protected void fail(String message, Exception error) {
		logger.error(message + ": " + error.getMessage());
		int failures = counters.failed.incrementAndGet();
		if (maxFailureCount > 0 && failures >= maxFailureCount) {
			throw new TooManyFailuresException("Too many failures (" + failures + "), aborting");
		}
	}
}
