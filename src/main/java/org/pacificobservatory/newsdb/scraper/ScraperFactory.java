package org.pacificobservatory.newsdb.scraper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;
import org.pacificobservatory.newsdb.descriptor.ConfigurationException;
import org.pacificobservatory.newsdb.descriptor.DescriptorLoader;
import org.pacificobservatory.newsdb.descriptor.SiteDescriptor;
import org.pacificobservatory.newsdb.fetch.FetchClient;
import org.pacificobservatory.newsdb.util.UrlUtils;
import org.slf4j.LoggerFactory;

/**
 * Finds site descriptors and creates scrapers for them. Descriptors live in
 * {@code <descriptors>/<country>/<source_id>.yaml}; every source id must be unique.
 */
public class ScraperFactory {
	private final Path storageRoot;
	private final FetchClient fetchClient;
	private final CancellationSignal cancellation;
	private final boolean dryRun;
	private final boolean fromStart;
	private final int maxPages;
	private final int detailThreads;
	private final int maxFailureCount;
	private final int maxFutureDays;

	public static ScraperFactory create(
			Path storageRoot,
			FetchClient fetchClient,
			CancellationSignal cancellation,
			boolean dryRun,
			boolean fromStart,
			int maxPages,
			int detailThreads,
			int maxFailureCount,
			int maxFutureDays) {
		return new ScraperFactory(
				storageRoot,
				fetchClient,
				cancellation,
				dryRun,
				fromStart,
				maxPages,
				detailThreads,
				maxFailureCount,
				maxFutureDays);
	}

	private ScraperFactory(
			Path storageRoot,
			FetchClient fetchClient,
			CancellationSignal cancellation,
			boolean dryRun,
			boolean fromStart,
			int maxPages,
			int detailThreads,
			int maxFailureCount,
			int maxFutureDays) {
		this.storageRoot = storageRoot;
		this.fetchClient = fetchClient;
		this.cancellation = cancellation;
		this.dryRun = dryRun;
		this.fromStart = fromStart;
		this.maxPages = maxPages;
		this.detailThreads = detailThreads;
		this.maxFailureCount = maxFailureCount;
		this.maxFutureDays = maxFutureDays;
	}

	/**
	 * Descriptors found below a directory.
	 *
	 * @param valid loaded descriptors, keyed and sorted by source id
	 * @param invalid errors of descriptors that could not be loaded, keyed by the source id their file
	 *     name implies
	 */
	public record Descriptors(Map<String, SiteDescriptor> valid, Map<String, ConfigurationException> invalid) {}

	/**
	 * Load every descriptor below a directory. A descriptor that fails to load is reported in
	 * {@link Descriptors#invalid()} and does not keep the others from loading.
	 *
	 * @param country only load descriptors from this country's sub-directory, or all when {@code null}
	 * @throws ConfigurationException if the directory does not exist or two descriptors share a source
	 *     id
	 */
	public static Descriptors loadDescriptors(Path descriptorsDir, String country)
			throws IOException, ConfigurationException {
		if (!Files.isDirectory(descriptorsDir)) {
			throw new ConfigurationException("Descriptor directory not found: " + descriptorsDir);
		}
		Map<String, SiteDescriptor> descriptors = new TreeMap<>();
		Map<String, ConfigurationException> invalid = new TreeMap<>();
		Map<String, Path> origins = new HashMap<>();
		for (Path file : findDescriptorFiles(descriptorsDir, country)) {
			String sourceId;
			try {
				SiteDescriptor descriptor = DescriptorLoader.load(file);
				sourceId = descriptor.sourceId();
				descriptors.put(sourceId, descriptor);
			} catch (ConfigurationException e) {
				sourceId = DescriptorLoader.defaultSourceId(file);
				invalid.put(sourceId, e);
			}
			Path existing = origins.put(sourceId, file);
			if (existing != null) {
				throw new ConfigurationException(
						"Duplicate source id '" + sourceId + "' in " + existing + " and " + file);
			}
		}
		return new Descriptors(descriptors, invalid);
	}

	static List<Path> findDescriptorFiles(Path descriptorsDir, String country) throws IOException {
		List<Path> files = new ArrayList<>();
		try (Stream<Path> paths = Files.walk(descriptorsDir)) {
			paths.filter(Files::isRegularFile)
					.filter(p -> {
						String name = p.getFileName().toString();
						return !name.startsWith(".") && (name.endsWith(".yaml") || name.endsWith(".yml"));
					})
					.filter(p -> country == null || matchesCountry(descriptorsDir, p, country))
					.sorted()
					.forEach(files::add);
		}
		return files;
	}

	private static boolean matchesCountry(Path root, Path file, String country) {
		Path relative = root.relativize(file);
		return relative.getNameCount() > 1
				&& relative.getName(0).toString().toLowerCase(Locale.ROOT).equals(country.toLowerCase(Locale.ROOT));
	}

	/** Create the scraper for a descriptor, registering its rate limit with the fetch client */
	public Scraper createScraper(SiteDescriptor descriptor) {
		fetchClient.configureHost(UrlUtils.host(descriptor.baseUrl()), descriptor.rateLimit());
		ScraperConfig config = new ScraperConfig(
				descriptor,
				storageRoot,
				fetchClient,
				LoggerFactory.getLogger("newsdb.scraper." + descriptor.sourceId()),
				dryRun,
				fromStart,
				maxPages,
				detailThreads,
				maxFailureCount,
				maxFutureDays,
				cancellation,
				Clock.systemUTC());
		return new NewspaperScraper(config);
	}
}
