package org.pacificobservatory.newsdb.scraper;

import java.util.concurrent.Callable;

/**
 * A scraper for one news source. Scrapers implement {@link Callable} so several sources can run in
 * parallel; a call never throws, failures are reported through the {@link ScraperResult}.
 */
public interface Scraper extends Callable<ScraperResult> {

	String sourceId();

	@Override
	ScraperResult call();
}
