package org.pacificobservatory.newsdb.scraper;

import java.util.concurrent.atomic.AtomicBoolean;

/** Shared flag asking running scrapers to stop after their in-flight work */
public class CancellationSignal {
	private final AtomicBoolean cancelled = new AtomicBoolean();

	public void cancel() {
		cancelled.set(true);
	}

	public boolean isCancelled() {
		return cancelled.get();
	}
}
