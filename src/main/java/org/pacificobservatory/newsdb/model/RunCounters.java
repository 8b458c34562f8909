package org.pacificobservatory.newsdb.model;

import java.util.concurrent.atomic.AtomicInteger;

/** Thread-safe tallies for a run, updated by the listing loop and the detail workers */
public class RunCounters {
	public final AtomicInteger pages = new AtomicInteger();
	public final AtomicInteger fetched = new AtomicInteger();
	public final AtomicInteger validated = new AtomicInteger();
	public final AtomicInteger rejected = new AtomicInteger();
	public final AtomicInteger duplicate = new AtomicInteger();
	public final AtomicInteger created = new AtomicInteger();
	public final AtomicInteger failed = new AtomicInteger();

	public RunManifest.Counts snapshot() {
		return new RunManifest.Counts(
				pages.get(),
				fetched.get(),
				validated.get(),
				rejected.get(),
				duplicate.get(),
				created.get(),
				failed.get());
	}
}
