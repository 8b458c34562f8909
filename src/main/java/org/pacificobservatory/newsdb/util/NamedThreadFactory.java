package org.pacificobservatory.newsdb.util;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

public class NamedThreadFactory implements ThreadFactory {
	private final String name;
	private final AtomicInteger counter = new AtomicInteger();

	public NamedThreadFactory(String name) {
		this.name = name;
	}

	@Override
	public Thread newThread(Runnable r) {
		Thread thread = new Thread(r, name + "-" + counter.incrementAndGet());
		thread.setDaemon(true);
		return thread;
	}
}
