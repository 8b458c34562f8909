package org.pacificobservatory.newsdb.fetch;

import java.time.Duration;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Politeness gate for one host: limits concurrent requests and hands out send slots at least
 * {@code minDelay} apart. Slots are reserved under the gate's lock, so two threads can never be
 * given the same slot.
 */
class HostGate {
	private final Semaphore permits;
	private final long minDelayNanos;
	private long nextSlot = Long.MIN_VALUE; // guarded by this

	HostGate(int maxConcurrent, Duration minDelay) {
		this.permits = new Semaphore(maxConcurrent, true);
		this.minDelayNanos = minDelay.toNanos();
	}

	/** Block until a concurrency permit is free */
	void enter() throws InterruptedException {
		permits.acquire();
	}

	/** Wait for this request's send slot; call between {@link #enter()} and {@link #leave()} */
	void awaitSlot() throws InterruptedException {
		long wait = reserve(System.nanoTime());
		if (wait > 0) {
			TimeUnit.NANOSECONDS.sleep(wait);
		}
	}

	void leave() {
		permits.release();
	}

	/** Reserve the next free slot and return how long to wait for it */
	synchronized long reserve(long now) {
		long slot = nextSlot == Long.MIN_VALUE ? now : Math.max(now, nextSlot);
		nextSlot = slot + minDelayNanos;
		return slot - now;
	}

	int availablePermits() {
		return permits.availablePermits();
	}
}
