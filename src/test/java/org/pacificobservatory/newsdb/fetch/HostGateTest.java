package org.pacificobservatory.newsdb.fetch;

import static org.assertj.core.api.Assertions.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class HostGateTest {

	@Test
	void testReserve_SpacesSlots() {
		// Given
		HostGate gate = new HostGate(1, Duration.ofNanos(100));

		// When/Then
		assertThat(gate.reserve(1_000)).isEqualTo(0);
		assertThat(gate.reserve(1_000)).isEqualTo(100);
		assertThat(gate.reserve(1_050)).isEqualTo(150);
		assertThat(gate.reserve(5_000)).isEqualTo(0);
	}

	@Test
	void testReserve_ConcurrentCallersGetDistinctSlots() throws Exception {
		// Given
		long delay = 1_000;
		HostGate gate = new HostGate(16, Duration.ofNanos(delay));
		List<Long> slots = Collections.synchronizedList(new ArrayList<>());
		ExecutorService executor = Executors.newFixedThreadPool(8);
		CountDownLatch start = new CountDownLatch(1);

		// When
		for (int i = 0; i < 64; i++) {
			executor.submit(() -> {
				start.await();
				slots.add(gate.reserve(0));
				return null;
			});
		}
		start.countDown();
		executor.shutdown();
		assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

		// Then
		assertThat(slots).hasSize(64).doesNotHaveDuplicates();
		List<Long> sorted = new ArrayList<>(slots);
		Collections.sort(sorted);
		for (int i = 1; i < sorted.size(); i++) {
			assertThat(sorted.get(i) - sorted.get(i - 1)).isEqualTo(delay);
		}
	}

	@Test
	void testEnter_LimitsConcurrency() throws Exception {
		// Given
		HostGate gate = new HostGate(2, Duration.ZERO);

		// When
		gate.enter();
		gate.enter();

		// Then
		assertThat(gate.availablePermits()).isZero();
		gate.leave();
		assertThat(gate.availablePermits()).isEqualTo(1);
	}
}
