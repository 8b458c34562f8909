package org.pacificobservatory.newsdb.fetch;

import static org.assertj.core.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {

	@Test
	void testBackoff_ExponentialAndCapped() {
		// Given
		RetryPolicy policy = new RetryPolicy(5, Duration.ofSeconds(2), Duration.ofSeconds(10), 0);

		// When/Then
		assertThat(policy.backoff(1)).isEqualTo(Duration.ofSeconds(2));
		assertThat(policy.backoff(2)).isEqualTo(Duration.ofSeconds(4));
		assertThat(policy.backoff(3)).isEqualTo(Duration.ofSeconds(8));
		assertThat(policy.backoff(4)).isEqualTo(Duration.ofSeconds(10));
	}

	@Test
	void testBackoff_JitterStaysInRange() {
		// Given
		RetryPolicy policy = new RetryPolicy(3, Duration.ofMillis(100), Duration.ofSeconds(1), 0.5);

		// When/Then
		for (int i = 0; i < 50; i++) {
			assertThat(policy.backoff(1).toMillis()).isBetween(100L, 150L);
		}
	}

	@Test
	void testRejectsInvalidSettings() {
		assertThatThrownBy(() -> new RetryPolicy(0, Duration.ofSeconds(1), Duration.ofSeconds(1), 0))
				.isInstanceOf(IllegalArgumentException.class);
		assertThatThrownBy(() -> RetryPolicy.DEFAULT.withMaxAttempts(-1)).isInstanceOf(IllegalArgumentException.class);
		assertThat(RetryPolicy.DEFAULT.maxAttempts()).isEqualTo(3);
	}
}
