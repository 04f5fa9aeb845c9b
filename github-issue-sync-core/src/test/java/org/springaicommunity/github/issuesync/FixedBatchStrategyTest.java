package org.springaicommunity.github.issuesync;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link FixedBatchStrategy}.
 */
@DisplayName("FixedBatchStrategy Tests")
class FixedBatchStrategyTest {

	private final FixedBatchStrategy<String> strategy = new FixedBatchStrategy<>();

	@Test
	@DisplayName("Should take batches from the head of the pending list")
	void shouldTakeFromHead() {
		List<String> pending = new ArrayList<>(List.of("a", "b", "c", "d", "e"));

		List<String> batch = strategy.createBatch(pending, 3);

		assertThat(batch).containsExactly("a", "b", "c");
		assertThat(pending).containsExactly("d", "e");
	}

	@Test
	@DisplayName("Should return the remainder when fewer items are pending")
	void shouldReturnRemainder() {
		List<String> pending = new ArrayList<>(List.of("a", "b"));

		assertThat(strategy.createBatch(pending, 10)).containsExactly("a", "b");
		assertThat(pending).isEmpty();
	}

	@Test
	@DisplayName("Should return an empty batch when nothing is pending")
	void shouldHandleEmptyPending() {
		assertThat(strategy.createBatch(new ArrayList<>(), 5)).isEmpty();
	}

	@Test
	@DisplayName("Should treat non-positive batch sizes as one")
	void shouldClampBatchSize() {
		List<String> pending = new ArrayList<>(List.of("a", "b"));

		assertThat(strategy.createBatch(pending, 0)).containsExactly("a");
	}

	@Test
	@DisplayName("Should always keep the requested batch size")
	void shouldKeepRequestedSize() {
		assertThat(strategy.calculateBatchSize(List.of("x".repeat(100_000)), 7)).isEqualTo(7);
	}

}
