package org.springaicommunity.github.issuesync;

import java.util.ArrayList;
import java.util.List;

/**
 * Simple fixed-size batch strategy.
 *
 * <p>
 * Always uses the requested batch size without adaptation.
 *
 * @param <T> the type of items being batched
 */
public class FixedBatchStrategy<T> implements BatchStrategy<T> {

	@Override
	public List<T> createBatch(List<T> pendingItems, int maxBatchSize) {
		return takeHead(pendingItems, maxBatchSize);
	}

	@Override
	public int calculateBatchSize(List<T> sampleItems, int requestedBatchSize) {
		return requestedBatchSize;
	}

	static <T> List<T> takeHead(List<T> pendingItems, int maxBatchSize) {
		if (pendingItems.isEmpty()) {
			return new ArrayList<>();
		}
		int batchSize = Math.min(Math.max(1, maxBatchSize), pendingItems.size());
		List<T> batch = new ArrayList<>(pendingItems.subList(0, batchSize));
		pendingItems.subList(0, batchSize).clear();
		return batch;
	}

}
