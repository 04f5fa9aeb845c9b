package org.springaicommunity.github.issuesync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Adaptive batch strategy that halves the batch size when items are large, so that one
 * batch of long issue bodies does not hold many slow requests in flight at once.
 *
 * @param <T> the type of items being batched
 */
public class AdaptiveBatchStrategy<T> implements BatchStrategy<T> {

	private static final Logger logger = LoggerFactory.getLogger(AdaptiveBatchStrategy.class);

	private final ObjectMapper objectMapper;

	private final int largeItemThreshold;

	/**
	 * Create an adaptive batch strategy.
	 * @param objectMapper for serializing items to estimate size
	 * @param largeItemThreshold average item size (in bytes) above which batch size is
	 * reduced
	 */
	public AdaptiveBatchStrategy(ObjectMapper objectMapper, int largeItemThreshold) {
		this.objectMapper = objectMapper;
		this.largeItemThreshold = largeItemThreshold;
	}

	@Override
	public List<T> createBatch(List<T> pendingItems, int maxBatchSize) {
		return FixedBatchStrategy.takeHead(pendingItems, maxBatchSize);
	}

	@Override
	public int calculateBatchSize(List<T> sampleItems, int requestedBatchSize) {
		if (sampleItems.isEmpty()) {
			return requestedBatchSize;
		}
		try {
			long totalSize = 0;
			for (T item : sampleItems) {
				totalSize += objectMapper.writeValueAsString(item).length();
			}
			long averageSize = totalSize / sampleItems.size();
			if (averageSize > largeItemThreshold) {
				int adaptiveBatchSize = Math.max(1, requestedBatchSize / 2);
				logger.info("Large items detected (avg: {} bytes), reducing batch size to {}", averageSize,
						adaptiveBatchSize);
				return adaptiveBatchSize;
			}
			return requestedBatchSize;
		}
		catch (JsonProcessingException e) {
			logger.warn("Failed to calculate adaptive batch size: {}", e.getMessage());
			return requestedBatchSize;
		}
	}

}
