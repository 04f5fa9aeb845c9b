package org.springaicommunity.github.issuesync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Runs a per-item function over a list of items, sequentially or in bounded concurrent
 * batches.
 *
 * <p>
 * Concurrency is engaged only when enabled and the item count reaches the threshold.
 * Each batch runs on a pool bounded by a semaphore, finishes with a wait-all barrier, and
 * is followed by a short pause before the next batch. Results always come back in input
 * order, and a failing item never aborts its siblings: its exception is captured in the
 * returned {@link DispatchOutcome}.
 *
 * @param <T> the type of items being dispatched
 */
public class ConcurrentBatchDispatcher<T> {

	private static final Logger logger = LoggerFactory.getLogger(ConcurrentBatchDispatcher.class);

	public static final int DEFAULT_THRESHOLD = 10;

	public static final int DEFAULT_BATCH_SIZE = 10;

	public static final int DEFAULT_MAX_WORKERS = 4;

	public static final Duration DEFAULT_BATCH_PAUSE = Duration.ofMillis(100);

	private final boolean enabled;

	private final int threshold;

	private final int batchSize;

	private final int maxWorkers;

	private final Duration batchPause;

	private final BatchStrategy<T> batchStrategy;

	private final RetryingIssuesClient.Sleeper sleeper;

	public ConcurrentBatchDispatcher(boolean enabled, int threshold, int batchSize, int maxWorkers,
			Duration batchPause, BatchStrategy<T> batchStrategy) {
		this(enabled, threshold, batchSize, maxWorkers, batchPause, batchStrategy,
				duration -> Thread.sleep(duration.toMillis()));
	}

	public ConcurrentBatchDispatcher(boolean enabled, int threshold, int batchSize, int maxWorkers,
			Duration batchPause, BatchStrategy<T> batchStrategy, RetryingIssuesClient.Sleeper sleeper) {
		this.enabled = enabled;
		this.threshold = Math.max(1, threshold);
		this.batchSize = Math.max(1, batchSize);
		this.maxWorkers = Math.max(1, maxWorkers);
		this.batchPause = batchPause;
		this.batchStrategy = batchStrategy;
		this.sleeper = sleeper;
	}

	/**
	 * Sequential-only dispatcher.
	 */
	public static <T> ConcurrentBatchDispatcher<T> sequential() {
		return new ConcurrentBatchDispatcher<>(false, DEFAULT_THRESHOLD, DEFAULT_BATCH_SIZE, 1, Duration.ZERO,
				new FixedBatchStrategy<>());
	}

	/**
	 * Whether a run over {@code itemCount} items would be concurrent.
	 */
	public boolean shouldUseConcurrency(int itemCount) {
		return enabled && itemCount >= threshold;
	}

	/**
	 * Worker count for a run: 1 up to 5 items, 2 up to 20, 3 up to 50, the cap beyond.
	 * Never exceeds the configured cap.
	 * @param itemCount number of items
	 * @return worker count
	 */
	public int optimalWorkerCount(int itemCount) {
		int workers;
		if (itemCount <= 5) {
			workers = 1;
		}
		else if (itemCount <= 20) {
			workers = 2;
		}
		else if (itemCount <= 50) {
			workers = 3;
		}
		else {
			workers = maxWorkers;
		}
		return Math.min(workers, maxWorkers);
	}

	/**
	 * Apply {@code processor} to every item.
	 * @param items items in order
	 * @param processor per-item function, may throw
	 * @param <R> result type
	 * @return one outcome per item, in input order
	 */
	public <R> List<DispatchOutcome<T, R>> dispatch(List<T> items, Function<T, R> processor) {
		if (!shouldUseConcurrency(items.size())) {
			List<DispatchOutcome<T, R>> outcomes = new ArrayList<>(items.size());
			for (T item : items) {
				outcomes.add(apply(item, processor));
			}
			return outcomes;
		}
		return dispatchConcurrently(items, processor);
	}

	private <R> List<DispatchOutcome<T, R>> dispatchConcurrently(List<T> items, Function<T, R> processor) {
		int workers = optimalWorkerCount(items.size());
		logger.info("Processing {} items concurrently with {} workers", items.size(), workers);
		Semaphore permits = new Semaphore(workers);
		ExecutorService executor = Executors.newFixedThreadPool(workers, new WorkerThreadFactory());
		List<DispatchOutcome<T, R>> outcomes = new ArrayList<>(items.size());
		List<T> pending = new ArrayList<>(items);
		int batchIndex = 0;
		try {
			while (!pending.isEmpty()) {
				if (batchIndex > 0 && !batchPause.isZero()) {
					pause();
				}
				List<T> sample = pending.subList(0, Math.min(batchSize, pending.size()));
				int size = batchStrategy.calculateBatchSize(new ArrayList<>(sample), batchSize);
				List<T> batch = batchStrategy.createBatch(pending, size);
				batchIndex++;
				logger.debug("Dispatching batch {} with {} items", batchIndex, batch.size());

				List<Future<DispatchOutcome<T, R>>> futures = new ArrayList<>(batch.size());
				for (T item : batch) {
					futures.add(executor.submit(() -> {
						permits.acquire();
						try {
							return apply(item, processor);
						}
						finally {
							permits.release();
						}
					}));
				}
				for (int i = 0; i < futures.size(); i++) {
					outcomes.add(await(batch.get(i), futures.get(i)));
				}
			}
		}
		finally {
			executor.shutdownNow();
		}
		return outcomes;
	}

	private <R> DispatchOutcome<T, R> apply(T item, Function<T, R> processor) {
		try {
			return DispatchOutcome.success(item, processor.apply(item));
		}
		catch (RuntimeException e) {
			logger.debug("Item failed: {}", e.getMessage());
			return DispatchOutcome.failure(item, e);
		}
	}

	private <R> DispatchOutcome<T, R> await(T item, Future<DispatchOutcome<T, R>> future) {
		try {
			return future.get();
		}
		catch (ExecutionException e) {
			Throwable cause = e.getCause();
			RuntimeException error = cause instanceof RuntimeException runtime ? runtime
					: new IllegalStateException("Worker failed: " + cause, cause);
			return DispatchOutcome.failure(item, error);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Interrupted while waiting for batch", e);
		}
	}

	private void pause() {
		try {
			sleeper.sleep(batchPause);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Interrupted between batches", e);
		}
	}

	int getMaxWorkers() {
		return maxWorkers;
	}

	private static final class WorkerThreadFactory implements ThreadFactory {

		private static final AtomicInteger POOL = new AtomicInteger();

		private final int pool = POOL.incrementAndGet();

		private final AtomicInteger counter = new AtomicInteger();

		@Override
		public Thread newThread(Runnable runnable) {
			Thread thread = new Thread(runnable, "issue-sync-" + pool + "-worker-" + counter.incrementAndGet());
			thread.setDaemon(true);
			return thread;
		}

	}

}
