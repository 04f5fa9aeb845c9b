package org.springaicommunity.github.issuesync;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Decorator that adds retry with backoff to an {@link IssuesClient}.
 *
 * <p>
 * Features:
 * <ul>
 * <li>Only failures classified as transient by {@link TransientFailureClassifier} are
 * retried; everything else propagates on the first attempt</li>
 * <li>Explicit wait hints ({@code Retry-After: N}, {@code wait N seconds}) take
 * precedence over computed backoff</li>
 * <li>Computed backoff is {@code base * 2^(attempt-1)} plus up to 250ms of jitter,
 * optionally capped by a maximum sleep</li>
 * <li>On exhaustion the original failure is rethrown</li>
 * </ul>
 *
 * <p>
 * Example usage:
 *
 * <pre>
 * {@code
 * // With defaults (3 attempts, 500ms base delay)
 * IssuesClient client = RetryingIssuesClient.builder()
 *     .wrapping(new GitHubRestIssuesClient(token, "owner/repo", mapper))
 *     .build();
 *
 * // With custom settings
 * IssuesClient client = RetryingIssuesClient.builder()
 *     .wrapping(delegate)
 *     .maxAttempts(5)
 *     .baseDelay(Duration.ofSeconds(1))
 *     .maxSleep(Duration.ofSeconds(30))
 *     .build();
 * }
 * </pre>
 *
 * <p>
 * The sleep blocks only the calling thread, so a retry inside a dispatcher worker does
 * not stall other workers.
 */
public final class RetryingIssuesClient implements IssuesClient {

	private static final Logger logger = LoggerFactory.getLogger(RetryingIssuesClient.class);

	private static final double MAX_JITTER_SECONDS = 0.25;

	private final IssuesClient delegate;

	private final int maxAttempts;

	private final Duration baseDelay;

	@Nullable
	private final Duration maxSleep;

	private final TransientFailureClassifier classifier;

	private final Sleeper sleeper;

	private final DoubleSupplier jitter;

	/**
	 * Private constructor - use {@link #builder()} to create instances.
	 */
	private RetryingIssuesClient(Builder builder) {
		this.delegate = builder.delegate;
		this.maxAttempts = builder.maxAttempts;
		this.baseDelay = builder.baseDelay;
		this.maxSleep = builder.maxSleep;
		this.classifier = builder.classifier;
		this.sleeper = builder.sleeper;
		this.jitter = builder.jitter;
	}

	/**
	 * Create a new builder for RetryingIssuesClient.
	 * @return new Builder instance
	 */
	public static Builder builder() {
		return new Builder();
	}

	@Override
	@Nullable
	public Integer create(String title, String body, List<String> labels, @Nullable String milestone) {
		return execute(() -> delegate.create(title, body, labels, milestone), "create '" + title + "'");
	}

	@Override
	public void update(int number, @Nullable String body, @Nullable List<String> labels, @Nullable String milestone,
			@Nullable String state) {
		execute(() -> {
			delegate.update(number, body, labels, milestone, state);
			return null;
		}, "update #" + number);
	}

	@Override
	public void close(int number) {
		execute(() -> {
			delegate.close(number);
			return null;
		}, "close #" + number);
	}

	@Override
	public List<RemoteIssue> list() {
		return execute(delegate::list, "list issues");
	}

	@Override
	public List<String> ensureLabels(Set<String> labels) {
		return execute(() -> delegate.ensureLabels(labels), "ensure labels");
	}

	@Override
	public List<String> ensureMilestones(List<String> milestones) {
		return execute(() -> delegate.ensureMilestones(milestones), "ensure milestones");
	}

	/**
	 * Run a remote call, retrying transient failures.
	 * @param call zero-argument remote call
	 * @param description short text for log messages
	 * @param <T> result type
	 * @return the call's result
	 * @throws RuntimeException the original failure when it is permanent or retries are
	 * exhausted
	 */
	@Nullable
	public <T> T execute(RemoteCall<T> call, String description) {
		for (int attempt = 1;; attempt++) {
			try {
				return call.call();
			}
			catch (RuntimeException e) {
				FailureClassification classification = classifier.classify(e);
				if (!classification.isTransient()) {
					throw e;
				}
				if (attempt >= maxAttempts) {
					logger.error("{} failed after {} attempts: {}", description, attempt, e.getMessage());
					throw e;
				}
				Duration wait = computeSleep(attempt, (FailureClassification.Transient) classification);
				logger.warn("{} hit a transient error (attempt {}/{}): {}. Sleeping {}ms", description, attempt,
						maxAttempts, e.getMessage(), wait.toMillis());
				sleep(wait);
			}
		}
	}

	/**
	 * Compute how long to wait before the next attempt. An explicit hint wins over the
	 * exponential schedule; the configured maximum caps both.
	 * @param attempt the attempt that just failed (1-based)
	 * @param classification the transient classification of the failure
	 * @return the sleep duration
	 */
	Duration computeSleep(int attempt, FailureClassification.Transient classification) {
		Duration sleep = classification.waitHint().orElseGet(() -> {
			long baseMs = baseDelay.toMillis() * (1L << (attempt - 1));
			long jitterMs = Math.round(jitter.getAsDouble() * 1000);
			return Duration.ofMillis(baseMs + jitterMs);
		});
		if (maxSleep != null && sleep.compareTo(maxSleep) > 0) {
			return maxSleep;
		}
		return sleep;
	}

	int getMaxAttempts() {
		return maxAttempts;
	}

	private void sleep(Duration duration) {
		try {
			sleeper.sleep(duration);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new RemoteIssueException("Retry interrupted", e);
		}
	}

	/**
	 * A zero-argument remote call.
	 *
	 * @param <T> result type
	 */
	@FunctionalInterface
	public interface RemoteCall<T> {

		@Nullable
		T call();

	}

	/**
	 * Blocking sleep, replaceable in tests.
	 */
	@FunctionalInterface
	public interface Sleeper {

		void sleep(Duration duration) throws InterruptedException;

	}

	/**
	 * Builder for {@link RetryingIssuesClient}.
	 *
	 * <p>
	 * Provides sensible defaults:
	 * <ul>
	 * <li>maxAttempts: 3</li>
	 * <li>baseDelay: 500 milliseconds</li>
	 * <li>maxSleep: none</li>
	 * <li>jitter: uniform in [0, 0.25) seconds</li>
	 * </ul>
	 */
	public static class Builder {

		private IssuesClient delegate;

		private int maxAttempts = 3;

		private Duration baseDelay = Duration.ofMillis(500);

		@Nullable
		private Duration maxSleep;

		private TransientFailureClassifier classifier = new TransientFailureClassifier();

		private Sleeper sleeper = duration -> Thread.sleep(duration.toMillis());

		private DoubleSupplier jitter = () -> ThreadLocalRandom.current().nextDouble(0, MAX_JITTER_SECONDS);

		private Builder() {
		}

		/**
		 * Set the client to wrap with retry logic.
		 * @param client the IssuesClient to wrap (required)
		 * @return this builder
		 */
		public Builder wrapping(IssuesClient client) {
			this.delegate = client;
			return this;
		}

		/**
		 * Set the maximum number of attempts, including the first one.
		 * @param maxAttempts maximum attempts (default: 3, values below 1 mean 1)
		 * @return this builder
		 */
		public Builder maxAttempts(int maxAttempts) {
			this.maxAttempts = Math.max(1, maxAttempts);
			return this;
		}

		/**
		 * Set the base delay of the exponential schedule.
		 * @param delay base delay (doubles on each attempt, default: 500ms)
		 * @return this builder
		 */
		public Builder baseDelay(Duration delay) {
			this.baseDelay = delay;
			return this;
		}

		/**
		 * Cap every sleep, whether hinted or computed.
		 * @param maxSleep maximum sleep, or null for no cap
		 * @return this builder
		 */
		public Builder maxSleep(@Nullable Duration maxSleep) {
			this.maxSleep = maxSleep;
			return this;
		}

		public Builder classifier(TransientFailureClassifier classifier) {
			this.classifier = classifier;
			return this;
		}

		public Builder sleeper(Sleeper sleeper) {
			this.sleeper = sleeper;
			return this;
		}

		/**
		 * Set the jitter source. Values are seconds and should lie in [0, 0.25).
		 * @param jitter jitter supplier
		 * @return this builder
		 */
		public Builder jitter(DoubleSupplier jitter) {
			this.jitter = jitter;
			return this;
		}

		/**
		 * Build the RetryingIssuesClient.
		 * @return configured RetryingIssuesClient
		 * @throws IllegalStateException if required parameters are missing or invalid
		 */
		public RetryingIssuesClient build() {
			if (delegate == null) {
				throw new IllegalStateException("An IssuesClient to wrap is required. Call wrapping() first.");
			}
			if (baseDelay.isNegative()) {
				throw new IllegalStateException("baseDelay must not be negative");
			}
			if (maxSleep != null && maxSleep.isNegative()) {
				throw new IllegalStateException("maxSleep must not be negative");
			}
			return new RetryingIssuesClient(this);
		}

	}

}
