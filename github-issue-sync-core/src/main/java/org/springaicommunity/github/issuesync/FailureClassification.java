package org.springaicommunity.github.issuesync;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.Optional;

/**
 * Result of classifying a remote failure, consumed by {@link RetryingIssuesClient}.
 */
public sealed interface FailureClassification
		permits FailureClassification.Transient, FailureClassification.Permanent {

	static FailureClassification transientFailure(@Nullable Duration hint) {
		return new Transient(hint);
	}

	static FailureClassification permanent() {
		return Permanent.INSTANCE;
	}

	default boolean isTransient() {
		return this instanceof Transient;
	}

	/**
	 * Retryable failure (rate limit, abuse detection, interrupted transport).
	 *
	 * @param hint explicit wait requested by the remote side, or null
	 */
	record Transient(@Nullable Duration hint) implements FailureClassification {

		public Optional<Duration> waitHint() {
			return Optional.ofNullable(hint);
		}

	}

	/**
	 * Failure that must propagate immediately.
	 */
	final class Permanent implements FailureClassification {

		static final Permanent INSTANCE = new Permanent();

		private Permanent() {
		}

		@Override
		public String toString() {
			return "Permanent";
		}

	}

}
