package org.springaicommunity.github.issuesync;

import org.jspecify.annotations.Nullable;

/**
 * Result of processing one item in a {@link ConcurrentBatchDispatcher}: either a value or
 * the failure raised while producing it.
 *
 * @param <T> item type
 * @param <R> result type
 */
public record DispatchOutcome<T, R>(T item, @Nullable R result, @Nullable RuntimeException error) {

	public static <T, R> DispatchOutcome<T, R> success(T item, R result) {
		return new DispatchOutcome<>(item, result, null);
	}

	public static <T, R> DispatchOutcome<T, R> failure(T item, RuntimeException error) {
		return new DispatchOutcome<>(item, null, error);
	}

	public boolean isSuccess() {
		return error == null;
	}

}
