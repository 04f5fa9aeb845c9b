package org.springaicommunity.github.issuesync;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of processing one spec.
 *
 * @param slug the spec's slug
 * @param action what was (or, in a dry-run, would be) done
 * @param number matched or created issue number, if known
 * @param changes change set for updates
 * @param error failure message when processing this spec failed
 */
public record ItemResult(String slug, SyncAction action, @Nullable Integer number, @Nullable ChangeSet changes,
		@Nullable String error) {

	public static ItemResult of(String slug, SyncAction action, @Nullable Integer number) {
		return new ItemResult(slug, action, number, null, null);
	}

	public static ItemResult updated(String slug, int number, ChangeSet changes) {
		return new ItemResult(slug, SyncAction.UPDATE, number, changes, null);
	}

	/**
	 * A failed spec. Counted as skipped.
	 */
	public static ItemResult failed(String slug, String error) {
		return new ItemResult(slug, SyncAction.SKIP, null, null, error);
	}

	public boolean isFailed() {
		return error != null;
	}

}
