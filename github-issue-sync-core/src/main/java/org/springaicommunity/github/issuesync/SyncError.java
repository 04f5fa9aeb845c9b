package org.springaicommunity.github.issuesync;

/**
 * An isolated per-spec failure.
 */
public record SyncError(String slug, String message) {
}
