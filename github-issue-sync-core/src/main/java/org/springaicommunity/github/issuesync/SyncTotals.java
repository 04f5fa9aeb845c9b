package org.springaicommunity.github.issuesync;

/**
 * Counters for one run. Failed specs count as skipped.
 */
public record SyncTotals(int specs, int created, int updated, int closed, int skipped) {
}
