package org.springaicommunity.github.issuesync;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a sync: totals, changes grouped by kind, the slug to issue mapping seen in
 * this run, the plan (dry-run only) and isolated errors.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunSummary(SyncTotals totals, SyncChanges changes, Map<String, Integer> mapping,
		@Nullable List<PlanEntry> plan, List<SyncError> errors) {

	/**
	 * Build a summary from per-item results.
	 * @param results results in specification order
	 * @param dryRun whether to attach a plan
	 * @param truncateBodyDiff body diff line cap for listed updates, 0 keeps all
	 * @return the summary
	 */
	static RunSummary from(List<ItemResult> results, boolean dryRun, int truncateBodyDiff) {
		List<ChangeEntry> created = new ArrayList<>();
		List<ChangeEntry> updated = new ArrayList<>();
		List<ChangeEntry> closed = new ArrayList<>();
		List<SyncError> errors = new ArrayList<>();
		Map<String, Integer> mapping = new LinkedHashMap<>();
		int skipped = 0;
		for (ItemResult result : results) {
			if (result.number() != null) {
				mapping.put(result.slug(), result.number());
			}
			if (result.error() != null) {
				errors.add(new SyncError(result.slug(), result.error()));
			}
			switch (result.action()) {
				case CREATE -> created.add(new ChangeEntry(result.slug(), result.number(), null));
				case UPDATE -> {
					ChangeSet diff = result.changes();
					if (diff != null && truncateBodyDiff > 0) {
						diff = diff.truncateBodyDiff(truncateBodyDiff);
					}
					updated.add(new ChangeEntry(result.slug(), result.number(), diff));
				}
				case CLOSE -> closed.add(new ChangeEntry(result.slug(), result.number(), null));
				case SKIP -> skipped++;
			}
		}
		SyncTotals totals = new SyncTotals(results.size(), created.size(), updated.size(), closed.size(), skipped);
		List<PlanEntry> plan = dryRun ? results.stream().map(PlanEntry::from).toList() : null;
		return new RunSummary(totals, new SyncChanges(created, updated, closed), mapping, plan, List.copyOf(errors));
	}

}
