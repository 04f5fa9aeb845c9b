package org.springaicommunity.github.issuesync;

import java.util.List;

/**
 * Per-run switches for {@link IssueSyncService}.
 *
 * @param dryRun plan only, never mutate remote state or the index
 * @param update update matched issues whose content drifted
 * @param respectStatus close matched issues whose spec says {@code closed}
 * @param prune close remote issues no spec refers to
 * @param milestoneRequired fail before any remote call when a spec lacks a milestone
 * @param truncateBodyDiff maximum body diff lines kept in the summary, 0 keeps all
 * @param preflight create missing labels and milestones before syncing
 * @param injectLabels extra labels to create during preflight
 * @param ensureMilestones milestones to create during preflight
 */
public record SyncOptions(boolean dryRun, boolean update, boolean respectStatus, boolean prune,
		boolean milestoneRequired, int truncateBodyDiff, boolean preflight, List<String> injectLabels,
		List<String> ensureMilestones) {

	public SyncOptions {
		injectLabels = List.copyOf(injectLabels);
		ensureMilestones = List.copyOf(ensureMilestones);
	}

	/**
	 * Defaults: apply changes, update and respect status, no prune, no preflight.
	 */
	public static SyncOptions defaults() {
		return new SyncOptions(false, true, true, false, false, 0, false, List.of(), List.of());
	}

	public static SyncOptions from(SyncProperties properties) {
		return new SyncOptions(properties.isDryRun(), properties.isUpdate(), properties.isRespectStatus(),
				properties.isPrune(), properties.isMilestoneRequired(), properties.getTruncateBodyDiff(),
				properties.isPreflight(), properties.getInjectLabels(), properties.getEnsureMilestones());
	}

	public SyncOptions asDryRun() {
		return new SyncOptions(true, update, respectStatus, prune, milestoneRequired, truncateBodyDiff, preflight,
				injectLabels, ensureMilestones);
	}

	public SyncOptions withUpdate(boolean update) {
		return new SyncOptions(dryRun, update, respectStatus, prune, milestoneRequired, truncateBodyDiff, preflight,
				injectLabels, ensureMilestones);
	}

	public SyncOptions withPrune(boolean prune) {
		return new SyncOptions(dryRun, update, respectStatus, prune, milestoneRequired, truncateBodyDiff, preflight,
				injectLabels, ensureMilestones);
	}

	public SyncOptions withMilestoneRequired(boolean milestoneRequired) {
		return new SyncOptions(dryRun, update, respectStatus, prune, milestoneRequired, truncateBodyDiff, preflight,
				injectLabels, ensureMilestones);
	}

	/**
	 * Enable preflight with extra labels and milestones to create.
	 */
	public SyncOptions withPreflight(List<String> injectLabels, List<String> ensureMilestones) {
		return new SyncOptions(dryRun, update, respectStatus, prune, milestoneRequired, truncateBodyDiff, true,
				injectLabels, ensureMilestones);
	}

}
