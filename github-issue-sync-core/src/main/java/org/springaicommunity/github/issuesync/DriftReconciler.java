package org.springaicommunity.github.issuesync;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Read-only comparison of specs against live issues. Never mutates remote state.
 *
 * <p>
 * A live issue is paired with a spec by exact title first, then by the slug in its
 * provenance marker. Unpaired live issues are {@code live_only}, paired ones whose
 * change set is non-empty are {@code diff}, and specs nothing paired with are
 * {@code spec_only}.
 */
public class DriftReconciler {

	private final IssueDiffEngine diffEngine;

	public DriftReconciler() {
		this(new IssueDiffEngine());
	}

	public DriftReconciler(IssueDiffEngine diffEngine) {
		this.diffEngine = diffEngine;
	}

	public DriftReport reconcile(List<IssueSpec> specs, List<RemoteIssue> live) {
		Map<String, IssueSpec> bySlug = new LinkedHashMap<>();
		for (IssueSpec spec : specs) {
			bySlug.putIfAbsent(spec.slug(), spec);
		}
		List<DriftEntry> drift = new ArrayList<>();
		Set<String> seen = new HashSet<>();
		for (RemoteIssue issue : live) {
			IssueSpec spec = pair(issue, bySlug);
			if (spec == null) {
				drift.add(DriftEntry.liveOnly(issue, diffEngine.extractSlug(issue.body())));
				continue;
			}
			seen.add(spec.slug());
			ChangeSet changes = diffEngine.computeDiff(spec, issue);
			if (!changes.isEmpty()) {
				drift.add(DriftEntry.diff(spec, issue, changes));
			}
		}
		bySlug.forEach((slug, spec) -> {
			if (!seen.contains(slug)) {
				drift.add(DriftEntry.specOnly(spec));
			}
		});
		return new DriftReport(specs.size(), live.size(), drift);
	}

	@Nullable
	private IssueSpec pair(RemoteIssue issue, Map<String, IssueSpec> bySlug) {
		String title = issue.title().strip();
		for (IssueSpec spec : bySlug.values()) {
			if (spec.title().equals(title)) {
				return spec;
			}
		}
		String slug = diffEngine.extractSlug(issue.body());
		return slug != null ? bySlug.get(slug) : null;
	}

	/**
	 * Render a report as human-readable lines.
	 * @param report the report
	 * @return one header line plus one line per finding
	 */
	public static List<String> format(DriftReport report) {
		List<String> lines = new ArrayList<>();
		if (report.inSync()) {
			lines.add("[reconcile] No drift detected (specs=" + report.specCount() + ", live=" + report.liveCount()
					+ ")");
			return lines;
		}
		lines.add("[reconcile] Drift items: " + report.driftCount() + " (specs=" + report.specCount() + ", live="
				+ report.liveCount() + ")");
		for (DriftEntry entry : report.drift()) {
			switch (entry.kind()) {
				case SPEC_ONLY -> lines.add("  spec_only: " + entry.slug() + " :: " + entry.title());
				case LIVE_ONLY ->
					lines.add("  live_only: #" + entry.number() + " :: " + entry.title() + " (slug=" + entry.slug() + ")");
				case DIFF -> lines.add("  diff: " + entry.slug() + " fields_changed=["
						+ String.join(",", changedFields(entry.changes())) + "]");
			}
		}
		return lines;
	}

	private static Set<String> changedFields(@Nullable ChangeSet changes) {
		Set<String> fields = new TreeSet<>();
		if (changes == null) {
			return fields;
		}
		if (!changes.labelsAdded().isEmpty()) {
			fields.add("labels_added");
		}
		if (!changes.labelsRemoved().isEmpty()) {
			fields.add("labels_removed");
		}
		if (changes.bodyChanged()) {
			fields.add("body_changed");
		}
		if (changes.isMilestoneChanged()) {
			fields.add("milestone_from");
			fields.add("milestone_to");
		}
		return fields;
	}

}
