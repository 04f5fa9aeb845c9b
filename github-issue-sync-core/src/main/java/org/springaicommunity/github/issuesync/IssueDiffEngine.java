package org.springaicommunity.github.issuesync;

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Matches specs to remote issues and computes the change set between them.
 *
 * <p>
 * Matching is a linear scan in fetch order: exact title equality is tried across all
 * issues before the provenance marker is considered, and the first hit wins. There is no
 * fuzzy matching.
 */
public class IssueDiffEngine {

	private static final Logger logger = LoggerFactory.getLogger(IssueDiffEngine.class);

	/**
	 * Hard cap on body diff lines kept in a {@link ChangeSet}.
	 */
	public static final int MAX_BODY_DIFF_LINES = 120;

	static final String TRUNCATION_MARKER = "... (truncated)";

	private static final int DIFF_CONTEXT_LINES = 3;

	/**
	 * Find the remote issue that corresponds to a spec.
	 * @param spec the parsed spec
	 * @param existing remote issues in fetch order
	 * @return the match, or {@link MatchResult#none()}
	 */
	public MatchResult match(IssueSpec spec, List<RemoteIssue> existing) {
		RemoteIssue byTitle = null;
		int titleHits = 0;
		for (RemoteIssue issue : existing) {
			if (spec.title().equals(issue.title())) {
				if (byTitle == null) {
					byTitle = issue;
				}
				titleHits++;
			}
		}
		if (byTitle != null) {
			return matched(spec, byTitle, MatchResult.Strategy.TITLE, titleHits);
		}

		RemoteIssue byMarker = null;
		int markerHits = 0;
		for (RemoteIssue issue : existing) {
			if (SlugMarker.contains(issue.body(), spec.slug())) {
				if (byMarker == null) {
					byMarker = issue;
				}
				markerHits++;
			}
		}
		if (byMarker != null) {
			return matched(spec, byMarker, MatchResult.Strategy.MARKER, markerHits);
		}
		return MatchResult.none();
	}

	private MatchResult matched(IssueSpec spec, RemoteIssue issue, MatchResult.Strategy strategy, int hits) {
		boolean ambiguous = hits > 1;
		if (ambiguous) {
			logger.warn("Ambiguous {} match for '{}': {} remote issues qualify, using #{} (first in fetch order)",
					strategy, spec.slug(), hits, issue.number());
		}
		return MatchResult.of(issue, strategy, ambiguous);
	}

	/**
	 * Decide whether a matched issue needs to be updated.
	 *
	 * <p>
	 * A prior fingerprint equal to the spec's fingerprint is authoritative: the spec has
	 * not changed since the last successful sync, so no structural comparison is done.
	 * @param spec the parsed spec
	 * @param issue the matched remote issue
	 * @param priorFingerprint fingerprint recorded by the previous run, or null
	 * @return true if labels, milestone or body differ
	 */
	public boolean needsUpdate(IssueSpec spec, RemoteIssue issue, @Nullable String priorFingerprint) {
		if (priorFingerprint != null && priorFingerprint.equals(spec.fingerprint())) {
			return false;
		}
		if (!new HashSet<>(spec.labels()).equals(new HashSet<>(issue.labels()))) {
			return true;
		}
		if (!milestoneOf(spec).equals(milestoneOf(issue))) {
			return true;
		}
		return !issue.body().strip().equals(spec.body().strip());
	}

	/**
	 * Compute the structured difference between a spec and its matched issue.
	 * @param spec the parsed spec
	 * @param issue the matched remote issue
	 * @return the change set, empty when nothing differs
	 */
	public ChangeSet computeDiff(IssueSpec spec, RemoteIssue issue) {
		Set<String> desired = new HashSet<>(spec.labels());
		Set<String> current = new HashSet<>(issue.labels());
		List<String> added = List.of();
		List<String> removed = List.of();
		if (!desired.equals(current)) {
			TreeSet<String> a = new TreeSet<>(desired);
			a.removeAll(current);
			TreeSet<String> r = new TreeSet<>(current);
			r.removeAll(desired);
			added = new ArrayList<>(a);
			removed = new ArrayList<>(r);
		}

		String milestoneFrom = null;
		String milestoneTo = null;
		String desiredMilestone = milestoneOf(spec);
		String currentMilestone = milestoneOf(issue);
		if (!desiredMilestone.equals(currentMilestone)) {
			milestoneFrom = currentMilestone;
			milestoneTo = desiredMilestone;
		}

		List<String> oldBody = issue.body().strip().lines().toList();
		List<String> newBody = spec.body().strip().lines().toList();
		boolean bodyChanged = !oldBody.equals(newBody);
		List<String> bodyDiff = bodyChanged ? unifiedDiff(oldBody, newBody) : List.of();

		return new ChangeSet(added, removed, milestoneFrom, milestoneTo, bodyChanged, bodyDiff);
	}

	/**
	 * Extract the slug from an issue body's provenance marker.
	 * @param body issue body, may be null
	 * @return the slug, or null when the body carries no marker
	 */
	@Nullable
	public String extractSlug(@Nullable String body) {
		return SlugMarker.extract(body);
	}

	private static List<String> unifiedDiff(List<String> oldBody, List<String> newBody) {
		Patch<String> patch = DiffUtils.diff(oldBody, newBody);
		List<String> lines = UnifiedDiffUtils.generateUnifiedDiff("remote", "spec", oldBody, patch,
				DIFF_CONTEXT_LINES);
		if (lines.size() > MAX_BODY_DIFF_LINES) {
			List<String> cut = new ArrayList<>(lines.subList(0, MAX_BODY_DIFF_LINES));
			cut.add(TRUNCATION_MARKER);
			return cut;
		}
		return lines;
	}

	private static String milestoneOf(IssueSpec spec) {
		return spec.milestone() != null ? spec.milestone() : "";
	}

	private static String milestoneOf(RemoteIssue issue) {
		return issue.milestone() != null ? issue.milestone() : "";
	}

}
