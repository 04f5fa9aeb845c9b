package org.springaicommunity.github.issuesync;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structured difference between an {@link IssueSpec} and the issue it matched.
 *
 * <p>
 * Purely derived and never persisted, except as part of a run summary.
 *
 * @param labelsAdded labels present in the spec but not on the issue (sorted)
 * @param labelsRemoved labels on the issue but not in the spec (sorted)
 * @param milestoneFrom current milestone title, set only when the milestone changes
 * @param milestoneTo desired milestone title, set only when the milestone changes
 * @param bodyChanged whether the stripped bodies differ
 * @param bodyDiff unified diff lines of the body change, possibly truncated
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChangeSet(List<String> labelsAdded, List<String> labelsRemoved, @Nullable String milestoneFrom,
		@Nullable String milestoneTo, boolean bodyChanged, List<String> bodyDiff) {

	public ChangeSet {
		labelsAdded = List.copyOf(labelsAdded);
		labelsRemoved = List.copyOf(labelsRemoved);
		bodyDiff = List.copyOf(bodyDiff);
	}

	@JsonIgnore
	public boolean isEmpty() {
		return labelsAdded.isEmpty() && labelsRemoved.isEmpty() && !isMilestoneChanged() && !bodyChanged;
	}

	@JsonIgnore
	public boolean isMilestoneChanged() {
		return milestoneTo != null;
	}

	/**
	 * Returns a copy whose body diff is cut to {@code maxLines} lines plus a truncation
	 * marker. Returns this instance when the diff already fits.
	 * @param maxLines maximum number of diff lines to keep
	 * @return truncated change set
	 */
	public ChangeSet truncateBodyDiff(int maxLines) {
		if (maxLines <= 0 || bodyDiff.size() <= maxLines) {
			return this;
		}
		List<String> cut = new ArrayList<>(bodyDiff.subList(0, maxLines));
		cut.add(IssueDiffEngine.TRUNCATION_MARKER);
		return new ChangeSet(labelsAdded, labelsRemoved, milestoneFrom, milestoneTo, bodyChanged, cut);
	}

	/**
	 * Count-only view used in dry-run plans.
	 * @return map of change kind to count
	 */
	public Map<String, Integer> counts() {
		Map<String, Integer> counts = new LinkedHashMap<>();
		counts.put("labels_added", labelsAdded.size());
		counts.put("labels_removed", labelsRemoved.size());
		counts.put("body_changed", bodyChanged ? 1 : 0);
		counts.put("milestone_changed", isMilestoneChanged() ? 1 : 0);
		return counts;
	}

}
