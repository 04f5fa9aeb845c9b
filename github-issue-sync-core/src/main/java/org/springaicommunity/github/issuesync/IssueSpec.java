package org.springaicommunity.github.issuesync;

import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A parsed issue specification entry.
 *
 * <p>
 * Instances are produced by {@link IssueSpecParser} on every parse and are never mutated:
 * a changed source text yields a new value with a new fingerprint.
 *
 * @param slug stable identifier taken from the heading (unique within a file)
 * @param title the issue title (required, never blank)
 * @param labels canonicalized labels in declaration order
 * @param milestone optional milestone title
 * @param status optional desired status ("open" or "closed")
 * @param body issue body, always containing the slug provenance marker
 * @param fingerprint content digest over title, labels, milestone, status and body
 * @param project optional project block, carried through untouched
 */
public record IssueSpec(String slug, String title, List<String> labels, @Nullable String milestone,
		@Nullable String status, String body, String fingerprint, @Nullable Map<String, Object> project) {

	public IssueSpec {
		labels = List.copyOf(labels);
		project = project != null ? Collections.unmodifiableMap(new LinkedHashMap<>(project)) : null;
	}

	/**
	 * Returns true if this entry asks for the issue to be closed.
	 * @return true when status is "closed" (case-insensitive)
	 */
	public boolean isClosed() {
		return "closed".equalsIgnoreCase(status);
	}

}
