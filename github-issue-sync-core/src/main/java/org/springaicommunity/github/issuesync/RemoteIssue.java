package org.springaicommunity.github.issuesync;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Locale;

/**
 * A GitHub issue as returned by {@link IssuesClient#list()}.
 *
 * <p>
 * Never cached beyond one sync pass.
 *
 * @param number the issue number within the repository
 * @param title the issue title
 * @param labels label names currently assigned
 * @param milestone milestone title, or null when none
 * @param body the issue body (empty when the remote has none)
 * @param state lifecycle state, "OPEN" or "CLOSED"
 */
public record RemoteIssue(int number, String title, List<String> labels, @Nullable String milestone, String body,
		String state) {

	public static final String OPEN = "OPEN";

	public static final String CLOSED = "CLOSED";

	public RemoteIssue {
		labels = List.copyOf(labels);
		state = state.toUpperCase(Locale.ROOT);
	}

	public boolean isClosed() {
		return CLOSED.equals(state);
	}

}
