package org.springaicommunity.github.issuesync;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of matching an {@link IssueSpec} against the fetched remote issues.
 *
 * @param issue the matched issue, or null when nothing matched
 * @param strategy how the match was made, or null when nothing matched
 * @param ambiguous true when more than one remote issue satisfied the winning strategy
 */
public record MatchResult(@Nullable RemoteIssue issue, @Nullable Strategy strategy, boolean ambiguous) {

	private static final MatchResult NONE = new MatchResult(null, null, false);

	public static MatchResult none() {
		return NONE;
	}

	public static MatchResult of(RemoteIssue issue, Strategy strategy, boolean ambiguous) {
		return new MatchResult(issue, strategy, ambiguous);
	}

	public boolean isMatched() {
		return issue != null;
	}

	/**
	 * Match strategies, in the order they are attempted.
	 */
	public enum Strategy {

		TITLE, MARKER

	}

}
