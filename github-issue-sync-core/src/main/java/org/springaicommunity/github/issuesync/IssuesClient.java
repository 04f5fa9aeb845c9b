package org.springaicommunity.github.issuesync;

import org.jspecify.annotations.Nullable;

import java.util.List;
import java.util.Set;

/**
 * Capability interface for issue operations against a remote tracker.
 *
 * <p>
 * Implementations are selected at construction time by {@link IssueSyncBuilder} (REST,
 * GitHub CLI or in-memory) and may be wrapped by decorators such as
 * {@link RetryingIssuesClient}. All failures surface as {@link RemoteIssueException}
 * with the raw diagnostic text preserved.
 */
public interface IssuesClient {

	/**
	 * Create a new issue.
	 * @param title issue title
	 * @param body issue body
	 * @param labels labels to assign (may be empty)
	 * @param milestone milestone title, or null
	 * @return the new issue number, or null if the backend could not report it
	 * @throws RemoteIssueException if the request fails
	 */
	@Nullable
	Integer create(String title, String body, List<String> labels, @Nullable String milestone);

	/**
	 * Update an existing issue. Null arguments leave the corresponding field unchanged.
	 * @param number issue number
	 * @param body new body, or null
	 * @param labels new label set, or null
	 * @param milestone new milestone title, or null
	 * @param state new state ("open"/"closed"), or null
	 * @throws RemoteIssueException if the request fails
	 */
	void update(int number, @Nullable String body, @Nullable List<String> labels, @Nullable String milestone,
			@Nullable String state);

	/**
	 * Close an issue.
	 * @param number issue number
	 * @throws RemoteIssueException if the request fails
	 */
	void close(int number);

	/**
	 * List all issues (open and closed) in fetch order.
	 * @return remote issues
	 * @throws RemoteIssueException if the request fails
	 */
	List<RemoteIssue> list();

	/**
	 * Create the labels that do not exist in the repository yet. A label that fails to be
	 * created is logged and skipped.
	 * @param labels label names
	 * @return the labels that were created, in name order
	 * @throws RemoteIssueException if the existing labels cannot be listed
	 */
	List<String> ensureLabels(Set<String> labels);

	/**
	 * Create the milestones that do not exist in the repository yet. Titles are compared
	 * case-insensitively. A milestone that fails to be created is logged and skipped.
	 * @param milestones milestone titles
	 * @return the milestones that were created, in the given order
	 * @throws RemoteIssueException if the existing milestones cannot be listed
	 */
	List<String> ensureMilestones(List<String> milestones);

}
