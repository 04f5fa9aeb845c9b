package org.springaicommunity.github.issuesync;

import java.util.List;

/**
 * Mutations grouped by kind.
 */
public record SyncChanges(List<ChangeEntry> created, List<ChangeEntry> updated, List<ChangeEntry> closed) {

	public SyncChanges {
		created = List.copyOf(created);
		updated = List.copyOf(updated);
		closed = List.copyOf(closed);
	}

}
