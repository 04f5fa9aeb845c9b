package org.springaicommunity.github.issuesync;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * One planned action recorded during a dry-run.
 *
 * @param externalId the spec's slug
 * @param action planned action
 * @param number matched issue number, absent for creates
 * @param changes change counts for updates
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlanEntry(String externalId, SyncAction action, @Nullable Integer number,
		@Nullable Map<String, Integer> changes) {

	static PlanEntry from(ItemResult result) {
		ChangeSet changes = result.changes();
		return new PlanEntry(result.slug(), result.action(), result.number(),
				changes != null ? changes.counts() : null);
	}

}
