package org.springaicommunity.github.issuesync;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Run summary artifact as written to disk after every sync.
 *
 * @param schemaVersion artifact schema version
 * @param generatedAt write time, second precision
 * @param dryRun whether the run was a dry-run
 * @param mappingPresent whether the index holds any entry
 * @param mappingSize number of index entries
 * @param mappingSnapshot index mapping, omitted above {@link #MAPPING_SNAPSHOT_THRESHOLD}
 * entries
 * @param totals run counters
 * @param changes mutations grouped by kind
 * @param mapping slugs mapped during this run
 * @param plan dry-run plan
 * @param errors isolated per-spec failures
 * @param lastError the failure that aborted the run, if any
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SummaryDocument(@JsonProperty("schemaVersion") int schemaVersion, Instant generatedAt, boolean dryRun,
		boolean mappingPresent, int mappingSize, @Nullable Map<String, Integer> mappingSnapshot, SyncTotals totals,
		SyncChanges changes, Map<String, Integer> mapping, @Nullable List<PlanEntry> plan, List<SyncError> errors,
		@Nullable LastError lastError) {

	public static final int SCHEMA_VERSION = 1;

	public static final int MAPPING_SNAPSHOT_THRESHOLD = 500;

	/**
	 * Assemble the artifact.
	 * @param summary run summary, or null when the run failed before producing one
	 * @param dryRun whether the run was a dry-run
	 * @param indexMapping the merged index mapping after this run
	 * @param lastError the aborting failure, if any
	 * @return the artifact
	 */
	public static SummaryDocument of(@Nullable RunSummary summary, boolean dryRun, Map<String, Integer> indexMapping,
			@Nullable LastError lastError) {
		Map<String, Integer> snapshot = !indexMapping.isEmpty() && indexMapping.size() <= MAPPING_SNAPSHOT_THRESHOLD
				? new LinkedHashMap<>(indexMapping) : null;
		SyncTotals totals = summary != null ? summary.totals() : new SyncTotals(0, 0, 0, 0, 0);
		SyncChanges changes = summary != null ? summary.changes() : new SyncChanges(List.of(), List.of(), List.of());
		return new SummaryDocument(SCHEMA_VERSION, Instant.now().truncatedTo(ChronoUnit.SECONDS), dryRun,
				!indexMapping.isEmpty(), indexMapping.size(), snapshot, totals, changes,
				summary != null ? summary.mapping() : Map.of(), summary != null ? summary.plan() : null,
				summary != null ? summary.errors() : List.of(), lastError);
	}

	/**
	 * Classified failure that aborted a run.
	 *
	 * @param category exception type simple name
	 * @param transientFailure whether the failure was classified transient
	 * @param message failure message
	 */
	public record LastError(String category, @JsonProperty("transient") boolean transientFailure, String message) {

		public static LastError from(RuntimeException e, TransientFailureClassifier classifier) {
			return new LastError(e.getClass().getSimpleName(), classifier.classify(e).isTransient(),
					e.getMessage() != null ? e.getMessage() : e.toString());
		}

	}

}
