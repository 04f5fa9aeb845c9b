package org.springaicommunity.github.issuesync;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Drift between specs and live issues.
 *
 * @param specCount number of specs compared
 * @param liveCount number of live issues compared
 * @param drift findings, live-issue findings first in fetch order, then spec-only ones
 */
public record DriftReport(int specCount, int liveCount, List<DriftEntry> drift) {

	public DriftReport {
		drift = List.copyOf(drift);
	}

	@JsonProperty
	public int driftCount() {
		return drift.size();
	}

	@JsonProperty
	public boolean inSync() {
		return drift.isEmpty();
	}

}
