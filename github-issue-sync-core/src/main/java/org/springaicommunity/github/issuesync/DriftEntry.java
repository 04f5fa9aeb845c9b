package org.springaicommunity.github.issuesync;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jspecify.annotations.Nullable;

import java.util.Locale;

/**
 * One drift finding produced by {@link DriftReconciler}.
 *
 * @param kind drift category
 * @param slug spec slug, or the marker slug for live-only issues when present
 * @param number live issue number, absent for spec-only drift
 * @param title spec title, or the live title for live-only drift
 * @param changes field differences for {@link Kind#DIFF}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DriftEntry(Kind kind, @Nullable String slug, @Nullable Integer number, @Nullable String title,
		@Nullable ChangeSet changes) {

	public static DriftEntry specOnly(IssueSpec spec) {
		return new DriftEntry(Kind.SPEC_ONLY, spec.slug(), null, spec.title(), null);
	}

	public static DriftEntry liveOnly(RemoteIssue issue, @Nullable String markerSlug) {
		return new DriftEntry(Kind.LIVE_ONLY, markerSlug, issue.number(), issue.title(), null);
	}

	public static DriftEntry diff(IssueSpec spec, RemoteIssue issue, ChangeSet changes) {
		return new DriftEntry(Kind.DIFF, spec.slug(), issue.number(), spec.title(), changes);
	}

	public enum Kind {

		SPEC_ONLY, LIVE_ONLY, DIFF;

		@JsonValue
		public String jsonName() {
			return name().toLowerCase(Locale.ROOT);
		}

	}

}
