package org.springaicommunity.github.issuesync;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.jspecify.annotations.Nullable;

/**
 * One slug's entry in the persisted index.
 *
 * @param issue remote issue number
 * @param hash fingerprint of the spec at the last successful sync, if known
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IndexEntry(int issue, @Nullable String hash) {

	public static IndexEntry of(int issue) {
		return new IndexEntry(issue, null);
	}

}
