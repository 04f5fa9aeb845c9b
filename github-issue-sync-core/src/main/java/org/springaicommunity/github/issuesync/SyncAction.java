package org.springaicommunity.github.issuesync;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Decision taken for one spec during a sync.
 */
public enum SyncAction {

	CREATE, UPDATE, CLOSE, SKIP;

	@JsonValue
	public String jsonName() {
		return name().toLowerCase(Locale.ROOT);
	}

}
