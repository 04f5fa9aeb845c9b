package org.springaicommunity.github.issuesync;

import java.util.List;

/**
 * Thrown when a run-level precondition fails. Raised before any remote call so that no
 * partial mutation happens and no summary is written.
 */
public class PreconditionFailedException extends RuntimeException {

	private final List<String> offendingSlugs;

	public PreconditionFailedException(String message, List<String> offendingSlugs) {
		super(message);
		this.offendingSlugs = List.copyOf(offendingSlugs);
	}

	public List<String> getOffendingSlugs() {
		return offendingSlugs;
	}

}
