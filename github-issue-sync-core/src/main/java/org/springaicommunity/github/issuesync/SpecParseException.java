package org.springaicommunity.github.issuesync;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when an issue specification file is malformed. Parsing never yields a partial
 * result: the whole file is rejected.
 */
public class SpecParseException extends RuntimeException {

	@Nullable
	private final String slug;

	public SpecParseException(String message) {
		this(message, null, null);
	}

	public SpecParseException(String message, @Nullable String slug) {
		this(message, slug, null);
	}

	public SpecParseException(String message, @Nullable String slug, @Nullable Throwable cause) {
		super(message, cause);
		this.slug = slug;
	}

	/**
	 * Returns the slug of the offending entry, if the failure is tied to one.
	 * @return the slug, or null for file-level failures
	 */
	@Nullable
	public String getSlug() {
		return slug;
	}

}
