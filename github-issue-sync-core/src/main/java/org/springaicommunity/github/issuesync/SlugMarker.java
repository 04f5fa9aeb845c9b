package org.springaicommunity.github.issuesync;

import org.jspecify.annotations.Nullable;

/**
 * Hidden provenance marker embedded in issue bodies, e.g.
 * {@code <!-- issuesuite:slug=alpha -->}.
 */
public final class SlugMarker {

	static final String PREFIX = "<!-- issuesuite:slug=";

	static final String SUFFIX = " -->";

	private SlugMarker() {
	}

	public static String of(String slug) {
		return PREFIX + slug + SUFFIX;
	}

	/**
	 * Prepend the marker for {@code slug} unless the body already contains it.
	 * @param body issue body
	 * @param slug item slug
	 * @return body with exactly one marker for the slug
	 */
	public static String ensure(String body, String slug) {
		String marker = of(slug);
		if (body.contains(marker)) {
			return body;
		}
		return marker + "\n\n" + body;
	}

	public static boolean contains(@Nullable String body, String slug) {
		return body != null && body.contains(of(slug));
	}

	/**
	 * Extract the slug from the first marker found in a body.
	 * @param body issue body, may be null
	 * @return the slug, or null when no well-formed marker is present
	 */
	@Nullable
	public static String extract(@Nullable String body) {
		if (body == null || body.isEmpty()) {
			return null;
		}
		int idx = body.indexOf(PREFIX);
		if (idx == -1) {
			return null;
		}
		String tail = body.substring(idx + PREFIX.length());
		int end = tail.indexOf("-->");
		if (end == -1) {
			return null;
		}
		String slug = tail.substring(0, end).strip();
		return slug.isEmpty() ? null : slug;
	}

}
