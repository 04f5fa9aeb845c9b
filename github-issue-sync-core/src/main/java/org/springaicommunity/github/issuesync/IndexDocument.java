package org.springaicommunity.github.issuesync;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * In-memory form of the slug to issue index.
 *
 * <p>
 * Entries keep insertion order. The signature is recomputed on every persist, so callers
 * only need to mutate entries.
 */
public class IndexDocument {

	public static final int CURRENT_VERSION = 1;

	private final Map<String, IndexEntry> entries = new LinkedHashMap<>();

	@Nullable
	private String repo;

	private int version = CURRENT_VERSION;

	private String generatedAt = Instant.now().toString();

	private String signature = "";

	public static IndexDocument empty() {
		return new IndexDocument();
	}

	public Map<String, IndexEntry> getEntries() {
		return Collections.unmodifiableMap(entries);
	}

	public void put(String slug, IndexEntry entry) {
		entries.put(slug, entry);
	}

	@Nullable
	public IndexEntry get(String slug) {
		return entries.get(slug);
	}

	public boolean isEmpty() {
		return entries.isEmpty();
	}

	/**
	 * Drop every entry whose slug is not in {@code slugs}.
	 * @param slugs slugs still present in the issue file
	 * @return number of entries removed
	 */
	public int retainOnly(Set<String> slugs) {
		int before = entries.size();
		entries.keySet().retainAll(slugs);
		return before - entries.size();
	}

	/**
	 * Slug to issue number view of the entries.
	 * @return ordered mapping snapshot
	 */
	public Map<String, Integer> toMapping() {
		Map<String, Integer> mapping = new LinkedHashMap<>();
		entries.forEach((slug, entry) -> mapping.put(slug, entry.issue()));
		return mapping;
	}

	/**
	 * Fingerprints recorded by the last sync, keyed by slug.
	 * @return slugs with a known hash
	 */
	public Map<String, String> fingerprints() {
		Map<String, String> hashes = new LinkedHashMap<>();
		entries.forEach((slug, entry) -> {
			if (entry.hash() != null) {
				hashes.put(slug, entry.hash());
			}
		});
		return hashes;
	}

	@Nullable
	public String getRepo() {
		return repo;
	}

	public void setRepo(@Nullable String repo) {
		this.repo = repo;
	}

	public int getVersion() {
		return version;
	}

	public void setVersion(int version) {
		this.version = version;
	}

	public String getGeneratedAt() {
		return generatedAt;
	}

	public void setGeneratedAt(String generatedAt) {
		this.generatedAt = generatedAt;
	}

	public String getSignature() {
		return signature;
	}

	public void setSignature(String signature) {
		this.signature = signature;
	}

}
