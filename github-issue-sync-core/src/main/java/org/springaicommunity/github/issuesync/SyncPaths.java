package org.springaicommunity.github.issuesync;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;

/**
 * Files touched by {@link IssueSyncService#run}.
 *
 * @param index signed index file
 * @param indexMirror optional copy of the index
 * @param summary run summary artifact, or null to skip writing it
 */
public record SyncPaths(Path index, @Nullable Path indexMirror, @Nullable Path summary) {

	public static SyncPaths from(SyncProperties properties) {
		String mirror = properties.getIndexMirrorFile();
		return new SyncPaths(Path.of(properties.getIndexFile()), mirror != null ? Path.of(mirror) : null,
				Path.of(properties.getSummaryFile()));
	}

}
