package org.springaicommunity.github.issuesync;

import org.jspecify.annotations.Nullable;

import java.nio.file.Path;

/**
 * Repository interface for the persisted slug index and run summary artifacts.
 *
 * <p>
 * Abstracts file system operations to enable testability and alternative storage.
 */
public interface IndexStateRepository {

	/**
	 * Load the index. Never fails: unreadable, missing or tampered documents yield an
	 * empty document.
	 * @param path index file
	 * @return the loaded document, possibly empty
	 */
	IndexDocument load(Path path);

	/**
	 * Sign and atomically write the index.
	 * @param path index file
	 * @param document document to persist, its signature is updated
	 * @param mirror optional second location receiving the same payload
	 */
	void persist(Path path, IndexDocument document, @Nullable Path mirror);

	/**
	 * Write the run summary artifact.
	 * @param path summary file
	 * @param summary the enriched summary
	 */
	void writeSummary(Path path, SummaryDocument summary);

}
