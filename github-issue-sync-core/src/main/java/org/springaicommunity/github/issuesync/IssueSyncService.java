package org.springaicommunity.github.issuesync;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Plans and applies the changes needed to bring remote issues in line with their specs.
 *
 * <p>
 * For each spec the first applicable rule wins:
 * <ol>
 * <li>no matching issue: create it</li>
 * <li>status handling on, spec {@code closed}, issue not closed: close it</li>
 * <li>updates on and content drifted: update it</li>
 * <li>otherwise: skip</li>
 * </ol>
 *
 * <p>
 * A full {@link #run} can first create the labels and milestones the specs need
 * (preflight). In a dry-run the same decisions are made and logged, but nothing is sent
 * to the remote and the index is not written. Failures of a single spec are isolated and reported in
 * the summary; the spec counts as skipped.
 */
public class IssueSyncService {

	private static final Logger logger = LoggerFactory.getLogger(IssueSyncService.class);

	static final int MISSING_MILESTONE_PREVIEW = 5;

	private final IssuesClient client;

	private final IssueSpecParser parser;

	private final IssueDiffEngine diffEngine;

	private final IndexStateRepository indexRepository;

	private final ConcurrentBatchDispatcher<IssueSpec> dispatcher;

	private final TransientFailureClassifier classifier = new TransientFailureClassifier();

	@Nullable
	private final String repository;

	public IssueSyncService(IssuesClient client, IssueSpecParser parser, IssueDiffEngine diffEngine,
			IndexStateRepository indexRepository, ConcurrentBatchDispatcher<IssueSpec> dispatcher,
			@Nullable String repository) {
		this.client = client;
		this.parser = parser;
		this.diffEngine = diffEngine;
		this.indexRepository = indexRepository;
		this.dispatcher = dispatcher;
		this.repository = repository;
	}

	/**
	 * Full run: parse, check preconditions, load the index, fetch issues, apply, update
	 * the index and write the summary artifact.
	 *
	 * <p>
	 * Parse and precondition failures propagate before anything is read or written.
	 * Once the run is past them, the summary artifact is written even if a later step
	 * fails; the failure is recorded in it and then rethrown.
	 * @param source specification file
	 * @param options run switches
	 * @param paths index and summary locations
	 * @return the summary artifact
	 */
	public SummaryDocument run(Path source, SyncOptions options, SyncPaths paths) {
		List<IssueSpec> specs = parser.parse(source);
		if (options.milestoneRequired()) {
			checkMilestones(specs);
		}
		logger.info("Starting sync of {} specs (dryRun={}, update={}, respectStatus={}, prune={})", specs.size(),
				options.dryRun(), options.update(), options.respectStatus(), options.prune());
		if (options.preflight() && !options.dryRun()) {
			preflight(specs, options);
		}

		IndexDocument index = IndexDocument.empty();
		RunSummary summary = null;
		try {
			index = indexRepository.load(paths.index());
			List<RemoteIssue> existing = client.list();
			List<ItemResult> results = apply(specs, existing, index.fingerprints(), options);
			summary = RunSummary.from(results, options.dryRun(), options.truncateBodyDiff());
			mergeIntoIndex(index, specs, results, options);
			if (!options.dryRun()) {
				indexRepository.persist(paths.index(), index, paths.indexMirror());
			}
		}
		catch (RuntimeException e) {
			logger.error("Sync failed: {}", e.getMessage());
			SummaryDocument failed = SummaryDocument.of(summary, options.dryRun(), index.toMapping(),
					SummaryDocument.LastError.from(e, classifier));
			writeSummary(paths.summary(), failed, e);
			throw e;
		}

		SyncTotals totals = summary.totals();
		logger.info("Sync done: {} specs, {} created, {} updated, {} closed, {} skipped", totals.specs(),
				totals.created(), totals.updated(), totals.closed(), totals.skipped());
		SummaryDocument document = SummaryDocument.of(summary, options.dryRun(), index.toMapping(), null);
		writeSummary(paths.summary(), document, null);
		return document;
	}

	/**
	 * Sync already parsed specs against already fetched issues.
	 * @param specs specs in file order
	 * @param existing remote issues in fetch order
	 * @param priorFingerprints fingerprints recorded by the previous run, by slug
	 * @param options run switches
	 * @return the run summary
	 */
	public RunSummary sync(List<IssueSpec> specs, List<RemoteIssue> existing, Map<String, String> priorFingerprints,
			SyncOptions options) {
		if (options.milestoneRequired()) {
			checkMilestones(specs);
		}
		List<ItemResult> results = apply(specs, existing, priorFingerprints, options);
		return RunSummary.from(results, options.dryRun(), options.truncateBodyDiff());
	}

	private List<ItemResult> apply(List<IssueSpec> specs, List<RemoteIssue> existing,
			Map<String, String> priorFingerprints, SyncOptions options) {
		List<DispatchOutcome<IssueSpec, ItemResult>> outcomes = dispatcher.dispatch(specs,
				spec -> processItem(spec, existing, priorFingerprints.get(spec.slug()), options));
		List<ItemResult> results = new ArrayList<>(outcomes.size());
		for (DispatchOutcome<IssueSpec, ItemResult> outcome : outcomes) {
			if (outcome.isSuccess()) {
				results.add(outcome.result());
			}
			else {
				RuntimeException error = outcome.error();
				String message = error.getMessage() != null ? error.getMessage() : error.toString();
				logger.warn("Failed to sync '{}': {}", outcome.item().slug(), message);
				results.add(ItemResult.failed(outcome.item().slug(), message));
			}
		}
		if (options.prune() && !options.dryRun()) {
			prune(specs, existing, results);
		}
		return results;
	}

	/**
	 * Decide and, unless this is a dry-run, apply the action for one spec.
	 * @param spec the spec
	 * @param existing remote issues in fetch order
	 * @param priorFingerprint fingerprint from the previous run, or null
	 * @param options run switches
	 * @return the item result
	 */
	public ItemResult processItem(IssueSpec spec, List<RemoteIssue> existing, @Nullable String priorFingerprint,
			SyncOptions options) {
		MatchResult match = diffEngine.match(spec, existing);
		RemoteIssue issue = match.issue();
		if (issue == null) {
			logMutation(options, SyncAction.CREATE, spec.slug(), null);
			Integer number = null;
			if (!options.dryRun()) {
				number = client.create(spec.title(), spec.body(), spec.labels(), spec.milestone());
			}
			return ItemResult.of(spec.slug(), SyncAction.CREATE, number);
		}

		if (options.respectStatus() && spec.isClosed() && !issue.isClosed()) {
			logMutation(options, SyncAction.CLOSE, spec.slug(), issue.number());
			if (!options.dryRun()) {
				client.close(issue.number());
			}
			return ItemResult.of(spec.slug(), SyncAction.CLOSE, issue.number());
		}

		if (options.update() && diffEngine.needsUpdate(spec, issue, priorFingerprint)) {
			ChangeSet changes = diffEngine.computeDiff(spec, issue);
			logMutation(options, SyncAction.UPDATE, spec.slug(), issue.number());
			if (!options.dryRun()) {
				client.update(issue.number(), spec.body(), spec.labels(), spec.milestone(), null);
			}
			return ItemResult.updated(spec.slug(), issue.number(), changes);
		}

		logger.debug("skip {} (#{})", spec.slug(), issue.number());
		return ItemResult.of(spec.slug(), SyncAction.SKIP, issue.number());
	}

	/**
	 * Create every label the specs use plus the injected ones, then the configured
	 * milestones. Failures are logged and do not stop the run.
	 */
	private void preflight(List<IssueSpec> specs, SyncOptions options) {
		Set<String> labels = new TreeSet<>(options.injectLabels());
		specs.forEach(spec -> labels.addAll(spec.labels()));
		if (!labels.isEmpty()) {
			try {
				List<String> created = client.ensureLabels(labels);
				logger.info("preflight: {} of {} labels created", created.size(), labels.size());
			}
			catch (RuntimeException e) {
				logger.warn("preflight: failed to ensure labels: {}", e.getMessage());
			}
		}
		if (!options.ensureMilestones().isEmpty()) {
			try {
				List<String> created = client.ensureMilestones(options.ensureMilestones());
				logger.info("preflight: {} of {} milestones created", created.size(), options.ensureMilestones().size());
			}
			catch (RuntimeException e) {
				logger.warn("preflight: failed to ensure milestones: {}", e.getMessage());
			}
		}
	}

	/**
	 * Fail when any spec lacks a milestone.
	 * @param specs parsed specs
	 * @throws PreconditionFailedException naming at most five offending slugs
	 */
	static void checkMilestones(List<IssueSpec> specs) {
		List<String> missing = specs.stream()
			.filter(spec -> spec.milestone() == null || spec.milestone().isBlank())
			.map(IssueSpec::slug)
			.toList();
		if (missing.isEmpty()) {
			return;
		}
		String preview = String.join(", ", missing.subList(0, Math.min(MISSING_MILESTONE_PREVIEW, missing.size())));
		String suffix = missing.size() > MISSING_MILESTONE_PREVIEW ? "..." : "";
		throw new PreconditionFailedException(
				"Milestone required but missing for " + missing.size() + " spec(s): " + preview + suffix, missing);
	}

	/**
	 * Close every remote issue no spec refers to. Issues matched by a spec whose
	 * processing failed still count as referenced. Already closed issues are left alone.
	 */
	private void prune(List<IssueSpec> specs, List<RemoteIssue> existing, List<ItemResult> results) {
		Set<Integer> referenced = new HashSet<>();
		for (ItemResult result : results) {
			if (result.number() != null) {
				referenced.add(result.number());
			}
		}
		for (IssueSpec spec : specs) {
			RemoteIssue matched = diffEngine.match(spec, existing).issue();
			if (matched != null) {
				referenced.add(matched.number());
			}
		}
		for (RemoteIssue issue : existing) {
			if (referenced.contains(issue.number()) || issue.isClosed()) {
				continue;
			}
			logger.info("prune: closing unreferenced #{} '{}'", issue.number(), issue.title());
			try {
				client.close(issue.number());
			}
			catch (RuntimeException e) {
				logger.error("Failed to prune unmatched issue #{}: {}", issue.number(), e.getMessage());
			}
		}
	}

	/**
	 * Merge this run's mapping into the index: drop slugs no longer specified, record the
	 * issue number for every mapped slug, and the fingerprint where the issue now
	 * reflects the spec.
	 */
	private void mergeIntoIndex(IndexDocument index, List<IssueSpec> specs, List<ItemResult> results,
			SyncOptions options) {
		if (repository != null) {
			index.setRepo(repository);
		}
		Set<String> slugs = new LinkedHashSet<>();
		specs.forEach(spec -> slugs.add(spec.slug()));
		int removed = index.retainOnly(slugs);
		if (removed > 0) {
			logger.info("Pruned {} stale index entries", removed);
		}
		Map<String, IssueSpec> bySlug = new HashMap<>();
		specs.forEach(spec -> bySlug.putIfAbsent(spec.slug(), spec));
		for (ItemResult result : results) {
			Integer number = result.number();
			if (number == null || result.isFailed()) {
				continue;
			}
			IndexEntry prior = index.get(result.slug());
			String hash = bySlug.get(result.slug()).fingerprint();
			if (result.action() == SyncAction.SKIP && !options.update()) {
				hash = prior != null ? prior.hash() : null;
			}
			index.put(result.slug(), new IndexEntry(number, hash));
		}
	}

	private void writeSummary(@Nullable Path path, SummaryDocument document, @Nullable RuntimeException primary) {
		if (path == null) {
			return;
		}
		try {
			indexRepository.writeSummary(path, document);
		}
		catch (RuntimeException e) {
			if (primary == null) {
				throw e;
			}
			logger.error("Failed to write summary {}: {}", path, e.getMessage());
			primary.addSuppressed(e);
		}
	}

	private static void logMutation(SyncOptions options, SyncAction action, String slug, @Nullable Integer number) {
		if (options.dryRun()) {
			logger.info("[dry-run] {} {}{}", action.jsonName(), slug, number != null ? " (#" + number + ")" : "");
		}
		else {
			logger.info("{} {}{}", action.jsonName(), slug, number != null ? " (#" + number + ")" : "");
		}
	}

}
