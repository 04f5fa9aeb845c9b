package org.springaicommunity.github.issuesync;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.IntSupplier;

/**
 * In-memory {@link IssuesClient} used for mock runs and tests.
 *
 * <p>
 * Issue numbers come from an {@link IntSupplier} injected at construction, so two
 * instances never share a counter. Thread-safe.
 */
public class InMemoryIssuesClient implements IssuesClient {

	private static final Logger logger = LoggerFactory.getLogger(InMemoryIssuesClient.class);

	/**
	 * First number handed out by {@link #sequenceFrom(int)} when used with the default.
	 */
	public static final int DEFAULT_FIRST_NUMBER = 1001;

	private final IntSupplier numberSequence;

	private final Map<Integer, RemoteIssue> issues = new LinkedHashMap<>();

	private final Set<String> labels = new TreeSet<>();

	private final Map<String, String> milestones = new LinkedHashMap<>();

	public InMemoryIssuesClient() {
		this(sequenceFrom(DEFAULT_FIRST_NUMBER));
	}

	public InMemoryIssuesClient(IntSupplier numberSequence) {
		this.numberSequence = numberSequence;
	}

	/**
	 * Create a fresh, independent number sequence.
	 * @param first first number to hand out
	 * @return sequence yielding first, first+1, ...
	 */
	public static IntSupplier sequenceFrom(int first) {
		AtomicInteger next = new AtomicInteger(first);
		return next::getAndIncrement;
	}

	/**
	 * Seed an issue as if it already existed remotely.
	 * @param issue the issue to store
	 * @return this client
	 */
	public synchronized InMemoryIssuesClient seed(RemoteIssue issue) {
		issues.put(issue.number(), issue);
		return this;
	}

	@Override
	public synchronized Integer create(String title, String body, List<String> labels, @Nullable String milestone) {
		int number = numberSequence.getAsInt();
		issues.put(number, new RemoteIssue(number, title, labels, milestone, body, RemoteIssue.OPEN));
		logger.info("MOCK create #{} '{}'", number, title);
		return number;
	}

	@Override
	public synchronized void update(int number, @Nullable String body, @Nullable List<String> labels,
			@Nullable String milestone, @Nullable String state) {
		RemoteIssue current = require(number);
		RemoteIssue updated = new RemoteIssue(number, current.title(), labels != null ? labels : current.labels(),
				milestone != null ? milestone : current.milestone(), body != null ? body : current.body(),
				state != null ? state.toUpperCase(Locale.ROOT) : current.state());
		issues.put(number, updated);
		logger.info("MOCK update #{}", number);
	}

	@Override
	public synchronized void close(int number) {
		update(number, null, null, null, RemoteIssue.CLOSED);
	}

	@Override
	public synchronized List<RemoteIssue> list() {
		return new ArrayList<>(issues.values());
	}

	@Override
	public synchronized List<String> ensureLabels(Set<String> wanted) {
		List<String> created = new ArrayList<>();
		for (String label : new TreeSet<>(wanted)) {
			if (labels.add(label)) {
				created.add(label);
			}
		}
		if (!created.isEmpty()) {
			logger.info("MOCK created labels {}", created);
		}
		return created;
	}

	@Override
	public synchronized List<String> ensureMilestones(List<String> wanted) {
		List<String> created = new ArrayList<>();
		for (String title : wanted) {
			String key = title.strip().toLowerCase(Locale.ROOT);
			if (!key.isEmpty() && !milestones.containsKey(key)) {
				milestones.put(key, title.strip());
				created.add(title.strip());
			}
		}
		if (!created.isEmpty()) {
			logger.info("MOCK created milestones {}", created);
		}
		return created;
	}

	/**
	 * Labels known to this client, in name order.
	 * @return label names
	 */
	public synchronized List<String> labels() {
		return new ArrayList<>(labels);
	}

	/**
	 * Milestones known to this client, in creation order.
	 * @return milestone titles
	 */
	public synchronized List<String> milestones() {
		return new ArrayList<>(milestones.values());
	}

	private RemoteIssue require(int number) {
		RemoteIssue issue = issues.get(number);
		if (issue == null) {
			throw new RemoteIssueException("Not found: issue #" + number, 404, "Not Found");
		}
		return issue;
	}

}
