package org.springaicommunity.github.issuesync;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Configuration properties for issue sync.
 *
 * <p>
 * Properties can be set directly via setters or passed to {@link IssueSyncBuilder}.
 * Default values are suitable for most repositories. Retry settings and the mock switch
 * can also be overridden from the environment via {@link #applyEnvironmentOverrides()}.
 */
public class SyncProperties {

	private static final Logger logger = LoggerFactory.getLogger(SyncProperties.class);

	static final String ENV_RETRY_ATTEMPTS = "ISSUESUITE_RETRY_ATTEMPTS";

	static final String ENV_RETRY_BASE = "ISSUESUITE_RETRY_BASE";

	static final String ENV_RETRY_MAX_SLEEP = "ISSUESUITE_RETRY_MAX_SLEEP";

	static final String ENV_MOCK = "ISSUESUITE_MOCK";

	/**
	 * Which {@link IssuesClient} implementation to talk to.
	 */
	public enum Backend {

		/** GitHub REST API over HTTPS. */
		REST,
		/** The {@code gh} command line tool. */
		GH_CLI,
		/** In-memory issues, nothing leaves the process. */
		MOCK

	}

	/**
	 * Target repository in "owner/repo" format. Required for the REST backend.
	 */
	@Nullable
	private String repository;

	private Backend backend = Backend.REST;

	private String apiUrl = GitHubRestIssuesClient.DEFAULT_API_URL;

	private String ghExecutable = "gh";

	/**
	 * Markdown file holding the issue specs.
	 */
	private String sourceFile = "ISSUES.md";

	private String indexFile = ".issuesuite/index.json";

	/**
	 * Optional second location for the index, e.g. a file committed to the repository.
	 */
	@Nullable
	private String indexMirrorFile;

	private String summaryFile = "issues_summary.json";

	private boolean dryRun = false;

	private boolean update = true;

	private boolean respectStatus = true;

	private boolean prune = false;

	private boolean milestoneRequired = false;

	/**
	 * Maximum body diff lines kept in the run summary, 0 keeps all.
	 */
	private int truncateBodyDiff = 0;

	/**
	 * Create missing labels and milestones before syncing. Skipped in dry-runs.
	 */
	private boolean preflight = false;

	/**
	 * Labels created during preflight in addition to those used by the specs.
	 */
	private List<String> injectLabels = new ArrayList<>();

	/**
	 * Milestones created during preflight.
	 */
	private List<String> ensureMilestones = new ArrayList<>();

	private int retryAttempts = 3;

	private Duration retryBase = Duration.ofMillis(500);

	@Nullable
	private Duration retryMaxSleep;

	private boolean concurrencyEnabled = false;

	private int concurrencyThreshold = ConcurrentBatchDispatcher.DEFAULT_THRESHOLD;

	private int batchSize = ConcurrentBatchDispatcher.DEFAULT_BATCH_SIZE;

	private int maxWorkers = ConcurrentBatchDispatcher.DEFAULT_MAX_WORKERS;

	private Duration batchPause = ConcurrentBatchDispatcher.DEFAULT_BATCH_PAUSE;

	/**
	 * Use {@link AdaptiveBatchStrategy} instead of fixed-size batches.
	 */
	private boolean adaptiveBatching = false;

	/**
	 * Average serialized spec size in bytes above which adaptive batches are halved.
	 */
	private int largeItemThreshold = 10240;

	/**
	 * Override retry and backend settings from the environment (or a {@code .env} file).
	 * Malformed values are logged and ignored.
	 * @return this instance
	 */
	public SyncProperties applyEnvironmentOverrides() {
		return applyOverrides(EnvironmentSupport::get);
	}

	SyncProperties applyOverrides(Function<String, @Nullable String> env) {
		String attempts = env.apply(ENV_RETRY_ATTEMPTS);
		if (attempts != null) {
			try {
				setRetryAttempts(Integer.parseInt(attempts.strip()));
			}
			catch (NumberFormatException e) {
				logger.warn("Ignoring invalid {}={}", ENV_RETRY_ATTEMPTS, attempts);
			}
		}
		Duration base = parseSeconds(ENV_RETRY_BASE, env.apply(ENV_RETRY_BASE));
		if (base != null) {
			setRetryBase(base);
		}
		Duration maxSleep = parseSeconds(ENV_RETRY_MAX_SLEEP, env.apply(ENV_RETRY_MAX_SLEEP));
		if (maxSleep != null) {
			setRetryMaxSleep(maxSleep);
		}
		String mock = env.apply(ENV_MOCK);
		if (mock != null && ("1".equals(mock.strip()) || "true".equals(mock.strip().toLowerCase(Locale.ROOT)))) {
			setBackend(Backend.MOCK);
		}
		return this;
	}

	@Nullable
	private static Duration parseSeconds(String name, @Nullable String value) {
		if (value == null) {
			return null;
		}
		try {
			double seconds = Double.parseDouble(value.strip());
			if (seconds < 0) {
				logger.warn("Ignoring negative {}={}", name, value);
				return null;
			}
			return Duration.ofMillis(Math.round(seconds * 1000));
		}
		catch (NumberFormatException e) {
			logger.warn("Ignoring invalid {}={}", name, value);
			return null;
		}
	}

	@Nullable
	public String getRepository() {
		return repository;
	}

	public void setRepository(@Nullable String repository) {
		this.repository = repository;
	}

	public Backend getBackend() {
		return backend;
	}

	public void setBackend(Backend backend) {
		this.backend = backend;
	}

	public String getApiUrl() {
		return apiUrl;
	}

	public void setApiUrl(String apiUrl) {
		this.apiUrl = apiUrl;
	}

	public String getGhExecutable() {
		return ghExecutable;
	}

	public void setGhExecutable(String ghExecutable) {
		this.ghExecutable = ghExecutable;
	}

	public String getSourceFile() {
		return sourceFile;
	}

	public void setSourceFile(String sourceFile) {
		this.sourceFile = sourceFile;
	}

	public String getIndexFile() {
		return indexFile;
	}

	public void setIndexFile(String indexFile) {
		this.indexFile = indexFile;
	}

	@Nullable
	public String getIndexMirrorFile() {
		return indexMirrorFile;
	}

	public void setIndexMirrorFile(@Nullable String indexMirrorFile) {
		this.indexMirrorFile = indexMirrorFile;
	}

	public String getSummaryFile() {
		return summaryFile;
	}

	public void setSummaryFile(String summaryFile) {
		this.summaryFile = summaryFile;
	}

	public boolean isDryRun() {
		return dryRun;
	}

	public void setDryRun(boolean dryRun) {
		this.dryRun = dryRun;
	}

	public boolean isUpdate() {
		return update;
	}

	public void setUpdate(boolean update) {
		this.update = update;
	}

	public boolean isRespectStatus() {
		return respectStatus;
	}

	public void setRespectStatus(boolean respectStatus) {
		this.respectStatus = respectStatus;
	}

	public boolean isPrune() {
		return prune;
	}

	public void setPrune(boolean prune) {
		this.prune = prune;
	}

	public boolean isMilestoneRequired() {
		return milestoneRequired;
	}

	public void setMilestoneRequired(boolean milestoneRequired) {
		this.milestoneRequired = milestoneRequired;
	}

	public int getTruncateBodyDiff() {
		return truncateBodyDiff;
	}

	public void setTruncateBodyDiff(int truncateBodyDiff) {
		this.truncateBodyDiff = truncateBodyDiff;
	}

	public boolean isPreflight() {
		return preflight;
	}

	public void setPreflight(boolean preflight) {
		this.preflight = preflight;
	}

	public List<String> getInjectLabels() {
		return injectLabels;
	}

	public void setInjectLabels(List<String> injectLabels) {
		this.injectLabels = new ArrayList<>(injectLabels);
	}

	public List<String> getEnsureMilestones() {
		return ensureMilestones;
	}

	public void setEnsureMilestones(List<String> ensureMilestones) {
		this.ensureMilestones = new ArrayList<>(ensureMilestones);
	}

	/**
	 * Returns the maximum number of attempts per remote call, including the first.
	 * @return the attempt limit
	 */
	public int getRetryAttempts() {
		return retryAttempts;
	}

	public void setRetryAttempts(int retryAttempts) {
		this.retryAttempts = retryAttempts;
	}

	/**
	 * Returns the base delay of the exponential backoff schedule.
	 * @return the base delay
	 */
	public Duration getRetryBase() {
		return retryBase;
	}

	public void setRetryBase(Duration retryBase) {
		this.retryBase = retryBase;
	}

	@Nullable
	public Duration getRetryMaxSleep() {
		return retryMaxSleep;
	}

	public void setRetryMaxSleep(@Nullable Duration retryMaxSleep) {
		this.retryMaxSleep = retryMaxSleep;
	}

	public boolean isConcurrencyEnabled() {
		return concurrencyEnabled;
	}

	public void setConcurrencyEnabled(boolean concurrencyEnabled) {
		this.concurrencyEnabled = concurrencyEnabled;
	}

	public int getConcurrencyThreshold() {
		return concurrencyThreshold;
	}

	public void setConcurrencyThreshold(int concurrencyThreshold) {
		this.concurrencyThreshold = concurrencyThreshold;
	}

	public int getBatchSize() {
		return batchSize;
	}

	public void setBatchSize(int batchSize) {
		this.batchSize = batchSize;
	}

	public int getMaxWorkers() {
		return maxWorkers;
	}

	public void setMaxWorkers(int maxWorkers) {
		this.maxWorkers = maxWorkers;
	}

	public Duration getBatchPause() {
		return batchPause;
	}

	public void setBatchPause(Duration batchPause) {
		this.batchPause = batchPause;
	}

	public boolean isAdaptiveBatching() {
		return adaptiveBatching;
	}

	public void setAdaptiveBatching(boolean adaptiveBatching) {
		this.adaptiveBatching = adaptiveBatching;
	}

	public int getLargeItemThreshold() {
		return largeItemThreshold;
	}

	public void setLargeItemThreshold(int largeItemThreshold) {
		this.largeItemThreshold = largeItemThreshold;
	}

}
