package org.springaicommunity.github.issuesync;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.IntSupplier;

/**
 * Builder for wiring an {@link IssueSyncService}.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // REST backend, token from ISSUESUITE_GITHUB_TOKEN / GITHUB_TOKEN / GH_TOKEN
 * SyncProperties props = new SyncProperties();
 * props.setRepository("owner/repo");
 *
 * IssueSyncService sync = IssueSyncBuilder.create()
 *     .properties(props)
 *     .tokenFromEnv()
 *     .build();
 * SummaryDocument summary = sync.run(Path.of("ISSUES.md"), SyncOptions.from(props), SyncPaths.from(props));
 *
 * // For testing with a custom client (retry still applied)
 * IssueSyncService testSync = IssueSyncBuilder.create()
 *     .issuesClient(new InMemoryIssuesClient())
 *     .build();
 * }
 * </pre>
 */
public class IssueSyncBuilder {

	private static final Logger logger = LoggerFactory.getLogger(IssueSyncBuilder.class);

	@Nullable
	private String token;

	private SyncProperties properties;

	@Nullable
	private ObjectMapper objectMapper;

	@Nullable
	private IssuesClient issuesClient;

	@Nullable
	private IndexStateRepository indexRepository;

	@Nullable
	private BatchStrategy<IssueSpec> batchStrategy;

	@Nullable
	private CommandRunner commandRunner;

	@Nullable
	private IntSupplier mockNumberSequence;

	private RetryingIssuesClient.@Nullable Sleeper sleeper;

	private IssueSyncBuilder() {
		this.properties = new SyncProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new IssueSyncBuilder
	 */
	public static IssueSyncBuilder create() {
		return new IssueSyncBuilder();
	}

	public IssueSyncBuilder token(@Nullable String token) {
		this.token = token;
		return this;
	}

	/**
	 * Read the GitHub token from the environment.
	 * @return this builder
	 * @throws IllegalStateException if none of the token variables is set
	 */
	public IssueSyncBuilder tokenFromEnv() {
		this.token = EnvironmentSupport.githubToken();
		if (this.token == null) {
			throw new IllegalStateException("A GitHub token is required. Set one of "
					+ String.join(", ", EnvironmentSupport.TOKEN_VARIABLES) + ".");
		}
		return this;
	}

	/**
	 * Set sync properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public IssueSyncBuilder properties(@Nullable SyncProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Apply {@code ISSUESUITE_*} overrides from the environment to the current
	 * properties. Call after {@link #properties(SyncProperties)}.
	 * @return this builder
	 */
	public IssueSyncBuilder environmentOverrides() {
		this.properties.applyEnvironmentOverrides();
		return this;
	}

	public IssueSyncBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Use a custom IssuesClient instead of the configured backend. It is still wrapped in
	 * {@link RetryingIssuesClient}. When a custom client is provided, the token is not
	 * required.
	 * @param issuesClient custom client (null to use the configured backend)
	 * @return this builder
	 */
	public IssueSyncBuilder issuesClient(@Nullable IssuesClient issuesClient) {
		this.issuesClient = issuesClient;
		return this;
	}

	public IssueSyncBuilder indexRepository(@Nullable IndexStateRepository indexRepository) {
		this.indexRepository = indexRepository;
		return this;
	}

	public IssueSyncBuilder batchStrategy(@Nullable BatchStrategy<IssueSpec> batchStrategy) {
		this.batchStrategy = batchStrategy;
		return this;
	}

	/**
	 * Command runner for the {@code gh} backend.
	 * @param commandRunner runner (null to spawn real processes)
	 * @return this builder
	 */
	public IssueSyncBuilder commandRunner(@Nullable CommandRunner commandRunner) {
		this.commandRunner = commandRunner;
		return this;
	}

	/**
	 * Issue number sequence for the mock backend.
	 * @param sequence number source (null to start at
	 * {@link InMemoryIssuesClient#DEFAULT_FIRST_NUMBER})
	 * @return this builder
	 */
	public IssueSyncBuilder mockNumberSequence(@Nullable IntSupplier sequence) {
		this.mockNumberSequence = sequence;
		return this;
	}

	/**
	 * Sleeper used by the retry layer and between dispatch batches.
	 * @param sleeper sleeper (null to block the calling thread)
	 * @return this builder
	 */
	public IssueSyncBuilder sleeper(RetryingIssuesClient.@Nullable Sleeper sleeper) {
		this.sleeper = sleeper;
		return this;
	}

	public IssueSyncService build() {
		ObjectMapper mapper = this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();
		IssuesClient client = buildIssuesClient();
		IndexStateRepository repository = this.indexRepository != null ? this.indexRepository
				: new FileSystemIndexStateRepository(mapper);
		return new IssueSyncService(client, new IssueSpecParser(), new IssueDiffEngine(), repository,
				buildDispatcher(mapper), properties.getRepository());
	}

	public DriftReconciler buildReconciler() {
		return new DriftReconciler(new IssueDiffEngine());
	}

	/**
	 * Build the retrying IssuesClient directly (for advanced usage).
	 * @return configured client
	 */
	public IssuesClient buildIssuesClient() {
		IssuesClient backend = this.issuesClient != null ? this.issuesClient : createBackend();
		RetryingIssuesClient.Builder retry = RetryingIssuesClient.builder()
			.wrapping(backend)
			.maxAttempts(properties.getRetryAttempts())
			.baseDelay(properties.getRetryBase())
			.maxSleep(properties.getRetryMaxSleep());
		if (sleeper != null) {
			retry.sleeper(sleeper);
		}
		return retry.build();
	}

	private IssuesClient createBackend() {
		ObjectMapper mapper = this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();
		return switch (properties.getBackend()) {
			case MOCK -> {
				logger.info("Using in-memory issues backend");
				yield mockNumberSequence != null ? new InMemoryIssuesClient(mockNumberSequence)
						: new InMemoryIssuesClient();
			}
			case GH_CLI -> new GhCliIssuesClient(properties.getRepository(), mapper,
					commandRunner != null ? commandRunner : new ProcessCommandRunner(), properties.getGhExecutable());
			case REST -> createRestClient(mapper);
		};
	}

	private IssuesClient createRestClient(ObjectMapper mapper) {
		if (token == null || token.isBlank()) {
			throw new IllegalStateException("GitHub token is required. Call token() or tokenFromEnv() first.");
		}
		String repo = properties.getRepository();
		if (repo == null || !repo.contains("/")) {
			throw new IllegalStateException("Repository in owner/repo format is required for the REST backend");
		}
		return new GitHubRestIssuesClient(token, repo, properties.getApiUrl(), mapper);
	}

	private ConcurrentBatchDispatcher<IssueSpec> buildDispatcher(ObjectMapper mapper) {
		BatchStrategy<IssueSpec> strategy = this.batchStrategy;
		if (strategy == null) {
			strategy = properties.isAdaptiveBatching()
					? new AdaptiveBatchStrategy<>(mapper, properties.getLargeItemThreshold())
					: new FixedBatchStrategy<>();
		}
		if (sleeper != null) {
			return new ConcurrentBatchDispatcher<>(properties.isConcurrencyEnabled(),
					properties.getConcurrencyThreshold(), properties.getBatchSize(), properties.getMaxWorkers(),
					properties.getBatchPause(), strategy, sleeper);
		}
		return new ConcurrentBatchDispatcher<>(properties.isConcurrencyEnabled(), properties.getConcurrencyThreshold(),
				properties.getBatchSize(), properties.getMaxWorkers(), properties.getBatchPause(), strategy);
	}

}
