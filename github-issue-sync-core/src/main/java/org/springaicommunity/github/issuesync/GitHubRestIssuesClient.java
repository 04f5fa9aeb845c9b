package org.springaicommunity.github.issuesync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link IssuesClient} backed by the GitHub REST API, using the Java 11+ HttpClient.
 *
 * <p>
 * Milestones are given by title and resolved to milestone numbers on demand; the lookup
 * is cached for the lifetime of the client. Pull requests returned by the issues endpoint
 * are filtered out of {@link #list()}.
 */
public class GitHubRestIssuesClient implements IssuesClient {

	private static final Logger logger = LoggerFactory.getLogger(GitHubRestIssuesClient.class);

	public static final String DEFAULT_API_URL = "https://api.github.com";

	private static final int PER_PAGE = 100;

	private static final String USER_AGENT = "github-issue-sync";

	private static final String AUTO_CREATED_DESCRIPTION = "Auto-created (github-issue-sync)";

	private static final String AUTO_CREATED_COLOR = "ededed";

	private final HttpClient httpClient;

	private final ObjectMapper objectMapper;

	private final String token;

	private final String repo;

	private final String baseUrl;

	private final Map<String, Integer> milestoneNumbers = new ConcurrentHashMap<>();

	private volatile boolean milestonesLoaded;

	public GitHubRestIssuesClient(String token, String repo, ObjectMapper objectMapper) {
		this(token, repo, DEFAULT_API_URL, objectMapper);
	}

	public GitHubRestIssuesClient(String token, String repo, String baseUrl, ObjectMapper objectMapper) {
		this.token = token;
		this.repo = repo;
		this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
		this.objectMapper = objectMapper;
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(Duration.ofSeconds(30))
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	@Override
	@Nullable
	public Integer create(String title, String body, List<String> labels, @Nullable String milestone) {
		ObjectNode payload = objectMapper.createObjectNode();
		payload.put("title", title);
		payload.put("body", body);
		if (!labels.isEmpty()) {
			payload.set("labels", objectMapper.valueToTree(labels));
		}
		if (milestone != null && !milestone.isBlank()) {
			Integer resolved = resolveMilestone(milestone);
			if (resolved != null) {
				payload.put("milestone", resolved);
			}
		}
		JsonNode created = readTree(send("POST", "/repos/" + repo + "/issues", payload));
		JsonNode number = created.path("number");
		return number.isInt() ? number.asInt() : null;
	}

	@Override
	public void update(int number, @Nullable String body, @Nullable List<String> labels, @Nullable String milestone,
			@Nullable String state) {
		ObjectNode payload = objectMapper.createObjectNode();
		if (body != null) {
			payload.put("body", body);
		}
		if (labels != null) {
			payload.set("labels", objectMapper.valueToTree(labels));
		}
		if (milestone != null) {
			Integer resolved = resolveMilestone(milestone);
			if (resolved != null) {
				payload.put("milestone", resolved);
			}
		}
		if (state != null) {
			payload.put("state", state.toLowerCase(Locale.ROOT));
		}
		if (payload.isEmpty()) {
			return;
		}
		send("PATCH", "/repos/" + repo + "/issues/" + number, payload);
	}

	@Override
	public void close(int number) {
		update(number, null, null, null, "closed");
	}

	@Override
	public List<RemoteIssue> list() {
		List<RemoteIssue> issues = new ArrayList<>();
		for (JsonNode entry : paginate("/repos/" + repo + "/issues", "state=all")) {
			if (entry.has("pull_request")) {
				continue;
			}
			issues.add(toRemoteIssue(entry));
		}
		logger.debug("Listed {} issues from {}", issues.size(), repo);
		return issues;
	}

	/**
	 * Resolve a milestone title (or number) to its milestone number.
	 * @param milestone title, matched case-insensitively, or a numeric string
	 * @return the milestone number, or null when no milestone has that title
	 */
	@Nullable
	Integer resolveMilestone(String milestone) {
		String wanted = milestone.strip();
		if (!wanted.isEmpty() && wanted.chars().allMatch(Character::isDigit)) {
			try {
				return Integer.parseInt(wanted);
			}
			catch (NumberFormatException e) {
				logger.debug("Milestone '{}' is not a valid number, resolving by title", wanted);
			}
		}
		loadMilestones();
		Integer resolved = milestoneNumbers.get(wanted.toLowerCase(Locale.ROOT));
		if (resolved == null) {
			logger.warn("Milestone '{}' not found in {}; leaving milestone unset", wanted, repo);
		}
		return resolved;
	}

	@Override
	public List<String> ensureLabels(Set<String> labels) {
		Set<String> existing = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
		for (JsonNode entry : paginate("/repos/" + repo + "/labels", null)) {
			if (entry.path("name").isTextual()) {
				existing.add(entry.path("name").asText());
			}
		}
		List<String> created = new ArrayList<>();
		for (String label : new TreeSet<>(labels)) {
			if (existing.contains(label)) {
				continue;
			}
			ObjectNode payload = objectMapper.createObjectNode();
			payload.put("name", label);
			payload.put("color", AUTO_CREATED_COLOR);
			payload.put("description", AUTO_CREATED_DESCRIPTION);
			try {
				send("POST", "/repos/" + repo + "/labels", payload);
				created.add(label);
				logger.info("Created label '{}' in {}", label, repo);
			}
			catch (RemoteIssueException e) {
				logger.warn("Failed to create label '{}': {}", label, e.getMessage());
			}
		}
		return created;
	}

	@Override
	public List<String> ensureMilestones(List<String> milestones) {
		loadMilestones();
		List<String> created = new ArrayList<>();
		for (String milestone : milestones) {
			String title = milestone.strip();
			if (title.isEmpty() || milestoneNumbers.containsKey(title.toLowerCase(Locale.ROOT))) {
				continue;
			}
			ObjectNode payload = objectMapper.createObjectNode();
			payload.put("title", title);
			payload.put("description", AUTO_CREATED_DESCRIPTION);
			try {
				JsonNode number = readTree(send("POST", "/repos/" + repo + "/milestones", payload)).path("number");
				if (number.isInt()) {
					milestoneNumbers.put(title.toLowerCase(Locale.ROOT), number.asInt());
				}
				created.add(title);
				logger.info("Created milestone '{}' in {}", title, repo);
			}
			catch (RemoteIssueException e) {
				logger.warn("Failed to create milestone '{}': {}", title, e.getMessage());
			}
		}
		return created;
	}

	private void loadMilestones() {
		if (milestonesLoaded) {
			return;
		}
		synchronized (milestoneNumbers) {
			if (!milestonesLoaded) {
				for (JsonNode entry : paginate("/repos/" + repo + "/milestones", "state=all")) {
					JsonNode title = entry.path("title");
					JsonNode number = entry.path("number");
					if (title.isTextual() && number.isInt()) {
						milestoneNumbers.putIfAbsent(title.asText().toLowerCase(Locale.ROOT), number.asInt());
					}
				}
				milestonesLoaded = true;
			}
		}
	}

	static RemoteIssue toRemoteIssue(JsonNode entry) {
		List<String> labels = new ArrayList<>();
		for (JsonNode label : entry.path("labels")) {
			if (label.isTextual()) {
				labels.add(label.asText());
			}
			else if (label.path("name").isTextual()) {
				labels.add(label.path("name").asText());
			}
		}
		JsonNode milestoneNode = entry.path("milestone");
		String milestone = null;
		if (milestoneNode.isTextual()) {
			milestone = milestoneNode.asText();
		}
		else if (milestoneNode.path("title").isTextual()) {
			milestone = milestoneNode.path("title").asText();
		}
		JsonNode body = entry.path("body");
		return new RemoteIssue(entry.path("number").asInt(), entry.path("title").asText(""), labels, milestone,
				body.isTextual() ? body.asText() : "", entry.path("state").asText(RemoteIssue.OPEN));
	}

	private List<JsonNode> paginate(String path, @Nullable String query) {
		List<JsonNode> results = new ArrayList<>();
		int page = 1;
		while (true) {
			String url = path + "?" + (query != null ? query + "&" : "") + "per_page=" + PER_PAGE + "&page=" + page;
			JsonNode data = readTree(send("GET", url, null));
			if (!data.isArray()) {
				break;
			}
			data.forEach(results::add);
			if (data.size() < PER_PAGE) {
				break;
			}
			page++;
		}
		return results;
	}

	private String send(String method, String path, @Nullable JsonNode payload) {
		String url = path.startsWith("http") ? path : baseUrl + path;
		HttpRequest.BodyPublisher publisher = payload != null
				? HttpRequest.BodyPublishers.ofString(payload.toString()) : HttpRequest.BodyPublishers.noBody();
		HttpRequest request = HttpRequest.newBuilder()
			.uri(URI.create(url))
			.header("Authorization", "Bearer " + token)
			.header("Accept", "application/vnd.github+json")
			.header("Content-Type", "application/json")
			.header("User-Agent", USER_AGENT)
			.method(method, publisher)
			.build();

		logger.debug("{} {}", method, url);
		long start = System.currentTimeMillis();
		try {
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
			int status = response.statusCode();
			logger.debug("{} {} -> {} in {}ms", method, url, status, System.currentTimeMillis() - start);
			if (status >= 200 && status < 300) {
				return response.body() != null ? response.body() : "";
			}
			throw toException(method, url, response);
		}
		catch (IOException e) {
			logger.error("HTTP request failed: {}", e.getMessage());
			throw new RemoteIssueException("HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new RemoteIssueException("HTTP request interrupted", e);
		}
	}

	private static RemoteIssueException toException(String method, String url, HttpResponse<String> response) {
		int status = response.statusCode();
		StringBuilder diagnostic = new StringBuilder(response.body() != null ? response.body() : "");
		response.headers()
			.firstValue("Retry-After")
			.ifPresent(value -> diagnostic.append("\nRetry-After: ").append(value));
		String remaining = response.headers().firstValue("X-RateLimit-Remaining").orElse("");
		String message;
		if (status == 401) {
			message = "Unauthorized: Bad credentials. Check your GitHub token.";
		}
		else if ((status == 403 && "0".equals(remaining)) || status == 429) {
			message = "GitHub API rate limit exceeded (" + status + ") for " + method + " " + url;
		}
		else {
			message = "GitHub API " + method + " " + url + " failed with " + status;
		}
		return new RemoteIssueException(message, status, diagnostic.toString());
	}

	private JsonNode readTree(String body) {
		if (body.isBlank()) {
			return objectMapper.missingNode();
		}
		try {
			return objectMapper.readTree(body);
		}
		catch (JsonProcessingException e) {
			throw new RemoteIssueException("Unparseable GitHub response: " + e.getOriginalMessage(), -1, body);
		}
	}

}
