package org.springaicommunity.github.issuesync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link IssuesClient} that shells out to the GitHub CLI ({@code gh}).
 *
 * <p>
 * Commands are scoped with {@code -R owner/repo} when a repository is configured,
 * otherwise {@code gh} resolves the repository from the current directory's remote. Label
 * updates use {@code --add-label}, which merges with existing labels rather than
 * replacing them.
 */
public class GhCliIssuesClient implements IssuesClient {

	private static final Logger logger = LoggerFactory.getLogger(GhCliIssuesClient.class);

	private static final Pattern ISSUE_NUMBER = Pattern.compile("/issues/(\\d+)");

	private static final String LIST_FIELDS = "number,title,body,labels,milestone,state";

	private static final String LIST_LIMIT = "1000";

	private static final String LABEL_LIST_LIMIT = "300";

	private static final String AUTO_CREATED_DESCRIPTION = "Auto-created (github-issue-sync)";

	private final CommandRunner runner;

	private final ObjectMapper objectMapper;

	private final String executable;

	@Nullable
	private final String repo;

	public GhCliIssuesClient(@Nullable String repo, ObjectMapper objectMapper) {
		this(repo, objectMapper, new ProcessCommandRunner(), "gh");
	}

	public GhCliIssuesClient(@Nullable String repo, ObjectMapper objectMapper, CommandRunner runner,
			String executable) {
		this.repo = repo != null && !repo.isBlank() ? repo.strip() : null;
		this.objectMapper = objectMapper;
		this.runner = runner;
		this.executable = executable;
	}

	@Override
	@Nullable
	public Integer create(String title, String body, List<String> labels, @Nullable String milestone) {
		List<String> cmd = command("issue", "create", "--title", title, "--body", body);
		if (!labels.isEmpty()) {
			cmd.add("--label");
			cmd.add(String.join(",", labels));
		}
		if (milestone != null && !milestone.isBlank()) {
			cmd.add("--milestone");
			cmd.add(milestone);
		}
		String out = run(cmd);
		Matcher m = ISSUE_NUMBER.matcher(out);
		if (m.find()) {
			return Integer.parseInt(m.group(1));
		}
		logger.warn("Could not determine number of created issue '{}' from gh output", title);
		return null;
	}

	@Override
	public void update(int number, @Nullable String body, @Nullable List<String> labels, @Nullable String milestone,
			@Nullable String state) {
		if (labels != null && !labels.isEmpty()) {
			run(command("issue", "edit", String.valueOf(number), "--add-label", String.join(",", labels)));
		}
		if (milestone != null && !milestone.isBlank()) {
			run(command("issue", "edit", String.valueOf(number), "--milestone", milestone));
		}
		if (body != null) {
			run(command("api", apiPath("issues/" + number), "--method", "PATCH", "-f", "body=" + body));
		}
		if (state != null) {
			run(command("issue", "closed".equalsIgnoreCase(state) ? "close" : "reopen", String.valueOf(number)));
		}
	}

	@Override
	public void close(int number) {
		run(command("issue", "close", String.valueOf(number)));
	}

	@Override
	public List<RemoteIssue> list() {
		String out = run(command("issue", "list", "--state", "all", "--limit", LIST_LIMIT, "--json", LIST_FIELDS));
		List<RemoteIssue> issues = new ArrayList<>();
		for (JsonNode entry : readArray(out, "gh issue list")) {
			if (entry.isObject()) {
				issues.add(GitHubRestIssuesClient.toRemoteIssue(entry));
			}
		}
		return issues;
	}

	@Override
	public List<String> ensureLabels(Set<String> labels) {
		Set<String> existing = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
		for (JsonNode entry : readArray(run(command("label", "list", "--limit", LABEL_LIST_LIMIT, "--json", "name")),
				"gh label list")) {
			if (entry.path("name").isTextual()) {
				existing.add(entry.path("name").asText());
			}
		}
		List<String> created = new ArrayList<>();
		for (String label : new TreeSet<>(labels)) {
			if (existing.contains(label)) {
				continue;
			}
			try {
				run(command("label", "create", label, "--color", "ededed", "--description", AUTO_CREATED_DESCRIPTION,
						"--force"));
				created.add(label);
			}
			catch (RemoteIssueException e) {
				logger.warn("Failed to create label '{}': {}", label, e.getMessage());
			}
		}
		return created;
	}

	@Override
	public List<String> ensureMilestones(List<String> milestones) {
		String endpoint = apiPath("milestones");
		Set<String> existing = new TreeSet<>();
		String titles = run(command("api", endpoint + "?state=all", "--paginate", "--jq", ".[].title"));
		for (String line : titles.split("\\R")) {
			if (!line.isBlank()) {
				existing.add(line.strip().toLowerCase(Locale.ROOT));
			}
		}
		List<String> created = new ArrayList<>();
		for (String milestone : milestones) {
			String title = milestone.strip();
			if (title.isEmpty() || !existing.add(title.toLowerCase(Locale.ROOT))) {
				continue;
			}
			try {
				run(command("api", endpoint, "--method", "POST", "-f", "title=" + title, "-f",
						"description=" + AUTO_CREATED_DESCRIPTION));
				created.add(title);
			}
			catch (RemoteIssueException e) {
				logger.warn("Failed to create milestone '{}': {}", title, e.getMessage());
			}
		}
		return created;
	}

	private String apiPath(String resource) {
		return "repos/" + (repo != null ? repo : ":owner/:repo") + "/" + resource;
	}

	private List<JsonNode> readArray(String out, String source) {
		List<JsonNode> entries = new ArrayList<>();
		if (out.isBlank()) {
			return entries;
		}
		try {
			JsonNode data = objectMapper.readTree(out);
			if (data.isArray()) {
				data.forEach(entries::add);
			}
			return entries;
		}
		catch (JsonProcessingException e) {
			throw new RemoteIssueException("Unparseable " + source + " output: " + e.getOriginalMessage(), -1, out);
		}
	}

	private List<String> command(String... parts) {
		List<String> cmd = new ArrayList<>();
		cmd.add(executable);
		cmd.addAll(List.of(parts));
		if (repo != null && !"api".equals(parts[0])) {
			cmd.add("-R");
			cmd.add(repo);
		}
		return cmd;
	}

	private String run(List<String> cmd) {
		CommandRunner.Result result = runner.run(cmd);
		if (!result.isSuccess()) {
			throw new RemoteIssueException("Command failed: " + String.join(" ", cmd.subList(0, Math.min(3, cmd.size())))
					+ " (exit " + result.exitCode() + ")", result.exitCode(), result.output());
		}
		return result.output();
	}

}
