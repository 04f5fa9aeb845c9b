package org.springaicommunity.github.issuesync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the Markdown issue specification format into {@link IssueSpec} records.
 *
 * <p>
 * Each entry is a {@code ## [slug: <slug>]} heading followed by a fenced {@code yaml}
 * block:
 *
 * <pre>
 * ## [slug: api-timeouts]
 *
 * ```yaml
 * title: Handle API timeouts
 * labels: [bug, p1-important]
 * milestone: Sprint 1
 * body: |
 *   Requests hang forever when the upstream stalls.
 * ```
 * </pre>
 *
 * <p>
 * Parsing fails fast: any malformed entry rejects the whole file with a
 * {@link SpecParseException}.
 */
public class IssueSpecParser {

	private static final Logger logger = LoggerFactory.getLogger(IssueSpecParser.class);

	private static final Pattern SLUG_HEADING = Pattern.compile("^##\\s*\\[slug:\\s*([a-z0-9][a-z0-9_-]*)\\s*\\]$",
			Pattern.CASE_INSENSITIVE);

	private static final Pattern LEGACY_HEADING = Pattern.compile("^##\\s+\\d{3}\\s*\\|.*");

	private static final Map<String, String> LABEL_CANON_MAP = Map.of("p0-critical", "P0-critical", "p1-important",
			"P1-important", "p2-enhancement", "P2-enhancement");

	private static final char FIELD_SEPARATOR = '\u001f';

	private final ObjectMapper yamlMapper;

	public IssueSpecParser() {
		this(ObjectMapperFactory.createYaml());
	}

	public IssueSpecParser(ObjectMapper yamlMapper) {
		this.yamlMapper = yamlMapper;
	}

	/**
	 * Parse a specification file.
	 * @param path UTF-8 Markdown file
	 * @return parsed specs in file order
	 * @throws SpecParseException if the file is missing or malformed
	 */
	public List<IssueSpec> parse(Path path) {
		if (!Files.exists(path)) {
			throw new SpecParseException("Source file not found: " + path);
		}
		try {
			List<IssueSpec> specs = parse(Files.readString(path, StandardCharsets.UTF_8));
			logger.info("Parsed {} issue specs from {}", specs.size(), path);
			return specs;
		}
		catch (IOException e) {
			throw new SpecParseException("Failed to read " + path + ": " + e.getMessage(), null, e);
		}
	}

	/**
	 * Parse specification text.
	 * @param text raw Markdown
	 * @return parsed specs in text order
	 * @throws SpecParseException if no entries are found or any entry is malformed
	 */
	public List<IssueSpec> parse(String text) {
		List<String> lines = text.lines().toList();
		List<IssueSpec> specs = new ArrayList<>();
		int i = 0;
		while (i < lines.size()) {
			String line = lines.get(i).stripTrailing();
			Matcher m = SLUG_HEADING.matcher(line);
			if (!m.matches()) {
				if (LEGACY_HEADING.matcher(line).matches()) {
					throw new SpecParseException("Legacy numeric issue format detected. Use slug+YAML format.");
				}
				i++;
				continue;
			}
			String slug = m.group(1);
			i++;
			while (i < lines.size() && lines.get(i).isBlank()) {
				i++;
			}
			if (i >= lines.size() || !lines.get(i).strip().startsWith("```yaml")) {
				throw new SpecParseException("Missing ```yaml fenced block for slug " + slug, slug);
			}
			i++;
			List<String> block = new ArrayList<>();
			while (i < lines.size() && !lines.get(i).strip().startsWith("```")) {
				block.add(lines.get(i));
				i++;
			}
			if (i >= lines.size()) {
				throw new SpecParseException("Unterminated YAML block for slug " + slug, slug);
			}
			i++;
			specs.add(parseEntry(slug, String.join("\n", block)));
		}
		if (specs.isEmpty()) {
			throw new SpecParseException("No slug headings found in specification");
		}
		return specs;
	}

	private IssueSpec parseEntry(String slug, String yaml) {
		JsonNode data;
		try {
			data = yaml.isBlank() ? null : yamlMapper.readTree(yaml);
		}
		catch (JsonProcessingException e) {
			throw new SpecParseException("Invalid YAML for slug " + slug + ": " + e.getOriginalMessage(), slug, e);
		}
		if (data == null || data.isMissingNode() || data.isNull()) {
			data = yamlMapper.createObjectNode();
		}
		if (!data.isObject()) {
			throw new SpecParseException("YAML for slug " + slug + " must be a mapping", slug);
		}

		JsonNode titleNode = data.path("title");
		if (!titleNode.isTextual() || titleNode.asText().isBlank()) {
			throw new SpecParseException("Missing title in slug " + slug, slug);
		}
		String title = titleNode.asText().strip();
		String body = SlugMarker.ensure(normalizeBody(data.get("body")), slug);
		List<String> labels = canonicalLabels(data.get("labels"));
		String milestone = textOrNull(data.get("milestone"));
		String status = textOrNull(data.get("status"));
		Map<String, Object> project = null;
		JsonNode projectNode = data.get("project");
		if (projectNode != null && projectNode.isObject()) {
			project = yamlMapper.convertValue(projectNode, new TypeReference<Map<String, Object>>() {
			});
		}

		String fingerprint = fingerprint(slug, title, labels, milestone, status, body);
		return new IssueSpec(slug, title, labels, milestone, status, body, fingerprint, project);
	}

	/**
	 * Compute the content fingerprint for a spec. Labels are sorted and de-duplicated so
	 * their order does not matter, and the body is stripped so edge whitespace does not
	 * matter.
	 * @return first 16 hex characters of the SHA-256 digest
	 */
	static String fingerprint(String slug, String title, List<String> labels, @Nullable String milestone,
			@Nullable String status, String body) {
		String joined = String.join(String.valueOf(FIELD_SEPARATOR), slug, title,
				String.join(",", new TreeSet<>(labels)), milestone != null ? milestone : "",
				status != null ? status : "", body.strip());
		try {
			MessageDigest digest = MessageDigest.getInstance("SHA-256");
			byte[] hash = digest.digest(joined.getBytes(StandardCharsets.UTF_8));
			return HexFormat.of().formatHex(hash).substring(0, 16);
		}
		catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("SHA-256 not available", e);
		}
	}

	static String canonicalLabel(String label) {
		return LABEL_CANON_MAP.getOrDefault(label.toLowerCase(Locale.ROOT), label);
	}

	private static List<String> canonicalLabels(@Nullable JsonNode node) {
		List<String> tokens = new ArrayList<>();
		if (node == null) {
			return tokens;
		}
		if (node.isTextual()) {
			for (String part : node.asText().split(",")) {
				if (!part.isBlank()) {
					tokens.add(part.strip());
				}
			}
		}
		else if (node.isArray()) {
			for (JsonNode element : node) {
				String value = element.asText().strip();
				if (!value.isEmpty()) {
					tokens.add(value);
				}
			}
		}
		return tokens.stream().map(IssueSpecParser::canonicalLabel).toList();
	}

	private static String normalizeBody(@Nullable JsonNode node) {
		if (node == null || node.isNull()) {
			return "\n";
		}
		if (node.isArray()) {
			List<String> lines = new ArrayList<>();
			node.forEach(element -> lines.add(element.asText()));
			return String.join("\n", lines) + "\n";
		}
		String body = node.asText();
		return body.endsWith("\n") ? body : body + "\n";
	}

	@Nullable
	private static String textOrNull(@Nullable JsonNode node) {
		return node != null && node.isTextual() ? node.asText() : null;
	}

}
