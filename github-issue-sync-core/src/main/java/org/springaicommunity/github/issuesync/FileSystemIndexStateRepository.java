package org.springaicommunity.github.issuesync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;

/**
 * File system implementation of {@link IndexStateRepository}.
 *
 * <p>
 * The index is written to {@code <path>.tmp} and then moved over the target, so readers
 * never observe a partially written file. Besides the signed {@code entries} the payload
 * carries a plain {@code mapping} snapshot for older readers.
 */
public class FileSystemIndexStateRepository implements IndexStateRepository {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemIndexStateRepository.class);

	private final ObjectMapper objectMapper;

	public FileSystemIndexStateRepository(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	@Override
	public IndexDocument load(Path path) {
		if (!Files.exists(path)) {
			logger.debug("No index at {}, starting empty", path);
			return IndexDocument.empty();
		}
		JsonNode raw;
		try {
			raw = objectMapper.readTree(Files.readString(path, StandardCharsets.UTF_8));
		}
		catch (IOException e) {
			logger.warn("Failed to read index {}: {}", path, e.getMessage());
			return IndexDocument.empty();
		}
		if (raw == null || !raw.isObject()) {
			return IndexDocument.empty();
		}

		ObjectNode signed = signedEntries(raw);
		IndexDocument document = IndexDocument.empty();
		JsonNode repo = raw.path("repo");
		document.setRepo(repo.isTextual() ? repo.asText() : null);
		int version = raw.path("version").asInt(IndexDocument.CURRENT_VERSION);
		document.setVersion(version > 0 ? version : IndexDocument.CURRENT_VERSION);
		JsonNode generatedAt = raw.path("generated_at");
		if (generatedAt.isTextual()) {
			document.setGeneratedAt(generatedAt.asText());
		}
		String signature = raw.path("signature").asText("");
		document.setSignature(signature);

		if (!signature.isEmpty() && !signature.equals(IndexSignature.compute(signed))) {
			logger.warn("Index signature mismatch detected at {}; ignoring entries", path);
			IndexDocument reset = IndexDocument.empty();
			reset.setRepo(document.getRepo());
			reset.setVersion(document.getVersion());
			return reset;
		}

		Iterator<Map.Entry<String, JsonNode>> fields = signed.fields();
		while (fields.hasNext()) {
			Map.Entry<String, JsonNode> field = fields.next();
			JsonNode issue = field.getValue().path("issue");
			int number = issue.isIntegralNumber() && issue.canConvertToInt() ? issue.asInt()
					: issue.isTextual() ? parseIntOrZero(issue.asText()) : 0;
			if (number <= 0) {
				logger.debug("Skipping non-integer index entry for {}: {}", field.getKey(), issue);
				continue;
			}
			JsonNode hash = field.getValue().path("hash");
			document.put(field.getKey(), new IndexEntry(number, hash.isTextual() ? hash.asText() : null));
		}
		logger.debug("Loaded {} index entries from {}", document.getEntries().size(), path);
		return document;
	}

	/**
	 * Entries as they are covered by the signature. Falls back to the legacy
	 * {@code mapping} form when no object entries are present.
	 */
	private ObjectNode signedEntries(JsonNode raw) {
		ObjectNode entries = objectMapper.createObjectNode();
		JsonNode entriesNode = raw.path("entries");
		if (entriesNode.isObject()) {
			entriesNode.fields().forEachRemaining(field -> {
				if (field.getValue().isObject()) {
					entries.set(field.getKey(), field.getValue());
				}
			});
		}
		if (entries.isEmpty()) {
			JsonNode mapping = raw.path("mapping");
			if (mapping.isObject()) {
				mapping.fields().forEachRemaining(field -> {
					ObjectNode entry = objectMapper.createObjectNode();
					entry.set("issue", field.getValue());
					entries.set(field.getKey(), entry);
				});
			}
		}
		return entries;
	}

	@Override
	public void persist(Path path, IndexDocument document, @Nullable Path mirror) {
		document.setSignature(IndexSignature.compute(document.getEntries()));
		document.setGeneratedAt(Instant.now().toString());

		ObjectNode payload = objectMapper.createObjectNode();
		payload.put("version", document.getVersion());
		payload.put("generated_at", document.getGeneratedAt());
		payload.put("repo", document.getRepo());
		payload.set("entries", objectMapper.valueToTree(document.getEntries()));
		payload.put("signature", document.getSignature());
		Map<String, Integer> mapping = document.toMapping();
		if (!mapping.isEmpty()) {
			payload.set("mapping", objectMapper.valueToTree(mapping));
		}

		try {
			String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(payload) + "\n";
			createParent(path);
			Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
			Files.writeString(tmp, json, StandardCharsets.UTF_8);
			try {
				Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
			}
			catch (AtomicMoveNotSupportedException e) {
				Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
			}
			logger.info("Saved index with {} entries to {}", mapping.size(), path);
			if (mirror != null) {
				createParent(mirror);
				Files.writeString(mirror, json, StandardCharsets.UTF_8);
				logger.debug("Mirrored index to {}", mirror);
			}
		}
		catch (IOException e) {
			throw new RuntimeException("Failed to persist index: " + path, e);
		}
	}

	@Override
	public void writeSummary(Path path, SummaryDocument summary) {
		try {
			createParent(path);
			objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), summary);
			logger.info("Wrote run summary to {}", path);
		}
		catch (IOException e) {
			throw new RuntimeException("Failed to write summary: " + path, e);
		}
	}

	private static void createParent(Path path) throws IOException {
		Path parent = path.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}
	}

	private static int parseIntOrZero(String text) {
		try {
			return Integer.parseInt(text.strip());
		}
		catch (NumberFormatException e) {
			return 0;
		}
	}

}
