package org.springaicommunity.github.issuesync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;

/**
 * Integrity signature of index entries: SHA-256 hex over the entries serialised as
 * compact JSON with keys sorted at every level.
 */
final class IndexSignature {

	private static final ObjectMapper CANONICAL = ObjectMapperFactory.createCanonical();

	private IndexSignature() {
	}

	static String compute(Map<String, IndexEntry> entries) {
		return compute(CANONICAL.<JsonNode>valueToTree(entries));
	}

	static String compute(JsonNode entries) {
		try {
			Object plain = CANONICAL.treeToValue(entries, Object.class);
			String canonical = CANONICAL.writeValueAsString(plain);
			MessageDigest digest = MessageDigest.getInstance("SHA-256");
			return HexFormat.of().formatHex(digest.digest(canonical.getBytes(StandardCharsets.UTF_8)));
		}
		catch (JsonProcessingException e) {
			throw new IllegalStateException("Failed to canonicalise index entries", e);
		}
		catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("SHA-256 not available", e);
		}
	}

}
