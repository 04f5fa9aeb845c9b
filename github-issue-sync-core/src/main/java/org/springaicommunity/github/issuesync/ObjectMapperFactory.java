package org.springaicommunity.github.issuesync;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Factory for creating consistently configured {@link ObjectMapper} instances.
 *
 * <p>
 * The default mapper uses {@link PropertyNamingStrategies#SNAKE_CASE} so that Java
 * camelCase record fields are serialized as snake_case JSON keys
 * (e.g.&nbsp;{@code generatedAt} &rarr; {@code generated_at}).
 */
public final class ObjectMapperFactory {

	private ObjectMapperFactory() {
	}

	/**
	 * Create a new {@link ObjectMapper} with standard configuration.
	 * @return configured ObjectMapper
	 */
	public static ObjectMapper create() {
		ObjectMapper mapper = new ObjectMapper();
		mapper.registerModule(new JavaTimeModule());
		mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
		mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
		return mapper;
	}

	/**
	 * Create a mapper for reading the YAML blocks embedded in specification files.
	 * @return YAML-backed ObjectMapper
	 */
	public static ObjectMapper createYaml() {
		return new ObjectMapper(new YAMLFactory());
	}

	/**
	 * Create a mapper producing canonical JSON: compact output with map keys and
	 * properties sorted, used for index signatures.
	 * @return canonicalizing ObjectMapper
	 */
	public static ObjectMapper createCanonical() {
		return JsonMapper.builder()
			.enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
			.enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
			.disable(SerializationFeature.INDENT_OUTPUT)
			.build();
	}

}
