package org.springaicommunity.github.scorer;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Factory for consistently configured {@link ObjectMapper} instances.
 */
public final class ObjectMapperFactory {

	private ObjectMapperFactory() {
	}

	/**
	 * Mapper for GraphQL request and response bodies. Field names are passed through
	 * unchanged since the GitHub schema uses camelCase.
	 * @return configured ObjectMapper
	 */
	public static ObjectMapper create() {
		ObjectMapper mapper = new ObjectMapper();
		mapper.registerModule(new JavaTimeModule());
		mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
		mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
		return mapper;
	}

	/**
	 * Mapper for report output. Uses {@link PropertyNamingStrategies#SNAKE_CASE} so that
	 * record components such as {@code powerUserRate} are written as
	 * {@code power_user_rate}.
	 * @return configured ObjectMapper
	 */
	public static ObjectMapper createForReports() {
		ObjectMapper mapper = create();
		mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
		mapper.enable(SerializationFeature.INDENT_OUTPUT);
		return mapper;
	}

}
