package org.springaicommunity.github.scorer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * {@link GraphQLService} backed by a {@link GitHubClient}.
 *
 * <p>
 * Serializes the request document, posts it and parses the response. Transport errors
 * (non-2xx status, I/O, interruption) and malformed responses are logged and turned into
 * {@link Optional#empty()}. GraphQL-level {@code errors} are logged but the response tree
 * is still returned, since its {@code data} may be partially usable or encode an absent
 * entity.
 */
public class GitHubGraphQLService implements GraphQLService {

	private static final Logger logger = LoggerFactory.getLogger(GitHubGraphQLService.class);

	private final GitHubClient httpClient;

	private final ObjectMapper objectMapper;

	public GitHubGraphQLService(GitHubClient httpClient, ObjectMapper objectMapper) {
		this.httpClient = httpClient;
		this.objectMapper = objectMapper;
	}

	@Override
	public Optional<JsonNode> executeQuery(String query, Map<String, @Nullable Object> variables) {
		String requestBody;
		try {
			requestBody = buildRequestBody(query, variables);
		}
		catch (JsonProcessingException e) {
			logger.error("Failed to serialize GraphQL request: {}", e.getMessage());
			return Optional.empty();
		}

		String response;
		try {
			response = httpClient.postGraphQL(requestBody);
		}
		catch (GitHubApiException e) {
			if (e.isRateLimitError()) {
				Object resetTime = e.getResetEpochSeconds() > 0 ? Instant.ofEpochSecond(e.getResetEpochSeconds())
						: "unknown";
				logger.error("GraphQL query rate limited ({} requests remaining); resets at {}",
						Math.max(0, e.getRateLimitRemaining()), resetTime);
			}
			else if (e.getStatusCode() > 0) {
				logger.error("GraphQL query failed with status {}: {} {}", e.getStatusCode(), e.getMessage(),
						e.getResponseBody());
			}
			else {
				logger.error("GraphQL query failed: {}", e.getMessage());
			}
			return Optional.empty();
		}

		try {
			JsonNode tree = objectMapper.readTree(response);
			logGraphQLErrors(tree);
			return Optional.of(tree);
		}
		catch (JsonProcessingException e) {
			logger.error("Failed to parse GraphQL response: {}", e.getOriginalMessage());
			return Optional.empty();
		}
	}

	String buildRequestBody(String query, Map<String, @Nullable Object> variables) throws JsonProcessingException {
		// LinkedHashMap keeps null values such as the first page cursor
		Map<String, Object> body = new LinkedHashMap<>();
		body.put("query", query);
		body.put("variables", new LinkedHashMap<>(variables));
		return objectMapper.writeValueAsString(body);
	}

	private void logGraphQLErrors(JsonNode tree) {
		JsonNode errors = tree.path("errors");
		if (errors.isArray() && !errors.isEmpty()) {
			for (JsonNode error : errors) {
				logger.warn("GraphQL error: {} (type: {}, path: {})", error.path("message").asText("unknown"),
						error.path("type").asText("n/a"), error.path("path"));
			}
		}
	}

}
