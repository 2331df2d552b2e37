package org.springaicommunity.github.scorer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link GitHubGraphQLService} with a mocked {@link GitHubClient}.
 */
@DisplayName("GitHubGraphQLService Tests")
@ExtendWith(MockitoExtension.class)
class GitHubGraphQLServiceTest {

	@Mock
	private GitHubClient gitHubClient;

	private final ObjectMapper objectMapper = ObjectMapperFactory.create();

	private GitHubGraphQLService service;

	@BeforeEach
	void setUp() {
		service = new GitHubGraphQLService(gitHubClient, objectMapper);
	}

	@Nested
	@DisplayName("Request body")
	class RequestBodyTest {

		@Test
		@DisplayName("Should send query and variables, keeping a null cursor")
		void shouldKeepNullVariables() throws Exception {
			when(gitHubClient.postGraphQL(anyString())).thenReturn("{\"data\":{}}");
			Map<String, @Nullable Object> variables = new HashMap<>();
			variables.put("owner", "octocat");
			variables.put("first", 100);
			variables.put("after", null);

			service.executeQuery("query { viewer { login } }", variables);

			ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
			verify(gitHubClient).postGraphQL(body.capture());
			JsonNode sent = objectMapper.readTree(body.getValue());
			assertThat(sent.path("query").asText()).isEqualTo("query { viewer { login } }");
			assertThat(sent.path("variables").path("owner").asText()).isEqualTo("octocat");
			assertThat(sent.path("variables").path("first").asInt()).isEqualTo(100);
			assertThat(sent.path("variables").has("after")).isTrue();
			assertThat(sent.path("variables").path("after").isNull()).isTrue();
		}

	}

	@Nested
	@DisplayName("Response handling")
	class ResponseHandlingTest {

		@Test
		@DisplayName("Should return the parsed response tree")
		void shouldReturnParsedTree() {
			when(gitHubClient.postGraphQL(anyString())).thenReturn("{\"data\":{\"viewer\":{\"login\":\"octocat\"}}}");

			Optional<JsonNode> result = service.executeQuery("q", Map.of());

			assertThat(result).isPresent();
			assertThat(JsonNodeUtils.getString(result.get(), "data", "viewer", "login")).contains("octocat");
		}

		@Test
		@DisplayName("Should still return the tree when GraphQL errors are present")
		void shouldReturnTreeWithErrors() {
			when(gitHubClient.postGraphQL(anyString()))
				.thenReturn("{\"data\":{\"user\":null},\"errors\":[{\"type\":\"NOT_FOUND\",\"message\":\"gone\"}]}");

			Optional<JsonNode> result = service.executeQuery("q", Map.of());

			assertThat(result).isPresent();
			assertThat(JsonNodeUtils.getNode(result.get(), "data", "user")).isEmpty();
		}

		@Test
		@DisplayName("Should return empty on a transport failure")
		void shouldReturnEmptyOnTransportFailure() {
			when(gitHubClient.postGraphQL(anyString()))
				.thenThrow(new GitHubApiException("GitHub API error: 502", 502, "Bad Gateway"));

			assertThat(service.executeQuery("q", Map.of())).isEmpty();
		}

		@Test
		@DisplayName("Should return empty when the rate limit is exhausted")
		void shouldReturnEmptyWhenRateLimited() {
			GitHubApiException rateLimited = new GitHubApiException("Rate limit exceeded. Resets at epoch: 1760000000",
					403, "{}", 0, 1760000000L);
			when(gitHubClient.postGraphQL(anyString())).thenThrow(rateLimited);

			assertThat(rateLimited.isRateLimitError()).isTrue();
			assertThat(service.executeQuery("q", Map.of())).isEmpty();
		}

		@Test
		@DisplayName("Should return empty when throttled without a reset time")
		void shouldReturnEmptyWhenThrottled() {
			when(gitHubClient.postGraphQL(anyString()))
				.thenThrow(new GitHubApiException("Too Many Requests (429). Resets at epoch: -1", 429, null));

			assertThat(service.executeQuery("q", Map.of())).isEmpty();
		}

		@Test
		@DisplayName("Should return empty on an I/O failure without status")
		void shouldReturnEmptyOnIoFailure() {
			when(gitHubClient.postGraphQL(anyString())).thenThrow(
					new GitHubApiException("HTTP request failed: reset", new IOException("reset")));

			assertThat(service.executeQuery("q", Map.of())).isEmpty();
		}

		@Test
		@DisplayName("Should return empty on a malformed response")
		void shouldReturnEmptyOnMalformedResponse() {
			when(gitHubClient.postGraphQL(anyString())).thenReturn("<html>not json");

			assertThat(service.executeQuery("q", Map.of())).isEmpty();
		}

	}

}
