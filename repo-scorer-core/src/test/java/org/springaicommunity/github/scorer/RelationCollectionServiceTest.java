package org.springaicommunity.github.scorer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link RelationCollectionService} with a mocked {@link GraphQLService}.
 */
@DisplayName("RelationCollectionService Tests")
@ExtendWith(MockitoExtension.class)
class RelationCollectionServiceTest {

	private static final RepositoryId REPO = new RepositoryId("octocat", "Hello-World");

	@Mock
	private GraphQLService graphQLService;

	@Captor
	private ArgumentCaptor<Map<String, Object>> variablesCaptor;

	private final ObjectMapper objectMapper = ObjectMapperFactory.create();

	private RelationCollectionService service;

	@BeforeEach
	void setUp() {
		service = new RelationCollectionService(graphQLService, new ScoringProperties());
	}

	private Optional<JsonNode> page(String connection, String nodes, boolean hasNextPage, String endCursor)
			throws Exception {
		String cursor = endCursor == null ? "null" : "\"" + endCursor + "\"";
		return Optional.of(objectMapper.readTree("""
				{
				  "data": {
				    "repository": {
				      "%s": {
				        "pageInfo": { "hasNextPage": %s, "endCursor": %s },
				        "nodes": %s
				      }
				    }
				  }
				}
				""".formatted(connection, hasNextPage, cursor, nodes)));
	}

	@Nested
	@DisplayName("Pagination")
	class PaginationTest {

		@Test
		@DisplayName("Should walk three pages and pass each page's cursor to the next request")
		void shouldWalkAllPagesWithCursors() throws Exception {
			when(graphQLService.executeQuery(eq(RelationKind.STARGAZER.query()), anyMap()))
				.thenReturn(page("stargazers", "[{\"login\":\"a\"},{\"login\":\"b\"}]", true, "c1"))
				.thenReturn(page("stargazers", "[{\"login\":\"c\"}]", true, "c2"))
				.thenReturn(page("stargazers", "[{\"login\":\"d\"},{\"login\":\"a\"}]", false, "c3"));

			Set<String> logins = service.collect(RelationKind.STARGAZER, REPO);

			assertThat(logins).containsExactlyInAnyOrder("a", "b", "c", "d");
			verify(graphQLService, times(3)).executeQuery(eq(RelationKind.STARGAZER.query()),
					variablesCaptor.capture());
			List<Map<String, Object>> requests = variablesCaptor.getAllValues();
			assertThat(requests).extracting(v -> v.get("after")).containsExactly(null, "c1", "c2");
			assertThat(requests.get(0)).containsEntry("owner", "octocat")
				.containsEntry("repo", "Hello-World")
				.containsEntry("first", 100);
		}

		@Test
		@DisplayName("Should stop after a single page when hasNextPage is false")
		void shouldStopOnLastPage() throws Exception {
			when(graphQLService.executeQuery(eq(RelationKind.WATCHER.query()), anyMap()))
				.thenReturn(page("watchers", "[{\"login\":\"w1\"}]", false, "end"));

			Set<String> logins = service.collect(RelationKind.WATCHER, REPO);

			assertThat(logins).containsExactly("w1");
			verify(graphQLService, times(1)).executeQuery(anyString(), anyMap());
		}

		@Test
		@DisplayName("Should stop when a page reports more pages but no cursor")
		void shouldStopWhenCursorMissing() throws Exception {
			when(graphQLService.executeQuery(eq(RelationKind.WATCHER.query()), anyMap()))
				.thenReturn(page("watchers", "[{\"login\":\"w1\"}]", true, null));

			Set<String> logins = service.collect(RelationKind.WATCHER, REPO);

			assertThat(logins).containsExactly("w1");
			verify(graphQLService, times(1)).executeQuery(anyString(), anyMap());
		}

		@Test
		@DisplayName("Should use the configured page size")
		void shouldUseConfiguredPageSize() throws Exception {
			ScoringProperties properties = new ScoringProperties();
			properties.setPageSize(25);
			RelationCollectionService smallPages = new RelationCollectionService(graphQLService, properties);
			when(graphQLService.executeQuery(anyString(), anyMap()))
				.thenReturn(page("stargazers", "[]", false, null));

			smallPages.collect(RelationKind.STARGAZER, REPO);

			verify(graphQLService).executeQuery(anyString(), variablesCaptor.capture());
			assertThat(variablesCaptor.getValue()).containsEntry("first", 25);
		}

	}

	@Nested
	@DisplayName("Fail-soft behavior")
	class FailSoftTest {

		@Test
		@DisplayName("Should return the first page's items when the second request fails")
		void shouldReturnPartialResultsOnFailure() throws Exception {
			when(graphQLService.executeQuery(eq(RelationKind.STARGAZER.query()), anyMap()))
				.thenReturn(page("stargazers", "[{\"login\":\"a\"},{\"login\":\"b\"}]", true, "c1"))
				.thenReturn(Optional.empty());

			Set<String> logins = service.collect(RelationKind.STARGAZER, REPO);

			assertThat(logins).containsExactlyInAnyOrder("a", "b");
			verify(graphQLService, times(2)).executeQuery(anyString(), anyMap());
		}

		@Test
		@DisplayName("Should return an empty set when the repository does not exist")
		void shouldReturnEmptySetForAbsentRepository() throws Exception {
			when(graphQLService.executeQuery(anyString(), anyMap())).thenReturn(Optional.of(objectMapper.readTree("""
					{
					  "data": { "repository": null },
					  "errors": [ { "type": "NOT_FOUND", "message": "Could not resolve to a Repository" } ]
					}
					""")));

			Set<String> logins = service.collect(RelationKind.FORKER, REPO);

			assertThat(logins).isEmpty();
			verify(graphQLService, times(1)).executeQuery(anyString(), anyMap());
		}

		@Test
		@DisplayName("Should stop without requesting when the thread is interrupted")
		void shouldStopWhenInterrupted() {
			Thread.currentThread().interrupt();
			try {
				Set<String> logins = service.collect(RelationKind.STARGAZER, REPO);

				assertThat(logins).isEmpty();
				verifyNoInteractions(graphQLService);
			}
			finally {
				Thread.interrupted();
			}
		}

	}

	@Nested
	@DisplayName("Login extraction")
	class LoginExtractionTest {

		@Test
		@DisplayName("Should collect fork owners rather than the forks themselves")
		void shouldCollectForkOwners() throws Exception {
			when(graphQLService.executeQuery(eq(RelationKind.FORKER.query()), anyMap())).thenReturn(page("forks",
					"[{\"owner\":{\"login\":\"forker1\"}},{\"owner\":{\"login\":\"forker2\"}},{\"owner\":null}]", false,
					"f"));

			Set<String> logins = service.collect(RelationKind.FORKER, REPO);

			assertThat(logins).containsExactlyInAnyOrder("forker1", "forker2");
		}

		@Test
		@DisplayName("Should skip null nodes and nodes without a login")
		void shouldSkipNodesWithoutLogin() throws Exception {
			when(graphQLService.executeQuery(anyString(), anyMap()))
				.thenReturn(page("watchers", "[{\"login\":\"w1\"}, null, {}, {\"login\":\"\"}]", false, "x"));

			Set<String> logins = service.collect(RelationKind.WATCHER, REPO);

			assertThat(logins).containsExactly("w1");
		}

		@Test
		@DisplayName("Should expose a single page with its cursor")
		void shouldFetchSinglePage() throws Exception {
			when(graphQLService.executeQuery(anyString(), anyMap()))
				.thenReturn(page("stargazers", "[{\"login\":\"a\"}]", true, "next"));

			Optional<PageResult<String>> page = service.fetchPage(RelationKind.STARGAZER, REPO, "prev");

			assertThat(page).hasValueSatisfying(p -> {
				assertThat(p.items()).containsExactly("a");
				assertThat(p.endCursor()).isEqualTo("next");
				assertThat(p.hasNextPage()).isTrue();
			});
			verify(graphQLService).executeQuery(anyString(), variablesCaptor.capture());
			assertThat(variablesCaptor.getValue()).containsEntry("after", "prev");
		}

	}

}
