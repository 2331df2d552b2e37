package org.springaicommunity.github.scorer.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIf;

import java.util.Optional;

import static org.assertj.core.api.Assertions.*;

import org.springaicommunity.github.scorer.*;

/**
 * Simple integration tests against the live GitHub GraphQL API.
 *
 * <p>
 * Only verifies that each query shape is accepted and parsed; no assertions about
 * actual counts. Requires GITHUB_TOKEN.
 */
@DisplayName("Simple Integration Tests")
@EnabledIf("isGitHubTokenAvailable")
class SimpleIntegrationIT {

	private static final RepositoryId REPO = new RepositoryId("octocat", "Hello-World");

	private GraphQLService graphQLService;

	private ScoringProperties properties;

	static boolean isGitHubTokenAvailable() {
		return EnvironmentSupport.githubToken() != null;
	}

	@BeforeEach
	void setUp() {
		properties = new ScoringProperties();
		properties.setPageSize(5);
		graphQLService = RepoScorerBuilder.create().tokenFromEnv().properties(properties).buildGraphQLService();
	}

	@Test
	@DisplayName("Repository counts query")
	void repositoryCounts() {
		RepositoryCounts counts = new RepositoryCountService(graphQLService).count(REPO);

		assertThat(counts.starCount()).isPositive();
	}

	@Test
	@DisplayName("One page of every relation")
	void relationPages() {
		RelationCollectionService collector = new RelationCollectionService(graphQLService, properties);

		for (RelationKind kind : RelationKind.values()) {
			Optional<PageResult<String>> page = collector.fetchPage(kind, REPO, null);
			assertThat(page).as(kind.connectionField()).isPresent();
			assertThat(page.get().items()).hasSizeLessThanOrEqualTo(5);
		}
	}

	@Test
	@DisplayName("User profile query")
	void userProfile() {
		UserSignificanceClassifier classifier = RepoScorerBuilder.create()
			.graphQLService(graphQLService)
			.buildClassifier();

		assertThatCode(() -> classifier.classify("octocat")).doesNotThrowAnyException();
		assertThat(classifier.fetchProfile("octocat").ownedRepositoryCount()).isPositive();
	}

}
