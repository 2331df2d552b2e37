package org.springaicommunity.github.scorer;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.time.Clock;

/**
 * Builder wiring the scoring services without a dependency injection container.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Token from GITHUB_TOKEN (environment or .env)
 * EngagementScorer scorer = RepoScorerBuilder.create()
 *     .tokenFromEnv()
 *     .buildEngagementScorer();
 *
 * // With custom scoring rule
 * ScoringProperties props = new ScoringProperties();
 * props.setOrganizationKeyword("google");
 * props.setConcurrency(8);
 *
 * EngagementScorer scorer = RepoScorerBuilder.create()
 *     .token("ghp_xxxxx")
 *     .properties(props)
 *     .buildEngagementScorer();
 *
 * // For testing with a mock transport and a fixed clock
 * GitHubClient mockClient = mock(GitHubClient.class);
 * EngagementScorer testScorer = RepoScorerBuilder.create()
 *     .httpClient(mockClient)
 *     .clock(Clock.fixed(instant, ZoneOffset.UTC))
 *     .buildEngagementScorer();
 * }
 * </pre>
 */
public class RepoScorerBuilder {

	private @Nullable String token;

	private ScoringProperties properties;

	private @Nullable ObjectMapper objectMapper;

	private @Nullable GitHubClient httpClient;

	private @Nullable GraphQLService graphQLService;

	private Clock clock = Clock.systemUTC();

	private RepoScorerBuilder() {
		this.properties = new ScoringProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new RepoScorerBuilder
	 */
	public static RepoScorerBuilder create() {
		return new RepoScorerBuilder();
	}

	/**
	 * Set the GitHub token directly.
	 * @param token GitHub personal access token
	 * @return this builder
	 */
	public RepoScorerBuilder token(String token) {
		this.token = token;
		return this;
	}

	/**
	 * Read the GitHub token from {@code GITHUB_TOKEN} via {@link EnvironmentSupport}.
	 * @return this builder
	 * @throws IllegalStateException if GITHUB_TOKEN is not set
	 */
	public RepoScorerBuilder tokenFromEnv() {
		this.token = EnvironmentSupport.githubToken();
		if (this.token == null) {
			throw new IllegalStateException(
					"GITHUB_TOKEN environment variable is required. Please set your GitHub personal access token.");
		}
		return this;
	}

	/**
	 * Set scoring properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public RepoScorerBuilder properties(@Nullable ScoringProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set a custom ObjectMapper for GraphQL bodies.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public RepoScorerBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom GitHubClient implementation. When a custom client is provided, the
	 * token is not required.
	 * @param httpClient custom GitHubClient implementation (null to use default)
	 * @return this builder
	 */
	public RepoScorerBuilder httpClient(@Nullable GitHubClient httpClient) {
		this.httpClient = httpClient;
		return this;
	}

	/**
	 * Set a custom GraphQLService, bypassing the HTTP layer entirely. When provided,
	 * neither token nor httpClient is used.
	 * @param graphQLService custom GraphQLService (null to use default)
	 * @return this builder
	 */
	public RepoScorerBuilder graphQLService(@Nullable GraphQLService graphQLService) {
		this.graphQLService = graphQLService;
		return this;
	}

	/**
	 * Set the clock the contribution window is computed from.
	 * @param clock the clock (default: system UTC)
	 * @return this builder
	 */
	public RepoScorerBuilder clock(Clock clock) {
		this.clock = clock;
		return this;
	}

	/**
	 * Build an EngagementScorer.
	 * @return configured EngagementScorer
	 */
	public EngagementScorer buildEngagementScorer() {
		GraphQLService service = buildGraphQLService();
		return new EngagementScorer(new RelationCollectionService(service, properties),
				new RepositoryCountService(service), new UserSignificanceClassifier(service, properties, clock),
				properties.getConcurrency());
	}

	/**
	 * Build the UserSignificanceClassifier directly (for advanced usage).
	 * @return configured UserSignificanceClassifier
	 */
	public UserSignificanceClassifier buildClassifier() {
		return new UserSignificanceClassifier(buildGraphQLService(), properties, clock);
	}

	/**
	 * Build the RelationCollectionService directly (for advanced usage).
	 * @return configured RelationCollectionService
	 */
	public RelationCollectionService buildRelationCollector() {
		return new RelationCollectionService(buildGraphQLService(), properties);
	}

	/**
	 * Build the GraphQLService directly (for advanced usage).
	 * @return configured GraphQLService
	 */
	public GraphQLService buildGraphQLService() {
		if (graphQLService != null) {
			return graphQLService;
		}
		ObjectMapper mapper = this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();
		return new GitHubGraphQLService(resolveHttpClient(), mapper);
	}

	private GitHubClient resolveHttpClient() {
		if (httpClient != null) {
			return httpClient;
		}
		if (token == null || token.trim().isEmpty()) {
			throw new IllegalStateException("GitHub token is required. Call token() or tokenFromEnv() first.");
		}
		return new GitHubHttpClient(token, properties.getGraphqlEndpoint(), properties.getConnectTimeout(),
				properties.getRequestTimeout());
	}

}
