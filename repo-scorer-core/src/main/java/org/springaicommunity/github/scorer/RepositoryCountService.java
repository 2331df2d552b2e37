package org.springaicommunity.github.scorer;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Reads the star, watcher and fork totals of a repository in a single query.
 *
 * <p>
 * The counts are reporting-only, so a failed query or an absent repository yields zeros
 * rather than an error.
 */
public class RepositoryCountService {

	private static final Logger logger = LoggerFactory.getLogger(RepositoryCountService.class);

	static final String COUNTS_QUERY = """
			query($owner: String!, $repo: String!) {
			  repository(owner: $owner, name: $repo) {
			    stargazerCount
			    watchers { totalCount }
			    forkCount
			  }
			}
			""";

	private final GraphQLService graphQLService;

	public RepositoryCountService(GraphQLService graphQLService) {
		this.graphQLService = graphQLService;
	}

	/**
	 * Fetch the aggregate counts for a repository.
	 * @param repositoryId the repository
	 * @return the counts, all zero if they could not be fetched
	 */
	public RepositoryCounts count(RepositoryId repositoryId) {
		Map<String, @Nullable Object> variables = Map.of("owner", repositoryId.owner(), "repo", repositoryId.name());

		Optional<JsonNode> repository = graphQLService.executeQuery(COUNTS_QUERY, variables)
			.flatMap(response -> JsonNodeUtils.getNode(response, "data", "repository"));
		if (repository.isEmpty()) {
			logger.warn("Could not read counts for {}; reporting zeros", repositoryId);
			return RepositoryCounts.zero();
		}

		RepositoryCounts counts = new RepositoryCounts(
				JsonNodeUtils.getInt(repository.get(), "stargazerCount").orElse(0),
				JsonNodeUtils.getInt(repository.get(), "watchers", "totalCount").orElse(0),
				JsonNodeUtils.getInt(repository.get(), "forkCount").orElse(0));
		logger.debug("Counts for {}: {}", repositoryId, counts);
		return counts;
	}

}
