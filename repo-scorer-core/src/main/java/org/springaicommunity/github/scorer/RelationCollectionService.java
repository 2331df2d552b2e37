package org.springaicommunity.github.scorer;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Collects the users related to a repository by walking a cursor-paginated connection.
 *
 * <p>
 * Collection is fail-soft: when a page cannot be fetched, when the repository is absent
 * or inaccessible, or when the calling thread is interrupted, the logins gathered so far
 * are returned instead of an error.
 */
public class RelationCollectionService {

	private static final Logger logger = LoggerFactory.getLogger(RelationCollectionService.class);

	private final GraphQLService graphQLService;

	private final int pageSize;

	public RelationCollectionService(GraphQLService graphQLService, ScoringProperties properties) {
		this.graphQLService = graphQLService;
		this.pageSize = properties.getPageSize();
	}

	/**
	 * Collect the unique logins of every user in the given relation.
	 * @param kind the relation to walk
	 * @param repositoryId the repository
	 * @return the logins collected, possibly partial
	 */
	public Set<String> collect(RelationKind kind, RepositoryId repositoryId) {
		logger.debug("Collecting {} for {}", kind.connectionField(), repositoryId);

		Set<String> logins = new LinkedHashSet<>();
		String cursor = null;
		int pages = 0;

		while (true) {
			if (Thread.currentThread().isInterrupted()) {
				logger.warn("Collection of {} for {} interrupted after {} pages", kind.connectionField(), repositoryId,
						pages);
				break;
			}

			Optional<PageResult<String>> page = fetchPage(kind, repositoryId, cursor);
			if (page.isEmpty()) {
				logger.warn("Stopping collection of {} for {} after {} pages: no data returned",
						kind.connectionField(), repositoryId, pages);
				break;
			}

			pages++;
			logins.addAll(page.get().items());

			if (!page.get().hasNextPage()) {
				break;
			}
			if (page.get().endCursor() == null) {
				logger.warn("Page {} of {} for {} reports more pages but no cursor", pages, kind.connectionField(),
						repositoryId);
				break;
			}
			cursor = page.get().endCursor();
		}

		logger.info("Collected {} unique {} for {} ({} pages)", logins.size(), kind.connectionField(), repositoryId,
				pages);
		return logins;
	}

	/**
	 * Fetch a single page of a relation.
	 * @param kind the relation
	 * @param repositoryId the repository
	 * @param cursor the previous page's end cursor, or null for the first page
	 * @return the page, or empty if the query failed or the repository is absent
	 */
	public Optional<PageResult<String>> fetchPage(RelationKind kind, RepositoryId repositoryId,
			@Nullable String cursor) {
		Map<String, @Nullable Object> variables = new LinkedHashMap<>();
		variables.put("owner", repositoryId.owner());
		variables.put("repo", repositoryId.name());
		variables.put("first", pageSize);
		variables.put("after", cursor);

		Optional<JsonNode> response = graphQLService.executeQuery(kind.query(), variables);
		if (response.isEmpty()) {
			return Optional.empty();
		}

		Optional<JsonNode> connection = JsonNodeUtils.getNode(response.get(), "data", "repository",
				kind.connectionField());
		if (connection.isEmpty()) {
			logger.warn("Repository {} not found or inaccessible", repositoryId);
			return Optional.empty();
		}

		List<String> logins = JsonNodeUtils.getArray(connection.get(), "nodes")
			.stream()
			.map(kind::loginOf)
			.flatMap(Optional::stream)
			.toList();
		boolean hasNextPage = JsonNodeUtils.getBoolean(connection.get(), "pageInfo", "hasNextPage");
		String endCursor = JsonNodeUtils.getString(connection.get(), "pageInfo", "endCursor").orElse(null);

		logger.debug("Fetched {} {} (hasNextPage={})", logins.size(), kind.connectionField(), hasNextPage);
		return Optional.of(new PageResult<>(logins, endCursor, hasNextPage));
	}

}
