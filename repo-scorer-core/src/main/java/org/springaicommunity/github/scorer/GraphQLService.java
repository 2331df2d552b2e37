package org.springaicommunity.github.scorer;

import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import java.util.Map;
import java.util.Optional;

/**
 * Executes GitHub GraphQL queries.
 *
 * <p>
 * Extracted to enable mocking in tests. Implementations never throw for transport-level
 * failures: a failed call is logged and reported as an empty result so callers can keep
 * whatever data they already gathered.
 */
public interface GraphQLService {

	/**
	 * Execute a GraphQL query with variables.
	 * @param query GraphQL query document
	 * @param variables named query variables; values may be null (e.g. the first page
	 * cursor)
	 * @return the parsed response tree, or empty if the call failed
	 */
	Optional<JsonNode> executeQuery(String query, Map<String, @Nullable Object> variables);

}
