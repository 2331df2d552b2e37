package org.springaicommunity.github.scorer;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * The ways a user can engage with a repository.
 *
 * <p>
 * Each kind maps to a paginated connection on the GraphQL {@code Repository} type and
 * knows where the user login sits inside a connection node. Forks are counted through
 * the login of the fork's owner.
 */
public enum RelationKind {

	STARGAZER("stargazers", "nodes { login }", "login"),

	WATCHER("watchers", "nodes { login }", "login"),

	FORKER("forks", "nodes { owner { login } }", "owner", "login");

	private static final String QUERY_TEMPLATE = """
			query($owner: String!, $repo: String!, $first: Int!, $after: String) {
			  repository(owner: $owner, name: $repo) {
			    %s(first: $first, after: $after) {
			      pageInfo { hasNextPage endCursor }
			      %s
			    }
			  }
			}
			""";

	private final String connectionField;

	private final String query;

	private final String[] loginPath;

	RelationKind(String connectionField, String nodeSelection, String... loginPath) {
		this.connectionField = connectionField;
		this.query = QUERY_TEMPLATE.formatted(connectionField, nodeSelection);
		this.loginPath = loginPath;
	}

	/**
	 * Name of the connection field on {@code Repository}, e.g. {@code stargazers}.
	 * @return the connection field name
	 */
	public String connectionField() {
		return connectionField;
	}

	/**
	 * GraphQL document fetching one page of this relation. Variables: {@code owner},
	 * {@code repo}, {@code first}, {@code after}.
	 * @return the query document
	 */
	public String query() {
		return query;
	}

	/**
	 * Extract the user login from one connection node.
	 * @param node a node of this relation's connection
	 * @return the login, or empty if the node carries none (e.g. a deleted fork owner)
	 */
	public Optional<String> loginOf(JsonNode node) {
		return JsonNodeUtils.getString(node, loginPath).filter(login -> !login.isEmpty());
	}

}
