package org.springaicommunity.github.scorer;

import org.jspecify.annotations.Nullable;

/**
 * Transport for the GitHub GraphQL API.
 *
 * <p>
 * Implementations carry the credential and endpoint; callers only supply the JSON request
 * document. Kept as an interface so services can be tested against a mock and so
 * decorators (logging, recording) can be layered on top.
 */
public interface GitHubClient {

	/**
	 * Execute a POST request against the GraphQL endpoint.
	 * @param body request body (JSON with {@code query} and {@code variables})
	 * @return response body as String
	 * @throws GitHubApiException if the request fails or returns a
	 * non-success status
	 */
	String postGraphQL(String body);

	/**
	 * Rate limit information from the most recent response, or null if no rate limit
	 * headers have been observed yet.
	 * @return last observed RateLimitInfo, or null
	 */
	default @Nullable RateLimitInfo getLastRateLimitInfo() {
		return null;
	}

}
