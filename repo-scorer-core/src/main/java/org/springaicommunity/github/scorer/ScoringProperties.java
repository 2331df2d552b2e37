package org.springaicommunity.github.scorer;

import java.time.Duration;

/**
 * Configuration properties for repository scoring.
 *
 * <p>
 * Properties can be set directly via setters, overlaid from the command line by
 * {@link ArgumentParser}, and passed to {@link RepoScorerBuilder}. Defaults reproduce the
 * reference scoring rule: Microsoft affiliation, or at least 50 contributions in the past
 * 365 days together with at least 5 owned repositories.
 */
public class ScoringProperties {

	/**
	 * GraphQL endpoint. Override for GitHub Enterprise Server.
	 */
	private String graphqlEndpoint = GitHubHttpClient.GITHUB_GRAPHQL_ENDPOINT;

	/**
	 * Items requested per page of a relation connection. GitHub caps this at 100.
	 */
	private int pageSize = 100;

	/**
	 * Case-insensitive substring of the declared company that marks an organization user.
	 */
	private String organizationKeyword = "microsoft";

	/**
	 * Minimum contributions in the trailing window for the activity rule (inclusive).
	 */
	private int minContributions = 50;

	/**
	 * Minimum owned repositories for the activity rule (inclusive).
	 */
	private int minOwnedRepositories = 5;

	/**
	 * Length of the trailing contribution window in days.
	 */
	private int contributionWindowDays = 365;

	/**
	 * Number of worker threads for relation collection and user classification. 1 runs
	 * everything sequentially.
	 */
	private int concurrency = 4;

	private Duration connectTimeout = Duration.ofSeconds(30);

	private Duration requestTimeout = Duration.ofSeconds(60);

	public String getGraphqlEndpoint() {
		return graphqlEndpoint;
	}

	public void setGraphqlEndpoint(String graphqlEndpoint) {
		this.graphqlEndpoint = graphqlEndpoint;
	}

	public int getPageSize() {
		return pageSize;
	}

	/**
	 * Sets the page size for relation collection.
	 * @param pageSize items per page, between 1 and 100
	 */
	public void setPageSize(int pageSize) {
		if (pageSize < 1 || pageSize > 100) {
			throw new IllegalArgumentException("Page size must be between 1 and 100 (got: " + pageSize + ")");
		}
		this.pageSize = pageSize;
	}

	public String getOrganizationKeyword() {
		return organizationKeyword;
	}

	/**
	 * Sets the organization keyword matched against the declared company.
	 * @param organizationKeyword non-blank keyword, matched case-insensitively
	 */
	public void setOrganizationKeyword(String organizationKeyword) {
		if (organizationKeyword.isBlank()) {
			throw new IllegalArgumentException("Organization keyword must not be blank");
		}
		this.organizationKeyword = organizationKeyword;
	}

	public int getMinContributions() {
		return minContributions;
	}

	public void setMinContributions(int minContributions) {
		this.minContributions = minContributions;
	}

	public int getMinOwnedRepositories() {
		return minOwnedRepositories;
	}

	public void setMinOwnedRepositories(int minOwnedRepositories) {
		this.minOwnedRepositories = minOwnedRepositories;
	}

	public int getContributionWindowDays() {
		return contributionWindowDays;
	}

	public void setContributionWindowDays(int contributionWindowDays) {
		this.contributionWindowDays = contributionWindowDays;
	}

	public int getConcurrency() {
		return concurrency;
	}

	/**
	 * Sets the worker pool size.
	 * @param concurrency number of threads, at least 1
	 */
	public void setConcurrency(int concurrency) {
		if (concurrency < 1) {
			throw new IllegalArgumentException("Concurrency must be at least 1 (got: " + concurrency + ")");
		}
		this.concurrency = concurrency;
	}

	public Duration getConnectTimeout() {
		return connectTimeout;
	}

	public void setConnectTimeout(Duration connectTimeout) {
		this.connectTimeout = connectTimeout;
	}

	public Duration getRequestTimeout() {
		return requestTimeout;
	}

	public void setRequestTimeout(Duration requestTimeout) {
		this.requestTimeout = requestTimeout;
	}

}
