package org.springaicommunity.github.scorer;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// Repositories to score; empty = prompt interactively
	public List<String> repositories = new ArrayList<>();

	// Scoring rule
	public String organizationKeyword;

	public int minContributions;

	public int minOwnedRepositories;

	// Execution
	public int concurrency;

	public String graphqlEndpoint;

	// Output
	public boolean json = false;

	public boolean verbose = false;

	public boolean helpRequested = false;

	public ParsedConfiguration(ScoringProperties defaultProperties) {
		this.organizationKeyword = defaultProperties.getOrganizationKeyword();
		this.minContributions = defaultProperties.getMinContributions();
		this.minOwnedRepositories = defaultProperties.getMinOwnedRepositories();
		this.concurrency = defaultProperties.getConcurrency();
		this.graphqlEndpoint = defaultProperties.getGraphqlEndpoint();
	}

	/**
	 * Returns true if no repository was given and addresses should be read from the
	 * console.
	 */
	public boolean isInteractive() {
		return repositories.isEmpty();
	}

	/**
	 * Copy the scoring options onto a properties instance.
	 * @param properties the properties to update
	 * @return the same properties instance
	 */
	public ScoringProperties applyTo(ScoringProperties properties) {
		properties.setOrganizationKeyword(organizationKeyword);
		properties.setMinContributions(minContributions);
		properties.setMinOwnedRepositories(minOwnedRepositories);
		properties.setConcurrency(concurrency);
		properties.setGraphqlEndpoint(graphqlEndpoint);
		return properties;
	}

	/**
	 * Label used for the organization in reports, e.g. {@code MICROSOFT}.
	 */
	public String organizationLabel() {
		return organizationKeyword.toUpperCase(Locale.ROOT);
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "repositories=" + repositories + ", organizationKeyword='"
				+ organizationKeyword + '\'' + ", minContributions=" + minContributions + ", minOwnedRepositories="
				+ minOwnedRepositories + ", concurrency=" + concurrency + ", graphqlEndpoint='" + graphqlEndpoint
				+ '\'' + ", json=" + json + ", verbose=" + verbose + ", helpRequested=" + helpRequested + '}';
	}

}
