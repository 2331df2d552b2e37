package org.springaicommunity.github.scorer;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line argument parser for the repository scorer. Pure Java implementation with
 * no framework dependencies for maximum testability.
 */
public class ArgumentParser {

	private final ScoringProperties defaultProperties;

	public ArgumentParser(ScoringProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments and return configuration. Arguments that are not
	 * options are taken as repository addresses.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-r", "--repo":
					config.repositories.add(getRequiredValue(args, i, "repo"));
					i++; // Skip next argument since we consumed it
					break;

				case "--org":
					config.organizationKeyword = getRequiredValue(args, i, "org").trim();
					i++;
					break;

				case "--min-contributions":
					config.minContributions = parseNonNegative(getRequiredValue(args, i, "min-contributions"),
							"min-contributions");
					i++;
					break;

				case "--min-repos":
					config.minOwnedRepositories = parseNonNegative(getRequiredValue(args, i, "min-repos"),
							"min-repos");
					i++;
					break;

				case "-c", "--concurrency":
					config.concurrency = parseNonNegative(getRequiredValue(args, i, "concurrency"), "concurrency");
					i++;
					break;

				case "--endpoint":
					config.graphqlEndpoint = getRequiredValue(args, i, "endpoint");
					i++;
					break;

				case "--json":
					config.json = true;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					config.repositories.add(arg);
					break;
			}
		}

		validateConfiguration(config);

		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: repo-scorer [OPTIONS] [REPO_ADDRESS...]\n");
		help.append("\n");
		help.append("Score the engagement quality of GitHub repositories from their stargazers,\n");
		help.append("watchers and forkers. Without a repository address, addresses are read\n");
		help.append("from the console until an empty line is entered.\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help                Show this help message\n");
		help.append("    -r, --repo ADDRESS        Repository to score, e.g. https://github.com/owner/repo\n");
		help.append("                              or owner/repo (repeatable)\n");
		help.append("    -c, --concurrency N       Worker threads for collection and classification (default: ")
			.append(defaultProperties.getConcurrency())
			.append(")\n");
		help.append("    --endpoint URL            GraphQL endpoint (default: ")
			.append(defaultProperties.getGraphqlEndpoint())
			.append(")\n");
		help.append("    --json                    Print each score as JSON\n");
		help.append("    -v, --verbose             Enable verbose logging\n");
		help.append("\n");
		help.append("SCORING OPTIONS:\n");
		help.append("    --org KEYWORD             Company keyword for organization users (default: ")
			.append(defaultProperties.getOrganizationKeyword())
			.append(")\n");
		help.append("    --min-contributions N     Contributions in the past year for power users (default: ")
			.append(defaultProperties.getMinContributions())
			.append(")\n");
		help.append("    --min-repos N             Owned repositories for power users (default: ")
			.append(defaultProperties.getMinOwnedRepositories())
			.append(")\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    GITHUB_TOKEN              GitHub personal access token (required, may be set in .env)\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    repo-scorer --repo https://github.com/octocat/Hello-World\n");
		help.append("    repo-scorer octocat/Hello-World spring-projects/spring-ai --json\n");
		help.append("    repo-scorer --org google --min-contributions 100\n");
		help.append("\n");

		return help.toString();
	}

	/**
	 * Validate environment and return the GitHub token.
	 * @return the token from GITHUB_TOKEN ({@code .env} or environment)
	 * @throws IllegalStateException if no token is configured
	 */
	public String requireToken() {
		String token = EnvironmentSupport.githubToken();
		if (token == null) {
			throw new IllegalStateException(
					"GITHUB_TOKEN environment variable is required. Please set your GitHub personal access token: export GITHUB_TOKEN=your_token_here");
		}
		return token;
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private int parseNonNegative(String value, String optionName) {
		try {
			int parsed = Integer.parseInt(value);
			if (parsed < 0) {
				throw new IllegalArgumentException(optionName + " must not be negative: " + parsed);
			}
			return parsed;
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException(
					"Invalid " + optionName + " '" + value + "': must be a non-negative integer");
		}
	}

	private void validateConfiguration(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		if (config.organizationKeyword.isBlank()) {
			errors.add("Organization keyword cannot be empty");
		}

		if (config.concurrency < 1) {
			errors.add("Concurrency must be at least 1 (got: " + config.concurrency + ")");
		}
		else if (config.concurrency > 64) {
			errors.add("Concurrency too large (got: " + config.concurrency + ", max: 64)");
		}

		try {
			URI endpoint = URI.create(config.graphqlEndpoint);
			if (!"https".equals(endpoint.getScheme()) && !"http".equals(endpoint.getScheme())) {
				errors.add("Endpoint must be an http(s) URL (got: " + config.graphqlEndpoint + ")");
			}
		}
		catch (IllegalArgumentException e) {
			errors.add("Endpoint is not a valid URL: " + config.graphqlEndpoint);
		}

		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

}
