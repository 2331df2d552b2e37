package org.springaicommunity.github.scorer.cli;

import ch.qos.logback.classic.Level;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.github.scorer.*;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Repository Scorer CLI Application
 *
 * Plain Java command-line application that scores the engagement quality of GitHub
 * repositories. No Spring dependencies - uses RepoScorerBuilder for service wiring.
 *
 * Usage: java -jar repo-scorer-cli.jar [OPTIONS] [REPO_ADDRESS...]
 *
 * Environment Variables: GITHUB_TOKEN - GitHub personal access token for authentication
 *
 * Examples: java -jar repo-scorer-cli.jar --repo https://github.com/octocat/Hello-World
 * java -jar repo-scorer-cli.jar octocat/Hello-World --json java -jar repo-scorer-cli.jar
 * (prompts for addresses until an empty line)
 */
public class RepoScorerCli {

	private static final Logger logger = LoggerFactory.getLogger(RepoScorerCli.class);

	static final String PROMPT = "Enter GitHub repo address (e.g., https://github.com/owner/repo): ";

	static final int EXIT_OK = 0;

	static final int EXIT_ERROR = 1;

	static final int EXIT_INVALID_ADDRESS = 2;

	private final BufferedReader in;

	private final PrintStream out;

	public RepoScorerCli(BufferedReader in, PrintStream out) {
		this.in = in;
		this.out = out;
	}

	public static void main(String[] args) {
		RepoScorerCli cli = new RepoScorerCli(
				new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
		try {
			int exitCode = cli.run(args);
			if (exitCode != EXIT_OK) {
				System.exit(exitCode);
			}
		}
		catch (Exception e) {
			logger.error("Scoring failed: {}", e.getMessage());
			System.exit(EXIT_ERROR);
		}
	}

	public int run(String[] args) throws IOException {
		ScoringProperties properties = new ScoringProperties();
		ArgumentParser argumentParser = new ArgumentParser(properties);

		// Check for help request first
		if (argumentParser.isHelpRequested(args)) {
			out.println(argumentParser.generateHelpText());
			return EXIT_OK;
		}

		ParsedConfiguration config;
		try {
			config = argumentParser.parseAndValidate(args);
		}
		catch (IllegalArgumentException e) {
			logger.error(e.getMessage());
			out.println("Run with --help for usage.");
			return EXIT_ERROR;
		}

		String token;
		try {
			token = argumentParser.requireToken();
		}
		catch (IllegalStateException e) {
			out.println("Token required for stargazer, watcher and user info. Exiting.");
			logger.error(e.getMessage());
			return EXIT_ERROR;
		}

		if (config.verbose) {
			enableVerboseLogging();
		}
		logConfiguration(config);

		config.applyTo(properties);
		GitHubHttpClient httpClient = new GitHubHttpClient(token, properties.getGraphqlEndpoint(),
				properties.getConnectTimeout(), properties.getRequestTimeout());
		EngagementScorer scorer = RepoScorerBuilder.create()
			.httpClient(httpClient)
			.properties(properties)
			.buildEngagementScorer();

		int exitCode = execute(config, scorer);

		RateLimitInfo rateLimit = httpClient.getLastRateLimitInfo();
		if (rateLimit != null) {
			logger.info("Rate limit: {}/{} remaining, resets at {}", rateLimit.remaining(), rateLimit.limit(),
					rateLimit.getResetTime());
		}
		return exitCode;
	}

	/**
	 * Score the configured repositories, or prompt for addresses when none were given.
	 * @param config parsed configuration
	 * @param scorer the scorer to use
	 * @return process exit code
	 */
	int execute(ParsedConfiguration config, EngagementScorer scorer) throws IOException {
		ScoreReportPrinter printer = new ScoreReportPrinter(config.organizationLabel());

		if (!config.isInteractive()) {
			int exitCode = EXIT_OK;
			for (String address : config.repositories) {
				if (!scoreAndPrint(address, scorer, printer, config.json)) {
					exitCode = EXIT_INVALID_ADDRESS;
				}
			}
			return exitCode;
		}

		String address = prompt();
		while (address != null && !address.isEmpty()) {
			scoreAndPrint(address, scorer, printer, config.json);
			address = prompt();
		}
		return EXIT_OK;
	}

	private boolean scoreAndPrint(String address, EngagementScorer scorer, ScoreReportPrinter printer,
			boolean json) {
		try {
			ScoreResult result = scorer.score(address);
			out.println(json ? printer.formatJson(result) : printer.format(result));
			return true;
		}
		catch (InvalidRepositoryAddressException e) {
			out.println(e.getMessage());
			logger.warn("Skipping address '{}'", e.getAddress());
			return false;
		}
	}

	private @Nullable String prompt() throws IOException {
		out.print(PROMPT);
		out.flush();
		String line = in.readLine();
		return line == null ? null : line.strip();
	}

	private static void enableVerboseLogging() {
		Logger scorerLogger = LoggerFactory.getLogger("org.springaicommunity.github.scorer");
		if (scorerLogger instanceof ch.qos.logback.classic.Logger logbackLogger) {
			logbackLogger.setLevel(Level.DEBUG);
		}
	}

	private static void logConfiguration(ParsedConfiguration config) {
		logger.info("Configuration:");
		logger.info("  Repositories: {}", config.isInteractive() ? "(interactive)" : config.repositories);
		logger.info("  Organization keyword: {}", config.organizationKeyword);
		logger.info("  Min contributions: {}", config.minContributions);
		logger.info("  Min owned repositories: {}", config.minOwnedRepositories);
		logger.info("  Concurrency: {}", config.concurrency);
		logger.info("  Endpoint: {}", config.graphqlEndpoint);
		logger.info("  JSON output: {}", config.json);
		logger.info("  Verbose: {}", config.verbose);
	}

}
