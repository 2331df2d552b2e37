package org.springaicommunity.github.scorer;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * GraphQL transport built on the Java 11+ {@link HttpClient}.
 *
 * <p>
 * Sends the credential as a bearer token, maps every non-2xx status to a
 * {@link GitHubApiException} and records the rate limit headers of each response so they
 * can be reported through {@link #getLastRateLimitInfo()}. There is no retry: a failed
 * call surfaces immediately.
 */
public class GitHubHttpClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(GitHubHttpClient.class);

	/**
	 * Public GitHub GraphQL endpoint.
	 */
	public static final String GITHUB_GRAPHQL_ENDPOINT = "https://api.github.com/graphql";

	private static final String USER_AGENT = "repo-scorer";

	private final HttpClient httpClient;

	private final URI endpoint;

	private final String token;

	private final Duration requestTimeout;

	private volatile @Nullable RateLimitInfo lastRateLimitInfo;

	public GitHubHttpClient(String token) {
		this(token, GITHUB_GRAPHQL_ENDPOINT, Duration.ofSeconds(30), Duration.ofSeconds(60));
	}

	public GitHubHttpClient(String token, String endpoint, Duration connectTimeout, Duration requestTimeout) {
		this.token = token;
		this.endpoint = URI.create(endpoint);
		this.requestTimeout = requestTimeout;
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(connectTimeout)
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	@Override
	public @Nullable RateLimitInfo getLastRateLimitInfo() {
		return lastRateLimitInfo;
	}

	@Override
	public String postGraphQL(String body) {
		logger.debug("POST GraphQL {} ({} bytes)", endpoint, body.length());
		long start = System.currentTimeMillis();

		HttpRequest request = HttpRequest.newBuilder()
			.uri(endpoint)
			.timeout(requestTimeout)
			.header("Authorization", "Bearer " + token)
			.header("Content-Type", "application/json")
			.header("User-Agent", USER_AGENT)
			.POST(HttpRequest.BodyPublishers.ofString(body))
			.build();

		try {
			String response = executeRequest(request);
			logger.debug("POST GraphQL completed in {}ms ({} bytes)", System.currentTimeMillis() - start,
					response.length());
			return response;
		}
		catch (GitHubApiException e) {
			logger.debug("POST GraphQL failed after {}ms: {}", System.currentTimeMillis() - start, e.getMessage());
			throw e;
		}
	}

	private String executeRequest(HttpRequest request) {
		try {
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

			int remaining = parseIntHeader(response, "X-RateLimit-Remaining", -1);
			long reset = parseLongHeader(response, "X-RateLimit-Reset", -1);
			int limit = parseIntHeader(response, "X-RateLimit-Limit", -1);
			int used = parseIntHeader(response, "X-RateLimit-Used", -1);

			if (remaining >= 0) {
				RateLimitInfo info = new RateLimitInfo(limit, remaining, reset, used);
				this.lastRateLimitInfo = info;
				if (info.isLow()) {
					logger.info("Rate limit low: {}/{} remaining, resets at {}", remaining, limit,
							info.getResetTime());
				}
				else {
					logger.debug("Rate limit: {}/{} remaining", remaining, limit);
				}
			}

			int statusCode = response.statusCode();
			if (statusCode >= 200 && statusCode < 300) {
				return response.body();
			}
			else if (statusCode == 401) {
				throw new GitHubApiException("Unauthorized: Bad credentials. Check your GITHUB_TOKEN.", statusCode,
						response.body(), remaining, reset);
			}
			else if (statusCode == 403 && remaining == 0) {
				throw new GitHubApiException("Rate limit exceeded. Resets at epoch: " + reset, statusCode,
						response.body(), remaining, reset);
			}
			else if (statusCode == 429) {
				throw new GitHubApiException("Too Many Requests (429). Resets at epoch: " + reset, statusCode,
						response.body(), remaining, reset);
			}
			else {
				throw new GitHubApiException("GitHub API error: " + statusCode, statusCode, response.body(), remaining,
						reset);
			}
		}
		catch (IOException e) {
			throw new GitHubApiException("HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitHubApiException("HTTP request interrupted", e);
		}
	}

	private static int parseIntHeader(HttpResponse<?> response, String headerName, int defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Integer.parseInt(v);
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	private static long parseLongHeader(HttpResponse<?> response, String headerName, long defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Long.parseLong(v);
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

}
