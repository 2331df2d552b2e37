package org.springaicommunity.github.scorer;

import org.jspecify.annotations.Nullable;

/**
 * Exception thrown when a GraphQL call fails at the transport level.
 *
 * <p>
 * Carries the status code, response body and rate limit headers when available so
 * the failure can be logged with enough context.
 */
public class GitHubApiException extends RuntimeException {

	private final int statusCode;

	private final @Nullable String responseBody;

	private final int rateLimitRemaining;

	private final long resetEpochSeconds;

	public GitHubApiException(String message, int statusCode, @Nullable String responseBody) {
		this(message, statusCode, responseBody, -1, -1);
	}

	public GitHubApiException(String message, int statusCode, @Nullable String responseBody,
			int rateLimitRemaining, long resetEpochSeconds) {
		super(message);
		this.statusCode = statusCode;
		this.responseBody = responseBody;
		this.rateLimitRemaining = rateLimitRemaining;
		this.resetEpochSeconds = resetEpochSeconds;
	}

	public GitHubApiException(String message, Throwable cause) {
		super(message, cause);
		this.statusCode = -1;
		this.responseBody = null;
		this.rateLimitRemaining = -1;
		this.resetEpochSeconds = -1;
	}

	public int getStatusCode() {
		return statusCode;
	}

	public @Nullable String getResponseBody() {
		return responseBody;
	}

	public int getRateLimitRemaining() {
		return rateLimitRemaining;
	}

	public long getResetEpochSeconds() {
		return resetEpochSeconds;
	}

	/**
	 * Returns true if this exception represents a rate limit error (either 403 with
	 * remaining=0 or 429).
	 */
	public boolean isRateLimitError() {
		return (statusCode == 429) || (statusCode == 403 && rateLimitRemaining == 0);
	}

}
