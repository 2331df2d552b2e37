package org.springaicommunity.github.scorer;

import java.time.Instant;

/**
 * Rate limit snapshot taken from the {@code X-RateLimit-*} response headers.
 *
 * <p>
 * Only reported to the caller; the scorer does not pace or back off on it.
 *
 * @param limit the maximum number of requests (or GraphQL points) per hour
 * @param remaining the number remaining in the current window
 * @param reset the time when the window resets (epoch seconds)
 * @param used the number used in the current window
 */
public record RateLimitInfo(int limit, int remaining, long reset, int used) {

	/**
	 * Threshold below which the remaining budget is reported at INFO level.
	 */
	public static final int LOW_REMAINING_THRESHOLD = 100;

	public Instant getResetTime() {
		return Instant.ofEpochSecond(reset);
	}

	public boolean isExceeded() {
		return remaining <= 0;
	}

	/**
	 * Returns true if fewer than {@link #LOW_REMAINING_THRESHOLD} requests remain.
	 * @return true when the budget is running low
	 */
	public boolean isLow() {
		return remaining < LOW_REMAINING_THRESHOLD;
	}

}
