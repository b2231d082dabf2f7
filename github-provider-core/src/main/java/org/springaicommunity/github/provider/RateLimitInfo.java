package org.springaicommunity.github.provider;

import java.time.Instant;

/**
 * Rate limit status reported by GitHub in the {@code X-RateLimit-*} response headers.
 *
 * @param limit the maximum number of requests (or GraphQL points) per window
 * @param remaining what is left in the current window
 * @param reset when the window resets (epoch seconds)
 * @param used what has been consumed in the current window
 */
public record RateLimitInfo(int limit, int remaining, long reset, int used) {

	/**
	 * Returns the reset time as an Instant.
	 * @return the reset time
	 */
	public Instant getResetTime() {
		return Instant.ofEpochSecond(reset);
	}

	/**
	 * Returns true if the budget is used up.
	 * @return true if nothing remains
	 */
	public boolean isExceeded() {
		return remaining <= 0;
	}

}
