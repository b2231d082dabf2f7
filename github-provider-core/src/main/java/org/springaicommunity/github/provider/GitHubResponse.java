package org.springaicommunity.github.provider;

/**
 * Raw response returned by a {@link GitHubClient}.
 *
 * @param endpoint API path the request was sent to, without the base URL
 * @param statusCode HTTP status code
 * @param body response body, empty when the server sent none
 */
public record GitHubResponse(String endpoint, int statusCode, String body) {

	/**
	 * Returns true for 2xx responses.
	 * @return true if the status code is in the 200-299 range
	 */
	public boolean isSuccessful() {
		return statusCode >= 200 && statusCode < 300;
	}

}
