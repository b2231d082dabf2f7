package org.springaicommunity.github.provider;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when a request could not be completed: a non-2xx GraphQL response, or an I/O
 * failure before any response arrived (status -1). Retrying is left to the caller.
 */
public class TransportException extends GitHubProviderException {

	public TransportException(String message, String endpoint, int statusCode, @Nullable String responseBody) {
		super(message, endpoint, statusCode, responseBody);
	}

	public TransportException(String message, String endpoint, Throwable cause) {
		super(message, endpoint, -1, null, cause);
	}

}
