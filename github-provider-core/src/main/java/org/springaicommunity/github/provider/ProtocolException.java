package org.springaicommunity.github.provider;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when a successful GraphQL response does not have the {@code data}/{@code errors}
 * envelope shape, which usually means the upstream API contract changed. Also thrown,
 * before anything is sent, when an operation's variables cannot be written as JSON.
 */
public class ProtocolException extends GitHubProviderException {

	public ProtocolException(String message, String endpoint, int statusCode, @Nullable String responseBody) {
		super(message, endpoint, statusCode, responseBody);
	}

	public ProtocolException(String message, String endpoint, int statusCode, @Nullable String responseBody,
			@Nullable Throwable cause) {
		super(message, endpoint, statusCode, responseBody, cause);
	}

}
