package org.springaicommunity.github.provider;

import org.jspecify.annotations.Nullable;

/**
 * Base class of every failure raised by the provider.
 *
 * <p>
 * Carries the endpoint path, HTTP status and a truncated response body when the failure
 * came from an HTTP exchange. None of these ever contain a bearer token, a signed JWT or
 * private key material.
 */
public class GitHubProviderException extends RuntimeException {

	/**
	 * Response bodies longer than this are cut before being attached to an exception.
	 */
	static final int MAX_BODY_LENGTH = 500;

	private final @Nullable String endpoint;

	private final int statusCode;

	private final @Nullable String responseBody;

	protected GitHubProviderException(String message) {
		this(message, null, -1, null, null);
	}

	protected GitHubProviderException(String message, @Nullable Throwable cause) {
		this(message, null, -1, null, cause);
	}

	protected GitHubProviderException(String message, @Nullable String endpoint, int statusCode,
			@Nullable String responseBody) {
		this(message, endpoint, statusCode, responseBody, null);
	}

	protected GitHubProviderException(String message, @Nullable String endpoint, int statusCode,
			@Nullable String responseBody, @Nullable Throwable cause) {
		super(message, cause);
		this.endpoint = endpoint;
		this.statusCode = statusCode;
		this.responseBody = truncate(responseBody);
	}

	/**
	 * Returns the API path the failing request was sent to.
	 * @return endpoint path such as {@code /graphql}, or null when no request was made
	 */
	public @Nullable String getEndpoint() {
		return endpoint;
	}

	/**
	 * Returns the HTTP status of the failing response.
	 * @return status code, or -1 when no response was received
	 */
	public int getStatusCode() {
		return statusCode;
	}

	/**
	 * Returns the start of the failing response body.
	 * @return body truncated to {@value #MAX_BODY_LENGTH} characters, or null
	 */
	public @Nullable String getResponseBody() {
		return responseBody;
	}

	static @Nullable String truncate(@Nullable String body) {
		if (body == null || body.length() <= MAX_BODY_LENGTH) {
			return body;
		}
		return body.substring(0, MAX_BODY_LENGTH) + "...";
	}

}
