package org.springaicommunity.github.provider;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when GitHub refuses to issue an installation token, or answers with something
 * that is not a usable token. The cached token for the installation is left untouched.
 */
public class AuthException extends GitHubProviderException {

	public AuthException(String message, String endpoint, int statusCode) {
		super(message, endpoint, statusCode, null);
	}

	public AuthException(String message, String endpoint, int statusCode, @Nullable String responseBody) {
		super(message, endpoint, statusCode, responseBody);
	}

	public AuthException(String message, String endpoint, int statusCode, @Nullable Throwable cause) {
		super(message, endpoint, statusCode, null, cause);
	}

}
