package org.springaicommunity.github.provider;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when the GitHub App private key cannot be parsed or used for RS256 signing.
 */
public class CryptoException extends GitHubProviderException {

	public CryptoException(String message, @Nullable Throwable cause) {
		super(message, cause);
	}

}
