package org.springaicommunity.github.provider;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when credential settings are missing, incomplete or contradictory, or when a
 * provider identifier is unknown. Never worth retrying.
 */
public class ConfigurationException extends GitHubProviderException {

	public ConfigurationException(String message) {
		super(message);
	}

	public ConfigurationException(String message, @Nullable Throwable cause) {
		super(message, cause);
	}

}
