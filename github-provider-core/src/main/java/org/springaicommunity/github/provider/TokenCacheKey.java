package org.springaicommunity.github.provider;

/**
 * Identifies a cache entry: tokens for the same installation with different scopes are
 * separate tokens.
 */
record TokenCacheKey(String installationId, TokenScope scope) {

	static TokenCacheKey of(Credential.AppInstallation installation) {
		return new TokenCacheKey(installation.installationId(), installation.scope());
	}

	static TokenCacheKey unscoped(String installationId) {
		return new TokenCacheKey(installationId, TokenScope.unscoped());
	}

}
