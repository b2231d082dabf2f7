package org.springaicommunity.github.provider;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * A token that authorizes GraphQL requests. Instances are immutable; the token caches
 * replace them whole when they go stale.
 *
 * @param token the secret token value
 * @param expiresAt when GitHub stops accepting the token ({@link Instant#MAX} for
 * personal access tokens)
 * @param installationId installation the token was issued for, or null for a personal
 * access token
 */
public record InstallationToken(String token, Instant expiresAt, @Nullable String installationId) {

	public InstallationToken {
		Objects.requireNonNull(token, "token");
		Objects.requireNonNull(expiresAt, "expiresAt");
	}

	/**
	 * Wrap a personal access token, which never expires from the provider's point of view.
	 * @param value personal access token
	 * @return a token that is always fresh
	 */
	public static InstallationToken forPersonalToken(String value) {
		return new InstallationToken(value, Instant.MAX, null);
	}

	/**
	 * Returns true if the token can still be used at {@code now}, treating anything that
	 * expires within {@code margin} as already expired.
	 * @param now current time
	 * @param margin safety margin before the stated expiry
	 * @return true if {@code expiresAt > now + margin}
	 */
	public boolean isFreshAt(Instant now, Duration margin) {
		return expiresAt.isAfter(now.plus(margin));
	}

	@Override
	public String toString() {
		return "InstallationToken[token=<redacted>, expiresAt=" + expiresAt + ", installationId=" + installationId + "]";
	}

}
