package org.springaicommunity.github.provider;

import java.time.Duration;
import java.time.Instant;

/**
 * A signed JWT asserting the GitHub App identity. GitHub rejects App JWTs that live
 * longer than ten minutes.
 *
 * @param token compact serialized JWS
 * @param issuedAt value of the {@code iat} claim
 * @param expiresAt value of the {@code exp} claim
 */
public record SignedAppJwt(String token, Instant issuedAt, Instant expiresAt) {

	/**
	 * Longest lifetime GitHub accepts for an App JWT.
	 */
	public static final Duration MAX_LIFETIME = Duration.ofMinutes(10);

	public SignedAppJwt {
		if (Duration.between(issuedAt, expiresAt).compareTo(MAX_LIFETIME) > 0) {
			throw new IllegalArgumentException("App JWT lifetime exceeds " + MAX_LIFETIME);
		}
	}

	@Override
	public String toString() {
		return "SignedAppJwt[token=<redacted>, issuedAt=" + issuedAt + ", expiresAt=" + expiresAt + "]";
	}

}
