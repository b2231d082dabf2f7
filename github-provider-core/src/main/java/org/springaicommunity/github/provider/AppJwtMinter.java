package org.springaicommunity.github.provider;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.RSASSASigner;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

/**
 * Mints RS256 JWTs that authenticate as a GitHub App.
 *
 * <p>
 * The {@code iat} claim is backdated by {@link #CLOCK_SKEW} to tolerate clock drift
 * between this host and GitHub, and {@code exp} is {@link #VALIDITY} after the current
 * time, keeping the whole token inside GitHub's ten minute limit. Nothing is cached here;
 * every token exchange signs a fresh JWT.
 *
 * <p>
 * Private keys may be PKCS#1 ({@code BEGIN RSA PRIVATE KEY}, the format GitHub hands out)
 * or PKCS#8 ({@code BEGIN PRIVATE KEY}).
 */
public class AppJwtMinter {

	static final Duration CLOCK_SKEW = Duration.ofSeconds(60);

	static final Duration VALIDITY = Duration.ofSeconds(540);

	/**
	 * Mint a JWT for the given App.
	 * @param appId GitHub App id, used as issuer
	 * @param privateKeyPem PEM-encoded RSA private key
	 * @param now current time
	 * @return the signed JWT
	 * @throws CryptoException if the key is malformed, not RSA, or signing fails
	 */
	public SignedAppJwt mint(String appId, byte[] privateKeyPem, Instant now) {
		RSAKey key = parsePrivateKey(privateKeyPem);
		Instant issuedAt = now.minus(CLOCK_SKEW);
		Instant expiresAt = now.plus(VALIDITY);

		JWTClaimsSet claims = new JWTClaimsSet.Builder().issuer(appId)
			.issueTime(Date.from(issuedAt))
			.expirationTime(Date.from(expiresAt))
			.build();
		SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.RS256), claims);
		try {
			jwt.sign(new RSASSASigner(key));
		}
		catch (JOSEException e) {
			throw new CryptoException("Failed to sign GitHub App JWT for app " + appId + ": " + e.getMessage(), e);
		}
		return new SignedAppJwt(jwt.serialize(), issuedAt, expiresAt);
	}

	private static RSAKey parsePrivateKey(byte[] privateKeyPem) {
		JWK jwk;
		try {
			jwk = JWK.parseFromPEMEncodedObjects(new String(privateKeyPem, StandardCharsets.UTF_8));
		}
		catch (JOSEException | RuntimeException e) {
			throw new CryptoException("GitHub App private key is not a readable PEM key: " + e.getMessage(), e);
		}
		if (!(jwk instanceof RSAKey) || !jwk.isPrivate()) {
			throw new CryptoException("GitHub App private key must be an RSA private key, got " + jwk.getKeyType()
					+ (jwk.isPrivate() ? "" : " public key"), null);
		}
		return (RSAKey) jwk;
	}

}
