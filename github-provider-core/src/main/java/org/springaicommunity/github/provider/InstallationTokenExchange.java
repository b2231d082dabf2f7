package org.springaicommunity.github.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Trades a freshly minted App JWT for an installation access token.
 *
 * <p>
 * Shared by {@link InstallationTokenCache} and {@link AsyncInstallationTokenCache}, which
 * decide <em>when</em> to exchange; this class only knows <em>how</em>. Every failure
 * surfaces as {@link AuthException}, except an unusable private key, which surfaces as
 * {@link CryptoException}.
 *
 * <p>
 * Installation ids can also be looked up here from a repository or account the App is
 * installed on.
 */
public class InstallationTokenExchange {

	private static final Logger logger = LoggerFactory.getLogger(InstallationTokenExchange.class);

	private final GitHubClient client;

	private final AppJwtMinter minter;

	private final ObjectMapper objectMapper;

	public InstallationTokenExchange(GitHubClient client, AppJwtMinter minter, ObjectMapper objectMapper) {
		this.client = client;
		this.minter = minter;
		this.objectMapper = objectMapper;
	}

	/**
	 * Exchange a new JWT for an installation token, blocking until GitHub answers.
	 * @param credential App installation to issue the token for
	 * @param now current time, used to mint the JWT
	 * @return the issued token
	 * @throws AuthException if the exchange fails
	 * @throws CryptoException if the App private key is unusable
	 */
	public InstallationToken exchange(Credential.AppInstallation credential, Instant now) {
		SignedAppJwt jwt = minter.mint(credential.appId(), credential.privateKey(), now);
		GitHubResponse response;
		try {
			response = client.createAccessToken(credential.installationId(), jwt.token(), scopeBody(credential.scope()));
		}
		catch (TransportException e) {
			throw exchangeFailed(credential.installationId(), e);
		}
		return parse(credential.installationId(), response);
	}

	/**
	 * Exchange a new JWT for an installation token without blocking. Never throws; all
	 * failures complete the returned future exceptionally.
	 * @param credential App installation to issue the token for
	 * @param now current time, used to mint the JWT
	 * @return future completed with the issued token
	 */
	public CompletableFuture<InstallationToken> exchangeAsync(Credential.AppInstallation credential, Instant now) {
		String installationId = credential.installationId();
		CompletableFuture<GitHubResponse> response;
		try {
			SignedAppJwt jwt = minter.mint(credential.appId(), credential.privateKey(), now);
			response = client.createAccessTokenAsync(installationId, jwt.token(), scopeBody(credential.scope()));
		}
		catch (RuntimeException e) {
			return CompletableFuture.failedFuture(e);
		}
		return response.handle((result, failure) -> {
			if (failure != null) {
				throw exchangeFailed(installationId, unwrap(failure));
			}
			return parse(installationId, result);
		});
	}

	/**
	 * Find the id of the App's installation on a repository or account.
	 * @param appId GitHub App id
	 * @param privateKey PEM-encoded App private key
	 * @param target repository, organization or user the App is installed on
	 * @param now current time, used to mint the JWT
	 * @return the installation id
	 * @throws AuthException if the App is not installed there or the lookup fails
	 * @throws CryptoException if the App private key is unusable
	 */
	public String findInstallationId(String appId, byte[] privateKey, InstallationTarget target, Instant now) {
		SignedAppJwt jwt = minter.mint(appId, privateKey, now);
		GitHubResponse response;
		try {
			response = client.getInstallation(target, jwt.token());
		}
		catch (TransportException e) {
			throw lookupFailed(target, e);
		}
		return parseInstallationId(target, response);
	}

	/**
	 * Non-blocking form of
	 * {@link #findInstallationId(String, byte[], InstallationTarget, Instant)}. Never
	 * throws; all failures complete the returned future exceptionally.
	 * @param appId GitHub App id
	 * @param privateKey PEM-encoded App private key
	 * @param target repository, organization or user the App is installed on
	 * @param now current time, used to mint the JWT
	 * @return future completed with the installation id
	 */
	public CompletableFuture<String> findInstallationIdAsync(String appId, byte[] privateKey,
			InstallationTarget target, Instant now) {
		CompletableFuture<GitHubResponse> response;
		try {
			SignedAppJwt jwt = minter.mint(appId, privateKey, now);
			response = client.getInstallationAsync(target, jwt.token());
		}
		catch (RuntimeException e) {
			return CompletableFuture.failedFuture(e);
		}
		return response.handle((result, failure) -> {
			if (failure != null) {
				throw lookupFailed(target, unwrap(failure));
			}
			return parseInstallationId(target, result);
		});
	}

	@Nullable String scopeBody(TokenScope scope) {
		if (scope.isUnscoped()) {
			return null;
		}
		ObjectNode body = objectMapper.createObjectNode();
		if (!scope.repositoryIds().isEmpty()) {
			ArrayNode ids = body.putArray("repository_ids");
			scope.repositoryIds().forEach(ids::add);
		}
		if (!scope.permissions().isEmpty()) {
			ObjectNode permissions = body.putObject("permissions");
			scope.permissions().forEach(permissions::put);
		}
		return body.toString();
	}

	String parseInstallationId(InstallationTarget target, GitHubResponse response) {
		String endpoint = response.endpoint();
		int status = response.statusCode();
		if (status == 404) {
			throw new AuthException("GitHub App is not installed on " + target.kind().name().toLowerCase(Locale.ROOT)
					+ " " + target.name(), endpoint, status, response.body());
		}
		if (!response.isSuccessful()) {
			throw new AuthException("Installation lookup for " + target.name() + " failed with HTTP " + status,
					endpoint, status, response.body());
		}
		JsonNode id;
		try {
			id = objectMapper.readTree(response.body()).path("id");
		}
		catch (JsonProcessingException e) {
			throw new AuthException("Installation lookup response is not valid JSON", endpoint, status, e);
		}
		if (!id.canConvertToLong() || id.asLong() <= 0) {
			throw new AuthException("Installation lookup response has no 'id' field", endpoint, status,
					response.body());
		}
		logger.info("GitHub App installation for {} is {}", target.name(), id.asLong());
		return String.valueOf(id.asLong());
	}

	InstallationToken parse(String installationId, GitHubResponse response) {
		String endpoint = response.endpoint();
		int status = response.statusCode();
		if (!response.isSuccessful()) {
			logger.warn("Installation token request for installation {} rejected with HTTP {}", installationId,
					status);
			throw new AuthException("GitHub rejected the installation token request for installation "
					+ installationId + " (HTTP " + status + ")", endpoint, status, response.body());
		}

		JsonNode root;
		try {
			root = objectMapper.readTree(response.body());
		}
		catch (JsonProcessingException e) {
			throw new AuthException("Installation token response is not valid JSON", endpoint, status, e);
		}

		// The body holds the token itself, so it is never attached to these failures
		JsonNode token = root.path("token");
		if (!token.isTextual() || token.asText().isBlank()) {
			throw new AuthException("Installation token response has no 'token' field", endpoint, status);
		}
		JsonNode expiresAt = root.path("expires_at");
		if (!expiresAt.isTextual()) {
			throw new AuthException("Installation token response has no 'expires_at' field", endpoint, status);
		}
		Instant expiry;
		try {
			expiry = OffsetDateTime.parse(expiresAt.asText(), DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
		}
		catch (DateTimeParseException e) {
			throw new AuthException("Installation token response has an unparseable 'expires_at': " + expiresAt.asText(),
					endpoint, status, e);
		}

		logger.info("Issued installation token for installation {}, expires at {}", installationId, expiry);
		return new InstallationToken(token.asText(), expiry, installationId);
	}

	private static GitHubProviderException exchangeFailed(String installationId, Throwable failure) {
		if (failure instanceof AuthException || failure instanceof CryptoException) {
			return (GitHubProviderException) failure;
		}
		logger.warn("Installation token request for installation {} failed: {}", installationId,
				failure.getMessage());
		return new AuthException(
				"Installation token request for installation " + installationId + " failed: " + failure.getMessage(),
				GitHubClient.accessTokensPath(installationId), -1, failure);
	}

	private static GitHubProviderException lookupFailed(InstallationTarget target, Throwable failure) {
		if (failure instanceof AuthException || failure instanceof CryptoException) {
			return (GitHubProviderException) failure;
		}
		logger.warn("Installation lookup for {} failed: {}", target.name(), failure.getMessage());
		return new AuthException("Installation lookup for " + target.name() + " failed: " + failure.getMessage(),
				target.installationPath(), -1, failure);
	}

	private static Throwable unwrap(Throwable failure) {
		if (failure instanceof CompletionException && failure.getCause() != null) {
			return failure.getCause();
		}
		return failure;
	}

}
