package org.springaicommunity.github.provider;

import org.jspecify.annotations.Nullable;

import java.util.concurrent.CompletableFuture;

/**
 * HTTP operations the provider needs from the GitHub API.
 *
 * <p>
 * Every operation has a blocking and a non-blocking form. Implementations return
 * responses of any status code; classifying them is up to the caller. Only failures to
 * get a response at all are raised, as {@link TransportException}. The asynchronous
 * methods report them by completing the future exceptionally.
 */
public interface GitHubClient {

	/**
	 * Path of the GraphQL endpoint, relative to the API base URL.
	 */
	String GRAPHQL_PATH = "/graphql";

	/**
	 * Request an installation access token
	 * ({@code POST /app/installations/{id}/access_tokens}).
	 * @param installationId GitHub App installation id
	 * @param jwt signed App JWT, sent as bearer credential
	 * @param body JSON body narrowing the token's repositories and permissions, or null
	 * for a token with everything the installation grants
	 * @return the response
	 * @throws TransportException if no response was received
	 */
	GitHubResponse createAccessToken(String installationId, String jwt, @Nullable String body);

	/**
	 * Non-blocking form of {@link #createAccessToken(String, String, String)}.
	 * @param installationId GitHub App installation id
	 * @param jwt signed App JWT, sent as bearer credential
	 * @param body JSON body narrowing the token, or null
	 * @return future completed with the response
	 */
	CompletableFuture<GitHubResponse> createAccessTokenAsync(String installationId, String jwt,
			@Nullable String body);

	/**
	 * Look up the App's installation on a repository or account
	 * ({@code GET /repos/{owner}/{repo}/installation} and the like).
	 * @param target repository, organization or user
	 * @param jwt signed App JWT, sent as bearer credential
	 * @return the response
	 * @throws TransportException if no response was received
	 */
	GitHubResponse getInstallation(InstallationTarget target, String jwt);

	/**
	 * Non-blocking form of {@link #getInstallation(InstallationTarget, String)}.
	 * @param target repository, organization or user
	 * @param jwt signed App JWT, sent as bearer credential
	 * @return future completed with the response
	 */
	CompletableFuture<GitHubResponse> getInstallationAsync(InstallationTarget target, String jwt);

	/**
	 * Execute a POST request against the GraphQL endpoint ({@code POST /graphql}).
	 * @param authorization full {@code Authorization} header value, e.g.
	 * {@code Bearer ghs_xxx}
	 * @param body request body (JSON)
	 * @return the response
	 * @throws TransportException if no response was received
	 */
	GitHubResponse postGraphQL(String authorization, String body);

	/**
	 * Non-blocking form of {@link #postGraphQL(String, String)}.
	 * @param authorization full {@code Authorization} header value
	 * @param body request body (JSON)
	 * @return future completed with the response
	 */
	CompletableFuture<GitHubResponse> postGraphQLAsync(String authorization, String body);

	/**
	 * Get the rate limit information from the most recent API response. Returns null if
	 * no rate limit headers have been observed yet.
	 * @return last observed RateLimitInfo, or null
	 */
	default @Nullable RateLimitInfo getLastRateLimitInfo() {
		return null;
	}

	static String accessTokensPath(String installationId) {
		return "/app/installations/" + installationId + "/access_tokens";
	}

}
