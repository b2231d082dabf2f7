package org.springaicommunity.github.provider;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Non-blocking GitHub GraphQL provider. Calls return immediately; token refresh and the
 * GraphQL request run on the HTTP client's executor.
 *
 * <p>
 * Cancelling a returned future abandons only that caller's wait. An installation token
 * exchange it was attached to still completes and is cached for later calls.
 */
public class AsyncGitHubProvider {

	private final ProviderCore core;

	private final AsyncInstallationTokenCache tokenCache;

	private final AsyncGraphQLDispatcher dispatcher;

	public AsyncGitHubProvider(ProviderCore core) {
		this.core = core;
		this.tokenCache = new AsyncInstallationTokenCache(core.exchange(), core.refreshMargin());
		this.dispatcher = new AsyncGraphQLDispatcher(core.client(), core.codec());
	}

	/**
	 * Execute a GraphQL operation.
	 * @param operation the operation
	 * @return future completed with the envelope, or exceptionally with a
	 * {@link GitHubProviderException}
	 */
	public CompletableFuture<GraphQLEnvelope> execute(GraphQLOperation operation) {
		Instant now = core.clock().instant();
		Credential credential = core.credential();
		return tokenFor(credential, now)
			.thenCompose(token -> dispatcher.send(token, credential.authorizationScheme(), operation));
	}

	/**
	 * Execute a GraphQL operation.
	 * @param name operation name, used for logging
	 * @param document GraphQL document
	 * @param variables variables, may be null
	 * @return future completed with the envelope
	 * @see #execute(GraphQLOperation)
	 */
	public CompletableFuture<GraphQLEnvelope> execute(String name, String document,
			@Nullable Map<String, @Nullable Object> variables) {
		return execute(new GraphQLOperation(name, document, variables));
	}

	public Credential credential() {
		return core.credential();
	}

	AsyncInstallationTokenCache tokenCache() {
		return tokenCache;
	}

	private CompletableFuture<InstallationToken> tokenFor(Credential credential, Instant now) {
		try {
			return tokenCache.tokenFor(credential, now);
		}
		catch (RuntimeException e) {
			return CompletableFuture.failedFuture(e);
		}
	}

}
