package org.springaicommunity.github.provider;

import org.jspecify.annotations.Nullable;

import java.time.Instant;
import java.util.Map;

/**
 * Blocking GitHub GraphQL provider. Each call resolves a usable token (reusing a cached
 * installation token while it is fresh) and sends the operation on the calling thread.
 *
 * <p>
 * Thread-safe; share one instance per configuration.
 */
public class GitHubProvider {

	private final ProviderCore core;

	private final InstallationTokenCache tokenCache;

	private final GraphQLDispatcher dispatcher;

	public GitHubProvider(ProviderCore core) {
		this.core = core;
		this.tokenCache = new InstallationTokenCache(core.exchange(), core.refreshMargin());
		this.dispatcher = new GraphQLDispatcher(core.client(), core.codec());
	}

	/**
	 * Execute a GraphQL operation.
	 * @param operation the operation
	 * @return the envelope; GraphQL-level errors are returned in it
	 * @throws AuthException if an installation token cannot be obtained
	 * @throws CryptoException if the App private key is unusable
	 * @throws TransportException on a non-2xx GraphQL response or I/O failure
	 * @throws ProtocolException on a malformed GraphQL response
	 */
	public GraphQLEnvelope execute(GraphQLOperation operation) {
		Instant now = core.clock().instant();
		Credential credential = core.credential();
		InstallationToken token = tokenCache.tokenFor(credential, now);
		return dispatcher.send(token, credential.authorizationScheme(), operation);
	}

	/**
	 * Execute a GraphQL operation.
	 * @param name operation name, used for logging
	 * @param document GraphQL document
	 * @param variables variables, may be null
	 * @return the envelope
	 * @see #execute(GraphQLOperation)
	 */
	public GraphQLEnvelope execute(String name, String document, @Nullable Map<String, @Nullable Object> variables) {
		return execute(new GraphQLOperation(name, document, variables));
	}

	public Credential credential() {
		return core.credential();
	}

	InstallationTokenCache tokenCache() {
		return tokenCache;
	}

}
