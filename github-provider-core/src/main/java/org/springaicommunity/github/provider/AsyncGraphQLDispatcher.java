package org.springaicommunity.github.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;

/**
 * Sends GraphQL operations without blocking. The returned future completes on the HTTP
 * client's executor once the response is decoded.
 */
public class AsyncGraphQLDispatcher {

	private static final Logger logger = LoggerFactory.getLogger(AsyncGraphQLDispatcher.class);

	private final GitHubClient client;

	private final GraphQLEnvelopeCodec codec;

	public AsyncGraphQLDispatcher(GitHubClient client, GraphQLEnvelopeCodec codec) {
		this.client = client;
		this.codec = codec;
	}

	/**
	 * Send an operation.
	 * @param token token to authorize with
	 * @param scheme authorization scheme of the credential the token belongs to
	 * @param operation the operation
	 * @return future completed with the decoded envelope, or exceptionally with
	 * {@link TransportException} or {@link ProtocolException}
	 */
	public CompletableFuture<GraphQLEnvelope> send(InstallationToken token, String scheme,
			GraphQLOperation operation) {
		String body;
		try {
			body = codec.encode(operation);
		}
		catch (ProtocolException e) {
			return CompletableFuture.failedFuture(e);
		}
		logger.debug("POST GraphQL operation {} ({} bytes, async)", operation.name(), body.length());
		long start = System.currentTimeMillis();

		return client.postGraphQLAsync(codec.authorization(scheme, token), body).thenApply(response -> {
			GraphQLEnvelope envelope = codec.decode(response);
			logger.debug("GraphQL operation {} completed in {}ms{}", operation.name(),
					System.currentTimeMillis() - start,
					envelope.hasErrors() ? " with " + envelope.errors().size() + " error(s)" : "");
			return envelope;
		});
	}

}
