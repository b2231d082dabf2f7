package org.springaicommunity.github.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sends GraphQL operations and blocks the calling thread until the response is decoded.
 */
public class GraphQLDispatcher {

	private static final Logger logger = LoggerFactory.getLogger(GraphQLDispatcher.class);

	private final GitHubClient client;

	private final GraphQLEnvelopeCodec codec;

	public GraphQLDispatcher(GitHubClient client, GraphQLEnvelopeCodec codec) {
		this.client = client;
		this.codec = codec;
	}

	/**
	 * Send an operation.
	 * @param token token to authorize with
	 * @param scheme authorization scheme of the credential the token belongs to
	 * @param operation the operation
	 * @return decoded envelope, GraphQL errors included
	 * @throws TransportException on a non-2xx response or I/O failure
	 * @throws ProtocolException on a malformed envelope, or variables that cannot be
	 * serialized
	 */
	public GraphQLEnvelope send(InstallationToken token, String scheme, GraphQLOperation operation) {
		String body = codec.encode(operation);
		logger.debug("POST GraphQL operation {} ({} bytes)", operation.name(), body.length());
		long start = System.currentTimeMillis();

		GitHubResponse response = client.postGraphQL(codec.authorization(scheme, token), body);
		GraphQLEnvelope envelope = codec.decode(response);

		logger.debug("GraphQL operation {} completed in {}ms{}", operation.name(), System.currentTimeMillis() - start,
				envelope.hasErrors() ? " with " + envelope.errors().size() + " error(s)" : "");
		return envelope;
	}

}
