package org.springaicommunity.github.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds GraphQL request bodies and decodes GraphQL responses. Shared by the blocking and
 * non-blocking dispatchers so both speak exactly the same wire format.
 *
 * <p>
 * Stateless and thread-safe.
 */
public class GraphQLEnvelopeCodec {

	private final ObjectMapper objectMapper;

	public GraphQLEnvelopeCodec(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	/**
	 * Build the request body {@code {"query": document, "variables": variables}}.
	 * @param operation the operation to send
	 * @return JSON request body
	 * @throws ProtocolException if the variables cannot be serialized to JSON
	 */
	public String encode(GraphQLOperation operation) {
		try {
			ObjectNode body = objectMapper.createObjectNode();
			body.put("query", operation.document());
			body.set("variables", objectMapper.valueToTree(operation.variables()));
			return objectMapper.writeValueAsString(body);
		}
		catch (JsonProcessingException | IllegalArgumentException e) {
			throw new ProtocolException("Variables of operation " + operation.name() + " cannot be serialized: "
					+ e.getMessage(), GitHubClient.GRAPHQL_PATH, -1, null, e);
		}
	}

	/**
	 * Build the {@code Authorization} header value for a token.
	 * @param scheme {@code token} or {@code Bearer}, see
	 * {@link Credential#authorizationScheme()}
	 * @param token the token to present
	 * @return header value
	 */
	public String authorization(String scheme, InstallationToken token) {
		return scheme + " " + token.token();
	}

	/**
	 * Decode a GraphQL response.
	 * @param response the raw response
	 * @return the envelope; GraphQL errors are part of it, not thrown
	 * @throws TransportException if the status is not 2xx
	 * @throws ProtocolException if the body is not a {@code data}/{@code errors} envelope
	 */
	public GraphQLEnvelope decode(GitHubResponse response) {
		String endpoint = response.endpoint();
		int status = response.statusCode();
		if (!response.isSuccessful()) {
			throw new TransportException("GraphQL request failed with HTTP " + status, endpoint, status,
					response.body());
		}

		JsonNode root;
		try {
			root = objectMapper.readTree(response.body());
		}
		catch (JsonProcessingException e) {
			throw new ProtocolException("GraphQL response is not valid JSON", endpoint, status, response.body(), e);
		}
		if (root == null || !root.isObject()) {
			throw new ProtocolException("GraphQL response is not a JSON object", endpoint, status, response.body());
		}

		JsonNode data = root.get("data");
		JsonNode errors = root.get("errors");
		if (data == null && errors == null) {
			throw new ProtocolException("GraphQL response has neither 'data' nor 'errors'", endpoint, status,
					response.body());
		}
		if (data != null && !data.isObject() && !data.isNull()) {
			throw new ProtocolException("GraphQL 'data' is not an object", endpoint, status, response.body());
		}
		return new GraphQLEnvelope(data == null || data.isNull() ? null : data,
				decodeErrors(errors, endpoint, status, response.body()));
	}

	private static @Nullable List<GraphQLError> decodeErrors(@Nullable JsonNode errors, String endpoint, int status,
			String body) {
		if (errors == null || errors.isNull()) {
			return null;
		}
		if (!errors.isArray()) {
			throw new ProtocolException("GraphQL 'errors' is not an array", endpoint, status, body);
		}
		List<GraphQLError> decoded = new ArrayList<>();
		for (JsonNode error : errors) {
			decoded.add(new GraphQLError(error.path("message").asText(""), decodePath(error.get("path")),
					error.hasNonNull("extensions") ? error.get("extensions") : null));
		}
		return decoded;
	}

	private static @Nullable List<Object> decodePath(@Nullable JsonNode path) {
		if (path == null || !path.isArray()) {
			return null;
		}
		List<Object> segments = new ArrayList<>();
		for (JsonNode segment : path) {
			segments.add(segment.isInt() ? (Object) segment.asInt() : segment.asText());
		}
		return segments;
	}

}
