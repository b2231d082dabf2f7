package org.springaicommunity.github.provider;

import org.jspecify.annotations.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A GraphQL operation as handed over by the host: its name, the document text it lives in
 * and the variables bound to it. The provider does not look inside the document.
 *
 * @param name operation name, used for logging
 * @param document GraphQL document text, sent as {@code query}
 * @param variables variable values; may contain null values
 */
public record GraphQLOperation(String name, String document, Map<String, @Nullable Object> variables) {

	public GraphQLOperation {
		Objects.requireNonNull(name, "name");
		Objects.requireNonNull(document, "document");
		variables = variables == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
	}

	/**
	 * Create an operation without variables.
	 * @param name operation name
	 * @param document GraphQL document text
	 * @return the operation
	 */
	public static GraphQLOperation of(String name, String document) {
		return new GraphQLOperation(name, document, Map.of());
	}

}
