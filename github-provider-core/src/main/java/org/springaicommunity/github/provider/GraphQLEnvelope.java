package org.springaicommunity.github.provider;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Decoded top-level GraphQL response. {@code data} and {@code errors} can both be present
 * when an operation partially succeeded; GraphQL errors are reported here rather than
 * thrown.
 *
 * @param data the {@code data} object, or null when absent or null in the response
 * @param errors the {@code errors} list, or null when absent
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GraphQLEnvelope(@Nullable JsonNode data, @Nullable List<GraphQLError> errors) {

	public GraphQLEnvelope {
		errors = errors != null ? List.copyOf(errors) : null;
	}

	/**
	 * Returns true if the response carried at least one GraphQL error.
	 * @return true if {@code errors} is non-empty
	 */
	@JsonIgnore
	public boolean hasErrors() {
		return errors != null && !errors.isEmpty();
	}

}
