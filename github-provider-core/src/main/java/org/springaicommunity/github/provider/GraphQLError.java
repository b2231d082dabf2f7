package org.springaicommunity.github.provider;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * One entry of the {@code errors} array of a GraphQL response.
 *
 * @param message human readable description
 * @param path response path of the failing field (names and list indices), if given
 * @param extensions implementation specific details such as GitHub's {@code type}, if
 * given
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GraphQLError(String message, @Nullable List<Object> path, @Nullable JsonNode extensions) {

}
