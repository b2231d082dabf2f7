package org.springaicommunity.github.provider;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Narrows what an installation token may do. An empty scope asks GitHub for a token with
 * all of the installation's repositories and permissions.
 *
 * <p>
 * Tokens issued for different scopes are cached separately.
 *
 * @param repositoryIds ids of the repositories the token is limited to, empty for all
 * @param permissions permission name to access level ({@code read}, {@code write} or
 * {@code admin}), empty for all the installation has
 */
public record TokenScope(List<Long> repositoryIds, Map<String, String> permissions) {

	private static final Set<String> ACCESS_LEVELS = Set.of("read", "write", "admin");

	private static final TokenScope UNSCOPED = new TokenScope(List.of(), Map.of());

	public TokenScope {
		repositoryIds = List.copyOf(repositoryIds);
		for (Long id : repositoryIds) {
			if (id <= 0) {
				throw new ConfigurationException("Repository ids must be positive: " + id);
			}
		}
		permissions.forEach((name, level) -> {
			if (name.isBlank() || !ACCESS_LEVELS.contains(level)) {
				throw new ConfigurationException(
						"Invalid token permission '" + name + "=" + level + "', expected read, write or admin");
			}
		});
		permissions = Collections.unmodifiableMap(new TreeMap<>(permissions));
	}

	public static TokenScope unscoped() {
		return UNSCOPED;
	}

	/**
	 * Parse a scope from its configuration form.
	 * @param repositoryIds comma separated repository ids, or null
	 * @param permissions comma separated {@code name=level} pairs such as
	 * {@code contents=read,issues=write}, or null
	 * @return the scope
	 * @throws ConfigurationException if either value is malformed
	 */
	public static TokenScope parse(@Nullable String repositoryIds, @Nullable String permissions) {
		List<Long> ids = new ArrayList<>();
		if (repositoryIds != null) {
			for (String id : repositoryIds.split(",")) {
				if (id.isBlank()) {
					continue;
				}
				try {
					ids.add(Long.parseLong(id.trim()));
				}
				catch (NumberFormatException e) {
					throw new ConfigurationException("Invalid repository id '" + id.trim() + "'", e);
				}
			}
		}
		Map<String, String> levels = new TreeMap<>();
		if (permissions != null) {
			for (String pair : permissions.split(",")) {
				if (pair.isBlank()) {
					continue;
				}
				int separator = pair.indexOf('=');
				if (separator < 0) {
					throw new ConfigurationException(
							"Invalid token permission '" + pair.trim() + "', expected name=level");
				}
				levels.put(pair.substring(0, separator).trim(), pair.substring(separator + 1).trim());
			}
		}
		return new TokenScope(ids, levels);
	}

	public boolean isUnscoped() {
		return repositoryIds.isEmpty() && permissions.isEmpty();
	}

}
