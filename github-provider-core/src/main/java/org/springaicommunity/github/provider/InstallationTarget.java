package org.springaicommunity.github.provider;

import java.util.Objects;

/**
 * An account or repository a GitHub App may be installed on, used to look up the
 * installation id instead of configuring it.
 *
 * @param kind what the name refers to
 * @param name {@code owner/repo}, organization login or user login
 */
public record InstallationTarget(Kind kind, String name) {

	public enum Kind {

		REPOSITORY, ORGANIZATION, USER

	}

	public InstallationTarget {
		Objects.requireNonNull(kind, "kind");
		if (name == null || name.isBlank()) {
			throw new ConfigurationException("Installation target name must not be blank");
		}
		name = name.trim();
		if (kind == Kind.REPOSITORY) {
			int slash = name.indexOf('/');
			if (slash <= 0 || slash == name.length() - 1 || name.indexOf('/', slash + 1) >= 0) {
				throw new ConfigurationException("Expected a repository as owner/repo, got '" + name + "'");
			}
		}
		else if (name.contains("/")) {
			throw new ConfigurationException("Expected an account login, got '" + name + "'");
		}
	}

	public static InstallationTarget repository(String ownerAndRepo) {
		return new InstallationTarget(Kind.REPOSITORY, ownerAndRepo);
	}

	public static InstallationTarget repository(String owner, String repo) {
		return new InstallationTarget(Kind.REPOSITORY, owner + "/" + repo);
	}

	public static InstallationTarget organization(String org) {
		return new InstallationTarget(Kind.ORGANIZATION, org);
	}

	public static InstallationTarget user(String login) {
		return new InstallationTarget(Kind.USER, login);
	}

	/**
	 * Returns the REST path that reports the App's installation on this target.
	 * @return path such as {@code /repos/octo/hello/installation}
	 */
	public String installationPath() {
		switch (kind) {
			case REPOSITORY:
				return "/repos/" + name + "/installation";
			case ORGANIZATION:
				return "/orgs/" + name + "/installation";
			default:
				return "/users/" + name + "/installation";
		}
	}

}
