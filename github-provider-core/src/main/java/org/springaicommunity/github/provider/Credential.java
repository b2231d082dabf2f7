package org.springaicommunity.github.provider;

import java.util.Arrays;
import java.util.Objects;

/**
 * Credential the provider authenticates with. Resolved once per provider instance by
 * {@link CredentialResolver} and never changed afterwards.
 *
 * <p>
 * {@code toString()} of every variant omits secret material.
 */
public interface Credential {

	/**
	 * Returns the scheme used in the {@code Authorization} header of GraphQL requests.
	 * @return {@code token} or {@code Bearer}
	 */
	String authorizationScheme();

	/**
	 * A personal access token, used as-is for every request.
	 *
	 * @param value the token
	 */
	record PersonalToken(String value) implements Credential {

		public PersonalToken {
			Objects.requireNonNull(value, "value");
		}

		@Override
		public String authorizationScheme() {
			return "token";
		}

		@Override
		public String toString() {
			return "PersonalToken[value=<redacted>]";
		}

	}

	/**
	 * A GitHub App installation. Requests use short-lived installation tokens obtained
	 * with a JWT signed by the App's private key.
	 *
	 * @param appId GitHub App id
	 * @param privateKey PEM-encoded RSA private key
	 * @param installationId installation to act on behalf of
	 * @param scope repositories and permissions the issued tokens are limited to
	 */
	record AppInstallation(String appId, byte[] privateKey, String installationId,
			TokenScope scope) implements Credential {

		public AppInstallation {
			Objects.requireNonNull(appId, "appId");
			Objects.requireNonNull(installationId, "installationId");
			Objects.requireNonNull(scope, "scope");
			privateKey = privateKey.clone();
		}

		public AppInstallation(String appId, byte[] privateKey, String installationId) {
			this(appId, privateKey, installationId, TokenScope.unscoped());
		}

		@Override
		public byte[] privateKey() {
			return privateKey.clone();
		}

		@Override
		public String authorizationScheme() {
			return "Bearer";
		}

		@Override
		public boolean equals(Object o) {
			if (this == o) {
				return true;
			}
			if (!(o instanceof AppInstallation)) {
				return false;
			}
			AppInstallation that = (AppInstallation) o;
			return appId.equals(that.appId) && Arrays.equals(privateKey, that.privateKey)
					&& installationId.equals(that.installationId) && scope.equals(that.scope);
		}

		@Override
		public int hashCode() {
			return Objects.hash(appId, Arrays.hashCode(privateKey), installationId, scope);
		}

		@Override
		public String toString() {
			return "AppInstallation[appId=" + appId + ", privateKey=<redacted>, installationId=" + installationId
					+ ", scope=" + scope + "]";
		}

	}

}
