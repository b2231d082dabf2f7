package org.springaicommunity.github.provider;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides which credential scheme {@link ProviderSettings} describe.
 *
 * <p>
 * A complete set of App settings (id, private key, and an installation id or a repository
 * to find the installation on) selects {@link Credential.AppInstallation}; a bare personal
 * token selects {@link Credential.PersonalToken}. Anything else is a configuration error.
 */
public class CredentialResolver {

	private static final InstallationLocator NO_LOOKUP = (appId, privateKey, target) -> {
		throw new ConfigurationException(
				"Looking up the installation on " + target.name() + " needs a GitHub client; set an installation id");
	};

	private final ProviderSettings settings;

	public CredentialResolver(ProviderSettings settings) {
		this.settings = settings;
	}

	/**
	 * Resolve the credential without any lookup against GitHub.
	 * @return the active credential
	 * @throws ConfigurationException if no scheme, more than one scheme, or an incomplete
	 * App configuration is supplied, or the installation would have to be looked up
	 */
	public Credential resolve() {
		return resolve(NO_LOOKUP);
	}

	/**
	 * Resolve the credential, asking GitHub for the installation id when only a repository
	 * is configured.
	 * @param locator finds the App's installation on a repository
	 * @return the active credential
	 * @throws ConfigurationException if no scheme, more than one scheme, or an incomplete
	 * App configuration is supplied
	 * @throws AuthException if the installation lookup fails
	 */
	public Credential resolve(InstallationLocator locator) {
		String personalToken = blankToNull(settings.getPersonalToken());
		String appId = blankToNull(settings.getAppId());
		String installationId = blankToNull(settings.getInstallationId());
		String installationRepository = blankToNull(settings.getInstallationRepository());
		byte[] privateKey = settings.getAppPrivateKey();
		if (privateKey != null && privateKey.length == 0) {
			privateKey = null;
		}
		TokenScope scope = settings.getTokenScope();

		boolean anyAppSetting = appId != null || privateKey != null || installationId != null
				|| installationRepository != null;
		if (personalToken != null && anyAppSetting) {
			throw new ConfigurationException(
					"Both a personal access token and GitHub App settings are configured; supply exactly one of them");
		}
		if (personalToken != null) {
			if (!scope.isUnscoped()) {
				throw new ConfigurationException("Token repositories and permissions only apply to GitHub App "
						+ "installation tokens, not to a personal access token");
			}
			return new Credential.PersonalToken(personalToken);
		}
		if (!anyAppSetting) {
			throw new ConfigurationException("No GitHub credentials configured. Set a personal access token, "
					+ "or a GitHub App id, private key and installation id.");
		}

		List<String> missing = new ArrayList<>();
		if (appId == null) {
			missing.add("app id");
		}
		if (privateKey == null) {
			missing.add("app private key");
		}
		if (installationId == null && installationRepository == null) {
			missing.add("installation id");
		}
		if (!missing.isEmpty()) {
			throw new ConfigurationException("Incomplete GitHub App configuration, missing: " + String.join(", ", missing));
		}
		if (installationId != null && installationRepository != null) {
			throw new ConfigurationException(
					"Both an installation id and an installation repository are configured; supply only one of them");
		}
		if (installationId == null) {
			installationId = locator.installationId(appId, privateKey,
					InstallationTarget.repository(installationRepository));
		}
		return new Credential.AppInstallation(appId, privateKey, installationId, scope);
	}

	private static @Nullable String blankToNull(@Nullable String value) {
		return value == null || value.isBlank() ? null : value.trim();
	}

	/**
	 * Finds the id of a GitHub App's installation on a repository or account.
	 */
	@FunctionalInterface
	public interface InstallationLocator {

		String installationId(String appId, byte[] privateKey, InstallationTarget target);

	}

}
