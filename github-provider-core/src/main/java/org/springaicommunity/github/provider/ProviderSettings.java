package org.springaicommunity.github.provider;

import org.jspecify.annotations.Nullable;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.function.Function;

/**
 * Configuration read by the provider.
 *
 * <p>
 * Exactly one credential scheme must be populated: either {@link #getPersonalToken()}, or
 * {@link #getAppId()} and {@link #getAppPrivateKey()} with either
 * {@link #getInstallationId()} or {@link #getInstallationRepository()}.
 * {@link CredentialResolver} enforces this.
 *
 * <p>
 * Settings can be filled through the setters, from a key/value map with
 * {@link #fromMap(Map)}, or from {@code GITHUB_*} environment variables with
 * {@link #fromEnvironment()}. Instances are not thread-safe; finish configuring before
 * handing them to {@link GitHubProviderBuilder}.
 */
public class ProviderSettings {

	static final String DEFAULT_API_URL = "https://api.github.com";

	static final String DEFAULT_USER_AGENT = "github-graphql-provider";

	private static final Keys MAP_KEYS = new Keys("personal_token", "app_id", "app_private_key",
			"app_private_key_file", "installation_id", "installation_repository", "token_repository_ids",
			"token_permissions", "api_url", "refresh_margin_seconds", "connect_timeout_seconds");

	private static final Keys ENVIRONMENT_KEYS = new Keys("GITHUB_TOKEN", "GITHUB_APP_ID", "GITHUB_APP_PRIVATE_KEY",
			"GITHUB_APP_PRIVATE_KEY_FILE", "GITHUB_INSTALLATION_ID", "GITHUB_INSTALLATION_REPOSITORY",
			"GITHUB_TOKEN_REPOSITORY_IDS", "GITHUB_TOKEN_PERMISSIONS", "GITHUB_API_URL",
			"GITHUB_TOKEN_REFRESH_MARGIN_SECONDS", "GITHUB_CONNECT_TIMEOUT_SECONDS");

	/**
	 * Personal access token, sent as {@code Authorization: token <value>}.
	 */
	private @Nullable String personalToken;

	/**
	 * GitHub App id, used as the {@code iss} claim of the App JWT.
	 */
	private @Nullable String appId;

	/**
	 * PEM-encoded RSA private key of the GitHub App (PKCS#1 or PKCS#8).
	 */
	private byte @Nullable [] appPrivateKey;

	/**
	 * Installation of the GitHub App to act on behalf of.
	 */
	private @Nullable String installationId;

	/**
	 * Repository ({@code owner/repo}) whose App installation is looked up when no
	 * installation id is configured.
	 */
	private @Nullable String installationRepository;

	/**
	 * Repositories and permissions installation tokens are limited to.
	 */
	private TokenScope tokenScope = TokenScope.unscoped();

	/**
	 * Base URL of the REST and GraphQL API. Change for GitHub Enterprise Server.
	 */
	private String apiUrl = DEFAULT_API_URL;

	/**
	 * Installation tokens expiring within this margin are refreshed before use.
	 */
	private Duration refreshMargin = Duration.ofSeconds(60);

	/**
	 * Connect timeout of the default HTTP transport.
	 */
	private Duration connectTimeout = Duration.ofSeconds(30);

	/**
	 * Value of the User-Agent header, which GitHub requires on every request.
	 */
	private String userAgent = DEFAULT_USER_AGENT;

	/**
	 * Build settings from a key/value map using the keys {@code personal_token},
	 * {@code app_id}, {@code app_private_key}, {@code app_private_key_file},
	 * {@code installation_id}, {@code installation_repository},
	 * {@code token_repository_ids}, {@code token_permissions}, {@code api_url},
	 * {@code refresh_margin_seconds}, {@code connect_timeout_seconds} and
	 * {@code user_agent}.
	 * @param values configuration values; unknown keys are ignored
	 * @return populated settings
	 * @throws ConfigurationException if a value cannot be interpreted
	 */
	public static ProviderSettings fromMap(Map<String, String> values) {
		ProviderSettings settings = fromLookup(values::get, MAP_KEYS);
		String userAgent = values.get("user_agent");
		if (userAgent != null && !userAgent.isBlank()) {
			settings.setUserAgent(userAgent);
		}
		return settings;
	}

	/**
	 * Build settings from the environment ({@code .env} files included, see
	 * {@link EnvironmentSupport}).
	 *
	 * <p>
	 * Recognized variables: {@code GITHUB_TOKEN}, {@code GITHUB_APP_ID},
	 * {@code GITHUB_APP_PRIVATE_KEY}, {@code GITHUB_APP_PRIVATE_KEY_FILE},
	 * {@code GITHUB_INSTALLATION_ID}, {@code GITHUB_INSTALLATION_REPOSITORY},
	 * {@code GITHUB_TOKEN_REPOSITORY_IDS}, {@code GITHUB_TOKEN_PERMISSIONS},
	 * {@code GITHUB_API_URL},
	 * {@code GITHUB_TOKEN_REFRESH_MARGIN_SECONDS} and
	 * {@code GITHUB_CONNECT_TIMEOUT_SECONDS}.
	 * @return populated settings
	 * @throws ConfigurationException if a value cannot be interpreted
	 */
	public static ProviderSettings fromEnvironment() {
		return fromEnvironment(EnvironmentSupport::get);
	}

	/**
	 * Build settings from environment-style names resolved through the given lookup.
	 * @param lookup resolves a variable name to its value, or null
	 * @return populated settings
	 */
	public static ProviderSettings fromEnvironment(Function<String, @Nullable String> lookup) {
		return fromLookup(lookup, ENVIRONMENT_KEYS);
	}

	private static ProviderSettings fromLookup(Function<String, @Nullable String> lookup, Keys keys) {
		ProviderSettings settings = new ProviderSettings();
		settings.setPersonalToken(trimToNull(lookup.apply(keys.token)));
		settings.setAppId(trimToNull(lookup.apply(keys.appId)));
		settings.setInstallationId(trimToNull(lookup.apply(keys.installationId)));
		settings.setInstallationRepository(trimToNull(lookup.apply(keys.installationRepository)));

		String privateKey = trimToNull(lookup.apply(keys.privateKey));
		String privateKeyFile = trimToNull(lookup.apply(keys.privateKeyFile));
		if (privateKey != null && privateKeyFile != null) {
			throw new ConfigurationException(
					"Both " + keys.privateKey + " and " + keys.privateKeyFile + " are set; supply only one of them");
		}
		if (privateKey != null) {
			// Keys passed through CI variables often arrive with escaped newlines
			settings.setAppPrivateKey(privateKey.replace("\\n", "\n").getBytes(StandardCharsets.UTF_8));
		}
		else if (privateKeyFile != null) {
			settings.setAppPrivateKey(readKeyFile(keys.privateKeyFile, privateKeyFile));
		}
		settings.setTokenScope(TokenScope.parse(trimToNull(lookup.apply(keys.repositoryIds)),
				trimToNull(lookup.apply(keys.permissions))));

		String apiUrl = trimToNull(lookup.apply(keys.apiUrl));
		if (apiUrl != null) {
			settings.setApiUrl(apiUrl);
		}
		String refreshMargin = trimToNull(lookup.apply(keys.refreshMargin));
		if (refreshMargin != null) {
			settings.setRefreshMargin(Duration.ofSeconds(parseSeconds(keys.refreshMargin, refreshMargin)));
		}
		String connectTimeout = trimToNull(lookup.apply(keys.connectTimeout));
		if (connectTimeout != null) {
			long seconds = parseSeconds(keys.connectTimeout, connectTimeout);
			if (seconds == 0) {
				throw new ConfigurationException(keys.connectTimeout + " must be positive: " + connectTimeout);
			}
			settings.setConnectTimeout(Duration.ofSeconds(seconds));
		}
		return settings;
	}

	private static byte[] readKeyFile(String key, String path) {
		try {
			return Files.readAllBytes(Path.of(path));
		}
		catch (IOException e) {
			throw new ConfigurationException("Cannot read " + key + " '" + path + "': " + e.getMessage(), e);
		}
	}

	private static long parseSeconds(String key, String value) {
		try {
			long seconds = Long.parseLong(value);
			if (seconds < 0) {
				throw new ConfigurationException(key + " must not be negative: " + value);
			}
			return seconds;
		}
		catch (NumberFormatException e) {
			throw new ConfigurationException("Invalid " + key + " '" + value + "': must be a whole number of seconds",
					e);
		}
	}

	private static @Nullable String trimToNull(@Nullable String value) {
		if (value == null) {
			return null;
		}
		String trimmed = value.trim();
		return trimmed.isEmpty() ? null : trimmed;
	}

	public @Nullable String getPersonalToken() {
		return personalToken;
	}

	public void setPersonalToken(@Nullable String personalToken) {
		this.personalToken = personalToken;
	}

	public @Nullable String getAppId() {
		return appId;
	}

	public void setAppId(@Nullable String appId) {
		this.appId = appId;
	}

	/**
	 * Returns the PEM-encoded App private key.
	 * @return a copy of the key bytes, or null if unset
	 */
	public byte @Nullable [] getAppPrivateKey() {
		return appPrivateKey != null ? appPrivateKey.clone() : null;
	}

	public void setAppPrivateKey(byte @Nullable [] appPrivateKey) {
		this.appPrivateKey = appPrivateKey != null ? appPrivateKey.clone() : null;
	}

	/**
	 * Sets the App private key from PEM text.
	 * @param pem PEM-encoded key, or null to clear it
	 */
	public void setAppPrivateKeyPem(@Nullable String pem) {
		setAppPrivateKey(pem != null ? pem.getBytes(StandardCharsets.UTF_8) : null);
	}

	public @Nullable String getInstallationId() {
		return installationId;
	}

	public void setInstallationId(@Nullable String installationId) {
		this.installationId = installationId;
	}

	public @Nullable String getInstallationRepository() {
		return installationRepository;
	}

	/**
	 * Sets the repository whose App installation is used when no installation id is set.
	 * @param installationRepository repository as {@code owner/repo}, or null
	 */
	public void setInstallationRepository(@Nullable String installationRepository) {
		this.installationRepository = installationRepository;
	}

	public TokenScope getTokenScope() {
		return tokenScope;
	}

	/**
	 * Limits installation tokens to some repositories and permissions.
	 * @param tokenScope the scope, {@link TokenScope#unscoped()} for everything the
	 * installation grants
	 */
	public void setTokenScope(TokenScope tokenScope) {
		this.tokenScope = tokenScope;
	}

	public String getApiUrl() {
		return apiUrl;
	}

	/**
	 * Sets the API base URL. A trailing slash is removed.
	 * @param apiUrl base URL such as {@code https://github.example.com/api/v3}
	 */
	public void setApiUrl(String apiUrl) {
		this.apiUrl = apiUrl.endsWith("/") ? apiUrl.substring(0, apiUrl.length() - 1) : apiUrl;
	}

	public Duration getRefreshMargin() {
		return refreshMargin;
	}

	/**
	 * Sets how long before its stated expiry an installation token is treated as expired.
	 * @param refreshMargin non-negative margin (default: 60 seconds)
	 */
	public void setRefreshMargin(Duration refreshMargin) {
		if (refreshMargin.isNegative()) {
			throw new ConfigurationException("refreshMargin must not be negative: " + refreshMargin);
		}
		this.refreshMargin = refreshMargin;
	}

	public Duration getConnectTimeout() {
		return connectTimeout;
	}

	/**
	 * Sets the connect timeout of the default HTTP transport.
	 * @param connectTimeout positive timeout (default: 30 seconds)
	 */
	public void setConnectTimeout(Duration connectTimeout) {
		if (connectTimeout.isNegative() || connectTimeout.isZero()) {
			throw new ConfigurationException("connectTimeout must be positive: " + connectTimeout);
		}
		this.connectTimeout = connectTimeout;
	}

	public String getUserAgent() {
		return userAgent;
	}

	public void setUserAgent(String userAgent) {
		this.userAgent = userAgent;
	}

	@Override
	public String toString() {
		return "ProviderSettings{" + "personalToken=" + (personalToken != null ? "<set>" : "<unset>") + ", appId='"
				+ appId + '\'' + ", appPrivateKey=" + (appPrivateKey != null ? "<set>" : "<unset>")
				+ ", installationId='" + installationId + '\'' + ", installationRepository='" + installationRepository
				+ '\'' + ", tokenScope=" + tokenScope + ", apiUrl='" + apiUrl + '\'' + ", refreshMargin="
				+ refreshMargin + ", connectTimeout=" + connectTimeout + ", userAgent='" + userAgent + '\'' + '}';
	}

	private record Keys(String token, String appId, String privateKey, String privateKeyFile, String installationId,
			String installationRepository, String repositoryIds, String permissions, String apiUrl,
			String refreshMargin, String connectTimeout) {
	}

}
