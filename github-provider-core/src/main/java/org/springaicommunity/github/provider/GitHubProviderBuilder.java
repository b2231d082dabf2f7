package org.springaicommunity.github.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.time.Clock;

/**
 * Builder for creating GitHub providers without Spring dependencies.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Credentials from GITHUB_* environment variables or .env
 * GitHubProvider github = GitHubProviderBuilder.create()
 *     .settingsFromEnv()
 *     .buildProvider();
 *
 * GraphQLEnvelope envelope = github.execute("viewer", "query { viewer { login } }", null);
 *
 * // For testing with a mock transport and a fixed clock
 * GitHubClient mockClient = mock(GitHubClient.class);
 * AsyncGitHubProvider provider = GitHubProviderBuilder.create()
 *     .settings(settings)
 *     .httpClient(mockClient)
 *     .clock(Clock.fixed(now, ZoneOffset.UTC))
 *     .buildAsyncProvider();
 * }
 * </pre>
 */
public class GitHubProviderBuilder {

	private @Nullable ProviderSettings settings;

	private @Nullable ObjectMapper objectMapper;

	private @Nullable GitHubClient httpClient;

	private Clock clock = Clock.systemUTC();

	private GitHubProviderBuilder() {
	}

	/**
	 * Create a new builder instance.
	 * @return new GitHubProviderBuilder
	 */
	public static GitHubProviderBuilder create() {
		return new GitHubProviderBuilder();
	}

	/**
	 * Set the provider settings directly.
	 * @param settings provider settings
	 * @return this builder
	 */
	public GitHubProviderBuilder settings(ProviderSettings settings) {
		this.settings = settings;
		return this;
	}

	/**
	 * Read the settings from {@code GITHUB_*} environment variables and {@code .env}
	 * files.
	 * @return this builder
	 * @throws ConfigurationException if a variable holds an invalid value
	 */
	public GitHubProviderBuilder settingsFromEnv() {
		this.settings = ProviderSettings.fromEnvironment();
		return this;
	}

	/**
	 * Set a custom ObjectMapper.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public GitHubProviderBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom GitHubClient implementation. Useful for testing with mocks.
	 * @param httpClient custom GitHubClient implementation (null to use default)
	 * @return this builder
	 */
	public GitHubProviderBuilder httpClient(@Nullable GitHubClient httpClient) {
		this.httpClient = httpClient;
		return this;
	}

	/**
	 * Set the clock used to judge token freshness and to mint JWTs.
	 * @param clock the clock
	 * @return this builder
	 */
	public GitHubProviderBuilder clock(Clock clock) {
		this.clock = clock;
		return this;
	}

	/**
	 * Build the shared provider core directly (for advanced usage).
	 * @return configured ProviderCore
	 * @throws IllegalStateException if no settings were given
	 * @throws ConfigurationException if the settings name no usable credential
	 */
	public ProviderCore buildCore() {
		ProviderSettings resolved = this.settings;
		if (resolved == null) {
			throw new IllegalStateException("Provider settings are required. Call settings() or settingsFromEnv() first.");
		}
		ObjectMapper mapper = this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();
		GitHubClient client = this.httpClient != null ? this.httpClient : new GitHubHttpClient(resolved);
		return new ProviderCore(resolved, client, mapper, clock);
	}

	/**
	 * Build a blocking provider.
	 * @return configured GitHubProvider
	 */
	public GitHubProvider buildProvider() {
		return new GitHubProvider(buildCore());
	}

	/**
	 * Build a non-blocking provider.
	 * @return configured AsyncGitHubProvider
	 */
	public AsyncGitHubProvider buildAsyncProvider() {
		return new AsyncGitHubProvider(buildCore());
	}

}
