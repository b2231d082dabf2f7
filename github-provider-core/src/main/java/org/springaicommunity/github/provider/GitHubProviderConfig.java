package org.springaicommunity.github.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;
import org.springframework.core.env.Environment;

/**
 * Spring configuration for the GitHub providers. Settings are read from the
 * {@code GITHUB_*} properties of the {@link Environment}, which include system
 * environment variables.
 */
@Configuration
public class GitHubProviderConfig {

	@Bean
	public ProviderSettings providerSettings(Environment environment) {
		return ProviderSettings.fromEnvironment(environment::getProperty);
	}

	@Bean
	public ObjectMapper objectMapper() {
		return ObjectMapperFactory.create();
	}

	@Bean
	public GitHubClient gitHubClient(ProviderSettings providerSettings) {
		return new GitHubHttpClient(providerSettings);
	}

	@Bean
	public GitHubProvider gitHubProvider(ProviderSettings providerSettings, GitHubClient gitHubClient,
			ObjectMapper objectMapper) {
		return GitHubProviderBuilder.create()
			.settings(providerSettings)
			.httpClient(gitHubClient)
			.objectMapper(objectMapper)
			.buildProvider();
	}

	@Bean
	@Lazy
	public AsyncGitHubProvider asyncGitHubProvider(ProviderSettings providerSettings, GitHubClient gitHubClient,
			ObjectMapper objectMapper) {
		return GitHubProviderBuilder.create()
			.settings(providerSettings)
			.httpClient(gitHubClient)
			.objectMapper(objectMapper)
			.buildAsyncProvider();
	}

}
