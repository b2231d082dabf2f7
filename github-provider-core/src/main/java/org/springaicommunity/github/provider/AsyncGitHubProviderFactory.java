package org.springaicommunity.github.provider;

/**
 * Registers the non-blocking {@link AsyncGitHubProvider} as {@code github-async}.
 */
public class AsyncGitHubProviderFactory implements ProviderFactory {

	public static final String NAME = "github-async";

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public AsyncGitHubProvider create(ProviderSettings settings) {
		return GitHubProviderBuilder.create().settings(settings).buildAsyncProvider();
	}

}
