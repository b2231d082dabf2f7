package org.springaicommunity.github.provider;

/**
 * Registers the blocking {@link GitHubProvider} as {@code github}.
 */
public class GitHubProviderFactory implements ProviderFactory {

	public static final String NAME = "github";

	@Override
	public String name() {
		return NAME;
	}

	@Override
	public GitHubProvider create(ProviderSettings settings) {
		return GitHubProviderBuilder.create().settings(settings).buildProvider();
	}

}
