package org.springaicommunity.github.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * The parts both provider facades share: the resolved credential, the token exchange,
 * the envelope codec, the transport and the clock.
 *
 * <p>
 * The credential is resolved once, when the core is built. When only an installation
 * repository is configured, building the core asks GitHub for the installation id.
 * Configuration changed afterwards is only seen by a new core.
 */
public final class ProviderCore {

	private static final Logger logger = LoggerFactory.getLogger(ProviderCore.class);

	private final Credential credential;

	private final GitHubClient client;

	private final InstallationTokenExchange exchange;

	private final GraphQLEnvelopeCodec codec;

	private final Duration refreshMargin;

	private final Clock clock;

	/**
	 * Resolve the credential and wire the shared collaborators.
	 * @param settings provider settings
	 * @param client transport
	 * @param objectMapper mapper used for token responses and GraphQL envelopes
	 * @param clock clock the facades read once per call
	 * @throws ConfigurationException if the settings name no usable credential
	 * @throws AuthException if the installation of the configured repository cannot be
	 * found
	 */
	public ProviderCore(ProviderSettings settings, GitHubClient client, ObjectMapper objectMapper, Clock clock) {
		this.client = client;
		this.exchange = new InstallationTokenExchange(client, new AppJwtMinter(), objectMapper);
		this.codec = new GraphQLEnvelopeCodec(objectMapper);
		this.refreshMargin = settings.getRefreshMargin();
		this.clock = clock;
		this.credential = new CredentialResolver(settings).resolve(
				(appId, privateKey, target) -> exchange.findInstallationId(appId, privateKey, target, clock.instant()));
		logger.info("GitHub provider configured for {} using {} authentication", settings.getApiUrl(),
				credential instanceof Credential.PersonalToken ? "personal access token" : "GitHub App installation");
	}

	public Credential credential() {
		return credential;
	}

	public GitHubClient client() {
		return client;
	}

	public InstallationTokenExchange exchange() {
		return exchange;
	}

	public GraphQLEnvelopeCodec codec() {
		return codec;
	}

	public Duration refreshMargin() {
		return refreshMargin;
	}

	public Clock clock() {
		return clock;
	}

}
