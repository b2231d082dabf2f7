package org.springaicommunity.github.provider.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springaicommunity.github.provider.AsyncGitHubProviderFactory;
import org.springaicommunity.github.provider.GitHubClient;
import org.springaicommunity.github.provider.GitHubProviderBuilder;
import org.springaicommunity.github.provider.GitHubProviderFactory;
import org.springaicommunity.github.provider.GitHubResponse;
import org.springaicommunity.github.provider.ObjectMapperFactory;
import org.springaicommunity.github.provider.ProviderFactory;
import org.springaicommunity.github.provider.ProviderRegistry;
import org.springaicommunity.github.provider.ProviderSettings;
import org.springaicommunity.github.provider.TransportException;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Tests for {@link GitHubProviderCli} with providers backed by a mocked
 * {@link GitHubClient}.
 */
@DisplayName("GitHubProviderCli Tests")
@ExtendWith(MockitoExtension.class)
class GitHubProviderCliTest {

	private static final String VIEWER_RESPONSE = "{\"data\":{\"viewer\":{\"login\":\"octocat\"}}}";

	@TempDir
	Path tempDir;

	@Mock
	private GitHubClient mockClient;

	private final ObjectMapper objectMapper = ObjectMapperFactory.create();

	private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();

	private final AtomicReference<ProviderSettings> usedSettings = new AtomicReference<>();

	private Path document;

	@BeforeEach
	void setUp() throws Exception {
		document = tempDir.resolve("viewer.graphql");
		Files.writeString(document, "query { viewer { login } }");
	}

	private Supplier<ProviderSettings> tokenSettings() {
		return () -> {
			ProviderSettings settings = new ProviderSettings();
			settings.setPersonalToken("abc123");
			return settings;
		};
	}

	private Function<Supplier<ProviderSettings>, ProviderRegistry> mockedRegistry() {
		return settings -> new ProviderRegistry(settings).register(factory(GitHubProviderFactory.NAME, false))
			.register(factory(AsyncGitHubProviderFactory.NAME, true));
	}

	private ProviderFactory factory(String name, boolean async) {
		return new ProviderFactory() {

			@Override
			public String name() {
				return name;
			}

			@Override
			public Object create(ProviderSettings settings) {
				usedSettings.set(settings);
				GitHubProviderBuilder builder = GitHubProviderBuilder.create().settings(settings).httpClient(mockClient);
				return async ? builder.buildAsyncProvider() : builder.buildProvider();
			}

		};
	}

	private int run(String... args) {
		return GitHubProviderCli.run(args, new PrintStream(stdout, true, StandardCharsets.UTF_8), tokenSettings(),
				mockedRegistry());
	}

	private JsonNode printedEnvelope() throws Exception {
		return objectMapper.readTree(stdout.toString(StandardCharsets.UTF_8));
	}

	@Nested
	@DisplayName("Successful Execution")
	class SuccessTest {

		@Test
		@DisplayName("Should print the envelope and exit 0")
		void shouldPrintEnvelope() throws Exception {
			when(mockClient.postGraphQL(eq("token abc123"), anyString()))
				.thenReturn(new GitHubResponse("/graphql", 200, VIEWER_RESPONSE));

			int exitCode = run("--document", document.toString());

			assertThat(exitCode).isZero();
			assertThat(printedEnvelope().at("/data/viewer/login").asText()).isEqualTo("octocat");
		}

		@Test
		@DisplayName("Should send variables from --var")
		void shouldSendVariables() throws Exception {
			when(mockClient.postGraphQL(anyString(), anyString()))
				.thenReturn(new GitHubResponse("/graphql", 200, VIEWER_RESPONSE));

			run("--document", document.toString(), "--var", "first=3", "--var", "owner=octocat");

			ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
			verify(mockClient).postGraphQL(anyString(), body.capture());
			JsonNode variables = objectMapper.readTree(body.getValue()).get("variables");
			assertThat(variables.get("first").asInt()).isEqualTo(3);
			assertThat(variables.get("owner").asText()).isEqualTo("octocat");
		}

		@Test
		@DisplayName("Should use the async provider with --async")
		void shouldUseAsyncProvider() throws Exception {
			when(mockClient.postGraphQLAsync(eq("token abc123"), anyString()))
				.thenReturn(CompletableFuture.completedFuture(new GitHubResponse("/graphql", 200, VIEWER_RESPONSE)));

			int exitCode = run("--document", document.toString(), "--async");

			assertThat(exitCode).isZero();
			verify(mockClient, never()).postGraphQL(anyString(), anyString());
		}

		@Test
		@DisplayName("Should apply --api-url to the provider settings")
		void shouldOverrideApiUrl() {
			when(mockClient.postGraphQL(anyString(), anyString()))
				.thenReturn(new GitHubResponse("/graphql", 200, VIEWER_RESPONSE));

			run("--document", document.toString(), "--api-url", "https://github.example.com/api/v3");

			assertThat(usedSettings.get().getApiUrl()).isEqualTo("https://github.example.com/api/v3");
		}

	}

	@Nested
	@DisplayName("Exit Codes")
	class ExitCodeTest {

		@Test
		@DisplayName("Should print the envelope and exit 2 when GraphQL errors are present")
		void shouldExitTwoOnGraphQLErrors() throws Exception {
			when(mockClient.postGraphQL(anyString(), anyString())).thenReturn(new GitHubResponse("/graphql", 200,
					"{\"data\":null,\"errors\":[{\"message\":\"Field 'x' doesn't exist\"}]}"));

			int exitCode = run("--document", document.toString());

			assertThat(exitCode).isEqualTo(2);
			assertThat(printedEnvelope().at("/errors/0/message").asText()).contains("doesn't exist");
		}

		@Test
		@DisplayName("Should exit 1 on transport failure without printing an envelope")
		void shouldExitOneOnTransportFailure() {
			when(mockClient.postGraphQL(anyString(), anyString()))
				.thenReturn(new GitHubResponse("/graphql", 502, "Bad Gateway"));

			assertThat(run("--document", document.toString())).isEqualTo(1);
			assertThat(stdout.toString(StandardCharsets.UTF_8)).isEmpty();
		}

		@Test
		@DisplayName("Should unwrap async failures and exit 1")
		void shouldExitOneOnAsyncFailure() {
			when(mockClient.postGraphQLAsync(anyString(), anyString())).thenReturn(CompletableFuture
				.failedFuture(new TransportException("HTTP request failed", "/graphql", new java.io.IOException())));

			assertThat(run("--document", document.toString(), "--async")).isEqualTo(1);
		}

		@Test
		@DisplayName("Should exit 1 when no credentials are configured")
		void shouldExitOneWithoutCredentials() {
			int exitCode = GitHubProviderCli.run(new String[] { "--document", document.toString() },
					new PrintStream(stdout, true, StandardCharsets.UTF_8), ProviderSettings::new, mockedRegistry());

			assertThat(exitCode).isEqualTo(1);
			verifyNoInteractions(mockClient);
		}

		@Test
		@DisplayName("Should exit 1 when the connect timeout is zero")
		void shouldExitOneOnZeroConnectTimeout() {
			Supplier<ProviderSettings> settings = () -> ProviderSettings
				.fromMap(Map.of("personal_token", "abc123", "connect_timeout_seconds", "0"));

			int exitCode = GitHubProviderCli.run(new String[] { "--document", document.toString() },
					new PrintStream(stdout, true, StandardCharsets.UTF_8), settings, mockedRegistry());

			assertThat(exitCode).isEqualTo(1);
			verifyNoInteractions(mockClient);
		}

		@Test
		@DisplayName("Should exit 1 when the document does not exist")
		void shouldExitOneOnMissingDocument() {
			assertThat(run("--document", tempDir.resolve("missing.graphql").toString())).isEqualTo(1);
			verifyNoInteractions(mockClient);
		}

		@Test
		@DisplayName("Should exit 1 on invalid arguments")
		void shouldExitOneOnBadArguments() {
			assertThat(run("--bogus")).isEqualTo(1);
		}

		@Test
		@DisplayName("Should print help and exit 0")
		void shouldPrintHelp() {
			assertThat(run("--help")).isZero();
			assertThat(stdout.toString(StandardCharsets.UTF_8)).contains("USAGE");
		}

	}

}
