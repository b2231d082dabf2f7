package org.springaicommunity.github.provider.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.github.provider.AsyncGitHubProvider;
import org.springaicommunity.github.provider.AsyncGitHubProviderFactory;
import org.springaicommunity.github.provider.GitHubProvider;
import org.springaicommunity.github.provider.GitHubProviderException;
import org.springaicommunity.github.provider.GitHubProviderFactory;
import org.springaicommunity.github.provider.GraphQLEnvelope;
import org.springaicommunity.github.provider.GraphQLError;
import org.springaicommunity.github.provider.GraphQLOperation;
import org.springaicommunity.github.provider.ObjectMapperFactory;
import org.springaicommunity.github.provider.ProviderRegistry;
import org.springaicommunity.github.provider.ProviderSettings;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletionException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * GitHub GraphQL Runner CLI Application
 *
 * Plain Java command-line application that executes one GraphQL document against the
 * GitHub API and prints the response envelope as JSON on standard output. Logs go to
 * standard error.
 *
 * Usage: java -jar github-provider-cli.jar --document FILE [OPTIONS]
 *
 * Environment Variables: GITHUB_TOKEN, or GITHUB_APP_ID with GITHUB_APP_PRIVATE_KEY (or
 * GITHUB_APP_PRIVATE_KEY_FILE) and GITHUB_INSTALLATION_ID or GITHUB_INSTALLATION_REPOSITORY
 */
public class GitHubProviderCli {

	private static final Logger logger = LoggerFactory.getLogger(GitHubProviderCli.class);

	static final int EXIT_OK = 0;

	static final int EXIT_FAILURE = 1;

	static final int EXIT_GRAPHQL_ERRORS = 2;

	public static void main(String[] args) {
		int exitCode = run(args, System.out);
		if (exitCode != EXIT_OK) {
			System.exit(exitCode);
		}
	}

	public static int run(String[] args, PrintStream out) {
		return run(args, out, ProviderSettings::fromEnvironment, ProviderRegistry::discover);
	}

	static int run(String[] args, PrintStream out, Supplier<ProviderSettings> settingsSource,
			Function<Supplier<ProviderSettings>, ProviderRegistry> registries) {
		ObjectMapper objectMapper = ObjectMapperFactory.create();
		ArgumentParser argumentParser = new ArgumentParser(objectMapper);

		if (argumentParser.isHelpRequested(args)) {
			out.println(argumentParser.generateHelpText());
			return EXIT_OK;
		}

		try {
			ParsedConfiguration config = argumentParser.parseAndValidate(args);
			if (config.verbose) {
				logConfiguration(config);
			}

			GraphQLOperation operation = new GraphQLOperation(config.operationName,
					readDocument(config.documentFile), config.variables);
			ProviderRegistry registry = registries.apply(() -> {
				ProviderSettings settings = settingsSource.get();
				if (config.apiUrl != null) {
					settings.setApiUrl(config.apiUrl);
				}
				if (config.verbose) {
					logger.info("Provider settings: {}", settings);
				}
				return settings;
			});

			GraphQLEnvelope envelope = execute(registry, config, operation);
			out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(envelope));

			if (envelope.hasErrors()) {
				for (GraphQLError error : envelope.errors()) {
					logger.warn("GraphQL error{}: {}", error.path() != null ? " at " + error.path() : "",
							error.message());
				}
				return EXIT_GRAPHQL_ERRORS;
			}
			return EXIT_OK;
		}
		catch (IllegalArgumentException e) {
			logger.error("{}", e.getMessage());
			logger.error("Run with --help for usage");
			return EXIT_FAILURE;
		}
		catch (GitHubProviderException e) {
			logProviderFailure(e);
			return EXIT_FAILURE;
		}
		catch (IOException e) {
			logger.error("Failed: {}", e.getMessage());
			return EXIT_FAILURE;
		}
	}

	private static GraphQLEnvelope execute(ProviderRegistry registry, ParsedConfiguration config,
			GraphQLOperation operation) {
		if (!config.async) {
			return registry.lookup(GitHubProviderFactory.NAME, GitHubProvider.class).execute(operation);
		}
		AsyncGitHubProvider provider = registry.lookup(AsyncGitHubProviderFactory.NAME, AsyncGitHubProvider.class);
		try {
			return provider.execute(operation).join();
		}
		catch (CompletionException e) {
			if (e.getCause() instanceof RuntimeException) {
				throw (RuntimeException) e.getCause();
			}
			throw e;
		}
	}

	private static String readDocument(String documentFile) throws IOException {
		Path path = Path.of(documentFile);
		if (!Files.isRegularFile(path)) {
			throw new IllegalArgumentException("GraphQL document not found: " + documentFile);
		}
		return Files.readString(path, StandardCharsets.UTF_8);
	}

	private static void logConfiguration(ParsedConfiguration config) {
		logger.info("Configuration:");
		logger.info("  Document: {}", config.documentFile);
		logger.info("  Operation: {}", config.operationName);
		logger.info("  Variables: {}", config.variables.keySet());
		logger.info("  Provider: {}", config.providerName());
		logger.info("  API URL: {}", config.apiUrl != null ? config.apiUrl : "(from environment)");
	}

	private static void logProviderFailure(GitHubProviderException e) {
		if (e.getStatusCode() >= 0) {
			logger.error("{} [{} -> HTTP {}]", e.getMessage(), e.getEndpoint(), e.getStatusCode());
		}
		else {
			logger.error("{}", e.getMessage());
		}
		if (e.getResponseBody() != null) {
			logger.error("Response body: {}", e.getResponseBody());
		}
	}

}
