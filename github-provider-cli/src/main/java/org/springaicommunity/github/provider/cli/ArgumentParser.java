package org.springaicommunity.github.provider.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Command-line argument parser for the GraphQL runner. Pure Java, no provider wiring, so
 * it can be tested on its own.
 */
public class ArgumentParser {

	private final ObjectMapper objectMapper;

	public ArgumentParser(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration();
		String variablesJson = null;
		List<String> vars = new ArrayList<>();

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-d", "--document":
					config.documentFile = getRequiredValue(args, i, "document");
					i++;
					break;

				case "-o", "--operation":
					config.operationName = getRequiredValue(args, i, "operation");
					i++;
					break;

				case "--var":
					vars.add(getRequiredValue(args, i, "var"));
					i++;
					break;

				case "--variables-json":
					variablesJson = getRequiredValue(args, i, "variables-json");
					i++;
					break;

				case "--api-url":
					config.apiUrl = getRequiredValue(args, i, "api-url");
					i++;
					break;

				case "-a", "--async":
					config.async = true;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					throw new IllegalArgumentException("Unknown option: " + arg);
			}
		}

		if (config.helpRequested) {
			return config;
		}
		if (variablesJson != null) {
			config.variables.putAll(parseVariablesJson(variablesJson));
		}
		for (String var : vars) {
			int separator = var.indexOf('=');
			if (separator <= 0) {
				throw new IllegalArgumentException("Invalid variable '" + var + "': expected key=value");
			}
			config.variables.put(var.substring(0, separator), parseValue(var.substring(separator + 1)));
		}
		if (config.operationName == null && config.documentFile != null) {
			config.operationName = defaultOperationName(config.documentFile);
		}

		validateConfiguration(config);
		return config;
	}

	/**
	 * Check if help was requested.
	 * @param args Command-line arguments
	 * @return true if help was requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("GitHub GraphQL Runner\n");
		help.append("Executes a GraphQL document against the GitHub API and prints the response envelope.\n");
		help.append("\n");
		help.append("USAGE:\n");
		help.append("    github-provider-cli --document <file> [OPTIONS]\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -d, --document <file>      GraphQL document to execute (required)\n");
		help.append("    -o, --operation <name>     Operation name used in logs (default: file name)\n");
		help.append("    --var <key=value>          Variable; value is read as JSON if it parses, else as text\n");
		help.append("                               May be repeated\n");
		help.append("    --variables-json <json>    All variables as a JSON object; --var overrides single keys\n");
		help.append("    -a, --async                Use the non-blocking provider\n");
		help.append("    --api-url <url>            API base URL (default: https://api.github.com)\n");
		help.append("    -v, --verbose              Log configuration and rate limit details\n");
		help.append("    -h, --help                 Show this help message\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    GITHUB_TOKEN                   Personal access token\n");
		help.append("    GITHUB_APP_ID                  GitHub App id (instead of GITHUB_TOKEN)\n");
		help.append("    GITHUB_APP_PRIVATE_KEY         GitHub App private key, PEM\n");
		help.append("    GITHUB_APP_PRIVATE_KEY_FILE    GitHub App private key file, PEM\n");
		help.append("    GITHUB_INSTALLATION_ID         GitHub App installation id\n");
		help.append("    GITHUB_INSTALLATION_REPOSITORY Repository (owner/repo) to find the installation on\n");
		help.append("    GITHUB_TOKEN_REPOSITORY_IDS    Limit App tokens to these repository ids\n");
		help.append("    GITHUB_TOKEN_PERMISSIONS       Limit App tokens, e.g. contents=read,issues=write\n");
		help.append("    GITHUB_API_URL                 API base URL\n");
		help.append("    Variables may also be set in a .env file in the working or home directory.\n");
		help.append("\n");
		help.append("EXIT CODES:\n");
		help.append("    0  success\n");
		help.append("    1  invalid arguments, configuration, authentication or transport failure\n");
		help.append("    2  GitHub answered with GraphQL errors\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    github-provider-cli --document viewer.graphql\n");
		help.append("    github-provider-cli -d repo.graphql --var owner=spring-projects --var name=spring-ai\n");
		help.append("    github-provider-cli -d issues.graphql --variables-json '{\"first\": 10}' --async\n");
		help.append("\n");
		return help.toString();
	}

	private Map<String, Object> parseVariablesJson(String json) {
		JsonNode node;
		try {
			node = objectMapper.readTree(json);
		}
		catch (JsonProcessingException e) {
			throw new IllegalArgumentException("Invalid --variables-json: " + e.getOriginalMessage());
		}
		if (node == null || !node.isObject()) {
			throw new IllegalArgumentException("Invalid --variables-json: must be a JSON object");
		}
		Map<String, Object> variables = new LinkedHashMap<>();
		Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
		while (fields.hasNext()) {
			Map.Entry<String, JsonNode> field = fields.next();
			variables.put(field.getKey(), toValue(field.getValue()));
		}
		return variables;
	}

	private Object parseValue(String raw) {
		JsonNode node;
		try {
			node = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS).readTree(raw);
		}
		catch (JsonProcessingException e) {
			return raw;
		}
		return node != null && !node.isMissingNode() ? toValue(node) : raw;
	}

	private Object toValue(JsonNode node) {
		try {
			return objectMapper.treeToValue(node, Object.class);
		}
		catch (JsonProcessingException e) {
			throw new IllegalArgumentException("Unsupported variable value: " + node, e);
		}
	}

	static String defaultOperationName(String documentFile) {
		Path fileName = Path.of(documentFile).getFileName();
		String name = fileName != null ? fileName.toString() : documentFile;
		int dot = name.lastIndexOf('.');
		return dot > 0 ? name.substring(0, dot) : name;
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private void validateConfiguration(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		if (config.documentFile == null || config.documentFile.isBlank()) {
			errors.add("A GraphQL document is required (--document <file>)");
		}
		if (config.operationName != null && config.operationName.isBlank()) {
			errors.add("Operation name cannot be empty");
		}
		if (config.apiUrl != null && !config.apiUrl.startsWith("http://") && !config.apiUrl.startsWith("https://")) {
			errors.add("API URL must start with http:// or https:// (got: " + config.apiUrl + ")");
		}

		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

}
