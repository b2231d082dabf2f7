package org.springaicommunity.github.provider.cli;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// GraphQL document file
	public String documentFile;

	// Operation name, defaults to the document file name without extension
	public String operationName;

	// Variables from --variables-json, overridden per key by --var
	public Map<String, Object> variables = new LinkedHashMap<>();

	// Mode flags
	public boolean async = false;

	public boolean verbose = false;

	public boolean helpRequested = false;

	// Overrides GITHUB_API_URL
	public String apiUrl = null;

	public String providerName() {
		return async ? "github-async" : "github";
	}

}
