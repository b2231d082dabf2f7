package org.springaicommunity.github.provider;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * {@link GitHubClient} backed by the Java 11+ {@link HttpClient}. Blocking calls use
 * {@link HttpClient#send}, non-blocking ones {@link HttpClient#sendAsync}.
 *
 * <p>
 * No timeouts beyond those configured on the {@link HttpClient} are applied. Rate limit
 * headers are read from every response and exposed via {@link #getLastRateLimitInfo()}.
 */
public class GitHubHttpClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(GitHubHttpClient.class);

	private static final String GITHUB_JSON = "application/vnd.github+json";

	private final HttpClient httpClient;

	private final String apiUrl;

	private final String userAgent;

	private volatile @Nullable RateLimitInfo lastRateLimitInfo;

	/**
	 * Create a client with a default {@link HttpClient} configured from the settings.
	 * @param settings provider settings (API URL, connect timeout, user agent)
	 */
	public GitHubHttpClient(ProviderSettings settings) {
		this(HttpClient.newBuilder()
			.connectTimeout(settings.getConnectTimeout())
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build(), settings.getApiUrl(), settings.getUserAgent());
	}

	/**
	 * Create a client on a caller-supplied {@link HttpClient}, which then owns all
	 * transport policy such as timeouts, proxies and executors.
	 * @param httpClient the transport
	 * @param apiUrl API base URL without trailing slash
	 * @param userAgent User-Agent header value
	 */
	public GitHubHttpClient(HttpClient httpClient, String apiUrl, String userAgent) {
		this.httpClient = httpClient;
		this.apiUrl = apiUrl;
		this.userAgent = userAgent;
	}

	@Override
	public @Nullable RateLimitInfo getLastRateLimitInfo() {
		return lastRateLimitInfo;
	}

	@Override
	public GitHubResponse createAccessToken(String installationId, String jwt, @Nullable String body) {
		String path = GitHubClient.accessTokensPath(installationId);
		return execute(accessTokenRequest(path, jwt, body), path);
	}

	@Override
	public CompletableFuture<GitHubResponse> createAccessTokenAsync(String installationId, String jwt,
			@Nullable String body) {
		String path = GitHubClient.accessTokensPath(installationId);
		return executeAsync(accessTokenRequest(path, jwt, body), path);
	}

	@Override
	public GitHubResponse getInstallation(InstallationTarget target, String jwt) {
		String path = target.installationPath();
		return execute(appRequest(path, jwt).GET().build(), path);
	}

	@Override
	public CompletableFuture<GitHubResponse> getInstallationAsync(InstallationTarget target, String jwt) {
		String path = target.installationPath();
		return executeAsync(appRequest(path, jwt).GET().build(), path);
	}

	@Override
	public GitHubResponse postGraphQL(String authorization, String body) {
		return execute(graphQLRequest(authorization, body), GRAPHQL_PATH);
	}

	@Override
	public CompletableFuture<GitHubResponse> postGraphQLAsync(String authorization, String body) {
		return executeAsync(graphQLRequest(authorization, body), GRAPHQL_PATH);
	}

	private HttpRequest accessTokenRequest(String path, String jwt, @Nullable String body) {
		HttpRequest.Builder builder = appRequest(path, jwt);
		if (body == null) {
			return builder.POST(HttpRequest.BodyPublishers.noBody()).build();
		}
		return builder.header("Content-Type", "application/json")
			.POST(HttpRequest.BodyPublishers.ofString(body))
			.build();
	}

	private HttpRequest.Builder appRequest(String path, String jwt) {
		return HttpRequest.newBuilder()
			.uri(URI.create(apiUrl + path))
			.header("Authorization", "Bearer " + jwt)
			.header("Accept", GITHUB_JSON)
			.header("User-Agent", userAgent);
	}

	private HttpRequest graphQLRequest(String authorization, String body) {
		return HttpRequest.newBuilder()
			.uri(URI.create(apiUrl + GRAPHQL_PATH))
			.header("Authorization", authorization)
			.header("Content-Type", "application/json")
			.header("Accept", "application/json")
			.header("User-Agent", userAgent)
			.POST(HttpRequest.BodyPublishers.ofString(body))
			.build();
	}

	private GitHubResponse execute(HttpRequest request, String path) {
		long start = System.currentTimeMillis();
		try {
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
			return toResponse(request, path, response, start);
		}
		catch (IOException e) {
			logger.error("{} {} failed after {}ms: {}", request.method(), path, System.currentTimeMillis() - start,
					e.getMessage());
			throw new TransportException("HTTP request failed: " + e.getMessage(), path, e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new TransportException("HTTP request interrupted", path, e);
		}
	}

	private CompletableFuture<GitHubResponse> executeAsync(HttpRequest request, String path) {
		long start = System.currentTimeMillis();
		return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString()).handle((response, failure) -> {
			if (failure != null) {
				Throwable cause = failure instanceof CompletionException && failure.getCause() != null
						? failure.getCause() : failure;
				logger.error("{} {} failed after {}ms: {}", request.method(), path,
						System.currentTimeMillis() - start, cause.getMessage());
				throw new TransportException("HTTP request failed: " + cause.getMessage(), path, cause);
			}
			return toResponse(request, path, response, start);
		});
	}

	private GitHubResponse toResponse(HttpRequest request, String path, HttpResponse<String> response, long start) {
		recordRateLimit(response);
		String body = response.body() != null ? response.body() : "";
		logger.debug("{} {} completed in {}ms with HTTP {} ({} bytes)", request.method(), path,
				System.currentTimeMillis() - start, response.statusCode(), body.length());
		return new GitHubResponse(path, response.statusCode(), body);
	}

	private void recordRateLimit(HttpResponse<?> response) {
		int remaining = parseIntHeader(response, "X-RateLimit-Remaining", -1);
		if (remaining < 0) {
			return;
		}
		long reset = parseLongHeader(response, "X-RateLimit-Reset", -1);
		int limit = parseIntHeader(response, "X-RateLimit-Limit", -1);
		int used = parseIntHeader(response, "X-RateLimit-Used", -1);
		this.lastRateLimitInfo = new RateLimitInfo(limit, remaining, reset, used);
		if (remaining < 100) {
			logger.info("Rate limit low: {}/{} remaining, resets at epoch {}", remaining, limit, reset);
		}
		else {
			logger.debug("Rate limit: {}/{} remaining, resets at epoch {}", remaining, limit, reset);
		}
	}

	private static int parseIntHeader(HttpResponse<?> response, String headerName, int defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Integer.parseInt(v);
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	private static long parseLongHeader(HttpResponse<?> response, String headerName, long defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Long.parseLong(v);
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

}
