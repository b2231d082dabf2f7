package org.springaicommunity.github.provider;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Blocking cache of installation tokens, one entry per installation and
 * {@link TokenScope}.
 *
 * <p>
 * Fresh tokens are served without locking. When a token is missing or within the refresh
 * margin of its expiry, callers serialize on the entry's lock and only the first one
 * performs the exchange; the others pick up its token, or its failure, once they get the
 * lock. Each of them gets its own exception, caused by the failure of that exchange. A
 * failed exchange leaves the entry as it was, so the next caller tries again.
 *
 * <p>
 * Safe to call from any number of threads. Personal access tokens pass straight through.
 */
public class InstallationTokenCache {

	private final InstallationTokenExchange exchange;

	private final Duration refreshMargin;

	private final ConcurrentMap<TokenCacheKey, CacheEntry> entries = new ConcurrentHashMap<>();

	public InstallationTokenCache(InstallationTokenExchange exchange, Duration refreshMargin) {
		this.exchange = exchange;
		this.refreshMargin = refreshMargin;
	}

	/**
	 * Get a token usable at {@code now} for the credential, exchanging a new one if needed.
	 * @param credential the provider's credential
	 * @param now current time
	 * @return a token that is fresh at {@code now}
	 * @throws AuthException if a needed exchange fails
	 * @throws CryptoException if the App private key is unusable
	 */
	public InstallationToken tokenFor(Credential credential, Instant now) {
		if (credential instanceof Credential.PersonalToken) {
			return InstallationToken.forPersonalToken(((Credential.PersonalToken) credential).value());
		}
		Credential.AppInstallation installation = (Credential.AppInstallation) credential;
		CacheEntry entry = entries.computeIfAbsent(TokenCacheKey.of(installation), key -> new CacheEntry());

		InstallationToken current = entry.current;
		if (current != null && current.isFreshAt(now, refreshMargin)) {
			return current;
		}

		long observedExchanges = entry.completedExchanges;
		entry.refreshLock.lock();
		try {
			current = entry.current;
			if (current != null && current.isFreshAt(now, refreshMargin)) {
				return current;
			}
			GitHubProviderException concurrentFailure = entry.lastFailure;
			if (entry.completedExchanges != observedExchanges && concurrentFailure != null) {
				// Another caller's exchange failed while this one waited
				throw sharedFailure(installation, concurrentFailure);
			}
			try {
				InstallationToken refreshed = exchange.exchange(installation, now);
				entry.current = refreshed;
				entry.lastFailure = null;
				return refreshed;
			}
			catch (GitHubProviderException e) {
				entry.lastFailure = e;
				throw e;
			}
			finally {
				entry.completedExchanges++;
			}
		}
		finally {
			entry.refreshLock.unlock();
		}
	}

	/**
	 * Returns the cached token for an App installation without refreshing it.
	 * @param installation installation and scope the token was issued for
	 * @return the cached token, or null if none was issued yet
	 */
	public @Nullable InstallationToken cachedToken(Credential.AppInstallation installation) {
		CacheEntry entry = entries.get(TokenCacheKey.of(installation));
		return entry != null ? entry.current : null;
	}

	/**
	 * Returns the cached unscoped token for an installation without refreshing it.
	 * @param installationId installation id
	 * @return the cached token, or null if none was issued yet
	 */
	public @Nullable InstallationToken cachedToken(String installationId) {
		CacheEntry entry = entries.get(TokenCacheKey.unscoped(installationId));
		return entry != null ? entry.current : null;
	}

	private static GitHubProviderException sharedFailure(Credential.AppInstallation installation,
			GitHubProviderException failure) {
		if (failure instanceof CryptoException) {
			return new CryptoException(failure.getMessage(), failure);
		}
		String endpoint = failure.getEndpoint();
		return new AuthException(failure.getMessage(),
				endpoint != null ? endpoint : GitHubClient.accessTokensPath(installation.installationId()),
				failure.getStatusCode(), failure);
	}

	int queuedRefreshes(String installationId) {
		CacheEntry entry = entries.get(TokenCacheKey.unscoped(installationId));
		return entry != null ? entry.refreshLock.getQueueLength() : 0;
	}

	private static final class CacheEntry {

		private final ReentrantLock refreshLock = new ReentrantLock();

		private volatile @Nullable InstallationToken current;

		// Written only while holding refreshLock
		private volatile long completedExchanges;

		private @Nullable GitHubProviderException lastFailure;

	}

}
