package org.springaicommunity.github.provider;

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Non-blocking cache of installation tokens, one entry per installation and
 * {@link TokenScope}.
 *
 * <p>
 * Fresh tokens are returned as completed futures. Otherwise the first caller starts an
 * exchange and parks it on the entry; callers arriving while it is pending attach to that
 * same exchange instead of starting another. Each caller gets its own copy of the pending
 * future, so cancelling one caller's wait leaves the exchange running for the rest. When
 * the exchange settles the entry keeps the token (on success) and clears the pending
 * slot, so a failure is not cached.
 *
 * <p>
 * No I/O happens while the entry monitor is held.
 */
public class AsyncInstallationTokenCache {

	private final InstallationTokenExchange exchange;

	private final Duration refreshMargin;

	private final ConcurrentMap<TokenCacheKey, CacheEntry> entries = new ConcurrentHashMap<>();

	public AsyncInstallationTokenCache(InstallationTokenExchange exchange, Duration refreshMargin) {
		this.exchange = exchange;
		this.refreshMargin = refreshMargin;
	}

	/**
	 * Get a token usable at {@code now} for the credential, exchanging a new one if needed.
	 * @param credential the provider's credential
	 * @param now current time
	 * @return future completed with a token that is fresh at {@code now}, or exceptionally
	 * with {@link AuthException} or {@link CryptoException}
	 */
	public CompletableFuture<InstallationToken> tokenFor(Credential credential, Instant now) {
		if (credential instanceof Credential.PersonalToken) {
			return CompletableFuture
				.completedFuture(InstallationToken.forPersonalToken(((Credential.PersonalToken) credential).value()));
		}
		Credential.AppInstallation installation = (Credential.AppInstallation) credential;
		CacheEntry entry = entries.computeIfAbsent(TokenCacheKey.of(installation), key -> new CacheEntry());

		InstallationToken current = entry.current;
		if (current != null && current.isFreshAt(now, refreshMargin)) {
			return CompletableFuture.completedFuture(current);
		}

		synchronized (entry) {
			current = entry.current;
			if (current != null && current.isFreshAt(now, refreshMargin)) {
				return CompletableFuture.completedFuture(current);
			}
			CompletableFuture<InstallationToken> pending = entry.pending;
			// A failed exchange may still be parked if its callbacks have not all run yet
			if (pending == null || pending.isCompletedExceptionally()) {
				pending = exchange.exchangeAsync(installation, now);
				entry.pending = pending;
				CompletableFuture<InstallationToken> started = pending;
				started.whenComplete((token, failure) -> entry.settle(started, token));
			}
			return pending.copy();
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

	boolean hasPendingExchange(String installationId) {
		CacheEntry entry = entries.get(TokenCacheKey.unscoped(installationId));
		if (entry == null) {
			return false;
		}
		synchronized (entry) {
			return entry.pending != null;
		}
	}

	private static final class CacheEntry {

		private volatile @Nullable InstallationToken current;

		// Guarded by the entry monitor
		private @Nullable CompletableFuture<InstallationToken> pending;

		synchronized void settle(CompletableFuture<InstallationToken> exchange, @Nullable InstallationToken token) {
			if (token != null) {
				current = token;
			}
			if (pending == exchange) {
				pending = null;
			}
		}

	}

}
