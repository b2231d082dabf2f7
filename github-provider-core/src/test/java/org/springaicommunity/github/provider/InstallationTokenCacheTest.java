package org.springaicommunity.github.provider;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link InstallationTokenCache}.
 */
@DisplayName("InstallationTokenCache Tests")
@ExtendWith(MockitoExtension.class)
class InstallationTokenCacheTest {

	private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

	private static final Duration MARGIN = Duration.ofSeconds(60);

	private static final int CALLERS = 8;

	@Mock
	private InstallationTokenExchange mockExchange;

	private InstallationTokenCache cache;

	private ExecutorService executor;

	private final Credential.AppInstallation credential = TestKeys.appInstallation("67890");

	@BeforeEach
	void setUp() {
		cache = new InstallationTokenCache(mockExchange, MARGIN);
		executor = Executors.newFixedThreadPool(CALLERS);
	}

	@AfterEach
	void tearDown() {
		executor.shutdownNow();
	}

	private static InstallationToken token(String value, Instant expiresAt) {
		return new InstallationToken(value, expiresAt, "67890");
	}

	private void awaitQueuedCallers(int expected) throws InterruptedException {
		long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
		while (cache.queuedRefreshes("67890") < expected) {
			if (System.nanoTime() > deadline) {
				fail("Only " + cache.queuedRefreshes("67890") + " of " + expected + " callers queued");
			}
			Thread.sleep(5);
		}
	}

	@Nested
	@DisplayName("Fresh Tokens")
	class FreshTokenTest {

		@Test
		@DisplayName("Should exchange on first use and reuse the token afterwards")
		void shouldReuseFreshToken() {
			InstallationToken issued = token("ghs_1", NOW.plus(Duration.ofHours(1)));
			when(mockExchange.exchange(credential, NOW)).thenReturn(issued);

			assertThat(cache.tokenFor(credential, NOW)).isSameAs(issued);
			assertThat(cache.tokenFor(credential, NOW)).isSameAs(issued);

			verify(mockExchange, times(1)).exchange(any(), any());
			assertThat(cache.cachedToken("67890")).isSameAs(issued);
		}

		@Test
		@DisplayName("Should refresh a token that expires within the margin")
		void shouldRefreshWithinMargin() {
			InstallationToken nearlyExpired = token("ghs_old", NOW.plusSeconds(30));
			InstallationToken refreshed = token("ghs_new", NOW.plus(Duration.ofHours(1)));
			when(mockExchange.exchange(eq(credential), any())).thenReturn(nearlyExpired, refreshed);

			cache.tokenFor(credential, NOW.minusSeconds(120));
			InstallationToken result = cache.tokenFor(credential, NOW);

			assertThat(result.token()).isEqualTo("ghs_new");
			verify(mockExchange, times(2)).exchange(any(), any());
		}

		@Test
		@DisplayName("Should treat a token expiring exactly at the margin as stale")
		void shouldTreatMarginBoundaryAsStale() {
			InstallationToken boundary = token("ghs_old", NOW.plus(MARGIN));
			InstallationToken refreshed = token("ghs_new", NOW.plus(Duration.ofHours(1)));
			when(mockExchange.exchange(eq(credential), any())).thenReturn(boundary, refreshed);

			cache.tokenFor(credential, NOW.minusSeconds(600));

			assertThat(cache.tokenFor(credential, NOW).token()).isEqualTo("ghs_new");
		}

		@Test
		@DisplayName("Should pass personal access tokens through without an exchange")
		void shouldPassThroughPersonalToken() {
			InstallationToken result = cache.tokenFor(new Credential.PersonalToken("abc123"), NOW);

			assertThat(result.token()).isEqualTo("abc123");
			assertThat(result.isFreshAt(NOW.plus(Duration.ofDays(3650)), MARGIN)).isTrue();
			verifyNoInteractions(mockExchange);
		}

		@Test
		@DisplayName("Should keep separate entries per installation")
		void shouldKeepEntriesPerInstallation() {
			Credential.AppInstallation other = TestKeys.appInstallation("11111");
			when(mockExchange.exchange(credential, NOW)).thenReturn(token("ghs_a", NOW.plus(Duration.ofHours(1))));
			when(mockExchange.exchange(other, NOW))
				.thenReturn(new InstallationToken("ghs_b", NOW.plus(Duration.ofHours(1)), "11111"));

			assertThat(cache.tokenFor(credential, NOW).token()).isEqualTo("ghs_a");
			assertThat(cache.tokenFor(other, NOW).token()).isEqualTo("ghs_b");
		}

		@Test
		@DisplayName("Should keep scoped and unscoped tokens of one installation apart")
		void shouldKeepEntriesPerScope() {
			Credential.AppInstallation scoped = new Credential.AppInstallation("12345", TestKeys.pkcs1Pem(), "67890",
					TokenScope.parse("1296269", "contents=read"));
			when(mockExchange.exchange(credential, NOW)).thenReturn(token("ghs_all", NOW.plus(Duration.ofHours(1))));
			when(mockExchange.exchange(scoped, NOW)).thenReturn(token("ghs_scoped", NOW.plus(Duration.ofHours(1))));

			assertThat(cache.tokenFor(credential, NOW).token()).isEqualTo("ghs_all");
			assertThat(cache.tokenFor(scoped, NOW).token()).isEqualTo("ghs_scoped");
			assertThat(cache.tokenFor(scoped, NOW).token()).isEqualTo("ghs_scoped");

			assertThat(cache.cachedToken("67890").token()).isEqualTo("ghs_all");
			assertThat(cache.cachedToken(scoped).token()).isEqualTo("ghs_scoped");
			verify(mockExchange, times(2)).exchange(any(), any());
		}

	}

	@Nested
	@DisplayName("Concurrent Refresh")
	class ConcurrentRefreshTest {

		@Test
		@DisplayName("Should perform a single exchange for many concurrent callers")
		void shouldSingleFlightRefresh() throws Exception {
			InstallationToken issued = token("ghs_shared", NOW.plus(Duration.ofHours(1)));
			CountDownLatch exchangeStarted = new CountDownLatch(1);
			CountDownLatch releaseExchange = new CountDownLatch(1);
			when(mockExchange.exchange(credential, NOW)).thenAnswer(invocation -> {
				exchangeStarted.countDown();
				releaseExchange.await();
				return issued;
			});

			List<Future<InstallationToken>> results = new ArrayList<>();
			results.add(executor.submit(() -> cache.tokenFor(credential, NOW)));
			assertThat(exchangeStarted.await(10, TimeUnit.SECONDS)).isTrue();
			for (int i = 1; i < CALLERS; i++) {
				results.add(executor.submit(() -> cache.tokenFor(credential, NOW)));
			}
			awaitQueuedCallers(CALLERS - 1);
			releaseExchange.countDown();

			for (Future<InstallationToken> result : results) {
				assertThat(result.get(10, TimeUnit.SECONDS)).isSameAs(issued);
			}
			verify(mockExchange, times(1)).exchange(any(), any());
		}

		@Test
		@DisplayName("Should fail callers that waited on a failed exchange without exchanging again")
		void shouldShareFailureWithWaiters() throws Exception {
			AuthException rejected = new AuthException("rejected", "/app/installations/67890/access_tokens", 404);
			CountDownLatch exchangeStarted = new CountDownLatch(1);
			CountDownLatch releaseExchange = new CountDownLatch(1);
			when(mockExchange.exchange(credential, NOW)).thenAnswer(invocation -> {
				exchangeStarted.countDown();
				releaseExchange.await();
				throw rejected;
			});

			List<Future<InstallationToken>> results = new ArrayList<>();
			results.add(executor.submit(() -> cache.tokenFor(credential, NOW)));
			assertThat(exchangeStarted.await(10, TimeUnit.SECONDS)).isTrue();
			for (int i = 1; i < CALLERS; i++) {
				results.add(executor.submit(() -> cache.tokenFor(credential, NOW)));
			}
			awaitQueuedCallers(CALLERS - 1);
			releaseExchange.countDown();

			List<Throwable> failures = new ArrayList<>();
			for (Future<InstallationToken> result : results) {
				Throwable failure = catchThrowable(() -> result.get(10, TimeUnit.SECONDS));
				assertThat(failure).isInstanceOf(ExecutionException.class);
				failures.add(failure.getCause());
			}
			verify(mockExchange, times(1)).exchange(any(), any());

			assertThat(failures).filteredOn(failure -> failure == rejected).hasSize(1);
			assertThat(failures).filteredOn(failure -> failure != rejected)
				.hasSize(CALLERS - 1)
				.allSatisfy(failure -> assertThat(failure).isInstanceOfSatisfying(AuthException.class, e -> {
					assertThat(e.getCause()).isSameAs(rejected);
					assertThat(e.getStatusCode()).isEqualTo(404);
					assertThat(e.getSuppressed()).isEmpty();
				}))
				.doesNotHaveDuplicates();
		}

	}

	@Nested
	@DisplayName("Failed Exchanges")
	class FailedExchangeTest {

		@Test
		@DisplayName("Should leave the entry empty after a 404 and retry on the next call")
		void shouldNotCacheFailure() {
			InstallationToken issued = token("ghs_1", NOW.plus(Duration.ofHours(1)));
			when(mockExchange.exchange(credential, NOW))
				.thenThrow(new AuthException("rejected", "/app/installations/67890/access_tokens", 404))
				.thenReturn(issued);

			assertThatThrownBy(() -> cache.tokenFor(credential, NOW)).isInstanceOfSatisfying(AuthException.class,
					e -> assertThat(e.getStatusCode()).isEqualTo(404));
			assertThat(cache.cachedToken("67890")).isNull();

			assertThat(cache.tokenFor(credential, NOW)).isSameAs(issued);
			verify(mockExchange, times(2)).exchange(any(), any());
		}

		@Test
		@DisplayName("Should keep the previous token when a refresh fails")
		void shouldKeepPreviousTokenOnFailure() {
			InstallationToken nearlyExpired = token("ghs_old", NOW.plusSeconds(30));
			when(mockExchange.exchange(eq(credential), any())).thenReturn(nearlyExpired)
				.thenThrow(new AuthException("rejected", "/app/installations/67890/access_tokens", 500));

			cache.tokenFor(credential, NOW.minusSeconds(120));

			assertThatThrownBy(() -> cache.tokenFor(credential, NOW)).isInstanceOf(AuthException.class);
			assertThat(cache.cachedToken("67890")).isSameAs(nearlyExpired);
		}

		@Test
		@DisplayName("Should propagate CryptoException from an unusable key")
		void shouldPropagateCryptoException() {
			when(mockExchange.exchange(credential, NOW)).thenThrow(new CryptoException("bad key", null));

			assertThatThrownBy(() -> cache.tokenFor(credential, NOW)).isInstanceOf(CryptoException.class);
		}

	}

}
