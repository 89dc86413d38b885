package io.sultan.auth;

import io.sultan.auth.InvalidTokenException.Reason;
import io.sultan.bootstrap.Persistence;
import io.sultan.domain.user.RefreshToken;
import io.sultan.support.MutableClock;
import io.sultan.support.TestDatabases;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Token issuance and rotation against a SQLite store.
 */
class TokenIssuerTest {

    private static final String SECRET = "test-secret-that-is-at-least-32-bytes-long";
    private static final Duration ACCESS_TTL = Duration.ofMinutes(15);
    private static final Duration REFRESH_TTL = Duration.ofDays(30);

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private Persistence persistence;
    private TokenIssuer issuer;
    private UUID userId;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        persistence = TestDatabases.sqlite(tempDir, clock);
        issuer = new TokenIssuer(new JwtService(SECRET, ACCESS_TTL, clock), persistence.refreshTokens(), REFRESH_TTL, clock);
        userId = persistence.users().create("alice", "alice@example.com", "$argon2id$placeholder").id();
    }

    @AfterEach
    void tearDown() {
        persistence.close();
    }

    @Test
    @DisplayName("Issued pair: access token verifies, refresh token is stored only as a hash")
    void issuePairStoresRefreshHash() {
        TokenPair pair = issuer.issuePair(userId);

        assertEquals(userId, issuer.verifyAccessToken(pair.accessToken()));
        assertEquals(43, pair.refreshToken().length());
        assertEquals(clock.instant().plus(REFRESH_TTL), pair.refresh().expiresAt());

        RefreshToken stored = persistence.refreshTokens().findByHash(TokenIssuer.hash(pair.refreshToken())).orElseThrow();
        assertEquals(userId, stored.userId());
        assertFalse(stored.isConsumed());
        assertTrue(persistence.refreshTokens().findByHash(pair.refreshToken()).isEmpty());
    }

    @Test
    @DisplayName("Refresh token is not accepted as an access token")
    void refreshTokenIsNotAnAccessToken() {
        TokenPair pair = issuer.issuePair(userId);

        assertThrows(InvalidTokenException.class, () -> issuer.verifyAccessToken(pair.refreshToken()));
    }

    @Test
    void rotateIssuesFreshPair() {
        TokenPair first = issuer.issuePair(userId);

        TokenPair second = issuer.rotate(first.refreshToken());

        assertNotEquals(first.refreshToken(), second.refreshToken());
        assertNotEquals(first.accessToken(), second.accessToken());
        assertEquals(userId, issuer.verifyAccessToken(second.accessToken()));
        assertTrue(persistence.refreshTokens().findByHash(TokenIssuer.hash(first.refreshToken())).orElseThrow().isConsumed());
    }

    @Test
    @DisplayName("Presenting the same refresh token twice fails the second time")
    void rotateTwiceFails() {
        TokenPair first = issuer.issuePair(userId);
        TokenPair second = issuer.rotate(first.refreshToken());

        InvalidTokenException e = assertThrows(InvalidTokenException.class, () -> issuer.rotate(first.refreshToken()));
        assertEquals(Reason.CONSUMED, e.getReason());

        // successor is unaffected
        assertNotNull(issuer.rotate(second.refreshToken()));
    }

    @Test
    void rotateRejectsExpiredToken() {
        TokenPair pair = issuer.issuePair(userId);
        clock.advance(REFRESH_TTL);

        InvalidTokenException e = assertThrows(InvalidTokenException.class, () -> issuer.rotate(pair.refreshToken()));
        assertEquals(Reason.EXPIRED, e.getReason());
    }

    @Test
    void rotateRejectsUnknownAndMalformedTokens() {
        String unknown = "A".repeat(43);

        assertEquals(Reason.UNKNOWN,
            assertThrows(InvalidTokenException.class, () -> issuer.rotate(unknown)).getReason());
        assertEquals(Reason.MALFORMED,
            assertThrows(InvalidTokenException.class, () -> issuer.rotate("short")).getReason());
        assertEquals(Reason.MALFORMED,
            assertThrows(InvalidTokenException.class, () -> issuer.rotate(null)).getReason());
    }

    @Test
    @DisplayName("Concurrent rotations of one token: exactly one succeeds")
    void concurrentRotationHasSingleWinner() throws Exception {
        TokenPair pair = issuer.issuePair(userId);
        int threads = 8;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(threads);

        try {
            List<Future<TokenPair>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<TokenPair> task = () -> {
                    start.await();
                    return issuer.rotate(pair.refreshToken());
                };
                futures.add(executor.submit(task));
            }
            start.countDown();

            int successes = 0;
            int consumed = 0;
            for (Future<TokenPair> future : futures) {
                try {
                    assertNotNull(future.get(30, TimeUnit.SECONDS));
                    successes++;
                } catch (ExecutionException e) {
                    InvalidTokenException cause = assertInstanceOf(InvalidTokenException.class, e.getCause());
                    assertEquals(Reason.CONSUMED, cause.getReason());
                    consumed++;
                }
            }

            assertEquals(1, successes);
            assertEquals(threads - 1, consumed);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void revokeConsumesTokenOnce() {
        TokenPair pair = issuer.issuePair(userId);

        assertTrue(issuer.revoke(pair.refreshToken()));
        assertFalse(issuer.revoke(pair.refreshToken()));
        assertFalse(issuer.revoke("not-a-token"));

        assertEquals(Reason.CONSUMED,
            assertThrows(InvalidTokenException.class, () -> issuer.rotate(pair.refreshToken())).getReason());
    }

    @Test
    void purgeExpiredRemovesOnlyExpiredTokens() {
        TokenPair old = issuer.issuePair(userId);
        clock.advance(Duration.ofDays(10));
        TokenPair recent = issuer.issuePair(userId);
        clock.advance(Duration.ofDays(25));

        assertEquals(1, issuer.purgeExpired());
        assertTrue(persistence.refreshTokens().findByHash(TokenIssuer.hash(old.refreshToken())).isEmpty());
        assertTrue(persistence.refreshTokens().findByHash(TokenIssuer.hash(recent.refreshToken())).isPresent());
    }

    @Test
    void constructorRejectsRefreshTtlNotLongerThanAccessTtl() {
        JwtService jwt = new JwtService(SECRET, ACCESS_TTL, clock);

        assertThrows(IllegalArgumentException.class,
            () -> new TokenIssuer(jwt, persistence.refreshTokens(), ACCESS_TTL, clock));
    }
}
