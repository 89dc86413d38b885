package io.sultan.repository;

import io.sultan.bootstrap.Persistence;
import io.sultan.domain.user.RefreshToken;
import io.sultan.domain.user.User;
import io.sultan.repository.DuplicateUserException.Field;
import io.sultan.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Behaviour every UserRepository adapter must share. Subclasses supply a migrated, empty store.
 */
abstract class UserRepositoryContract {

    protected static final String HASH = "$argon2id$v=19$m=1024,t=1,p=1$c2FsdHNhbHQ$aGFzaGhhc2g";

    protected MutableClock clock;
    protected Persistence persistence;
    protected UserRepository users;

    protected abstract Persistence openPersistence(MutableClock clock) throws Exception;

    @BeforeEach
    void setUpStore() throws Exception {
        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00.123456789Z"));
        persistence = openPersistence(clock);
        users = persistence.users();
    }

    @AfterEach
    void closeStore() {
        if (persistence != null) {
            persistence.close();
        }
    }

    @Test
    void createThenFindByUsernameAndId() {
        User created = users.create("alice", "alice@example.com", HASH);

        assertNotNull(created.id());
        assertEquals("alice", created.username());
        assertEquals("alice@example.com", created.email());
        assertEquals(HASH, created.passwordHash());

        assertEquals(Optional.of(created), users.findByUsername("alice"));
        assertEquals(Optional.of(created), users.findById(created.id()));
    }

    @Test
    @DisplayName("created_at reads back as the millisecond instant returned by create")
    void createdAtHasMillisecondPrecision() {
        User created = users.create("alice", "alice@example.com", HASH);

        assertEquals(Instant.parse("2026-03-01T10:00:00.123Z"), created.createdAt());
        assertEquals(created.createdAt(), users.findById(created.id()).orElseThrow().createdAt());
    }

    @Test
    void findReturnsEmptyWhenAbsent() {
        assertTrue(users.findByUsername("nobody").isEmpty());
        assertTrue(users.findById(UUID.randomUUID()).isEmpty());
    }

    @Test
    @DisplayName("A null id finds nothing and deletes nothing")
    void nullIdFindsAndDeletesNothing() {
        users.create("alice", "alice@example.com", HASH);

        assertTrue(users.findById(null).isEmpty());
        assertFalse(users.delete(null));
        assertTrue(users.findByUsername(null).isEmpty());
        assertTrue(users.findByUsername("alice").isPresent());
    }

    @Test
    void usernameLookupIsExact() {
        users.create("alice", "alice@example.com", HASH);

        assertTrue(users.findByUsername("Alice").isEmpty());
        assertTrue(users.findByUsername("alice ").isEmpty());
    }

    @Test
    void duplicateUsernameIsReported() {
        users.create("alice", "alice@example.com", HASH);

        DuplicateUserException e = assertThrows(DuplicateUserException.class,
            () -> users.create("alice", "other@example.com", HASH));
        assertEquals(Field.USERNAME, e.getField());
    }

    @Test
    void duplicateEmailIsReported() {
        users.create("alice", "alice@example.com", HASH);

        DuplicateUserException e = assertThrows(DuplicateUserException.class,
            () -> users.create("alice2", "alice@example.com", HASH));
        assertEquals(Field.EMAIL, e.getField());
    }

    @Test
    @DisplayName("Concurrent creates with the same username: exactly one succeeds")
    void concurrentDuplicateUsername() throws Exception {
        int threads = 8;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(threads);

        try {
            List<Future<User>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                String email = "bob" + i + "@example.com";
                futures.add(executor.submit(() -> {
                    start.await();
                    return users.create("bob", email, HASH);
                }));
            }
            start.countDown();

            int created = 0;
            int duplicates = 0;
            for (Future<User> future : futures) {
                try {
                    future.get(30, TimeUnit.SECONDS);
                    created++;
                } catch (ExecutionException e) {
                    DuplicateUserException cause = assertInstanceOf(DuplicateUserException.class, e.getCause());
                    assertEquals(Field.USERNAME, cause.getField());
                    duplicates++;
                }
            }

            assertEquals(1, created);
            assertEquals(threads - 1, duplicates);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Deleting a user removes the row and its refresh tokens")
    void deleteCascadesToRefreshTokens() {
        User alice = users.create("alice", "alice@example.com", HASH);
        Instant now = clock.instant();
        persistence.refreshTokens().insert(RefreshToken.issued("a".repeat(64), alice.id(), now, now.plus(Duration.ofDays(1))));

        assertTrue(users.delete(alice.id()));
        assertFalse(users.delete(alice.id()));

        assertTrue(users.findById(alice.id()).isEmpty());
        assertTrue(persistence.refreshTokens().findByHash("a".repeat(64)).isEmpty());

        // username is free again
        assertNotNull(users.create("alice", "alice@example.com", HASH));
    }
}
