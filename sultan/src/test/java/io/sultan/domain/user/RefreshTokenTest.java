package io.sultan.domain.user;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class RefreshTokenTest {

    private static final Instant ISSUED = Instant.parse("2026-03-01T10:00:00Z");
    private static final Instant EXPIRES = Instant.parse("2026-03-08T10:00:00Z");

    @Test
    void expiresExactlyAtExpiresAt() {
        RefreshToken token = RefreshToken.issued("hash", UUID.randomUUID(), ISSUED, EXPIRES);

        assertFalse(token.isExpiredAt(ISSUED));
        assertFalse(token.isExpiredAt(EXPIRES.minusMillis(1)));
        assertTrue(token.isExpiredAt(EXPIRES));
        assertTrue(token.isExpiredAt(EXPIRES.plusSeconds(1)));
    }

    @Test
    void consumedOnlyOnceConsumedAtIsSet() {
        RefreshToken fresh = RefreshToken.issued("hash", UUID.randomUUID(), ISSUED, EXPIRES);
        RefreshToken used = new RefreshToken("hash", fresh.userId(), ISSUED, EXPIRES, ISSUED.plusSeconds(60));

        assertFalse(fresh.isConsumed());
        assertTrue(used.isConsumed());
    }
}
