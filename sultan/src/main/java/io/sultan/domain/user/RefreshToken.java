package io.sultan.domain.user;

import java.time.Instant;
import java.util.UUID;

/**
 * Stored refresh-token state. Only the SHA-256 of the opaque token is kept.
 * consumedAt is set on rotation or revocation.
 */
public record RefreshToken(
    String tokenHash,
    UUID userId,
    Instant issuedAt,
    Instant expiresAt,
    Instant consumedAt
) {
    public static RefreshToken issued(String tokenHash, UUID userId, Instant issuedAt, Instant expiresAt) {
        return new RefreshToken(tokenHash, userId, issuedAt, expiresAt, null);
    }

    public boolean isConsumed() {
        return consumedAt != null;
    }

    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
