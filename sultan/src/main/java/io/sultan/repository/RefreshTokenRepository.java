package io.sultan.repository;

import io.sultan.domain.user.RefreshToken;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for refresh-token state.
 */
public interface RefreshTokenRepository {

    void insert(RefreshToken token);

    Optional<RefreshToken> findByHash(String tokenHash);

    /**
     * Consume the presented token and store its successor in one transaction.
     *
     * The consume step is a conditional update, so among concurrent callers presenting the same
     * token exactly one sees {@link RotationOutcome#ROTATED}; the others see
     * {@link RotationOutcome#CONSUMED}.
     *
     * @param presentedHash hash of the token being exchanged
     * @param successorHash hash of the replacement token
     * @param successorExpiresAt expiry of the replacement token
     * @param now rotation instant
     */
    RotationResult rotate(String presentedHash, String successorHash, Instant successorExpiresAt, Instant now);

    /**
     * Mark a token consumed without issuing a successor.
     *
     * @return true if an unconsumed token was revoked
     */
    boolean revoke(String tokenHash, Instant now);

    /**
     * Delete rows whose expiry is before the given instant.
     *
     * @return number of rows deleted
     */
    int deleteExpired(Instant before);

    enum RotationOutcome {
        ROTATED,
        UNKNOWN,
        EXPIRED,
        CONSUMED
    }

    record RotationResult(RotationOutcome outcome, UUID userId) {
        public static RotationResult rotated(UUID userId) {
            return new RotationResult(RotationOutcome.ROTATED, userId);
        }

        public static RotationResult rejected(RotationOutcome outcome) {
            return new RotationResult(outcome, null);
        }

        public boolean isRotated() {
            return outcome == RotationOutcome.ROTATED;
        }
    }
}
