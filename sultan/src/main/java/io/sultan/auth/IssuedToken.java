package io.sultan.auth;

import java.time.Instant;

/**
 * A freshly minted token and the instant it stops being valid.
 */
public record IssuedToken(String token, Instant expiresAt) {
    @Override
    public String toString() {
        return "IssuedToken[expiresAt=" + expiresAt + "]";
    }
}
