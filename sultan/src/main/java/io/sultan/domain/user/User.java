package io.sultan.domain.user;

import java.time.Instant;
import java.util.UUID;

/**
 * User entity.
 * Created once at registration, read afterwards; never updated in place.
 */
public record User(
    UUID id,
    String username,
    String email,
    String passwordHash,
    Instant createdAt
) {
    @Override
    public String toString() {
        return "User[id=" + id + ", username=" + username + ", email=" + email + ", createdAt=" + createdAt + "]";
    }
}
