package io.sultan.repository;

import io.sultan.domain.user.User;

import java.util.Optional;
import java.util.UUID;

/**
 * Repository interface for user records.
 *
 * Both engine adapters honour the same contract: identifiers are UUIDs generated by the adapter,
 * created_at comes back as the same millisecond-precision instant regardless of engine, and
 * uniqueness of username and email is enforced by the database itself.
 */
public interface UserRepository {

    /**
     * Insert a new user.
     *
     * @throws DuplicateUserException when the username or email is already taken
     * @throws StorageException for any other database failure
     */
    User create(String username, String email, String passwordHash);

    Optional<User> findByUsername(String username);

    /**
     * @return empty when no user has this id, including a null id
     */
    Optional<User> findById(UUID id);

    /**
     * Remove a user (administrative path). Refresh tokens go with it.
     *
     * @return true if a row was deleted; false for a null id
     */
    boolean delete(UUID id);
}
