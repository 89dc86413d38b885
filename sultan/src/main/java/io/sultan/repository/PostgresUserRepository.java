package io.sultan.repository;

import io.sultan.domain.user.User;
import io.sultan.repository.DuplicateUserException.Field;
import org.postgresql.util.PSQLException;
import org.postgresql.util.ServerErrorMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL implementation of UserRepository.
 * Native UUID ids, TIMESTAMPTZ created_at.
 */
public final class PostgresUserRepository implements UserRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresUserRepository.class);

    private static final String UNIQUE_VIOLATION = "23505";
    private static final String USERNAME_CONSTRAINT = "users_username_key";
    private static final String EMAIL_CONSTRAINT = "users_email_key";

    private final DataSource dataSource;
    private final Clock clock;

    public PostgresUserRepository(DataSource dataSource, Clock clock) {
        this.dataSource = dataSource;
        this.clock = clock;
    }

    @Override
    public User create(String username, String email, String passwordHash) {
        UUID id = UUID.randomUUID();
        Instant createdAt = clock.instant().truncatedTo(ChronoUnit.MILLIS);

        String sql = """
            INSERT INTO users (id, username, email, password_hash, created_at)
            VALUES (?, ?, ?, ?, ?)
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setObject(1, id);
            stmt.setString(2, username);
            stmt.setString(3, email);
            stmt.setString(4, passwordHash);
            stmt.setObject(5, OffsetDateTime.ofInstant(createdAt, ZoneOffset.UTC));
            stmt.executeUpdate();

            log.debug("[PG USERS] Inserted user {} ({})", username, id);
            return new User(id, username, email, passwordHash, createdAt);

        } catch (SQLException e) {
            if (UNIQUE_VIOLATION.equals(e.getSQLState())) {
                Field field = duplicateField(e);
                if (field != null) {
                    throw new DuplicateUserException(field, e);
                }
            }
            log.error("[PG USERS] Failed to insert user {}: {}", username, e.getMessage());
            throw new StorageException("Failed to insert user", e);
        }
    }

    @Override
    public Optional<User> findByUsername(String username) {
        String sql = """
            SELECT id, username, email, password_hash, created_at
            FROM users
            WHERE username = ?
            """;
        return findOne(sql, username, "username");
    }

    @Override
    public Optional<User> findById(UUID id) {
        if (id == null) {
            return Optional.empty();
        }
        String sql = """
            SELECT id, username, email, password_hash, created_at
            FROM users
            WHERE id = ?
            """;
        return findOne(sql, id, "id");
    }

    @Override
    public boolean delete(UUID id) {
        if (id == null) {
            return false;
        }
        String sql = "DELETE FROM users WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setObject(1, id);
            int deleted = stmt.executeUpdate();
            if (deleted > 0) {
                log.info("[PG USERS] Deleted user {}", id);
            }
            return deleted > 0;

        } catch (SQLException e) {
            log.error("[PG USERS] Failed to delete user {}: {}", id, e.getMessage());
            throw new StorageException("Failed to delete user", e);
        }
    }

    private Optional<User> findOne(String sql, Object key, String column) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setObject(1, key);

            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapUser(rs));
                }
                return Optional.empty();
            }

        } catch (SQLException e) {
            log.error("[PG USERS] Failed to find user by {}: {}", column, e.getMessage());
            throw new StorageException("Failed to find user by " + column, e);
        }
    }

    /**
     * Which unique constraint fired. Null when it was neither username nor email.
     */
    private static Field duplicateField(SQLException e) {
        if (e instanceof PSQLException) {
            ServerErrorMessage server = ((PSQLException) e).getServerErrorMessage();
            if (server != null && server.getConstraint() != null) {
                return switch (server.getConstraint()) {
                    case USERNAME_CONSTRAINT -> Field.USERNAME;
                    case EMAIL_CONSTRAINT -> Field.EMAIL;
                    default -> null;
                };
            }
        }
        // Fallback when the server did not report the constraint name
        String message = e.getMessage() != null ? e.getMessage() : "";
        if (message.contains("(username)")) return Field.USERNAME;
        if (message.contains("(email)")) return Field.EMAIL;
        return null;
    }

    private User mapUser(ResultSet rs) throws SQLException {
        return new User(
            rs.getObject("id", UUID.class),
            rs.getString("username"),
            rs.getString("email"),
            rs.getString("password_hash"),
            rs.getObject("created_at", OffsetDateTime.class).toInstant().truncatedTo(ChronoUnit.MILLIS)
        );
    }
}
