package io.sultan.repository;

import io.sultan.domain.user.User;
import io.sultan.repository.DuplicateUserException.Field;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.UUID;

/**
 * SQLite implementation of UserRepository.
 * Ids and timestamps are TEXT columns; values are normalised on the way in and out.
 */
public final class SqliteUserRepository implements UserRepository {
    private static final Logger log = LoggerFactory.getLogger(SqliteUserRepository.class);

    // Primary result code; extended codes (e.g. SQLITE_CONSTRAINT_UNIQUE) share it.
    private static final int SQLITE_CONSTRAINT = 19;

    private final DataSource dataSource;
    private final Clock clock;

    public SqliteUserRepository(DataSource dataSource, Clock clock) {
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

            stmt.setString(1, id.toString());
            stmt.setString(2, username);
            stmt.setString(3, email);
            stmt.setString(4, passwordHash);
            stmt.setString(5, SqliteTimestamps.format(createdAt));
            stmt.executeUpdate();

            log.debug("[SQLITE USERS] Inserted user {} ({})", username, id);
            return new User(id, username, email, passwordHash, createdAt);

        } catch (SQLException e) {
            if (e.getErrorCode() == SQLITE_CONSTRAINT) {
                Field field = duplicateField(e);
                if (field != null) {
                    throw new DuplicateUserException(field, e);
                }
            }
            log.error("[SQLITE USERS] Failed to insert user {}: {}", username, e.getMessage());
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
        return findOne(sql, id.toString(), "id");
    }

    @Override
    public boolean delete(UUID id) {
        if (id == null) {
            return false;
        }
        String sql = "DELETE FROM users WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, id.toString());
            int deleted = stmt.executeUpdate();
            if (deleted > 0) {
                log.info("[SQLITE USERS] Deleted user {}", id);
            }
            return deleted > 0;

        } catch (SQLException e) {
            log.error("[SQLITE USERS] Failed to delete user {}: {}", id, e.getMessage());
            throw new StorageException("Failed to delete user", e);
        }
    }

    private Optional<User> findOne(String sql, String key, String column) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, key);

            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapUser(rs));
                }
                return Optional.empty();
            }

        } catch (SQLException e) {
            log.error("[SQLITE USERS] Failed to find user by {}: {}", column, e.getMessage());
            throw new StorageException("Failed to find user by " + column, e);
        }
    }

    /**
     * SQLite names the failing column in the message: "UNIQUE constraint failed: users.email".
     */
    private static Field duplicateField(SQLException e) {
        String message = e.getMessage() != null ? e.getMessage() : "";
        if (!message.contains("UNIQUE")) return null;
        if (message.contains("users.username")) return Field.USERNAME;
        if (message.contains("users.email")) return Field.EMAIL;
        return null;
    }

    private User mapUser(ResultSet rs) throws SQLException {
        String id = rs.getString("id");
        String createdAt = rs.getString("created_at");
        try {
            return new User(
                UUID.fromString(id),
                rs.getString("username"),
                rs.getString("email"),
                rs.getString("password_hash"),
                SqliteTimestamps.parse(createdAt)
            );
        } catch (IllegalArgumentException e) {
            throw new SQLException("Corrupt user row " + id, e);
        }
    }
}
