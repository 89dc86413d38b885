package io.sultan.repository;

import io.sultan.domain.user.RefreshToken;
import io.sultan.repository.RefreshTokenRepository.RotationOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * SQLite implementation of RefreshTokenRepository.
 *
 * SQLite has a single writer. Connections are opened with IMMEDIATE transactions and a busy
 * timeout, so a concurrent rotation waits for the first to commit and then finds the token
 * already consumed.
 */
public final class SqliteRefreshTokenRepository implements RefreshTokenRepository {
    private static final Logger log = LoggerFactory.getLogger(SqliteRefreshTokenRepository.class);

    private final DataSource dataSource;

    public SqliteRefreshTokenRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void insert(RefreshToken token) {
        try (Connection conn = dataSource.getConnection()) {
            insert(conn, token);
        } catch (SQLException e) {
            log.error("[SQLITE REFRESH] Failed to store refresh token for user {}: {}", token.userId(), e.getMessage());
            throw new StorageException("Failed to store refresh token", e);
        }
    }

    @Override
    public Optional<RefreshToken> findByHash(String tokenHash) {
        String sql = """
            SELECT token_hash, user_id, issued_at, expires_at, consumed_at
            FROM refresh_tokens
            WHERE token_hash = ?
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, tokenHash);

            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
                return Optional.empty();
            }

        } catch (SQLException e) {
            log.error("[SQLITE REFRESH] Failed to look up refresh token: {}", e.getMessage());
            throw new StorageException("Failed to look up refresh token", e);
        }
    }

    @Override
    public RotationResult rotate(String presentedHash, String successorHash, Instant successorExpiresAt, Instant now) {
        String consumeSql = """
            UPDATE refresh_tokens
            SET consumed_at = ?
            WHERE token_hash = ?
              AND consumed_at IS NULL
              AND expires_at > ?
            """;

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                String nowText = SqliteTimestamps.format(now);
                int updated;
                try (PreparedStatement stmt = conn.prepareStatement(consumeSql)) {
                    stmt.setString(1, nowText);
                    stmt.setString(2, presentedHash);
                    stmt.setString(3, nowText);
                    updated = stmt.executeUpdate();
                }

                if (updated == 0) {
                    RotationOutcome outcome = classifyRejected(conn, presentedHash, now);
                    conn.rollback();
                    return RotationResult.rejected(outcome);
                }

                UUID userId = ownerOf(conn, presentedHash);
                insert(conn, RefreshToken.issued(successorHash, userId, now, successorExpiresAt));
                conn.commit();
                return RotationResult.rotated(userId);

            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            log.error("[SQLITE REFRESH] Rotation failed: {}", e.getMessage());
            throw new StorageException("Failed to rotate refresh token", e);
        }
    }

    @Override
    public boolean revoke(String tokenHash, Instant now) {
        String sql = """
            UPDATE refresh_tokens
            SET consumed_at = ?
            WHERE token_hash = ?
              AND consumed_at IS NULL
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, SqliteTimestamps.format(now));
            stmt.setString(2, tokenHash);
            return stmt.executeUpdate() > 0;

        } catch (SQLException e) {
            log.error("[SQLITE REFRESH] Failed to revoke refresh token: {}", e.getMessage());
            throw new StorageException("Failed to revoke refresh token", e);
        }
    }

    @Override
    public int deleteExpired(Instant before) {
        String sql = "DELETE FROM refresh_tokens WHERE expires_at < ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setString(1, SqliteTimestamps.format(before));
            int deleted = stmt.executeUpdate();
            if (deleted > 0) {
                log.info("[SQLITE REFRESH] Purged {} expired refresh tokens", deleted);
            }
            return deleted;

        } catch (SQLException e) {
            log.error("[SQLITE REFRESH] Failed to purge expired refresh tokens: {}", e.getMessage());
            throw new StorageException("Failed to purge expired refresh tokens", e);
        }
    }

    private void insert(Connection conn, RefreshToken token) throws SQLException {
        String sql = """
            INSERT INTO refresh_tokens (token_hash, user_id, issued_at, expires_at)
            VALUES (?, ?, ?, ?)
            """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, token.tokenHash());
            stmt.setString(2, token.userId().toString());
            stmt.setString(3, SqliteTimestamps.format(token.issuedAt()));
            stmt.setString(4, SqliteTimestamps.format(token.expiresAt()));
            stmt.executeUpdate();
        }
    }

    private UUID ownerOf(Connection conn, String tokenHash) throws SQLException {
        String sql = "SELECT user_id FROM refresh_tokens WHERE token_hash = ?";
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, tokenHash);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    throw new SQLException("Refresh token vanished during rotation");
                }
                return parseUuid(rs.getString("user_id"));
            }
        }
    }

    /**
     * The conditional update matched nothing; find out why. Consumed wins over expired.
     */
    private RotationOutcome classifyRejected(Connection conn, String tokenHash, Instant now) throws SQLException {
        String sql = """
            SELECT token_hash, user_id, issued_at, expires_at, consumed_at
            FROM refresh_tokens
            WHERE token_hash = ?
            """;
        try (PreparedStatement stmt = conn.prepareStatement(sql)) {
            stmt.setString(1, tokenHash);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next()) {
                    return RotationOutcome.UNKNOWN;
                }
                RefreshToken token = mapRow(rs);
                if (token.isConsumed()) {
                    return RotationOutcome.CONSUMED;
                }
                // Not consumed and not expired means another rotation consumed it after our UPDATE
                return token.isExpiredAt(now) ? RotationOutcome.EXPIRED : RotationOutcome.CONSUMED;
            }
        }
    }

    private static UUID parseUuid(String value) throws SQLException {
        try {
            return UUID.fromString(value);
        } catch (IllegalArgumentException e) {
            throw new SQLException("Corrupt user_id in refresh_tokens: " + value, e);
        }
    }

    private static Instant parseTimestamp(String value) throws SQLException {
        try {
            return SqliteTimestamps.parse(value);
        } catch (IllegalArgumentException e) {
            throw new SQLException("Corrupt timestamp in refresh_tokens: " + value, e);
        }
    }

    private RefreshToken mapRow(ResultSet rs) throws SQLException {
        return new RefreshToken(
            rs.getString("token_hash"),
            parseUuid(rs.getString("user_id")),
            parseTimestamp(rs.getString("issued_at")),
            parseTimestamp(rs.getString("expires_at")),
            parseTimestamp(rs.getString("consumed_at"))
        );
    }
}
