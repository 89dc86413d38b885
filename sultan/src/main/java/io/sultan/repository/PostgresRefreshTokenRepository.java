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
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

/**
 * PostgreSQL implementation of RefreshTokenRepository.
 *
 * Rotation relies on row locking: a second UPDATE on the same token_hash blocks until the first
 * transaction commits, then re-checks consumed_at and matches nothing.
 */
public final class PostgresRefreshTokenRepository implements RefreshTokenRepository {
    private static final Logger log = LoggerFactory.getLogger(PostgresRefreshTokenRepository.class);

    private final DataSource dataSource;

    public PostgresRefreshTokenRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void insert(RefreshToken token) {
        try (Connection conn = dataSource.getConnection()) {
            insert(conn, token);
        } catch (SQLException e) {
            log.error("[PG REFRESH] Failed to store refresh token for user {}: {}", token.userId(), e.getMessage());
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
            log.error("[PG REFRESH] Failed to look up refresh token: {}", e.getMessage());
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
            RETURNING user_id
            """;

        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                UUID userId = null;
                try (PreparedStatement stmt = conn.prepareStatement(consumeSql)) {
                    stmt.setObject(1, utc(now));
                    stmt.setString(2, presentedHash);
                    stmt.setObject(3, utc(now));
                    try (ResultSet rs = stmt.executeQuery()) {
                        if (rs.next()) {
                            userId = rs.getObject("user_id", UUID.class);
                        }
                    }
                }

                if (userId == null) {
                    RotationOutcome outcome = classifyRejected(conn, presentedHash, now);
                    conn.rollback();
                    return RotationResult.rejected(outcome);
                }

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
            log.error("[PG REFRESH] Rotation failed: {}", e.getMessage());
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

            stmt.setObject(1, utc(now));
            stmt.setString(2, tokenHash);
            return stmt.executeUpdate() > 0;

        } catch (SQLException e) {
            log.error("[PG REFRESH] Failed to revoke refresh token: {}", e.getMessage());
            throw new StorageException("Failed to revoke refresh token", e);
        }
    }

    @Override
    public int deleteExpired(Instant before) {
        String sql = "DELETE FROM refresh_tokens WHERE expires_at < ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setObject(1, utc(before));
            int deleted = stmt.executeUpdate();
            if (deleted > 0) {
                log.info("[PG REFRESH] Purged {} expired refresh tokens", deleted);
            }
            return deleted;

        } catch (SQLException e) {
            log.error("[PG REFRESH] Failed to purge expired refresh tokens: {}", e.getMessage());
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
            stmt.setObject(2, token.userId());
            stmt.setObject(3, utc(token.issuedAt()));
            stmt.setObject(4, utc(token.expiresAt()));
            stmt.executeUpdate();
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

    private static OffsetDateTime utc(Instant instant) {
        return OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private RefreshToken mapRow(ResultSet rs) throws SQLException {
        OffsetDateTime consumedAt = rs.getObject("consumed_at", OffsetDateTime.class);
        return new RefreshToken(
            rs.getString("token_hash"),
            rs.getObject("user_id", UUID.class),
            rs.getObject("issued_at", OffsetDateTime.class).toInstant(),
            rs.getObject("expires_at", OffsetDateTime.class).toInstant(),
            consumedAt != null ? consumedAt.toInstant() : null
        );
    }
}
