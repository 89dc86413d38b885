package io.sultan.migration;

import io.sultan.config.DatabaseType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * Schema Migration - Creates the account tables on startup.
 *
 * Creates two tables:
 * - users: one row per account, username and email unique
 * - refresh_tokens: SHA-256 of each issued refresh token with expiry and consumption time,
 *   removed together with the owning user
 *
 * Every statement is idempotent, so the migration can run on each start.
 */
public final class SchemaMigration {
    private static final Logger log = LoggerFactory.getLogger(SchemaMigration.class);

    private final DataSource dataSource;
    private final DatabaseType databaseType;

    public SchemaMigration(DataSource dataSource, DatabaseType databaseType) {
        this.dataSource = dataSource;
        this.databaseType = databaseType;
    }

    /**
     * Run migration - creates tables and indexes if they don't exist.
     */
    public void migrate() {
        log.info("[SCHEMA MIGRATION] Starting {} schema migration", databaseType);

        List<String> statements = databaseType == DatabaseType.POSTGRES ? postgresStatements() : sqliteStatements();

        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            for (String sql : statements) {
                stmt.execute(sql);
            }
            log.info("[SCHEMA MIGRATION] Migration completed ({} statements)", statements.size());

        } catch (SQLException e) {
            log.error("[SCHEMA MIGRATION] Migration failed: {}", e.getMessage(), e);
            throw new IllegalStateException("Schema migration failed", e);
        }
    }

    private static List<String> postgresStatements() {
        return List.of(
            """
            CREATE TABLE IF NOT EXISTS users (
                id UUID PRIMARY KEY,
                username VARCHAR(50) NOT NULL UNIQUE,
                email VARCHAR(255) NOT NULL UNIQUE,
                password_hash TEXT NOT NULL,
                created_at TIMESTAMPTZ NOT NULL DEFAULT now()
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS refresh_tokens (
                token_hash CHAR(64) PRIMARY KEY,
                user_id UUID NOT NULL REFERENCES users(id) ON DELETE CASCADE,
                issued_at TIMESTAMPTZ NOT NULL,
                expires_at TIMESTAMPTZ NOT NULL,
                consumed_at TIMESTAMPTZ
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_refresh_tokens_user ON refresh_tokens(user_id)",
            "CREATE INDEX IF NOT EXISTS idx_refresh_tokens_expires ON refresh_tokens(expires_at)"
        );
    }

    // Timestamps are TEXT in 'yyyy-MM-dd HH:mm:ss.SSS' UTC so string comparison orders them
    private static List<String> sqliteStatements() {
        return List.of(
            """
            CREATE TABLE IF NOT EXISTS users (
                id TEXT PRIMARY KEY,
                username TEXT NOT NULL UNIQUE,
                email TEXT NOT NULL UNIQUE,
                password_hash TEXT NOT NULL,
                created_at TEXT NOT NULL DEFAULT CURRENT_TIMESTAMP
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS refresh_tokens (
                token_hash TEXT PRIMARY KEY,
                user_id TEXT NOT NULL REFERENCES users(id) ON DELETE CASCADE,
                issued_at TEXT NOT NULL,
                expires_at TEXT NOT NULL,
                consumed_at TEXT
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_refresh_tokens_user ON refresh_tokens(user_id)",
            "CREATE INDEX IF NOT EXISTS idx_refresh_tokens_expires ON refresh_tokens(expires_at)"
        );
    }
}
