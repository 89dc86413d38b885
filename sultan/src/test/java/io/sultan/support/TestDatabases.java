package io.sultan.support;

import io.sultan.bootstrap.Persistence;
import io.sultan.config.DatabaseType;
import io.sultan.migration.SchemaMigration;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Clock;

/**
 * Migrated databases for repository and service tests.
 *
 * PostgreSQL tests run only when SULTAN_TEST_PG_URL points at a scratch database
 * (optionally SULTAN_TEST_PG_USER / SULTAN_TEST_PG_PASS); its tables are truncated on open.
 */
public final class TestDatabases {
    public static final String PG_URL_ENV = "SULTAN_TEST_PG_URL";

    private TestDatabases() {}

    public static Persistence sqlite(Path dir, Clock clock) {
        Persistence persistence = Persistence.open(
            DatabaseType.SQLITE, "jdbc:sqlite:" + dir.resolve("sultan-test.db"), null, null, 4, clock);
        new SchemaMigration(persistence.dataSource(), DatabaseType.SQLITE).migrate();
        return persistence;
    }

    public static Persistence postgres(Clock clock) throws SQLException {
        Persistence persistence = Persistence.open(
            DatabaseType.POSTGRES,
            System.getenv(PG_URL_ENV),
            System.getenv().getOrDefault("SULTAN_TEST_PG_USER", "postgres"),
            System.getenv().getOrDefault("SULTAN_TEST_PG_PASS", "postgres"),
            8,
            clock);
        new SchemaMigration(persistence.dataSource(), DatabaseType.POSTGRES).migrate();
        execute(persistence.dataSource(), "TRUNCATE refresh_tokens, users");
        return persistence;
    }

    public static void execute(DataSource dataSource, String sql) throws SQLException {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
        }
    }
}
