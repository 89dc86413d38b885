package io.sultan.migration;

import io.sultan.bootstrap.Persistence;
import io.sultan.config.DatabaseType;
import io.sultan.support.TestDatabases;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.ResultSet;
import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;

class SchemaMigrationTest {

    @TempDir
    Path tempDir;

    @Test
    void migrationIsIdempotent() throws Exception {
        try (Persistence persistence = TestDatabases.sqlite(tempDir, Clock.systemUTC())) {
            persistence.users().create("alice", "alice@example.com", "$argon2id$x");

            new SchemaMigration(persistence.dataSource(), DatabaseType.SQLITE).migrate();

            assertTrue(persistence.users().findByUsername("alice").isPresent());
            try (Connection conn = persistence.dataSource().getConnection();
                 ResultSet rs = conn.getMetaData().getTables(null, null, "refresh_tokens", new String[]{"TABLE"})) {
                assertTrue(rs.next());
            }
        }
    }
}
