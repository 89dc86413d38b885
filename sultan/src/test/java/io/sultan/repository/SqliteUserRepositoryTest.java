package io.sultan.repository;

import io.sultan.bootstrap.Persistence;
import io.sultan.support.MutableClock;
import io.sultan.support.TestDatabases;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class SqliteUserRepositoryTest extends UserRepositoryContract {

    @TempDir
    Path tempDir;

    @Override
    protected Persistence openPersistence(MutableClock clock) {
        return TestDatabases.sqlite(tempDir, clock);
    }

    @Test
    void readsRowsWrittenWithDefaultTimestamp() throws Exception {
        TestDatabases.execute(persistence.dataSource(),
            "INSERT INTO users (id, username, email, password_hash) VALUES "
                + "('6f1c2e1e-8f7a-4d5b-9a51-7d1c7a0e2b11', 'legacy', 'legacy@example.com', '" + HASH + "')");

        assertNotNull(users.findByUsername("legacy").orElseThrow().createdAt());
    }

    @Test
    void corruptRowIsStorageFault() throws Exception {
        TestDatabases.execute(persistence.dataSource(),
            "INSERT INTO users (id, username, email, password_hash, created_at) VALUES "
                + "('not-a-uuid', 'broken', 'broken@example.com', '" + HASH + "', 'yesterday')");

        assertThrows(StorageException.class, () -> users.findByUsername("broken"));
    }
}
