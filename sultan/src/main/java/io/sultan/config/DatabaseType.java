package io.sultan.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Storage engine backing the user repository. Chosen once at startup.
 */
public enum DatabaseType {
    POSTGRES,
    SQLITE;

    private static final Logger log = LoggerFactory.getLogger(DatabaseType.class);

    /**
     * Parse DATABASE_TYPE. Unknown values fall back to SQLite with a warning.
     */
    public static DatabaseType parse(String value) {
        if (value == null || value.isBlank()) {
            return SQLITE;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return switch (normalized) {
            case "postgres", "postgresql" -> POSTGRES;
            case "sqlite" -> SQLITE;
            default -> {
                log.warn("Unknown DATABASE_TYPE '{}', defaulting to sqlite", value);
                yield SQLITE;
            }
        };
    }
}
