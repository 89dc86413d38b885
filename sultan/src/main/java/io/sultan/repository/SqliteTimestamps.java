package io.sultan.repository;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * SQLite stores timestamps as UTC text. Written as fixed-width "yyyy-MM-dd HH:mm:ss.SSS" so that
 * text comparison in SQL orders the same way as time; read back from that form, from plain
 * CURRENT_TIMESTAMP output, or from ISO-8601.
 */
final class SqliteTimestamps {
    private static final DateTimeFormatter WRITE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");

    static String format(Instant instant) {
        return WRITE_FORMAT.format(LocalDateTime.ofInstant(instant.truncatedTo(ChronoUnit.MILLIS), ZoneOffset.UTC));
    }

    static Instant parse(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().replace('T', ' ');
        if (normalized.endsWith("Z")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        try {
            return LocalDateTime.parse(normalized.replace(' ', 'T'))
                .toInstant(ZoneOffset.UTC)
                .truncatedTo(ChronoUnit.MILLIS);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Unrecognised SQLite timestamp: " + value, e);
        }
    }

    private SqliteTimestamps() {}
}
