package io.sultan.repository;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SqliteTimestampsTest {

    @Test
    void formatIsFixedWidthUtcWithMillis() {
        assertEquals("2026-03-01 09:05:07.120", SqliteTimestamps.format(Instant.parse("2026-03-01T09:05:07.120999Z")));
        assertEquals("2026-03-01 09:05:07.000", SqliteTimestamps.format(Instant.parse("2026-03-01T09:05:07Z")));
    }

    @Test
    void formattedValuesSortChronologically() {
        String earlier = SqliteTimestamps.format(Instant.parse("2026-03-01T09:59:59.999Z"));
        String later = SqliteTimestamps.format(Instant.parse("2026-03-01T10:00:00Z"));

        assertTrue(earlier.compareTo(later) < 0);
    }

    @Test
    void parseAcceptsStoredAndDefaultForms() {
        assertEquals(Instant.parse("2026-03-01T09:05:07.120Z"), SqliteTimestamps.parse("2026-03-01 09:05:07.120"));
        assertEquals(Instant.parse("2026-03-01T09:05:07Z"), SqliteTimestamps.parse("2026-03-01 09:05:07"));
        assertEquals(Instant.parse("2026-03-01T09:05:07.120Z"), SqliteTimestamps.parse("2026-03-01T09:05:07.120Z"));
        assertNull(SqliteTimestamps.parse(null));
    }

    @Test
    void parseRejectsGarbage() {
        assertThrows(IllegalArgumentException.class, () -> SqliteTimestamps.parse("yesterday"));
    }
}
