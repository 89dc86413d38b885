package io.sultan.bootstrap;

import io.sultan.config.AppConfig;
import io.sultan.config.DatabaseType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;

/**
 * Startup configuration validator.
 *
 * Called from App.main() before any pool is opened. Throws IllegalStateException on the first
 * violation and the process refuses to start.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    static final int MIN_SECRET_BYTES = 32;

    private StartupConfigValidator() {}

    /**
     * @throws IllegalStateException if configuration is invalid
     */
    public static void validate(AppConfig config) {
        log.info("Running startup config validation...");

        if (config.jwtSecret().getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalStateException(
                "INVALID CONFIG: JWT_SECRET must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        log.info("✓ JWT secret length ok");

        if (config.accessTokenTtl().isNegative() || config.accessTokenTtl().isZero()) {
            throw new IllegalStateException("INVALID CONFIG: ACCESS_TOKEN_TTL_SECS must be positive");
        }
        if (config.refreshTokenTtl().compareTo(config.accessTokenTtl()) <= 0) {
            throw new IllegalStateException(
                "INVALID CONFIG: refresh token lifetime (REFRESH_TOKEN_TTL_DAYS) must exceed access token lifetime");
        }
        log.info("✓ Token lifetimes: access={}, refresh={}", config.accessTokenTtl(), config.refreshTokenTtl());

        String expectedPrefix = config.databaseType() == DatabaseType.POSTGRES ? "jdbc:postgresql:" : "jdbc:sqlite:";
        if (!config.databaseUrl().startsWith(expectedPrefix)) {
            throw new IllegalStateException(
                "INVALID CONFIG: DATABASE_URL must start with " + expectedPrefix
                    + " when DATABASE_TYPE is " + config.databaseType());
        }
        if (config.databasePoolSize() < 1) {
            throw new IllegalStateException("INVALID CONFIG: DB_POOL_SIZE must be at least 1");
        }
        log.info("✓ Database: {}", config.databaseType());

        AppConfig.HashingParams hashing = config.hashing();
        if (hashing.memoryKib() < 8 * hashing.parallelism() || hashing.iterations() < 1 || hashing.parallelism() < 1) {
            throw new IllegalStateException("INVALID CONFIG: Argon2 parameters out of range: " + hashing);
        }
        log.info("✓ Argon2 parameters: {}", hashing);

        String origin = config.corsOrigin();
        if (origin == null || origin.isBlank() || origin.equals("*")) {
            throw new IllegalStateException(
                "INVALID CONFIG: CORS_ORIGIN must name a single origin (credentials are allowed, so no wildcard)");
        }
        log.info("✓ CORS origin: {}", origin);

        log.info("✅ Startup config validation passed");
    }
}
