package io.sultan.config;

import io.sultan.util.Env;

import java.time.Duration;

/**
 * Process-wide configuration, read once at startup and immutable afterwards.
 */
public record AppConfig(
    DatabaseType databaseType,
    String databaseUrl,
    String databaseUser,
    String databasePassword,
    int databasePoolSize,
    boolean migrateOnStartup,
    String jwtSecret,
    Duration accessTokenTtl,
    Duration refreshTokenTtl,
    HashingParams hashing,
    int port,
    String corsOrigin
) {
    public static final String DEFAULT_CORS_ORIGIN = "http://localhost:5173";


    public static AppConfig fromEnv() {
        DatabaseType databaseType = DatabaseType.parse(Env.get("DATABASE_TYPE", "sqlite"));
        return new AppConfig(
            databaseType,
            Env.require("DATABASE_URL"),
            Env.get("DB_USER", null),
            Env.get("DB_PASS", null),
            Env.getInt("DB_POOL_SIZE", databaseType == DatabaseType.SQLITE ? 4 : 10),
            Env.getBool("DB_MIGRATE", true),
            Env.require("JWT_SECRET"),
            Duration.ofSeconds(Env.getLong("ACCESS_TOKEN_TTL_SECS", 900)),
            Duration.ofDays(Env.getLong("REFRESH_TOKEN_TTL_DAYS", 30)),
            new HashingParams(
                Env.getInt("ARGON2_MEMORY_KIB", HashingParams.DEFAULT.memoryKib()),
                Env.getInt("ARGON2_ITERATIONS", HashingParams.DEFAULT.iterations()),
                Env.getInt("ARGON2_PARALLELISM", HashingParams.DEFAULT.parallelism())
            ),
            Env.getInt("PORT", 8080),
            Env.get("CORS_ORIGIN", DEFAULT_CORS_ORIGIN)
        );
    }

    @Override
    public String toString() {
        return "AppConfig[databaseType=" + databaseType
            + ", databaseUrl=" + databaseUrl
            + ", databaseUser=" + databaseUser
            + ", databasePoolSize=" + databasePoolSize
            + ", migrateOnStartup=" + migrateOnStartup
            + ", accessTokenTtl=" + accessTokenTtl
            + ", refreshTokenTtl=" + refreshTokenTtl
            + ", hashing=" + hashing
            + ", port=" + port
            + ", corsOrigin=" + corsOrigin + "]";
    }

    /**
     * Argon2id work factor.
     */
    public record HashingParams(int memoryKib, int iterations, int parallelism) {
        public static final HashingParams DEFAULT = new HashingParams(19456, 2, 1);
    }
}
