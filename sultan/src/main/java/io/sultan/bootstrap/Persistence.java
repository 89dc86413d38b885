package io.sultan.bootstrap;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.sultan.config.AppConfig;
import io.sultan.config.DatabaseType;
import io.sultan.repository.PostgresRefreshTokenRepository;
import io.sultan.repository.PostgresUserRepository;
import io.sultan.repository.RefreshTokenRepository;
import io.sultan.repository.SqliteRefreshTokenRepository;
import io.sultan.repository.SqliteUserRepository;
import io.sultan.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Connection pool plus the repositories bound to it, chosen once by {@link DatabaseType}.
 */
public final class Persistence implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Persistence.class);

    private final DatabaseType databaseType;
    private final HikariDataSource dataSource;
    private final UserRepository users;
    private final RefreshTokenRepository refreshTokens;

    private Persistence(DatabaseType databaseType, HikariDataSource dataSource, Clock clock) {
        this.databaseType = databaseType;
        this.dataSource = dataSource;
        if (databaseType == DatabaseType.POSTGRES) {
            this.users = new PostgresUserRepository(dataSource, clock);
            this.refreshTokens = new PostgresRefreshTokenRepository(dataSource);
        } else {
            this.users = new SqliteUserRepository(dataSource, clock);
            this.refreshTokens = new SqliteRefreshTokenRepository(dataSource);
        }
    }

    public static Persistence open(AppConfig config, Clock clock) {
        return open(config.databaseType(), config.databaseUrl(), config.databaseUser(),
            config.databasePassword(), config.databasePoolSize(), clock);
    }

    public static Persistence open(DatabaseType type, String url, String user, String pass, int maxPool, Clock clock) {
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(url);
        config.setMaximumPoolSize(maxPool);
        config.setMinimumIdle(1);
        config.setConnectionTimeout(5000);

        if (type == DatabaseType.POSTGRES) {
            config.setUsername(user);
            config.setPassword(pass);
            config.setPoolName("sultan-pg");
        } else {
            // Passed to the sqlite-jdbc driver as connection pragmas
            config.addDataSourceProperty("journal_mode", "WAL");
            config.addDataSourceProperty("busy_timeout", "5000");
            config.addDataSourceProperty("foreign_keys", "true");
            config.addDataSourceProperty("transaction_mode", "IMMEDIATE");
            config.setPoolName("sultan-sqlite");
        }

        log.info("DB: type={}, url={}, pool={}", type, url, maxPool);
        return new Persistence(type, new HikariDataSource(config), clock);
    }

    public DatabaseType databaseType() {
        return databaseType;
    }

    public DataSource dataSource() {
        return dataSource;
    }

    public UserRepository users() {
        return users;
    }

    public RefreshTokenRepository refreshTokens() {
        return refreshTokens;
    }

    @Override
    public void close() {
        dataSource.close();
    }
}
