package io.sultan.bootstrap;

import io.sultan.auth.Argon2PasswordHasher;
import io.sultan.auth.JwtService;
import io.sultan.auth.PasswordHasher;
import io.sultan.auth.TokenIssuer;
import io.sultan.config.AppConfig;
import io.sultan.metrics.AuthMetrics;
import io.sultan.metrics.PrometheusMetricsHandler;
import io.sultan.migration.SchemaMigration;
import io.sultan.repository.StorageException;
import io.sultan.security.InputValidator;
import io.sultan.service.UserService;
import io.sultan.transport.http.AuthHandlers;
import io.sultan.transport.http.CorsHandler;
import io.sultan.transport.http.RequestLoggingHandler;
import io.undertow.Handlers;
import io.undertow.Undertow;
import io.undertow.UndertowOptions;
import io.undertow.server.HttpHandler;
import io.undertow.server.RoutingHandler;
import io.undertow.server.handlers.BlockingHandler;
import io.undertow.util.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Sultan account service - main entry point.
 *
 * Wiring:
 * - Configuration from environment, validated before anything is opened
 * - HikariCP pool and repositories for the configured engine (PostgreSQL or SQLite)
 * - Argon2id hashing, JWT access tokens, stored refresh tokens
 * - Undertow HTTP API plus Prometheus /metrics, per-request id and access log
 * - Hourly purge of expired refresh tokens
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== Sultan account service starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        // ═══════════════════════════════════════════════════════════════
        // Configuration (fails fast)
        // ═══════════════════════════════════════════════════════════════
        AppConfig config;
        try {
            config = AppConfig.fromEnv();
            StartupConfigValidator.validate(config);
        } catch (IllegalStateException e) {
            log.error("❌ STARTUP VALIDATION FAILED", e);
            System.err.println("\n" + e.getMessage() + "\n");
            System.exit(1);
            return;
        }
        log.info("Config: {}", config);

        Clock clock = Clock.systemUTC();

        // ═══════════════════════════════════════════════════════════════
        // Database
        // ═══════════════════════════════════════════════════════════════
        Persistence persistence = Persistence.open(config, clock);

        if (config.migrateOnStartup()) {
            try {
                new SchemaMigration(persistence.dataSource(), config.databaseType()).migrate();
            } catch (IllegalStateException e) {
                log.error("❌ SCHEMA MIGRATION FAILED", e);
                persistence.close();
                System.exit(1);
                return;
            }
        } else {
            log.info("Schema migration disabled (DB_MIGRATE=false)");
        }

        // ═══════════════════════════════════════════════════════════════
        // Metrics
        // ═══════════════════════════════════════════════════════════════
        AuthMetrics metrics = new AuthMetrics();
        log.info("✓ Prometheus metrics initialized");

        // ═══════════════════════════════════════════════════════════════
        // Credentials, tokens, service
        // ═══════════════════════════════════════════════════════════════
        PasswordHasher passwordHasher = new Argon2PasswordHasher(config.hashing());
        JwtService jwtService = new JwtService(config.jwtSecret(), config.accessTokenTtl(), clock);
        TokenIssuer tokenIssuer = new TokenIssuer(jwtService, persistence.refreshTokens(), config.refreshTokenTtl(), clock);
        UserService userService = new UserService(
            persistence.users(), passwordHasher, tokenIssuer, new InputValidator(), metrics);
        log.info("✓ User service initialized");

        // ═══════════════════════════════════════════════════════════════
        // Housekeeping
        // ═══════════════════════════════════════════════════════════════
        ScheduledExecutorService housekeeping = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "refresh-token-purge");
            t.setDaemon(true);
            return t;
        });
        housekeeping.scheduleAtFixedRate(() -> purgeExpired(tokenIssuer), 1, 60, TimeUnit.MINUTES);

        // ═══════════════════════════════════════════════════════════════
        // HTTP
        // ═══════════════════════════════════════════════════════════════
        AuthHandlers authHandlers = new AuthHandlers(userService);
        PrometheusMetricsHandler metricsHandler = new PrometheusMetricsHandler(metrics.getRegistry());

        RoutingHandler routes = authHandlers.addRoutes(Handlers.routing())
            .get("/metrics", metricsHandler)
            .setFallbackHandler(exchange -> {
                exchange.setStatusCode(404);
                exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain; charset=utf-8");
                exchange.getResponseSender().send(
                    "Sultan account service\n\n" +
                    "Auth: POST /api/auth/register, /api/auth/login, /api/auth/refresh, /api/auth/logout\n" +
                    "      GET  /api/auth/me\n" +
                    "Ops:  GET  /api/health, /metrics\n"
                );
            });

        // Request logging runs on the worker thread so its MDC reaches handler and service logs
        HttpHandler root = new CorsHandler(config.corsOrigin(),
            new BlockingHandler(new RequestLoggingHandler(routes)));

        Undertow server = Undertow.builder()
            .addHttpListener(config.port(), "0.0.0.0")
            .setServerOption(UndertowOptions.MAX_ENTITY_SIZE, (long) AuthHandlers.MAX_BODY_BYTES)
            .setHandler(root)
            .build();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down...");
            server.stop();
            housekeeping.shutdownNow();
            persistence.close();
            log.info("✓ Shutdown complete");
        }, "shutdown"));

        server.start();
        log.info("✓ Sultan started on http://localhost:{}/ ({})", config.port(), config.databaseType());
    }

    private static void purgeExpired(TokenIssuer tokenIssuer) {
        try {
            int removed = tokenIssuer.purgeExpired();
            log.info("[HOUSEKEEPING] Purged {} expired refresh tokens", removed);
        } catch (StorageException e) {
            // Next run retries; an exception here would cancel the schedule
            log.warn("[HOUSEKEEPING] Refresh token purge failed: {}", e.getMessage());
        }
    }
}
