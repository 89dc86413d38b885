package io.sultan.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Histogram;

import java.util.Locale;

/**
 * Prometheus metrics for account operations.
 *
 * Key Metrics:
 * - sultan_auth_operations_total{operation, outcome} - outcome is "success" or an error kind
 * - sultan_auth_operation_seconds{operation} - latency distribution
 */
public class AuthMetrics {

    public enum Operation {
        REGISTER,
        LOGIN,
        REFRESH,
        LOGOUT,
        AUTHENTICATE;

        String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final CollectorRegistry registry;
    private final Counter operations;
    private final Histogram latency;

    public AuthMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public AuthMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.operations = Counter.build()
            .name("sultan_auth_operations_total")
            .help("Account operations by outcome")
            .labelNames("operation", "outcome")
            .register(registry);

        // Argon2 dominates register/login latency, hence the wide buckets
        this.latency = Histogram.build()
            .name("sultan_auth_operation_seconds")
            .help("Account operation latency in seconds")
            .labelNames("operation")
            .buckets(0.005, 0.01, 0.025, 0.05, 0.1, 0.25, 0.5, 1.0, 2.5)
            .register(registry);
    }

    public void record(Operation operation, String outcome, long startNanos) {
        operations.labels(operation.label(), outcome.toLowerCase(Locale.ROOT)).inc();
        latency.labels(operation.label()).observe((System.nanoTime() - startNanos) / 1_000_000_000.0);
    }

    public double count(Operation operation, String outcome) {
        return operations.labels(operation.label(), outcome.toLowerCase(Locale.ROOT)).get();
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
