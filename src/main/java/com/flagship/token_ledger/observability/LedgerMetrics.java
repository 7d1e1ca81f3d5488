package com.flagship.token_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.operations: counter tagged by operation and outcome
 *   (success, insufficient_balance, overflow, invalid, error)
 * - ledger.operation.latency: timer tagged by operation
 * - ledger.notifications: counter tagged by result (published, failed)
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter notificationsPublished;
    private final Counter notificationsFailed;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.notificationsPublished = Counter.builder("ledger.notifications")
                .description("Transfer notifications handed to the notification channel")
                .tag("result", "published")
                .register(registry);

        this.notificationsFailed = Counter.builder("ledger.notifications")
                .description("Transfer notifications the notification channel rejected")
                .tag("result", "failed")
                .register(registry);
    }

    /**
     * Records one ledger call with its outcome.
     */
    public void recordOperation(String operation, String outcome, Duration duration) {
        registry.counter("ledger.operations",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
        registry.timer("ledger.operation.latency",
                "operation", sanitizeTag(operation)
        ).record(duration);
    }

    public void recordNotificationPublished() {
        notificationsPublished.increment();
    }

    public void recordNotificationFailed() {
        notificationsFailed.increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
