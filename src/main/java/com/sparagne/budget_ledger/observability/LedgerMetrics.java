package com.sparagne.budget_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.transactions: Counter of ledger commands, tagged by type and outcome
 * - ledger.voids: Counter of successful voids
 * - statistics.cache: Counter of statistics cache lookups, tagged hit/miss
 * - ledger.latency: Timer per engine operation
 * - ledger.balance.drift: Counter of targets found drifting by verification
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter voids;
    private final Counter balanceDrift;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.voids = Counter.builder("ledger.voids")
                .description("Number of transactions voided")
                .register(registry);

        this.balanceDrift = Counter.builder("ledger.balance.drift")
                .description("Wallets or cash flows whose stored balance disagrees with their posted legs")
                .register(registry);
    }

    // ==================== Counter Methods ====================

    /**
     * Records a ledger command with its transaction type and outcome
     * ({@code success} or the lower-cased error kind).
     */
    public void recordTransaction(String type, String outcome) {
        registry.counter("ledger.transactions",
                "type", sanitizeTag(type),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void incrementVoids() {
        voids.increment();
    }

    public void recordBalanceDrift(int targets) {
        balanceDrift.increment(targets);
    }

    public void recordStatisticsCacheHit() {
        registry.counter("statistics.cache", "result", "hit").increment();
    }

    public void recordStatisticsCacheMiss() {
        registry.counter("statistics.cache", "result", "miss").increment();
    }

    // ==================== Timer Methods ====================

    /**
     * Records engine operation latency.
     */
    public void recordLatency(String operation, long durationMs) {
        registry.timer("ledger.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    // ==================== Helper Methods ====================

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
