package com.flagship.gold_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer counters and timers for custody, ledger and settlement operations.
 *
 * Metrics exposed:
 * - custody.assets{operation,status}: mint, burn, status, custody, transfer, settlement
 * - ledger.balance.updates{channel,status}: operator vs capability-driven updates
 * - settlement.orders{phase,status}: prepare, sign, execute, cancel, fail
 * - custody.latency{operation}: wall-clock time per service operation
 * - idempotency.cache{result}: Redis fast-path hits and misses for txRef checks
 */
@Component
public class CustodyMetrics {

    private final MeterRegistry registry;

    public CustodyMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordAssetOperation(String operation, String status) {
        registry.counter("custody.assets",
                "operation", sanitizeTag(operation),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordBalanceUpdate(String channel, String status) {
        registry.counter("ledger.balance.updates",
                "channel", sanitizeTag(channel),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordOrderPhase(String phase, String status) {
        registry.counter("settlement.orders",
                "phase", sanitizeTag(phase),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("custody.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
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
