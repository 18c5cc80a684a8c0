package com.flagship.wallet_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer metrics for the money path.
 *
 * - ledger.transfers{type, outcome}: transfers and deposits by outcome
 * - ledger.idempotent_replays{type}: requests answered from the idempotency index
 * - ledger.rejections{reason}: requests refused before locking
 * - ledger.lock_conflicts: units of work rolled back on lock timeout or deadlock
 * - ledger.unit_of_work.duration{type}: time spent inside a unit of work
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;
    private final Counter lockConflicts;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.lockConflicts = Counter.builder("ledger.lock_conflicts")
            .description("Units of work rolled back because of lock timeout, deadlock or serialization failure")
            .register(registry);
    }

    public void recordTransfer(String type, String outcome) {
        registry.counter("ledger.transfers", "type", sanitizeTag(type), "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordReplay(String type) {
        registry.counter("ledger.idempotent_replays", "type", sanitizeTag(type)).increment();
    }

    public void recordRejection(String reason) {
        registry.counter("ledger.rejections", "reason", sanitizeTag(reason)).increment();
    }

    public void recordLockConflict() {
        lockConflicts.increment();
    }

    public void recordUnitOfWork(String type, Duration duration) {
        Timer.builder("ledger.unit_of_work.duration")
            .description("Time spent inside a transfer unit of work")
            .tag("type", sanitizeTag(type))
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(registry)
            .record(duration);
    }

    public void recordPaymentIntent(String status) {
        registry.counter("ledger.payment_intents", "status", sanitizeTag(status)).increment();
    }

    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
