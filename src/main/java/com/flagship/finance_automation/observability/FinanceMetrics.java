package com.flagship.finance_automation.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for polling, transfers, reconciliation and auto-save.
 *
 * Metrics exposed:
 * - balance.polls{bank,outcome}: completed bank polls
 * - balance.fetch.failures{bank,kind}: failed member fetches
 * - balance.stale_groups{bank}: groups reported stale
 * - balance.poll.duration{bank}: time to poll one bank
 * - transfers.executed{outcome}: final outcome of each execution
 * - transfers.duplicate_intents: intents whose key was already taken
 * - transfers.attempts: calls made to the transfer API
 * - transfers.latency: time from reserve to final ledger state
 * - pots.reconciliations{pot,outcome}: reconciliation runs
 * - autosave.triggers{result}: trigger events evaluated
 * - autosave.sweeps{outcome}: transaction-based savings sweeps
 * - homeassistant.publish.failures{kind}: state or notification calls that failed
 */
@Component
public class FinanceMetrics {

    private final MeterRegistry registry;

    private final Counter duplicateIntents;
    private final Counter transferAttempts;
    private final Timer transferLatency;

    public FinanceMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.duplicateIntents = Counter.builder("transfers.duplicate_intents")
                .description("Intents rejected because the idempotency key already exists")
                .register(registry);

        this.transferAttempts = Counter.builder("transfers.attempts")
                .description("Calls made to the transfer API, including retries")
                .register(registry);

        this.transferLatency = Timer.builder("transfers.latency")
                .description("Time from reservation to final ledger state")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    // ==================== Balances ====================

    public void recordPoll(String bank, String outcome) {
        registry.counter("balance.polls",
                "bank", sanitizeTag(bank),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordPollDuration(String bank, Duration duration) {
        registry.timer("balance.poll.duration", "bank", sanitizeTag(bank)).record(duration);
    }

    public void recordFetchFailure(String bank, String kind) {
        registry.counter("balance.fetch.failures",
                "bank", sanitizeTag(bank),
                "kind", sanitizeTag(kind)
        ).increment();
    }

    public void recordStaleGroup(String bank) {
        registry.counter("balance.stale_groups", "bank", sanitizeTag(bank)).increment();
    }

    // ==================== Transfers ====================

    public void recordTransferExecuted(String outcome) {
        registry.counter("transfers.executed", "outcome", sanitizeTag(outcome)).increment();
    }

    public void incrementDuplicateIntents() {
        duplicateIntents.increment();
    }

    public void incrementTransferAttempts() {
        transferAttempts.increment();
    }

    public void recordTransferLatency(Duration duration) {
        transferLatency.record(duration);
    }

    // ==================== Pots and auto-save ====================

    public void recordReconciliation(String pot, String outcome) {
        registry.counter("pots.reconciliations",
                "pot", sanitizeTag(pot),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordAutoSaveTrigger(String result) {
        registry.counter("autosave.triggers", "result", sanitizeTag(result)).increment();
    }

    public void recordSavingsSweep(String outcome) {
        registry.counter("autosave.sweeps", "outcome", sanitizeTag(outcome)).increment();
    }

    // ==================== Home Assistant ====================

    public void recordPublishFailure(String kind) {
        registry.counter("homeassistant.publish.failures", "kind", sanitizeTag(kind)).increment();
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
