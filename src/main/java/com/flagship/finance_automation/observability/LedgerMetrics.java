package com.flagship.finance_automation.observability;

import com.flagship.finance_automation.transfer.TransferLedger;
import com.flagship.finance_automation.transfer.TransferRecord;
import com.flagship.finance_automation.transfer.TransferStatus;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Gauges over the transfer ledger.
 *
 * - ledger.records{status}: records per status
 * - ledger.reserved.oldest.age.seconds: how long the oldest RESERVED record has waited
 *
 * Values are cached and refreshed by {@link MetricsScheduler} so scrapes never hit the database.
 */
@Component
@Slf4j
public class LedgerMetrics {

    private final TransferLedger ledger;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final Map<TransferStatus, AtomicLong> recordCounts = new EnumMap<>(TransferStatus.class);
    private final AtomicLong oldestReservedAgeSeconds = new AtomicLong(0);

    public LedgerMetrics(TransferLedger ledger, MeterRegistry meterRegistry, Clock clock) {
        this.ledger = ledger;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        for (TransferStatus status : TransferStatus.values()) {
            AtomicLong count = new AtomicLong(0);
            recordCounts.put(status, count);
            Gauge.builder("ledger.records", count, AtomicLong::get)
                    .description("Transfer records by status")
                    .tag("status", status.name().toLowerCase())
                    .register(meterRegistry);
        }

        Gauge.builder("ledger.reserved.oldest.age.seconds", oldestReservedAgeSeconds, AtomicLong::get)
                .description("Age of the oldest RESERVED transfer in seconds")
                .register(meterRegistry);

        log.info("Ledger metrics registered with Micrometer");
    }

    public void refreshMetrics() {
        try {
            ledger.countByStatus().forEach((status, count) -> recordCounts.get(status).set(count));

            List<TransferRecord> reserved = ledger.findByStatus(TransferStatus.RESERVED);
            long oldestAge = reserved.isEmpty()
                    ? 0
                    : Math.max(0, Duration.between(reserved.get(0).getUpdatedAt(), clock.instant()).getSeconds());
            oldestReservedAgeSeconds.set(oldestAge);

            log.debug("Ledger metrics refreshed: counts={}, oldestReservedAge={}s", recordCounts, oldestAge);
        } catch (Exception e) {
            log.warn("Failed to refresh ledger metrics: {}", e.getMessage());
        }
    }
}
