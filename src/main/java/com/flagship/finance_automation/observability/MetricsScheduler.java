package com.flagship.finance_automation.observability;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically refreshes gauges that need database queries.
 */
@Component
@RequiredArgsConstructor
public class MetricsScheduler {

    private final LedgerMetrics ledgerMetrics;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshLedgerMetrics() {
        ledgerMetrics.refreshMetrics();
    }
}
