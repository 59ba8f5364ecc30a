package com.flagship.finance_automation.pot;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Daily pot reconciliation, by default at 21:00 London time.
 */
@Component
@ConditionalOnProperty(name = "finance.reconciliation.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class PotReconciliationScheduler {

    private final PotReconciliationService reconciliationService;

    @Scheduled(cron = "${finance.reconciliation.cron:0 0 21 * * *}", zone = "${finance.zone:Europe/London}")
    public void reconcilePots() {
        log.info("Starting scheduled pot reconciliation");
        reconciliationService.reconcileAll();
    }
}
