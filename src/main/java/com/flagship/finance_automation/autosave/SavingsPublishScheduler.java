package com.flagship.finance_automation.autosave;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Keeps the pending savings amount visible between sweeps.
 */
@Component
@ConditionalOnProperty(name = {"finance.auto-saver.sweep.enabled", "finance.auto-saver.sweep.publish-enabled"},
        havingValue = "true")
@RequiredArgsConstructor
@Slf4j
public class SavingsPublishScheduler {

    private final SavingsSweepService sweepService;

    @Scheduled(fixedDelayString = "${finance.auto-saver.sweep.publish-interval:PT30M}")
    public void publishPendingSavings() {
        try {
            SavingsCalculation calculation = sweepService.publish();
            log.debug("Published pending savings: {}", calculation.getTotalMinorUnits());
        } catch (RuntimeException e) {
            log.warn("Failed to publish pending savings: {}", e.getMessage());
        }
    }
}
