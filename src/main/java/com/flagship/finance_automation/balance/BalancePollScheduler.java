package com.flagship.finance_automation.balance;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Fixed-delay timer for balance polling.
 */
@Component
@ConditionalOnProperty(name = "finance.polling.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class BalancePollScheduler {

    private final BalancePollService pollService;

    @Scheduled(fixedDelayString = "${finance.polling.interval:PT15M}",
            initialDelayString = "${finance.polling.initial-delay:PT10S}")
    public void pollBalances() {
        log.debug("Starting scheduled balance poll");
        pollService.pollAllBanks();
    }
}
