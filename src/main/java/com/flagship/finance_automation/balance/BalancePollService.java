package com.flagship.finance_automation.balance;

import com.flagship.finance_automation.bank.AccountGroup;
import com.flagship.finance_automation.bank.BankRef;
import com.flagship.finance_automation.config.FinanceConfiguration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs bank polls, at most one at a time per bank.
 *
 * Scheduled polls submit one independent task per bank so a slow or failing
 * bank never delays the others. On-demand polls run on the caller's thread.
 */
@Service
@Slf4j
public class BalancePollService {

    private final BalanceAggregator aggregator;
    private final FinanceConfiguration configuration;
    private final ThreadPoolTaskExecutor pollExecutor;

    private final Set<BankRef> inProgress = ConcurrentHashMap.newKeySet();

    public BalancePollService(BalanceAggregator aggregator,
                              FinanceConfiguration configuration,
                              @Qualifier("pollExecutor") ThreadPoolTaskExecutor pollExecutor) {
        this.aggregator = aggregator;
        this.configuration = configuration;
        this.pollExecutor = pollExecutor;
    }

    /**
     * Submits a poll task for every configured bank.
     */
    public void pollAllBanks() {
        for (BankRef bankRef : configuration.banks()) {
            try {
                pollExecutor.execute(() -> pollSafely(bankRef));
            } catch (TaskRejectedException e) {
                log.warn("Poll queue full, skipping {} this cycle", bankRef);
            }
        }
    }

    /**
     * Polls one bank now.
     *
     * @return the snapshots, or empty if a poll of this bank is already running
     */
    public Optional<Map<AccountGroup, BalanceSnapshot>> pollNow(BankRef bankRef) {
        if (!configuration.banks().contains(bankRef)) {
            throw new IllegalArgumentException("Bank is not configured: " + bankRef);
        }
        if (!inProgress.add(bankRef)) {
            log.info("Poll of {} already in progress, skipping", bankRef);
            return Optional.empty();
        }
        try {
            return Optional.of(aggregator.poll(bankRef));
        } finally {
            inProgress.remove(bankRef);
        }
    }

    private void pollSafely(BankRef bankRef) {
        try {
            pollNow(bankRef);
        } catch (Exception e) {
            log.error("Poll of {} failed: {}", bankRef, e.getMessage(), e);
        }
    }
}
