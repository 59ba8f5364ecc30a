package com.flagship.finance_automation.pot;

import com.flagship.finance_automation.balance.BalanceSnapshot;
import com.flagship.finance_automation.config.FinanceConfiguration;
import com.flagship.finance_automation.transfer.TransferEndpoint;
import com.flagship.finance_automation.transfer.TransferIntent;
import com.flagship.finance_automation.transfer.TransferLedger;
import com.flagship.finance_automation.transfer.TransferRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

/**
 * Decides whether a pot needs topping up or drawing down to match its target.
 *
 * No intent is produced when:
 * - the pot has no target group
 * - either snapshot is stale or older than one poll interval plus the grace
 * - a transfer touching the pot committed at or after the pot balance was
 *   observed (the balance does not reflect it yet)
 * - the difference is below the pot's minimum delta
 * - the difference is negative and withdrawals are disabled
 * - the intent's key is already committed
 *
 * The key {@code pot-reconcile:<potId>:<yyyyMMdd>:<target>:<current>} is
 * derived from the inputs, so the same decision on the same balances and day
 * always maps to the same ledger record.
 */
@Service
@Slf4j
public class PotManager {

    private final TransferLedger ledger;
    private final FinanceConfiguration configuration;
    private final Clock clock;

    public PotManager(TransferLedger ledger, FinanceConfiguration configuration, Clock clock) {
        this.ledger = ledger;
        this.configuration = configuration;
        this.clock = clock;
    }

    public Optional<TransferIntent> reconcile(Pot pot, BalanceSnapshot currentPotBalance,
                                              BalanceSnapshot targetGroupBalance) {
        if (!pot.hasTarget()) {
            log.debug("Pot {} has no target group", pot.getName());
            return Optional.empty();
        }
        if (currentPotBalance.isStale() || targetGroupBalance.isStale()) {
            log.info("Pot {} not reconciled: stale balance (pot stale={}, target stale={})",
                    pot.getName(), currentPotBalance.isStale(), targetGroupBalance.isStale());
            return Optional.empty();
        }

        Instant now = clock.instant();
        Duration maximumAge = configuration.maximumSnapshotAge();
        if (currentPotBalance.ageAt(now).compareTo(maximumAge) > 0
                || targetGroupBalance.ageAt(now).compareTo(maximumAge) > 0) {
            log.info("Pot {} not reconciled: balances older than {} (pot observed {}, target observed {})",
                    pot.getName(), maximumAge, currentPotBalance.getObservedAt(), targetGroupBalance.getObservedAt());
            return Optional.empty();
        }

        TransferEndpoint potEndpoint = TransferEndpoint.pot(pot.getPotId());
        Optional<TransferRecord> latest = ledger.findLatestCommittedInvolving(potEndpoint);
        if (latest.isPresent() && !latest.get().getCommittedAt().isBefore(currentPotBalance.getObservedAt())) {
            log.info("Pot {} not reconciled: transfer {} committed at {} is newer than the pot balance ({})",
                    pot.getName(), latest.get().getIdempotencyKey(), latest.get().getCommittedAt(),
                    currentPotBalance.getObservedAt());
            return Optional.empty();
        }

        long target = targetGroupBalance.getAmountMinorUnits();
        long current = currentPotBalance.getAmountMinorUnits();
        long delta = Math.subtractExact(target, current);
        if (Math.abs(delta) < pot.getMinimumDelta()) {
            log.debug("Pot {} within minimum delta: target={}, current={}", pot.getName(), target, current);
            return Optional.empty();
        }
        if (delta < 0 && !pot.isWithdrawalsEnabled()) {
            log.info("Pot {} holds {} more than its target but withdrawals are disabled", pot.getName(), -delta);
            return Optional.empty();
        }

        String key = key(pot, now, target, current);
        if (ledger.isCommitted(key)) {
            log.debug("Pot {} reconciliation {} already committed", pot.getName(), key);
            return Optional.empty();
        }

        TransferEndpoint funding = TransferEndpoint.account(pot.getFundingAccountId());
        if (delta > 0) {
            return Optional.of(TransferIntent.create(key, funding, potEndpoint, delta,
                    String.format("Top up %s to match %s", pot.getName(), pot.getTargetGroup()), now));
        }
        return Optional.of(TransferIntent.create(key, potEndpoint, funding, -delta,
                String.format("Withdraw from %s to match %s", pot.getName(), pot.getTargetGroup()), now));
    }

    String key(Pot pot, Instant now, long target, long current) {
        String day = LocalDate.ofInstant(now, configuration.getZone()).format(DateTimeFormatter.BASIC_ISO_DATE);
        return String.format("pot-reconcile:%s:%s:%d:%d", pot.getPotId(), day, target, current);
    }
}
