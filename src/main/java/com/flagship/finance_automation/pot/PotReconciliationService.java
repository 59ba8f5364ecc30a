package com.flagship.finance_automation.pot;

import com.flagship.finance_automation.balance.BalanceSnapshot;
import com.flagship.finance_automation.balance.BalanceSnapshotStore;
import com.flagship.finance_automation.common.MinorUnits;
import com.flagship.finance_automation.config.FinanceConfiguration;
import com.flagship.finance_automation.homeassistant.Notifier;
import com.flagship.finance_automation.observability.FinanceMetrics;
import com.flagship.finance_automation.transfer.MoneyMover;
import com.flagship.finance_automation.transfer.TransferIntent;
import com.flagship.finance_automation.transfer.TransferRecord;
import com.flagship.finance_automation.transfer.TransferStatus;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Applies {@link PotManager} decisions to configured pots.
 *
 * On top of the decision itself this service:
 * - caps top-ups at what the funding account can spare above its minimum remainder
 * - refuses anything above the global transfer safety bound
 * - asks a human to confirm top-ups above the pot's automatic limit
 * - executes through {@link MoneyMover} and reports the outcome
 * - tells a human when the pot already matches and nothing was moved
 */
@Service
@Slf4j
public class PotReconciliationService {

    private final PotManager potManager;
    private final BalanceSnapshotStore snapshots;
    private final MoneyMover moneyMover;
    private final Notifier notifier;
    private final FinanceMetrics metrics;
    private final FinanceConfiguration configuration;

    public PotReconciliationService(PotManager potManager, BalanceSnapshotStore snapshots, MoneyMover moneyMover,
                                    Notifier notifier, FinanceMetrics metrics,
                                    FinanceConfiguration configuration) {
        this.potManager = potManager;
        this.snapshots = snapshots;
        this.moneyMover = moneyMover;
        this.notifier = notifier;
        this.metrics = metrics;
        this.configuration = configuration;
    }

    /**
     * Reconciles every pot with a target group. One pot failing never stops the others.
     */
    public List<ReconciliationResult> reconcileAll() {
        List<ReconciliationResult> results = new ArrayList<>();
        for (Pot pot : configuration.potsWithTarget()) {
            try {
                results.add(reconcile(pot, false));
            } catch (Exception e) {
                metrics.recordReconciliation(pot.getName(), "error");
                log.error("Reconciliation of pot {} failed: {}", pot.getName(), e.getMessage(), e);
            }
        }
        return results;
    }

    /**
     * @param confirmed true when a human approved a top-up above the automatic limit
     * @throws PotNotFoundException if no pot has this name
     */
    public ReconciliationResult reconcile(String potName, boolean confirmed) {
        Pot pot = configuration.pot(potName).orElseThrow(() -> new PotNotFoundException(potName));
        return reconcile(pot, confirmed);
    }

    public ReconciliationResult reconcile(Pot pot, boolean confirmed) {
        MDC.put("pot", pot.getName());
        try {
            ReconciliationResult result = decideAndExecute(pot, confirmed);
            metrics.recordReconciliation(pot.getName(), result.getOutcome().name());
            log.info("Pot reconciliation finished: outcome={}, amount={}, detail={}",
                    result.getOutcome(), result.getAmountMinorUnits(), result.getDetail());
            return result;
        } finally {
            MDC.remove("pot");
        }
    }

    private ReconciliationResult decideAndExecute(Pot pot, boolean confirmed) {
        if (!pot.hasTarget()) {
            return ReconciliationResult.skipped(pot, "pot has no target group");
        }
        Optional<BalanceSnapshot> current = snapshots.find(pot.getBalanceGroup());
        Optional<BalanceSnapshot> target = snapshots.find(pot.getTargetGroup());
        if (current.isEmpty() || target.isEmpty()) {
            log.warn("Pot {} skipped: no snapshot yet for {} or {}",
                    pot.getName(), pot.getBalanceGroup(), pot.getTargetGroup());
            return ReconciliationResult.skipped(pot, "balance not yet available");
        }

        Optional<TransferIntent> decision = potManager.reconcile(pot, current.get(), target.get());
        if (decision.isEmpty()) {
            if (alreadyMatches(pot, current.get(), target.get())) {
                notifier.notify(pot.getName() + " top up skipped",
                        String.format("No top up needed: %s already holds £%s against £%s on %s.", pot.getName(),
                                MinorUnits.toMajorString(current.get().getAmountMinorUnits()),
                                MinorUnits.toMajorString(target.get().getAmountMinorUnits()), pot.getTargetGroup()));
            }
            return ReconciliationResult.noChange(pot);
        }
        TransferIntent intent = decision.get();
        boolean topUp = intent.getDestination().isPot();

        if (topUp && pot.getFundingGroup() != null) {
            Optional<TransferIntent> capped = capToFunding(pot, intent);
            if (capped.isEmpty()) {
                return ReconciliationResult.skipped(pot, "funding account cannot cover the minimum top-up");
            }
            intent = capped.get();
        }

        long amount = intent.getAmountMinorUnits();
        if (amount > configuration.getTransfers().getMaximumAmount()) {
            log.error("Pot {} transfer of {} exceeds the safety bound {}; refusing",
                    pot.getName(), amount, configuration.getTransfers().getMaximumAmount());
            return ReconciliationResult.skipped(pot, "amount exceeds the transfer safety bound");
        }

        if (topUp && amount > pot.getMaximumAutoTopUp() && !confirmed) {
            notifier.notify("Top up pot?",
                    String.format("%s needs £%s to match %s, above the automatic limit of £%s. "
                                    + "Confirm to transfer from the funding account.",
                            pot.getName(), MinorUnits.toMajorString(amount), pot.getTargetGroup(),
                            MinorUnits.toMajorString(pot.getMaximumAutoTopUp())));
            return ReconciliationResult.awaitingConfirmation(pot, amount);
        }

        TransferRecord record = moneyMover.execute(intent);
        if (record.getStatus() == TransferStatus.COMMITTED && record.getIdempotencyKey().equals(intent.getIdempotencyKey())) {
            notifier.notify(topUp ? "Pot topped up" : "Pot drawn down",
                    String.format("Moved £%s %s %s.", MinorUnits.toMajorString(record.getAmountMinorUnits()),
                            topUp ? "into" : "out of", pot.getName()));
        }
        return ReconciliationResult.executed(pot, record);
    }

    private static boolean alreadyMatches(Pot pot, BalanceSnapshot current, BalanceSnapshot target) {
        return !current.isStale() && !target.isStale()
                && Math.abs(target.getAmountMinorUnits() - current.getAmountMinorUnits()) < pot.getMinimumDelta();
    }

    private Optional<TransferIntent> capToFunding(Pot pot, TransferIntent intent) {
        Optional<BalanceSnapshot> funding = snapshots.find(pot.getFundingGroup());
        if (funding.isEmpty() || funding.get().isStale()) {
            log.warn("Pot {} top-up skipped: funding balance {} unavailable or stale",
                    pot.getName(), pot.getFundingGroup());
            return Optional.empty();
        }
        long spare = Math.max(funding.get().getAmountMinorUnits() - pot.getMinimumRemainder(), 0);
        if (intent.getAmountMinorUnits() <= spare) {
            return Optional.of(intent);
        }
        if (spare < pot.getMinimumDelta()) {
            log.warn("Pot {} top-up of {} skipped: funding can spare only {} above the remainder {}",
                    pot.getName(), intent.getAmountMinorUnits(), spare, pot.getMinimumRemainder());
            return Optional.empty();
        }
        log.info("Pot {} top-up capped from {} to {} by funding balance", pot.getName(),
                intent.getAmountMinorUnits(), spare);
        return Optional.of(TransferIntent.create(intent.getIdempotencyKey(), intent.getSource(),
                intent.getDestination(), spare, intent.getReason() + " (capped by funding)", intent.getCreatedAt()));
    }
}
