package com.flagship.finance_automation.autosave;

import com.flagship.finance_automation.bank.AccountGroup;
import com.flagship.finance_automation.bank.AccountIdentifier;
import com.flagship.finance_automation.bank.AccountSource;
import com.flagship.finance_automation.bank.AccountTransaction;
import com.flagship.finance_automation.bank.GroupRef;
import com.flagship.finance_automation.common.MinorUnits;
import com.flagship.finance_automation.config.FinanceConfiguration;
import com.flagship.finance_automation.homeassistant.Notifier;
import com.flagship.finance_automation.homeassistant.StatePublisher;
import com.flagship.finance_automation.homeassistant.StateUpdate;
import com.flagship.finance_automation.observability.FinanceMetrics;
import com.flagship.finance_automation.pot.Pot;
import com.flagship.finance_automation.transfer.MoneyMover;
import com.flagship.finance_automation.transfer.TransferEndpoint;
import com.flagship.finance_automation.transfer.TransferIntent;
import com.flagship.finance_automation.transfer.TransferLedger;
import com.flagship.finance_automation.transfer.TransferRecord;
import com.flagship.finance_automation.transfer.TransferStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Periodic savings computed from spending since the last sweep.
 *
 * The window starts when the previous sweep committed, or
 * {@code initial-lookback} ago when there has been none, and ends now. The
 * deposit key {@code auto-save-sweep:<potId>:<windowStartEpochSecond>} is fixed
 * by the window start, so repeating a sweep before the previous one committed
 * reuses the same ledger record.
 */
@Service
@Slf4j
public class SavingsSweepService {

    static final String KEY_PREFIX = "auto-save-sweep:";

    private final FinanceConfiguration configuration;
    private final AccountSource accountSource;
    private final SavingsCalculator calculator;
    private final TransferLedger ledger;
    private final MoneyMover moneyMover;
    private final StatePublisher statePublisher;
    private final Notifier notifier;
    private final FinanceMetrics metrics;
    private final Clock clock;

    public SavingsSweepService(FinanceConfiguration configuration,
                               AccountSource accountSource,
                               SavingsCalculator calculator,
                               TransferLedger ledger,
                               MoneyMover moneyMover,
                               StatePublisher statePublisher,
                               Notifier notifier,
                               FinanceMetrics metrics,
                               Clock clock) {
        this.configuration = configuration;
        this.accountSource = accountSource;
        this.calculator = calculator;
        this.ledger = ledger;
        this.moneyMover = moneyMover;
        this.statePublisher = statePublisher;
        this.notifier = notifier;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Works out what a sweep would save right now, without moving money.
     *
     * @throws IllegalStateException when the sweep is disabled
     */
    public SavingsCalculation calculate() {
        FinanceConfiguration.SavingsSweep sweep = requireEnabled();
        Instant until = clock.instant();
        Instant since = windowStart(sweep, until);
        List<AccountTransaction> transactions = fetchTransactions(sweep, since, until);
        SavingsCalculation calculation = calculator.calculate(transactions, sweep, since, until);
        log.debug("Savings calculation since {}: total={}, categories={}",
                since, calculation.getTotalMinorUnits(), calculation.getCategories());
        return calculation;
    }

    /**
     * Calculates and publishes the pending amount with its breakdown.
     */
    public SavingsCalculation publish() {
        SavingsCalculation calculation = calculate();
        statePublisher.publishAsync(toStateUpdate(configuration.getAutoSave().getSweep(), calculation));
        return calculation;
    }

    /**
     * Deposits the pending amount into the sweep pot.
     *
     * @return the ledger record, or empty when there was nothing to save
     */
    public Optional<TransferRecord> sweep() {
        FinanceConfiguration.SavingsSweep sweep = requireEnabled();
        SavingsCalculation calculation = calculate();
        statePublisher.publishAsync(toStateUpdate(sweep, calculation));

        long total = calculation.getTotalMinorUnits();
        if (total <= 0) {
            log.info("Nothing to save since {}", calculation.getSince());
            metrics.recordSavingsSweep("nothing_to_save");
            return Optional.empty();
        }

        Pot pot = sweep.getPot();
        TransferIntent intent = TransferIntent.create(key(pot, calculation.getSince()),
                TransferEndpoint.account(pot.getFundingAccountId()),
                TransferEndpoint.pot(pot.getPotId()),
                total,
                "Savings sweep since " + calculation.getSince(),
                clock.instant());
        TransferRecord record = moneyMover.execute(intent);
        metrics.recordSavingsSweep(record.getStatus().name().toLowerCase(Locale.ROOT));
        log.info("Savings sweep finished: key={}, amount={}, status={}",
                record.getIdempotencyKey(), total, record.getStatus());

        if (record.getStatus() == TransferStatus.COMMITTED) {
            notifier.notify("Auto-save",
                    String.format("Saved £%s into %s (%s).", MinorUnits.toMajorString(total), pot.getName(),
                            describe(calculation.getCategories())));
        }
        return Optional.of(record);
    }

    /**
     * When the last sweep into the pot committed.
     */
    public Optional<Instant> lastSweepAt() {
        return lastSweepAt(requireEnabled());
    }

    static String key(Pot pot, Instant since) {
        return KEY_PREFIX + pot.getPotId() + ":" + since.getEpochSecond();
    }

    private Optional<Instant> lastSweepAt(FinanceConfiguration.SavingsSweep sweep) {
        return ledger.findLatestCommittedWithKeyPrefix(KEY_PREFIX + sweep.getPot().getPotId() + ":")
                .map(TransferRecord::getCommittedAt);
    }

    private Instant windowStart(FinanceConfiguration.SavingsSweep sweep, Instant until) {
        return lastSweepAt(sweep).orElseGet(() -> until.minus(sweep.getInitialLookback()));
    }

    private List<AccountTransaction> fetchTransactions(FinanceConfiguration.SavingsSweep sweep,
                                                       Instant since, Instant until) {
        Map<String, AccountTransaction> byId = new LinkedHashMap<>();
        for (GroupRef ref : sweep.getTransactionGroups()) {
            AccountGroup group = configuration.group(ref)
                    .orElseThrow(() -> new IllegalStateException("Unknown transaction group " + ref));
            for (AccountIdentifier member : group.getMembers()) {
                for (AccountTransaction transaction
                        : accountSource.fetchTransactions(group.getBankRef(), member, since, until)) {
                    String id = transaction.getTransactionId() == null
                            ? "unidentified-" + byId.size() : transaction.getTransactionId();
                    byId.putIfAbsent(id, transaction);
                }
            }
        }
        return new ArrayList<>(byId.values());
    }

    private StateUpdate toStateUpdate(FinanceConfiguration.SavingsSweep sweep, SavingsCalculation calculation) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("currency", configuration.getCurrency());
        attributes.put("since", calculation.getSince().toString());
        attributes.put("transactions", calculation.getTransactionCount());
        calculation.getCategories().forEach((category, amount) ->
                attributes.put(category, MinorUnits.toMajorString(amount)));
        attributes.put("breakdown", calculation.getBreakdown());
        return new StateUpdate(sweep.getEntityId(),
                MinorUnits.toMajorString(calculation.getTotalMinorUnits()), attributes);
    }

    private FinanceConfiguration.SavingsSweep requireEnabled() {
        FinanceConfiguration.SavingsSweep sweep = configuration.getAutoSave().getSweep();
        if (sweep == null || !sweep.isEnabled()) {
            throw new IllegalStateException("Savings sweep is disabled");
        }
        return sweep;
    }

    private static String describe(Map<String, Long> categories) {
        StringJoiner joiner = new StringJoiner(", ");
        categories.forEach((category, amount) -> {
            if (amount > 0) {
                joiner.add(category.replace('_', ' ') + " £" + MinorUnits.toMajorString(amount));
            }
        });
        return joiner.toString();
    }
}
