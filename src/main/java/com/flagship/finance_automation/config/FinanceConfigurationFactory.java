package com.flagship.finance_automation.config;

import com.flagship.finance_automation.bank.AccountGroup;
import com.flagship.finance_automation.bank.AccountIdentifier;
import com.flagship.finance_automation.bank.BankRef;
import com.flagship.finance_automation.bank.GroupRef;
import com.flagship.finance_automation.pot.Pot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.DateTimeException;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Builds the immutable {@link FinanceConfiguration} from the bound properties.
 *
 * Every inconsistency is reported as a {@link ConfigurationException}, which
 * aborts context startup before any poll or trigger is handled.
 */
@Configuration
@Slf4j
public class FinanceConfigurationFactory {

    @Bean
    public FinanceConfiguration financeConfiguration(FinanceProperties properties) {
        FinanceConfiguration configuration = build(properties);
        log.info("Finance configuration loaded: banks={}, pots={}, autoSave={}",
                configuration.banks(), configuration.getPots().keySet(),
                configuration.getAutoSave().isEnabled());
        return configuration;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    public static FinanceConfiguration build(FinanceProperties properties) {
        ZoneId zone = parseZone(properties.getZone());

        Map<BankRef, List<AccountGroup>> groupsByBank = new EnumMap<>(BankRef.class);
        properties.getBanks().forEach((key, bank) -> {
            BankRef bankRef = parseBank(key);
            if (groupsByBank.containsKey(bankRef)) {
                throw new ConfigurationException("Bank configured twice: " + bankRef);
            }
            groupsByBank.put(bankRef, buildGroups(bankRef, bank));
        });

        FinanceConfiguration.FinanceConfigurationBuilder builder = FinanceConfiguration.builder()
                .zone(zone)
                .currency(properties.getCurrency())
                .pollInterval(properties.getPolling().getInterval())
                .fetchTimeout(properties.getPolling().getFetchTimeout())
                .freshnessGrace(properties.getReconciliation().getFreshnessGrace())
                .groupsByBank(groupsByBank);

        Map<String, Pot> pots = new LinkedHashMap<>();
        properties.getPots().forEach((name, definition) ->
                pots.put(name, buildPot(name, definition, groupsByBank)));
        builder.pots(pots);

        FinanceProperties.Transfers transfers = properties.getTransfers();
        if (transfers.getMaximumAmount() <= 0) {
            throw new ConfigurationException("finance.transfers.maximum-amount must be positive");
        }
        if (transfers.getInitialBackoff().toMillis() < 1
                || transfers.getMaxBackoff().compareTo(transfers.getInitialBackoff()) <= 0) {
            throw new ConfigurationException(
                    "finance.transfers.max-backoff must exceed a positive initial-backoff");
        }
        Duration retryBudget = transferRetryBudget(transfers, properties.getMonzo());
        if (transfers.getStaleReservationAfter().compareTo(retryBudget) <= 0) {
            throw new ConfigurationException(String.format(
                    "finance.transfers.stale-reservation-after (%s) must exceed the transfer retry budget (%s)",
                    transfers.getStaleReservationAfter(), retryBudget));
        }
        builder.transfers(FinanceConfiguration.TransferPolicy.builder()
                .maxAttempts(transfers.getMaxAttempts())
                .initialBackoff(transfers.getInitialBackoff())
                .multiplier(transfers.getMultiplier())
                .maxBackoff(transfers.getMaxBackoff())
                .maximumAmount(transfers.getMaximumAmount())
                .staleReservationAfter(transfers.getStaleReservationAfter())
                .build());

        builder.autoSave(buildAutoSave(properties.getAutoSaver(), pots, groupsByBank));
        return builder.build();
    }

    /**
     * Longest time one execution can keep a reservation: every attempt waiting out
     * connect and read timeouts, plus the backoff between attempts.
     */
    static Duration transferRetryBudget(FinanceProperties.Transfers transfers, FinanceProperties.Monzo monzo) {
        Duration perAttempt = monzo.getConnectTimeout().plus(monzo.getReadTimeout());
        Duration budget = perAttempt.multipliedBy(transfers.getMaxAttempts());
        double backoffMillis = transfers.getInitialBackoff().toMillis();
        for (int retry = 1; retry < transfers.getMaxAttempts(); retry++) {
            long wait = (long) Math.min(backoffMillis, transfers.getMaxBackoff().toMillis());
            budget = budget.plusMillis(wait);
            backoffMillis *= transfers.getMultiplier();
        }
        return budget;
    }

    private static List<AccountGroup> buildGroups(BankRef bankRef, FinanceProperties.Bank bank) {
        if (bank.getGroups().isEmpty()) {
            throw new ConfigurationException("Bank " + bankRef + " has no account groups");
        }
        List<AccountGroup> groups = new ArrayList<>();
        bank.getGroups().forEach((name, group) -> {
            List<AccountIdentifier> members = new ArrayList<>();
            group.getAccountIds().forEach(id -> members.add(identifier(bankRef, name, true, id)));
            group.getCardIds().forEach(id -> members.add(identifier(bankRef, name, false, id)));
            if (members.isEmpty()) {
                throw new ConfigurationException(
                        String.format("Account group %s/%s has no account or card ids", bankRef, name));
            }
            groups.add(AccountGroup.of(bankRef, name, members));
        });
        return List.copyOf(groups);
    }

    private static AccountIdentifier identifier(BankRef bankRef, String group, boolean account, String id) {
        try {
            return account ? AccountIdentifier.account(id) : AccountIdentifier.card(id);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(
                    String.format("Account group %s/%s has a blank identifier", bankRef, group), e);
        }
    }

    private static Pot buildPot(String name, FinanceProperties.PotDefinition definition,
                                Map<BankRef, List<AccountGroup>> groupsByBank) {
        if (isBlank(definition.getPotId())) {
            throw new ConfigurationException("Pot " + name + " has no pot-id");
        }
        if (isBlank(definition.getFundingAccountId())) {
            throw new ConfigurationException("Pot " + name + " has no funding-account-id");
        }
        if (definition.getMinimumDelta() <= 0) {
            throw new ConfigurationException("Pot " + name + " minimum-delta must be positive");
        }
        if (definition.getMinimumRemainder() < 0 || definition.getMaximumAutoTopUp() < 0) {
            throw new ConfigurationException("Pot " + name + " has a negative limit");
        }

        String owner = "Pot " + name;
        GroupRef balanceGroup = optionalGroup(owner, "balance-group", definition.getBalanceGroup(), groupsByBank);
        GroupRef targetGroup = optionalGroup(owner, "target-group", definition.getTargetGroup(), groupsByBank);
        GroupRef fundingGroup = optionalGroup(owner, "funding-group", definition.getFundingGroup(), groupsByBank);
        if (targetGroup != null && balanceGroup == null) {
            throw new ConfigurationException("Pot " + name + " has a target-group but no balance-group");
        }

        return Pot.builder()
                .name(name)
                .potId(definition.getPotId().trim())
                .purpose(definition.getPurpose())
                .fundingAccountId(definition.getFundingAccountId().trim())
                .balanceGroup(balanceGroup)
                .targetGroup(targetGroup)
                .fundingGroup(fundingGroup)
                .minimumDelta(definition.getMinimumDelta())
                .minimumRemainder(definition.getMinimumRemainder())
                .maximumAutoTopUp(definition.getMaximumAutoTopUp())
                .withdrawalsEnabled(definition.isWithdrawalsEnabled())
                .build();
    }

    private static GroupRef optionalGroup(String owner, String field, String text,
                                          Map<BankRef, List<AccountGroup>> groupsByBank) {
        if (isBlank(text)) {
            return null;
        }
        GroupRef ref;
        try {
            ref = GroupRef.parse(text.trim());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(
                    String.format("%s %s is invalid: %s", owner, field, e.getMessage()), e);
        }
        boolean known = groupsByBank.getOrDefault(ref.getBankRef(), List.of()).stream()
                .anyMatch(group -> group.getName().equals(ref.getGroupName()));
        if (!known) {
            throw new ConfigurationException(
                    String.format("%s %s references unknown group %s", owner, field, ref));
        }
        return ref;
    }

    private static FinanceConfiguration.AutoSave buildAutoSave(FinanceProperties.AutoSaver autoSaver,
                                                               Map<String, Pot> pots,
                                                               Map<BankRef, List<AccountGroup>> groupsByBank) {
        LocalTime activeFrom = parseTime("active-from", autoSaver.getActiveFrom());
        LocalTime activeUntil = parseTime("active-until", autoSaver.getActiveUntil());
        if (autoSaver.getDebounceWindow().compareTo(Duration.ofSeconds(1)) < 0) {
            throw new ConfigurationException("finance.auto-saver.debounce-window must be at least one second: "
                    + autoSaver.getDebounceWindow());
        }

        Pot pot = null;
        if (autoSaver.isEnabled()) {
            if (isBlank(autoSaver.getPot()) || !pots.containsKey(autoSaver.getPot())) {
                throw new ConfigurationException("finance.auto-saver.pot references unknown pot: "
                        + autoSaver.getPot());
            }
            if (autoSaver.getAmountPerTrack() <= 0) {
                throw new ConfigurationException("finance.auto-saver.amount-per-track must be positive");
            }
            pot = pots.get(autoSaver.getPot());
        }

        return FinanceConfiguration.AutoSave.builder()
                .enabled(autoSaver.isEnabled())
                .pot(pot)
                .amountPerTrack(autoSaver.getAmountPerTrack())
                .debounceWindow(autoSaver.getDebounceWindow())
                .activeFrom(activeFrom)
                .activeUntil(activeUntil)
                .sweep(buildSweep(autoSaver, pots, groupsByBank))
                .build();
    }

    private static FinanceConfiguration.SavingsSweep buildSweep(FinanceProperties.AutoSaver autoSaver,
                                                                Map<String, Pot> pots,
                                                                Map<BankRef, List<AccountGroup>> groupsByBank) {
        FinanceProperties.AutoSaver.Sweep sweep = autoSaver.getSweep();
        FinanceConfiguration.SavingsSweep.SavingsSweepBuilder builder = FinanceConfiguration.SavingsSweep.builder()
                .enabled(sweep.isEnabled())
                .roundUps(sweep.isRoundUps())
                .debitPercentage(percentage("debit-percentage", sweep.getDebitPercentage()))
                .naughtyPercentage(percentage("naughty-percentage", sweep.getNaughtyPercentage()))
                .minimum(sweep.getMinimum())
                .initialLookback(sweep.getInitialLookback())
                .entityId(sweep.getEntityId().trim());
        if (!sweep.isEnabled()) {
            return builder.build();
        }

        String potName = isBlank(sweep.getPot()) ? autoSaver.getPot() : sweep.getPot().trim();
        if (isBlank(potName) || !pots.containsKey(potName)) {
            throw new ConfigurationException("finance.auto-saver.sweep.pot references unknown pot: " + potName);
        }
        if (sweep.getTransactionGroups().isEmpty()) {
            throw new ConfigurationException("finance.auto-saver.sweep.transaction-groups must not be empty");
        }
        for (String group : sweep.getTransactionGroups()) {
            if (isBlank(group)) {
                throw new ConfigurationException("finance.auto-saver.sweep.transaction-groups has a blank entry");
            }
            builder.transactionGroup(optionalGroup("finance.auto-saver.sweep", "transaction-groups", group,
                    groupsByBank));
        }
        if (sweep.getMinimum() < 0) {
            throw new ConfigurationException("finance.auto-saver.sweep.minimum cannot be negative");
        }
        if (sweep.getInitialLookback().isZero() || sweep.getInitialLookback().isNegative()) {
            throw new ConfigurationException("finance.auto-saver.sweep.initial-lookback must be positive");
        }
        if (!isBlank(sweep.getNaughtyPattern())) {
            try {
                builder.naughtyPattern(Pattern.compile(sweep.getNaughtyPattern().trim(), Pattern.CASE_INSENSITIVE));
            } catch (PatternSyntaxException e) {
                throw new ConfigurationException(
                        "Invalid finance.auto-saver.sweep.naughty-pattern: " + e.getDescription(), e);
            }
        }
        return builder.pot(pots.get(potName)).build();
    }

    private static BigDecimal percentage(String field, BigDecimal value) {
        if (value == null || value.signum() < 0 || value.compareTo(BigDecimal.valueOf(100)) > 0) {
            throw new ConfigurationException(
                    "finance.auto-saver.sweep." + field + " must be between 0 and 100: " + value);
        }
        return value;
    }

    private static BankRef parseBank(String key) {
        try {
            return BankRef.fromConfigKey(key);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
    }

    private static ZoneId parseZone(String zone) {
        try {
            return ZoneId.of(zone);
        } catch (DateTimeException e) {
            throw new ConfigurationException("Invalid finance.zone: " + zone, e);
        }
    }

    private static LocalTime parseTime(String field, String value) {
        try {
            return LocalTime.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new ConfigurationException("Invalid finance.auto-saver." + field + ": " + value, e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
