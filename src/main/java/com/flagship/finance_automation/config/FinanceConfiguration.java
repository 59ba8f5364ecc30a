package com.flagship.finance_automation.config;

import com.flagship.finance_automation.bank.AccountGroup;
import com.flagship.finance_automation.bank.BankRef;
import com.flagship.finance_automation.bank.GroupRef;
import com.flagship.finance_automation.pot.Pot;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Validated, immutable configuration. Built once at startup by
 * {@link FinanceConfigurationFactory} and injected into every component.
 */
@Value
@Builder
public class FinanceConfiguration {

    ZoneId zone;
    String currency;
    Duration pollInterval;
    Duration fetchTimeout;
    Duration freshnessGrace;
    @Singular("bankGroups")
    Map<BankRef, List<AccountGroup>> groupsByBank;
    @Singular
    Map<String, Pot> pots;
    TransferPolicy transfers;
    AutoSave autoSave;

    @Value
    @Builder
    public static class TransferPolicy {
        int maxAttempts;
        Duration initialBackoff;
        double multiplier;
        Duration maxBackoff;
        long maximumAmount;
        Duration staleReservationAfter;
    }

    @Value
    @Builder
    public static class AutoSave {
        boolean enabled;
        /**
         * Receiving pot. Null when auto-save is disabled.
         */
        Pot pot;
        long amountPerTrack;
        Duration debounceWindow;
        LocalTime activeFrom;
        LocalTime activeUntil;
        SavingsSweep sweep;
    }

    @Value
    @Builder
    public static class SavingsSweep {
        boolean enabled;
        /**
         * Receiving pot. Null when the sweep is disabled.
         */
        Pot pot;
        @Singular
        List<GroupRef> transactionGroups;
        boolean roundUps;
        BigDecimal debitPercentage;
        /**
         * Null when no pattern is configured.
         */
        Pattern naughtyPattern;
        BigDecimal naughtyPercentage;
        long minimum;
        Duration initialLookback;
        String entityId;
    }

    public Set<BankRef> banks() {
        return groupsByBank.keySet();
    }

    public List<AccountGroup> groups(BankRef bankRef) {
        return groupsByBank.getOrDefault(bankRef, List.of());
    }

    public Optional<AccountGroup> group(GroupRef ref) {
        return groups(ref.getBankRef()).stream()
                .filter(group -> group.getName().equals(ref.getGroupName()))
                .findFirst();
    }

    public Optional<Pot> pot(String name) {
        return Optional.ofNullable(pots.get(name));
    }

    public List<Pot> potsWithTarget() {
        return pots.values().stream()
                .filter(Pot::hasTarget)
                .collect(Collectors.toList());
    }

    /**
     * Oldest a snapshot may be and still drive a transfer.
     */
    public Duration maximumSnapshotAge() {
        return pollInterval.plus(freshnessGrace);
    }
}
