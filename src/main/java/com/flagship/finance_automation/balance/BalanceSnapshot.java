package com.flagship.finance_automation.balance;

import com.flagship.finance_automation.bank.BankRef;
import com.flagship.finance_automation.bank.GroupRef;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Summed balance of one account group at a point in time.
 *
 * {@code observedAt} is the oldest as-of among the group's members. A stale
 * snapshot carries the last good value; it must never drive a transfer.
 */
@Value
public class BalanceSnapshot {
    BankRef bankRef;
    String groupName;
    long amountMinorUnits;
    String currency;
    Instant observedAt;
    boolean stale;

    public static BalanceSnapshot fresh(GroupRef group, long amountMinorUnits, String currency, Instant observedAt) {
        return new BalanceSnapshot(group.getBankRef(), group.getGroupName(), amountMinorUnits, currency,
                observedAt, false);
    }

    public GroupRef groupRef() {
        return GroupRef.of(bankRef, groupName);
    }

    /**
     * Same value and observation time, flagged stale.
     */
    public BalanceSnapshot asStale() {
        return stale ? this : new BalanceSnapshot(bankRef, groupName, amountMinorUnits, currency, observedAt, true);
    }

    public boolean isObservedBefore(BalanceSnapshot other) {
        return observedAt.isBefore(other.observedAt);
    }

    public Duration ageAt(Instant now) {
        return Duration.between(observedAt, now);
    }

    /**
     * Home Assistant entity holding this group's balance, e.g. {@code var.truelayer_balance_amex_cards}.
     */
    public String entityId() {
        String group = groupName.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_");
        return "var.truelayer_balance_" + bankRef.slug() + "_" + group;
    }
}
