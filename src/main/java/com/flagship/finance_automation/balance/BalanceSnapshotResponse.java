package com.flagship.finance_automation.balance;

import lombok.Value;

import java.time.Instant;

/**
 * API view of a balance snapshot.
 */
@Value
public class BalanceSnapshotResponse {
    String bank;
    String group;
    long amountMinorUnits;
    String currency;
    Instant observedAt;
    boolean stale;

    public static BalanceSnapshotResponse fromSnapshot(BalanceSnapshot snapshot) {
        return new BalanceSnapshotResponse(
                snapshot.getBankRef().name(),
                snapshot.getGroupName(),
                snapshot.getAmountMinorUnits(),
                snapshot.getCurrency(),
                snapshot.getObservedAt(),
                snapshot.isStale()
        );
    }
}
