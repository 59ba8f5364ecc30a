package com.flagship.finance_automation.bank;

import lombok.Value;

import java.time.Instant;

/**
 * One settled or pending transaction on an account or card.
 *
 * The amount is always positive; {@link Direction} says which way the money went.
 */
@Value
public class AccountTransaction {

    public enum Direction {
        DEBIT,
        CREDIT
    }

    String transactionId;
    Instant timestamp;
    String description;
    long amountMinorUnits;
    String currency;
    Direction direction;

    public boolean isDebit() {
        return direction == Direction.DEBIT;
    }
}
