package com.flagship.finance_automation.bank;

import lombok.Value;

import java.time.Instant;

/**
 * Balance of a single account or card as reported by the bank.
 */
@Value
public class AccountBalance {
    long amountMinorUnits;
    String currency;
    Instant asOf;
}
