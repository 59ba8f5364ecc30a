package com.flagship.finance_automation.autosave;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Amount a savings sweep would deposit, split by category.
 */
@Value
@Builder
public class SavingsCalculation {

    public static final String ROUND_UPS = "round_ups";
    public static final String DEBIT_PERCENTAGE = "debit_percentage";
    public static final String NAUGHTY_PERCENTAGE = "naughty_percentage";
    public static final String MINIMUM = "minimum";

    Instant since;
    Instant until;
    int transactionCount;
    /**
     * Category to minor units, in calculation order.
     */
    Map<String, Long> categories;
    /**
     * Category to the transactions that contributed, as {@code £12.34 @ description}.
     */
    Map<String, List<String>> breakdown;

    public long getTotalMinorUnits() {
        return categories.values().stream().mapToLong(Long::longValue).sum();
    }
}
