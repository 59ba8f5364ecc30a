package com.flagship.finance_automation.autosave;

import com.flagship.finance_automation.bank.AccountTransaction;
import com.flagship.finance_automation.common.MinorUnits;
import com.flagship.finance_automation.config.FinanceConfiguration;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Works out how much to save from a window of transactions.
 *
 * Only debits count, and transfers into or out of pots (descriptions starting
 * with {@code pot_}) are ignored everywhere. Categories:
 * - round ups: each debit rounded up to the next whole pound; whole-pound debits add 100
 * - debit percentage: a share of everything spent
 * - naughty percentage: a share of debits whose description matches the pattern
 * - minimum: a fixed amount added to every sweep
 *
 * Percentages are floored to whole minor units.
 */
@Component
public class SavingsCalculator {

    private static final Pattern MULTISPACE = Pattern.compile("\\s+");
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public SavingsCalculation calculate(List<AccountTransaction> transactions,
                                        FinanceConfiguration.SavingsSweep sweep,
                                        Instant since, Instant until) {
        List<AccountTransaction> debits = new ArrayList<>();
        for (AccountTransaction transaction : transactions) {
            if (transaction.isDebit() && !isPotTransfer(transaction)) {
                debits.add(transaction);
            }
        }

        Map<String, Long> categories = new LinkedHashMap<>();
        Map<String, List<String>> breakdown = new LinkedHashMap<>();

        if (sweep.isRoundUps()) {
            categories.put(SavingsCalculation.ROUND_UPS, roundUps(debits));
        }

        if (sweep.getDebitPercentage().signum() > 0) {
            long spent = 0;
            List<String> lines = new ArrayList<>();
            for (AccountTransaction debit : debits) {
                spent = Math.addExact(spent, debit.getAmountMinorUnits());
                lines.add(line(debit));
            }
            categories.put(SavingsCalculation.DEBIT_PERCENTAGE, percentageOf(spent, sweep.getDebitPercentage()));
            if (!lines.isEmpty()) {
                breakdown.put(SavingsCalculation.DEBIT_PERCENTAGE, lines);
            }
        }

        if (sweep.getNaughtyPattern() != null && sweep.getNaughtyPercentage().signum() > 0) {
            long naughty = 0;
            List<String> lines = new ArrayList<>();
            for (AccountTransaction debit : debits) {
                if (sweep.getNaughtyPattern().matcher(debit.getDescription()).find()) {
                    naughty = Math.addExact(naughty, debit.getAmountMinorUnits());
                    lines.add(line(debit));
                }
            }
            categories.put(SavingsCalculation.NAUGHTY_PERCENTAGE, percentageOf(naughty, sweep.getNaughtyPercentage()));
            if (!lines.isEmpty()) {
                breakdown.put(SavingsCalculation.NAUGHTY_PERCENTAGE, lines);
            }
        }

        if (sweep.getMinimum() > 0) {
            categories.put(SavingsCalculation.MINIMUM, sweep.getMinimum());
        }

        return SavingsCalculation.builder()
                .since(since)
                .until(until)
                .transactionCount(debits.size())
                .categories(categories)
                .breakdown(breakdown)
                .build();
    }

    static long roundUps(List<AccountTransaction> debits) {
        long total = 0;
        for (AccountTransaction debit : debits) {
            total += 100 - (debit.getAmountMinorUnits() % 100);
        }
        return total;
    }

    static long percentageOf(long amountMinorUnits, BigDecimal percentage) {
        return BigDecimal.valueOf(amountMinorUnits)
                .multiply(percentage)
                .divide(HUNDRED, 0, RoundingMode.DOWN)
                .longValueExact();
    }

    private static boolean isPotTransfer(AccountTransaction transaction) {
        return transaction.getDescription().startsWith("pot_");
    }

    private static String line(AccountTransaction transaction) {
        return String.format("£%s @ %s", MinorUnits.toMajorString(transaction.getAmountMinorUnits()),
                MULTISPACE.matcher(transaction.getDescription()).replaceAll(" "));
    }
}
