package com.flagship.finance_automation.bank;

import java.time.Instant;
import java.util.List;

/**
 * Read-only access to account and card balances and transactions.
 */
public interface AccountSource {

    /**
     * Fetches the current balance of one account or card.
     *
     * @throws AccountSourceException when the fetch fails after any internal retries
     */
    AccountBalance fetchBalance(BankRef bankRef, AccountIdentifier identifier);

    /**
     * Fetches the transactions of one account or card with a timestamp in {@code [from, to)}.
     *
     * @throws AccountSourceException when the fetch fails after any internal retries
     */
    List<AccountTransaction> fetchTransactions(BankRef bankRef, AccountIdentifier identifier,
                                               Instant from, Instant to);
}
