package com.flagship.finance_automation.bank;

/**
 * A rate-limited or unavailable fetch. Retried with backoff.
 */
public class TransientAccountSourceException extends AccountSourceException {

    public TransientAccountSourceException(FailureKind kind, BankRef bankRef, AccountIdentifier identifier,
                                           String message, Throwable cause) {
        super(kind, bankRef, identifier, message, cause);
    }
}
