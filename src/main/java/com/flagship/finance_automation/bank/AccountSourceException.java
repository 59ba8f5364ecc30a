package com.flagship.finance_automation.bank;

import lombok.Getter;

/**
 * A balance fetch failed. Non-transient kinds are never retried.
 */
@Getter
public class AccountSourceException extends RuntimeException {

    private final FailureKind kind;
    private final BankRef bankRef;
    private final AccountIdentifier identifier;

    public AccountSourceException(FailureKind kind, BankRef bankRef, AccountIdentifier identifier,
                                  String message, Throwable cause) {
        super(String.format("%s fetching %s %s: %s", kind, bankRef, identifier, message), cause);
        this.kind = kind;
        this.bankRef = bankRef;
        this.identifier = identifier;
    }

    /**
     * Creates the right exception type for the kind, so retry policies can match on class.
     */
    public static AccountSourceException of(FailureKind kind, BankRef bankRef, AccountIdentifier identifier,
                                            String message, Throwable cause) {
        if (kind.isTransient()) {
            return new TransientAccountSourceException(kind, bankRef, identifier, message, cause);
        }
        return new AccountSourceException(kind, bankRef, identifier, message, cause);
    }
}
