package com.flagship.finance_automation.bank;

/**
 * Classification of a failed balance fetch.
 */
public enum FailureKind {
    RATE_LIMITED,
    UNAUTHORIZED,
    UNAVAILABLE,
    NOT_FOUND;

    /**
     * Transient kinds are retried inside the account source.
     */
    public boolean isTransient() {
        return this == RATE_LIMITED || this == UNAVAILABLE;
    }
}
