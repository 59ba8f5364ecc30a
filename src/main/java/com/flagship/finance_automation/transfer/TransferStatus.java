package com.flagship.finance_automation.transfer;

/**
 * Lifecycle of a transfer record in the ledger.
 *
 * RESERVED -> COMMITTED | FAILED | ABANDONED
 * ABANDONED -> COMMITTED | FAILED (manual resolution)
 * FAILED | ABANDONED -> RESERVED (re-reservation of the same key)
 */
public enum TransferStatus {
    /**
     * Key claimed; the transfer may be in flight.
     */
    RESERVED,

    /**
     * The provider confirmed the transfer. Terminal, never left.
     */
    COMMITTED,

    /**
     * The provider definitively refused, or every attempt was provably not processed.
     */
    FAILED,

    /**
     * Retries ran out with at least one ambiguous outcome. Needs a human.
     */
    ABANDONED;

    public boolean isReservable() {
        return this == FAILED || this == ABANDONED;
    }
}
