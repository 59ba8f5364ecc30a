package com.flagship.finance_automation.transfer;

/**
 * The outcome is unknown; the provider may or may not have moved the money.
 * Retried with the same idempotency key.
 */
public class AmbiguousTransferException extends TransientTransferException {

    public AmbiguousTransferException(String message) {
        super(message);
    }

    public AmbiguousTransferException(String message, Throwable cause) {
        super(message, cause);
    }
}
