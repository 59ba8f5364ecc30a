package com.flagship.finance_automation.transfer;

/**
 * The request was not processed by the provider and can be retried.
 */
public class TransientTransferException extends RuntimeException {

    public TransientTransferException(String message) {
        super(message);
    }

    public TransientTransferException(String message, Throwable cause) {
        super(message, cause);
    }
}
