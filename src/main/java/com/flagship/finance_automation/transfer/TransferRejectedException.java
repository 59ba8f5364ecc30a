package com.flagship.finance_automation.transfer;

/**
 * Definitive refusal: insufficient funds, invalid destination, forbidden, unsupported route.
 * Never retried.
 */
public class TransferRejectedException extends RuntimeException {

    public TransferRejectedException(String message) {
        super(message);
    }

    public TransferRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
