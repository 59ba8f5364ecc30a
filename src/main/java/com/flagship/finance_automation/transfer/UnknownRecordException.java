package com.flagship.finance_automation.transfer;

import lombok.Getter;

/**
 * No record exists for the key in the status the operation requires.
 */
@Getter
public class UnknownRecordException extends RuntimeException {

    private final String idempotencyKey;

    public UnknownRecordException(String idempotencyKey, String message) {
        super(message);
        this.idempotencyKey = idempotencyKey;
    }

    public static UnknownRecordException notFound(String idempotencyKey) {
        return new UnknownRecordException(idempotencyKey, "Transfer record not found: " + idempotencyKey);
    }

    public static UnknownRecordException notInStatus(String idempotencyKey, TransferStatus required,
                                                     TransferStatus actual) {
        return new UnknownRecordException(idempotencyKey,
                String.format("No %s transfer record for %s (current status: %s)",
                        required, idempotencyKey, actual));
    }
}
