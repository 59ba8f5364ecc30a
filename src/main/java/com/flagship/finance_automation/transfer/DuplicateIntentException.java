package com.flagship.finance_automation.transfer;

import lombok.Getter;

/**
 * The idempotency key is already reserved or committed.
 */
@Getter
public class DuplicateIntentException extends RuntimeException {

    private final TransferRecord existing;

    public DuplicateIntentException(TransferRecord existing) {
        super(String.format("Transfer %s already exists in %s status",
                existing.getIdempotencyKey(), existing.getStatus()));
        this.existing = existing;
    }
}
