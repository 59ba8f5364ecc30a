package com.flagship.finance_automation.transfer;

import lombok.Value;

import java.time.Instant;

/**
 * A request to move money, identified by a deterministic idempotency key.
 *
 * The key is derived from the inputs that caused the intent, so recomputing
 * the same decision yields the same key.
 */
@Value
public class TransferIntent {

    public static final int MAX_KEY_LENGTH = 200;

    String idempotencyKey;
    TransferEndpoint source;
    TransferEndpoint destination;
    long amountMinorUnits;
    String reason;
    Instant createdAt;

    public static TransferIntent create(String idempotencyKey, TransferEndpoint source,
                                        TransferEndpoint destination, long amountMinorUnits,
                                        String reason, Instant createdAt) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
        if (idempotencyKey.length() > MAX_KEY_LENGTH) {
            throw new IllegalArgumentException(String.format(
                    "Idempotency key longer than %d characters: %s...", MAX_KEY_LENGTH,
                    idempotencyKey.substring(0, 40)));
        }
        if (source == null || destination == null) {
            throw new IllegalArgumentException("Source and destination are required");
        }
        if (source.equals(destination)) {
            throw new IllegalArgumentException("Source and destination must differ: " + source);
        }
        if (amountMinorUnits <= 0) {
            throw new IllegalArgumentException("Amount must be positive: " + amountMinorUnits);
        }
        return new TransferIntent(idempotencyKey, source, destination, amountMinorUnits,
                reason == null ? "" : reason, createdAt);
    }
}
