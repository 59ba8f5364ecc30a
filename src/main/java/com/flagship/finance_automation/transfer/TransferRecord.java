package com.flagship.finance_automation.transfer;

import lombok.Value;

import java.time.Instant;

/**
 * Ledger row for one idempotency key. Only {@link TransferLedger} changes its status.
 */
@Value
public class TransferRecord {
    String idempotencyKey;
    TransferStatus status;
    int attempts;
    String lastError;
    long amountMinorUnits;
    TransferEndpoint source;
    TransferEndpoint destination;
    String reason;
    String externalTransferId;
    Instant createdAt;
    Instant updatedAt;
    Instant committedAt;

    public boolean isCommitted() {
        return status == TransferStatus.COMMITTED;
    }

    public boolean isReserved() {
        return status == TransferStatus.RESERVED;
    }

    public TransferRequest toRequest() {
        return new TransferRequest(source, destination, amountMinorUnits, idempotencyKey);
    }
}
