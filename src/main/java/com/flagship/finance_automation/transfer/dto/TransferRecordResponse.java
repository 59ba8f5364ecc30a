package com.flagship.finance_automation.transfer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.finance_automation.transfer.TransferRecord;
import com.flagship.finance_automation.transfer.TransferStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Response DTO for ledger records.
 */
@Value
@Builder
public class TransferRecordResponse {

    @JsonProperty("idempotency_key")
    String idempotencyKey;

    @JsonProperty("status")
    TransferStatus status;

    @JsonProperty("attempts")
    int attempts;

    @JsonProperty("last_error")
    String lastError;

    @JsonProperty("amount_minor_units")
    long amountMinorUnits;

    @JsonProperty("source")
    String source;

    @JsonProperty("destination")
    String destination;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("external_transfer_id")
    String externalTransferId;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    @JsonProperty("committed_at")
    Instant committedAt;

    public static TransferRecordResponse from(TransferRecord record) {
        return TransferRecordResponse.builder()
            .idempotencyKey(record.getIdempotencyKey())
            .status(record.getStatus())
            .attempts(record.getAttempts())
            .lastError(record.getLastError())
            .amountMinorUnits(record.getAmountMinorUnits())
            .source(record.getSource().toString())
            .destination(record.getDestination().toString())
            .reason(record.getReason())
            .externalTransferId(record.getExternalTransferId())
            .createdAt(record.getCreatedAt())
            .updatedAt(record.getUpdatedAt())
            .committedAt(record.getCommittedAt())
            .build();
    }
}
