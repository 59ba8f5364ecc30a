package com.flagship.finance_automation.pot;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.finance_automation.transfer.dto.TransferRecordResponse;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ReconciliationResponse {

    @JsonProperty("pot")
    String pot;

    @JsonProperty("outcome")
    ReconciliationOutcome outcome;

    @JsonProperty("amount_minor_units")
    long amountMinorUnits;

    @JsonProperty("detail")
    String detail;

    @JsonProperty("transfer")
    TransferRecordResponse transfer;

    public static ReconciliationResponse from(ReconciliationResult result) {
        return ReconciliationResponse.builder()
            .pot(result.getPotName())
            .outcome(result.getOutcome())
            .amountMinorUnits(result.getAmountMinorUnits())
            .detail(result.getDetail())
            .transfer(result.getRecord() == null ? null : TransferRecordResponse.from(result.getRecord()))
            .build();
    }
}
