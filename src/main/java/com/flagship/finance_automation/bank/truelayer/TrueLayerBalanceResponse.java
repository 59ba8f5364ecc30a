package com.flagship.finance_automation.bank.truelayer;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Response of {@code GET /data/v1/accounts/{id}/balance} and {@code /data/v1/cards/{id}/balance}.
 */
@Data
@NoArgsConstructor
public class TrueLayerBalanceResponse {

    private List<Result> results = new ArrayList<>();

    @Data
    @NoArgsConstructor
    public static class Result {
        private String currency;
        private BigDecimal available;
        private BigDecimal current;
        @JsonProperty("update_timestamp")
        private String updateTimestamp;
    }
}
