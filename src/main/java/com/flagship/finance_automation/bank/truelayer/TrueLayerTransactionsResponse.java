package com.flagship.finance_automation.bank.truelayer;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Response of {@code GET /data/v1/accounts/{id}/transactions} and {@code /data/v1/cards/{id}/transactions}.
 *
 * Account debits carry a negative amount; card purchases are positive with
 * {@code transaction_type} DEBIT.
 */
@Data
@NoArgsConstructor
public class TrueLayerTransactionsResponse {

    private List<Result> results = new ArrayList<>();

    @Data
    @NoArgsConstructor
    public static class Result {
        @JsonProperty("transaction_id")
        private String transactionId;
        private String timestamp;
        private String description;
        private BigDecimal amount;
        private String currency;
        @JsonProperty("transaction_type")
        private String transactionType;
    }
}
