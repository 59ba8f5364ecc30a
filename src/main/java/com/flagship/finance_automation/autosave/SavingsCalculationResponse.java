package com.flagship.finance_automation.autosave;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Value
@Builder
public class SavingsCalculationResponse {

    @JsonProperty("since")
    Instant since;

    @JsonProperty("until")
    Instant until;

    @JsonProperty("transactions")
    int transactions;

    @JsonProperty("total_minor_units")
    long totalMinorUnits;

    @JsonProperty("categories")
    Map<String, Long> categories;

    @JsonProperty("breakdown")
    Map<String, List<String>> breakdown;

    public static SavingsCalculationResponse from(SavingsCalculation calculation) {
        return SavingsCalculationResponse.builder()
            .since(calculation.getSince())
            .until(calculation.getUntil())
            .transactions(calculation.getTransactionCount())
            .totalMinorUnits(calculation.getTotalMinorUnits())
            .categories(calculation.getCategories())
            .breakdown(calculation.getBreakdown())
            .build();
    }
}
