package com.flagship.finance_automation.transfer.monzo;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Pot object returned by the deposit and withdraw endpoints. Balance is in minor units.
 */
@Data
@NoArgsConstructor
public class MonzoPotResponse {
    private String id;
    private String name;
    private Long balance;
    private String currency;
    @JsonProperty("deleted")
    private boolean deleted;
}
