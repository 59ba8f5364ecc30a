package com.flagship.finance_automation.transfer.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Operator decision for an ABANDONED transfer after checking the provider.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResolutionRequest {

    @NotBlank(message = "Outcome is required")
    @Pattern(regexp = "^(COMMITTED|FAILED)$", message = "Outcome must be COMMITTED or FAILED")
    @JsonProperty("outcome")
    private String outcome;

    @NotBlank(message = "A note describing what was checked is required")
    @Size(max = 500, message = "Note must be at most 500 characters")
    @JsonProperty("note")
    private String note;
}
