package com.flagship.finance_ledger.journal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

/**
 * Reversal date (any format the period check accepts) and the reason shown in the description.
 */
@Value
public class ReverseEntryRequest {

    @NotBlank(message = "Reversal date is required")
    @JsonProperty("date")
    String date;

    @NotBlank(message = "Reversal reason is required")
    @JsonProperty("reason")
    String reason;
}
