package com.flagship.finance_ledger.periodlock.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

/**
 * Opens a locked period for amendment. {@code window_hours} defaults to 72 when omitted.
 */
@Value
public class UnlockPeriodRequest {

    @NotBlank(message = "Period is required (YYYY-MM)")
    @JsonProperty("period")
    String period;

    @NotBlank(message = "Unlock reason is required")
    @JsonProperty("reason")
    String reason;

    @JsonProperty("window_hours")
    Integer windowHours;
}
