package com.flagship.finance_ledger.periodlock.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class LockPeriodRequest {

    @NotBlank(message = "Period is required (YYYY-MM)")
    @JsonProperty("period")
    String period;

    @JsonProperty("reason")
    String reason;
}
