package com.flagship.finance_ledger.periodlock.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class ExtendUnlockRequest {

    @NotBlank(message = "Period is required (YYYY-MM)")
    @JsonProperty("period")
    String period;

    @JsonProperty("additional_hours")
    Integer additionalHours;
}
