package com.flagship.finance_ledger.periodlock.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Result of a successful check; a locked period is reported as a 409 error instead.
 */
@Value
public class PeriodCheckResponse {

    @JsonProperty("status")
    String status;

    @JsonProperty("period")
    String period;

    public static PeriodCheckResponse open(String period) {
        return new PeriodCheckResponse("open", period);
    }
}
