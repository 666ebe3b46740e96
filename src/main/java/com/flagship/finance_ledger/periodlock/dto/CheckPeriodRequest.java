package com.flagship.finance_ledger.periodlock.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Date to test against the period locks. Accepts yyyy-MM-dd, ISO local/offset/zoned
 * date-times and instants.
 */
@Value
public class CheckPeriodRequest {

    @JsonProperty("date")
    String date;
}
