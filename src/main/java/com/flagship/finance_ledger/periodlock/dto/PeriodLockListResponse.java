package com.flagship.finance_ledger.periodlock.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

@Value
public class PeriodLockListResponse {

    @JsonProperty("locks")
    List<PeriodLockResponse> locks;

    @JsonProperty("total")
    int total;

    public static PeriodLockListResponse of(List<PeriodLockResponse> locks) {
        return new PeriodLockListResponse(locks, locks.size());
    }
}
