package com.flagship.finance_ledger.tax.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.finance_ledger.tax.IndianState;
import lombok.Value;

@Value
public class StateResponse {

    @JsonProperty("code")
    String code;

    @JsonProperty("name")
    String name;

    public static StateResponse from(IndianState state) {
        return new StateResponse(state.getCode(), state.getDisplayName());
    }
}
