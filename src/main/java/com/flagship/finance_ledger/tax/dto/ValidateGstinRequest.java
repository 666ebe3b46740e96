package com.flagship.finance_ledger.tax.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class ValidateGstinRequest {

    @JsonProperty("gstin")
    String gstin;
}
