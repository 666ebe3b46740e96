package com.flagship.finance_ledger.tax.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.finance_ledger.tax.GstinValidator;
import lombok.Builder;
import lombok.Value;

/**
 * GSTIN validation outcome. Only {@code valid}, {@code gstin} and {@code error} are set for an
 * invalid number.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GstinValidationResponse {

    @JsonProperty("valid")
    boolean valid;

    @JsonProperty("gstin")
    String gstin;

    @JsonProperty("state_code")
    String stateCode;

    @JsonProperty("state_name")
    String stateName;

    @JsonProperty("pan")
    String pan;

    @JsonProperty("entity_code")
    String entityCode;

    @JsonProperty("checksum")
    String checksum;

    @JsonProperty("error")
    String error;

    public static GstinValidationResponse from(GstinValidator.Result result) {
        return GstinValidationResponse.builder()
            .valid(result.isValid())
            .gstin(result.getGstin())
            .stateCode(result.getStateCode())
            .stateName(result.getStateName())
            .pan(result.getPan())
            .entityCode(result.getEntityCode())
            .checksum(result.getChecksum())
            .error(result.getError())
            .build();
    }
}
