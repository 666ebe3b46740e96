package com.flagship.finance_ledger.periodlock.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class LockFiscalYearRequest {

    @NotNull(message = "Fiscal year is required")
    @JsonProperty("year")
    Integer year;

    @JsonProperty("fiscal_year_start_month")
    Integer fiscalYearStartMonth;
}
