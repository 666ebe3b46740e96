package com.flagship.finance_ledger.journal.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.finance_ledger.journal.JournalLine;
import lombok.Value;

import java.math.BigDecimal;

@Value
public class JournalLineResponse {

    @JsonProperty("account_code")
    String accountCode;

    @JsonProperty("account_name")
    String accountName;

    @JsonProperty("debit")
    BigDecimal debit;

    @JsonProperty("credit")
    BigDecimal credit;

    @JsonProperty("description")
    String description;

    public static JournalLineResponse from(JournalLine line) {
        return new JournalLineResponse(line.getAccountCode(), line.getAccountName(), line.getDebit(),
                line.getCredit(), line.getDescription());
    }
}
