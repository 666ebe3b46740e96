package com.flagship.finance_ledger.tax;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * An open receivable as seen by payment allocation and aging.
 */
@Value
@Builder
public class OutstandingInvoice {
    String invoiceId;
    String invoiceNumber;
    LocalDate invoiceDate;
    LocalDate dueDate;
    BigDecimal balanceDue;
}
