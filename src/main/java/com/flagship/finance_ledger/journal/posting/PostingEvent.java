package com.flagship.finance_ledger.journal.posting;

import com.flagship.finance_ledger.journal.SourceDocumentType;

import java.time.LocalDate;

/**
 * A money-moving business event that produces exactly one journal entry.
 *
 * The family is closed: adding a kind means adding a {@link Visitor} method, so every
 * consumer of the hierarchy fails to compile until it handles the new kind.
 */
public sealed interface PostingEvent
        permits InvoicePosting, PaymentReceivedPosting, BillPosting, BillPaymentPosting,
                ExpensePosting, PayrollRunPosting {

    String organizationId();

    /**
     * Accounting date of the entry; decides which period lock applies.
     */
    LocalDate effectiveDate();

    SourceDocumentType sourceDocumentType();

    String sourceDocumentId();

    <R> R accept(Visitor<R> visitor);

    interface Visitor<R> {
        R visitInvoice(InvoicePosting invoice);

        R visitPaymentReceived(PaymentReceivedPosting payment);

        R visitBill(BillPosting bill);

        R visitBillPayment(BillPaymentPosting payment);

        R visitExpense(ExpensePosting expense);

        R visitPayrollRun(PayrollRunPosting payrollRun);
    }
}
