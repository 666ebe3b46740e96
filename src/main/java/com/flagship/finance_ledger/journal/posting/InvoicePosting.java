package com.flagship.finance_ledger.journal.posting;

import com.flagship.finance_ledger.exception.ValidationException;
import com.flagship.finance_ledger.journal.SourceDocumentType;
import com.flagship.finance_ledger.tax.IndianState;
import com.flagship.finance_ledger.tax.InvoiceTotals;
import com.flagship.finance_ledger.tax.Money;
import com.flagship.finance_ledger.tax.TaxSplit;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A finalized sales invoice: receivable against revenue and GST payable.
 */
public record InvoicePosting(
        String organizationId,
        String invoiceId,
        String invoiceNumber,
        String customerName,
        LocalDate invoiceDate,
        BigDecimal taxableAmount,
        TaxSplit taxes) implements PostingEvent {

    public InvoicePosting {
        PostingFields.requireText("Organization ID", organizationId);
        PostingFields.requireText("Invoice ID", invoiceId);
        PostingFields.require("Invoice date", invoiceDate);
        invoiceNumber = PostingFields.orEmpty(invoiceNumber);
        customerName = PostingFields.orEmpty(customerName);
        taxableAmount = PostingFields.nonNegative("Taxable amount", taxableAmount);
        taxes = PostingFields.taxes(taxes);
        if (taxableAmount.add(taxes.total()).signum() == 0) {
            throw new ValidationException("Invoice " + invoiceId + " has no amount to post");
        }
    }

    /**
     * Uses the taxable value and GST split computed by the invoice calculator.
     */
    public static InvoicePosting fromTotals(String organizationId, String invoiceId, String invoiceNumber,
                                            String customerName, LocalDate invoiceDate, InvoiceTotals totals) {
        return new InvoicePosting(organizationId, invoiceId, invoiceNumber, customerName, invoiceDate,
                totals.getTaxableTotal(), totals.taxSplit());
    }

    /**
     * Splits a tax total by supply type: halves for a supply within one state, IGST otherwise.
     */
    public static InvoicePosting withTaxSplit(String organizationId, String invoiceId, String invoiceNumber,
                                              String customerName, LocalDate invoiceDate, BigDecimal taxableAmount,
                                              BigDecimal taxTotal, String supplierStateCode,
                                              String placeOfSupplyCode) {
        boolean interState = IndianState.isInterState(supplierStateCode, placeOfSupplyCode);
        return new InvoicePosting(organizationId, invoiceId, invoiceNumber, customerName, invoiceDate,
                taxableAmount, TaxSplit.ofTotal(PostingFields.nonNegative("Tax total", taxTotal), interState));
    }

    public BigDecimal total() {
        return Money.round(taxableAmount.add(taxes.total()));
    }

    @Override
    public LocalDate effectiveDate() {
        return invoiceDate;
    }

    @Override
    public SourceDocumentType sourceDocumentType() {
        return SourceDocumentType.INVOICE;
    }

    @Override
    public String sourceDocumentId() {
        return invoiceId;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitInvoice(this);
    }
}
