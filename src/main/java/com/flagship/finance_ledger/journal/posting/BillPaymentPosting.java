package com.flagship.finance_ledger.journal.posting;

import com.flagship.finance_ledger.journal.SourceDocumentType;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Payment of a vendor bill.
 */
public record BillPaymentPosting(
        String organizationId,
        String paymentId,
        String referenceNumber,
        String vendorName,
        String billNumber,
        LocalDate paymentDate,
        BigDecimal amount,
        PaymentMode mode) implements PostingEvent {

    public BillPaymentPosting {
        PostingFields.requireText("Organization ID", organizationId);
        PostingFields.requireText("Payment ID", paymentId);
        PostingFields.require("Payment date", paymentDate);
        referenceNumber = PostingFields.orEmpty(referenceNumber);
        vendorName = PostingFields.orEmpty(vendorName);
        billNumber = PostingFields.orEmpty(billNumber);
        amount = PostingFields.positive("Payment amount", amount);
        mode = mode == null ? PaymentMode.BANK : mode;
    }

    @Override
    public LocalDate effectiveDate() {
        return paymentDate;
    }

    @Override
    public SourceDocumentType sourceDocumentType() {
        return SourceDocumentType.BILL_PAYMENT;
    }

    @Override
    public String sourceDocumentId() {
        return paymentId;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitBillPayment(this);
    }
}
