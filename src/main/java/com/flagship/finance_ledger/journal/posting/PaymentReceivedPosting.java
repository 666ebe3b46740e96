package com.flagship.finance_ledger.journal.posting;

import com.flagship.finance_ledger.journal.SourceDocumentType;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Customer payment against an invoice.
 */
public record PaymentReceivedPosting(
        String organizationId,
        String paymentId,
        String referenceNumber,
        String customerName,
        String invoiceNumber,
        LocalDate paymentDate,
        BigDecimal amount,
        PaymentMode mode) implements PostingEvent {

    public PaymentReceivedPosting {
        PostingFields.requireText("Organization ID", organizationId);
        PostingFields.requireText("Payment ID", paymentId);
        PostingFields.require("Payment date", paymentDate);
        referenceNumber = PostingFields.orEmpty(referenceNumber);
        customerName = PostingFields.orEmpty(customerName);
        invoiceNumber = PostingFields.orEmpty(invoiceNumber);
        amount = PostingFields.positive("Payment amount", amount);
        mode = mode == null ? PaymentMode.BANK : mode;
    }

    @Override
    public LocalDate effectiveDate() {
        return paymentDate;
    }

    @Override
    public SourceDocumentType sourceDocumentType() {
        return SourceDocumentType.PAYMENT_RECEIVED;
    }

    @Override
    public String sourceDocumentId() {
        return paymentId;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitPaymentReceived(this);
    }
}
