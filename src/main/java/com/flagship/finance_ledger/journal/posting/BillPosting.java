package com.flagship.finance_ledger.journal.posting;

import com.flagship.finance_ledger.exception.ValidationException;
import com.flagship.finance_ledger.journal.AccountRef;
import com.flagship.finance_ledger.journal.LedgerAccount;
import com.flagship.finance_ledger.journal.SourceDocumentType;
import com.flagship.finance_ledger.tax.Money;
import com.flagship.finance_ledger.tax.TaxSplit;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * An approved vendor bill. Without an explicit expense account the purchase is booked to
 * Cost of Goods Sold.
 */
public record BillPosting(
        String organizationId,
        String billId,
        String billNumber,
        String vendorName,
        LocalDate billDate,
        BigDecimal subTotal,
        TaxSplit inputTaxes,
        AccountRef expenseAccount) implements PostingEvent {

    public BillPosting {
        PostingFields.requireText("Organization ID", organizationId);
        PostingFields.requireText("Bill ID", billId);
        PostingFields.require("Bill date", billDate);
        billNumber = PostingFields.orEmpty(billNumber);
        vendorName = PostingFields.orEmpty(vendorName);
        subTotal = PostingFields.nonNegative("Bill subtotal", subTotal);
        inputTaxes = PostingFields.taxes(inputTaxes);
        expenseAccount = expenseAccount == null ? LedgerAccount.COST_OF_GOODS_SOLD.ref() : expenseAccount;
        if (subTotal.add(inputTaxes.total()).signum() == 0) {
            throw new ValidationException("Bill " + billId + " has no amount to post");
        }
    }

    public BigDecimal total() {
        return Money.round(subTotal.add(inputTaxes.total()));
    }

    @Override
    public LocalDate effectiveDate() {
        return billDate;
    }

    @Override
    public SourceDocumentType sourceDocumentType() {
        return SourceDocumentType.BILL;
    }

    @Override
    public String sourceDocumentId() {
        return billId;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitBill(this);
    }
}
