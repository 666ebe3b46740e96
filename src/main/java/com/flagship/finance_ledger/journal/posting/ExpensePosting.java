package com.flagship.finance_ledger.journal.posting;

import com.flagship.finance_ledger.journal.AccountRef;
import com.flagship.finance_ledger.journal.LedgerAccount;
import com.flagship.finance_ledger.journal.SourceDocumentType;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A recorded expense. Defaults: Miscellaneous Expense, paid through the bank.
 */
public record ExpensePosting(
        String organizationId,
        String expenseId,
        String referenceNumber,
        String description,
        LocalDate expenseDate,
        BigDecimal amount,
        AccountRef expenseAccount,
        PaidThrough paidThrough) implements PostingEvent {

    public ExpensePosting {
        PostingFields.requireText("Organization ID", organizationId);
        PostingFields.requireText("Expense ID", expenseId);
        PostingFields.require("Expense date", expenseDate);
        referenceNumber = PostingFields.orEmpty(referenceNumber);
        amount = PostingFields.positive("Expense amount", amount);
        expenseAccount = expenseAccount == null ? LedgerAccount.MISC_EXPENSE.ref() : expenseAccount;
        paidThrough = paidThrough == null ? PaidThrough.BANK : paidThrough;
        description = description == null || description.isBlank() ? expenseAccount.name() : description;
    }

    @Override
    public LocalDate effectiveDate() {
        return expenseDate;
    }

    @Override
    public SourceDocumentType sourceDocumentType() {
        return SourceDocumentType.EXPENSE;
    }

    @Override
    public String sourceDocumentId() {
        return expenseId;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitExpense(this);
    }
}
