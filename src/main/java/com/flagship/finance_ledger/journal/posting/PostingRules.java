package com.flagship.finance_ledger.journal.posting;

import com.flagship.finance_ledger.journal.AccountRef;
import com.flagship.finance_ledger.journal.EntryType;
import com.flagship.finance_ledger.journal.JournalLine;
import com.flagship.finance_ledger.journal.LedgerAccount;
import com.flagship.finance_ledger.tax.TaxSplit;

import java.math.BigDecimal;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Fixed debit/credit mapping for each kind of business event.
 *
 * Zero-amount lines are left out, so an invoice without tax posts two lines and a payroll run
 * without ESI has no ESI lines.
 */
public final class PostingRules implements PostingEvent.Visitor<PostingDraft> {

    public static final PostingRules INSTANCE = new PostingRules();

    private PostingRules() {
    }

    public static PostingDraft draft(PostingEvent event) {
        return event.accept(INSTANCE);
    }

    @Override
    public PostingDraft visitInvoice(InvoicePosting invoice) {
        String number = invoice.invoiceNumber();
        Lines lines = new Lines()
            .debit(LedgerAccount.ACCOUNTS_RECEIVABLE.ref(), invoice.total(),
                    "Invoice " + number + " - " + invoice.customerName())
            .credit(LedgerAccount.SALES_REVENUE.ref(), invoice.taxableAmount(), "Sales - Invoice " + number);
        outputTax(lines, invoice.taxes(), "on Invoice " + number);

        return new PostingDraft(EntryType.SALES,
                "Sales Invoice " + number + " - " + invoice.customerName(), lines.build());
    }

    @Override
    public PostingDraft visitPaymentReceived(PaymentReceivedPosting payment) {
        Lines lines = new Lines()
            .debit(settlementAccount(payment.mode()), payment.amount(),
                    "Payment received - " + payment.referenceNumber())
            .credit(LedgerAccount.ACCOUNTS_RECEIVABLE.ref(), payment.amount(),
                    "Payment for Invoice " + payment.invoiceNumber());

        return new PostingDraft(EntryType.RECEIPT,
                "Payment Received - " + payment.customerName() + " - " + payment.referenceNumber(), lines.build());
    }

    @Override
    public PostingDraft visitBill(BillPosting bill) {
        String number = bill.billNumber();
        Lines lines = new Lines()
            .debit(bill.expenseAccount(), bill.subTotal(), "Bill " + number + " - " + bill.vendorName());
        TaxSplit taxes = bill.inputTaxes();
        lines.debit(LedgerAccount.GST_INPUT_CGST.ref(), taxes.getCgst(), "CGST Input on Bill " + number)
            .debit(LedgerAccount.GST_INPUT_SGST.ref(), taxes.getSgst(), "SGST Input on Bill " + number)
            .debit(LedgerAccount.GST_INPUT_IGST.ref(), taxes.getIgst(), "IGST Input on Bill " + number)
            .credit(LedgerAccount.ACCOUNTS_PAYABLE.ref(), bill.total(), "Bill " + number + " - " + bill.vendorName());

        return new PostingDraft(EntryType.PURCHASE,
                "Purchase Bill " + number + " - " + bill.vendorName(), lines.build());
    }

    @Override
    public PostingDraft visitBillPayment(BillPaymentPosting payment) {
        Lines lines = new Lines()
            .debit(LedgerAccount.ACCOUNTS_PAYABLE.ref(), payment.amount(), "Payment for Bill " + payment.billNumber())
            .credit(settlementAccount(payment.mode()), payment.amount(),
                    "Bill Payment - " + payment.referenceNumber());

        return new PostingDraft(EntryType.PAYMENT,
                "Bill Payment - " + payment.vendorName() + " - " + payment.referenceNumber(), lines.build());
    }

    @Override
    public PostingDraft visitExpense(ExpensePosting expense) {
        AccountRef funding;
        switch (expense.paidThrough()) {
            case CASH:
                funding = LedgerAccount.CASH.ref();
                break;
            case ACCOUNTS_PAYABLE:
                funding = LedgerAccount.ACCOUNTS_PAYABLE.ref();
                break;
            default:
                funding = LedgerAccount.BANK.ref();
                break;
        }

        Lines lines = new Lines()
            .debit(expense.expenseAccount(), expense.amount(), expense.description())
            .credit(funding, expense.amount(), "Expense - " + expense.referenceNumber());

        return new PostingDraft(EntryType.EXPENSE, "Expense: " + expense.description(), lines.build());
    }

    @Override
    public PostingDraft visitPayrollRun(PayrollRunPosting run) {
        String label = run.payrollPeriod().getMonth().getDisplayName(TextStyle.FULL, Locale.ENGLISH)
                + " " + run.payrollPeriod().getYear();
        BigDecimal employerPf = run.totalEmployerPf();
        BigDecimal employerEsi = run.totalEmployerEsi();

        Lines lines = new Lines()
            .debit(LedgerAccount.SALARY_EXPENSE.ref(), run.totalGross(), "Gross salary expense " + label)
            .debit(LedgerAccount.EMPLOYER_PF_EXPENSE.ref(), employerPf, "Employer PF contribution " + label)
            .debit(LedgerAccount.EMPLOYER_ESI_EXPENSE.ref(), employerEsi, "Employer ESI contribution " + label)
            .credit(LedgerAccount.SALARY_PAYABLE.ref(), run.totalNet(), "Net salary payable " + label)
            .credit(LedgerAccount.TDS_PAYABLE.ref(), run.totalTds(), "TDS deducted " + label)
            .credit(LedgerAccount.EMPLOYEE_PF_PAYABLE.ref(), run.totalEmployeePf(), "Employee PF deduction " + label)
            .credit(LedgerAccount.EMPLOYER_PF_PAYABLE.ref(), employerPf, "Employer PF contribution " + label)
            .credit(LedgerAccount.ESI_PAYABLE.ref(), run.totalEmployeeEsi().add(employerEsi),
                    "ESI payable (employee + employer) " + label)
            .credit(LedgerAccount.PROFESSIONAL_TAX_PAYABLE.ref(), run.totalProfessionalTax(),
                    "Professional tax " + label);

        String narration = String.format("Payroll %s - %d employees | Gross: %s | Net: %s | TDS: %s",
                label, run.employeeCount(), run.totalGross(), run.totalNet(), run.totalTds());
        return new PostingDraft(EntryType.PAYROLL, narration, lines.build());
    }

    private static void outputTax(Lines lines, TaxSplit taxes, String suffix) {
        lines.credit(LedgerAccount.GST_PAYABLE_CGST.ref(), taxes.getCgst(), "CGST " + suffix)
            .credit(LedgerAccount.GST_PAYABLE_SGST.ref(), taxes.getSgst(), "SGST " + suffix)
            .credit(LedgerAccount.GST_PAYABLE_IGST.ref(), taxes.getIgst(), "IGST " + suffix);
    }

    private static AccountRef settlementAccount(PaymentMode mode) {
        return mode == PaymentMode.CASH ? LedgerAccount.CASH.ref() : LedgerAccount.BANK.ref();
    }

    /**
     * Line accumulator that drops zero amounts.
     */
    private static final class Lines {
        private final List<JournalLine> lines = new ArrayList<>();

        Lines debit(AccountRef account, BigDecimal amount, String description) {
            if (amount.signum() != 0) {
                lines.add(JournalLine.debit(account, amount, description));
            }
            return this;
        }

        Lines credit(AccountRef account, BigDecimal amount, String description) {
            if (amount.signum() != 0) {
                lines.add(JournalLine.credit(account, amount, description));
            }
            return this;
        }

        List<JournalLine> build() {
            return List.copyOf(lines);
        }
    }
}
