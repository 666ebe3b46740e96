package com.flagship.finance_ledger.consumer;

import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.finance_ledger.exception.ValidationException;
import com.flagship.finance_ledger.journal.AccountRef;
import com.flagship.finance_ledger.journal.posting.BillPaymentPosting;
import com.flagship.finance_ledger.journal.posting.BillPosting;
import com.flagship.finance_ledger.journal.posting.ExpensePosting;
import com.flagship.finance_ledger.journal.posting.InvoicePosting;
import com.flagship.finance_ledger.journal.posting.PaidThrough;
import com.flagship.finance_ledger.journal.posting.PaymentMode;
import com.flagship.finance_ledger.journal.posting.PaymentReceivedPosting;
import com.flagship.finance_ledger.journal.posting.PayrollRecord;
import com.flagship.finance_ledger.journal.posting.PayrollRunPosting;
import com.flagship.finance_ledger.journal.posting.PostingEvent;
import com.flagship.finance_ledger.periodlock.EffectiveDateParser;
import com.flagship.finance_ledger.periodlock.Periods;
import com.flagship.finance_ledger.tax.TaxSplit;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Maps document event payloads onto posting events. Payload fields are camelCase; amounts may
 * arrive as JSON numbers or numeric strings.
 */
final class FinanceDocumentMapper {

    static final String INVOICE_FINALIZED = "InvoiceFinalized";
    static final String PAYMENT_RECEIVED = "PaymentReceived";
    static final String BILL_APPROVED = "BillApproved";
    static final String BILL_PAID = "BillPaid";
    static final String EXPENSE_RECORDED = "ExpenseRecorded";
    static final String PAYROLL_RUN_COMPLETED = "PayrollRunCompleted";

    private FinanceDocumentMapper() {
        // Utility class
    }

    /**
     * @return empty for event types the ledger does not post
     * @throws ValidationException if the payload is missing fields or carries bad values
     */
    static Optional<PostingEvent> toPostingEvent(String eventType, String organizationId, JsonNode payload) {
        if (payload == null || !payload.isObject()) {
            throw new ValidationException("Event payload must be a JSON object");
        }
        return switch (eventType) {
            case INVOICE_FINALIZED -> Optional.of(invoice(organizationId, payload));
            case PAYMENT_RECEIVED -> Optional.of(paymentReceived(organizationId, payload));
            case BILL_APPROVED -> Optional.of(bill(organizationId, payload));
            case BILL_PAID -> Optional.of(billPayment(organizationId, payload));
            case EXPENSE_RECORDED -> Optional.of(expense(organizationId, payload));
            case PAYROLL_RUN_COMPLETED -> Optional.of(payrollRun(organizationId, payload));
            default -> Optional.empty();
        };
    }

    private static InvoicePosting invoice(String organizationId, JsonNode p) {
        LocalDate invoiceDate = date(p, "invoiceDate");
        if (p.hasNonNull("taxTotal")) {
            return InvoicePosting.withTaxSplit(organizationId, text(p, "invoiceId"), text(p, "invoiceNumber"),
                    text(p, "customerName"), invoiceDate, decimal(p, "taxableAmount"), decimal(p, "taxTotal"),
                    text(p, "supplierStateCode"), text(p, "placeOfSupply"));
        }
        return new InvoicePosting(organizationId, text(p, "invoiceId"), text(p, "invoiceNumber"),
                text(p, "customerName"), invoiceDate, decimal(p, "taxableAmount"), taxes(p));
    }

    private static PaymentReceivedPosting paymentReceived(String organizationId, JsonNode p) {
        return new PaymentReceivedPosting(organizationId, text(p, "paymentId"), text(p, "referenceNumber"),
                text(p, "customerName"), text(p, "invoiceNumber"), date(p, "paymentDate"), decimal(p, "amount"),
                PaymentMode.fromString(text(p, "paymentMode")));
    }

    private static BillPosting bill(String organizationId, JsonNode p) {
        return new BillPosting(organizationId, text(p, "billId"), text(p, "billNumber"), text(p, "vendorName"),
                date(p, "billDate"), decimal(p, "subTotal"), taxes(p),
                account(p, "expenseAccountCode", "expenseAccountName"));
    }

    private static BillPaymentPosting billPayment(String organizationId, JsonNode p) {
        return new BillPaymentPosting(organizationId, text(p, "paymentId"), text(p, "referenceNumber"),
                text(p, "vendorName"), text(p, "billNumber"), date(p, "paymentDate"), decimal(p, "amount"),
                PaymentMode.fromString(text(p, "paymentMode")));
    }

    private static ExpensePosting expense(String organizationId, JsonNode p) {
        return new ExpensePosting(organizationId, text(p, "expenseId"), text(p, "referenceNumber"),
                text(p, "description"), date(p, "expenseDate"), decimal(p, "amount"),
                account(p, "accountCode", "accountName"), PaidThrough.fromString(text(p, "paidThrough")));
    }

    private static PayrollRunPosting payrollRun(String organizationId, JsonNode p) {
        String period = text(p, "payrollPeriod");
        YearMonth payrollPeriod = period == null ? null : Periods.parse(period);

        JsonNode recordsNode = p.path("records");
        if (!recordsNode.isArray()) {
            throw new ValidationException("Payroll records are required");
        }
        List<PayrollRecord> records = new ArrayList<>();
        for (JsonNode r : recordsNode) {
            records.add(new PayrollRecord(
                    text(r, "employeeId"),
                    decimal(r, "gross"),
                    decimal(r, "net"),
                    decimal(r, "tds"),
                    decimal(r, "employeePf"),
                    decimal(r, "employeeEsi"),
                    decimal(r, "professionalTax"),
                    decimal(r, "employerPf"),
                    decimal(r, "employerEsi")));
        }
        return new PayrollRunPosting(organizationId, text(p, "payrollRunId"), payrollPeriod, date(p, "runDate"),
                records);
    }

    private static TaxSplit taxes(JsonNode p) {
        return new TaxSplit(decimal(p, "cgst"), decimal(p, "sgst"), decimal(p, "igst"));
    }

    private static AccountRef account(JsonNode p, String codeField, String nameField) {
        String code = text(p, codeField);
        return code == null ? null : new AccountRef(code, text(p, nameField));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static LocalDate date(JsonNode node, String field) {
        String value = text(node, field);
        if (value == null) {
            throw new ValidationException(field + " is required");
        }
        return EffectiveDateParser.parse(value);
    }

    private static BigDecimal decimal(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.decimalValue();
        }
        if (value.isTextual()) {
            try {
                return new BigDecimal(value.asText().strip());
            } catch (NumberFormatException e) {
                throw new ValidationException(field + " is not a number: '" + value.asText() + "'");
            }
        }
        throw new ValidationException(field + " is not a number: " + value);
    }
}
