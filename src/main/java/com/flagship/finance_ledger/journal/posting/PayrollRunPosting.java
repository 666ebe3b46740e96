package com.flagship.finance_ledger.journal.posting;

import com.flagship.finance_ledger.exception.ValidationException;
import com.flagship.finance_ledger.journal.SourceDocumentType;
import com.flagship.finance_ledger.tax.Money;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.function.Function;

/**
 * A completed payroll run, posted as one batched entry across all employees.
 *
 * @param payrollPeriod month the salaries are for, used in line descriptions
 * @param runDate accounting date of the entry
 */
public record PayrollRunPosting(
        String organizationId,
        String payrollRunId,
        YearMonth payrollPeriod,
        LocalDate runDate,
        List<PayrollRecord> records) implements PostingEvent {

    public PayrollRunPosting {
        PostingFields.requireText("Organization ID", organizationId);
        PostingFields.requireText("Payroll run ID", payrollRunId);
        PostingFields.require("Payroll run date", runDate);
        payrollPeriod = payrollPeriod == null ? YearMonth.from(runDate) : payrollPeriod;
        records = List.copyOf(PostingFields.require("Payroll records", records));
        if (records.isEmpty()) {
            throw new ValidationException("Payroll run " + payrollRunId + " has no employee records");
        }
        if (records.stream().allMatch(r -> r.gross().signum() == 0 && r.employerPf().signum() == 0
                && r.employerEsi().signum() == 0)) {
            throw new ValidationException("Payroll run " + payrollRunId + " has no amount to post");
        }
    }

    public int employeeCount() {
        return records.size();
    }

    public BigDecimal totalGross() {
        return sum(PayrollRecord::gross);
    }

    public BigDecimal totalNet() {
        return sum(PayrollRecord::net);
    }

    public BigDecimal totalTds() {
        return sum(PayrollRecord::tds);
    }

    public BigDecimal totalEmployeePf() {
        return sum(PayrollRecord::employeePf);
    }

    public BigDecimal totalEmployerPf() {
        return sum(PayrollRecord::employerPf);
    }

    public BigDecimal totalEmployeeEsi() {
        return sum(PayrollRecord::employeeEsi);
    }

    public BigDecimal totalEmployerEsi() {
        return sum(PayrollRecord::employerEsi);
    }

    public BigDecimal totalProfessionalTax() {
        return sum(PayrollRecord::professionalTax);
    }

    @Override
    public LocalDate effectiveDate() {
        return runDate;
    }

    @Override
    public SourceDocumentType sourceDocumentType() {
        return SourceDocumentType.PAYROLL_RUN;
    }

    @Override
    public String sourceDocumentId() {
        return payrollRunId;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitPayrollRun(this);
    }

    private BigDecimal sum(Function<PayrollRecord, BigDecimal> field) {
        return Money.sum(records.stream().map(field).toList());
    }
}
