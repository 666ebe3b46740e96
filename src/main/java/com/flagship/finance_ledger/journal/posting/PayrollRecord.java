package com.flagship.finance_ledger.journal.posting;

import com.flagship.finance_ledger.exception.ValidationException;
import com.flagship.finance_ledger.tax.Money;

import java.math.BigDecimal;

/**
 * One employee's figures in a payroll run. Net pay plus employee deductions must equal gross.
 */
public record PayrollRecord(
        String employeeId,
        BigDecimal gross,
        BigDecimal net,
        BigDecimal tds,
        BigDecimal employeePf,
        BigDecimal employeeEsi,
        BigDecimal professionalTax,
        BigDecimal employerPf,
        BigDecimal employerEsi) {

    public PayrollRecord {
        PostingFields.requireText("Employee ID", employeeId);
        gross = PostingFields.nonNegative("Gross salary", gross);
        net = PostingFields.nonNegative("Net salary", net);
        tds = PostingFields.nonNegative("TDS", tds);
        employeePf = PostingFields.nonNegative("Employee PF", employeePf);
        employeeEsi = PostingFields.nonNegative("Employee ESI", employeeEsi);
        professionalTax = PostingFields.nonNegative("Professional tax", professionalTax);
        employerPf = PostingFields.nonNegative("Employer PF", employerPf);
        employerEsi = PostingFields.nonNegative("Employer ESI", employerEsi);

        BigDecimal accounted = Money.round(net.add(tds).add(employeePf).add(employeeEsi).add(professionalTax));
        if (gross.compareTo(accounted) != 0) {
            throw new ValidationException(String.format(
                    "Payroll record for %s is inconsistent: gross %s != net + deductions %s",
                    employeeId, gross, accounted));
        }
    }
}
