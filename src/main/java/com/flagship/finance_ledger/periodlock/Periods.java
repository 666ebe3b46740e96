package com.flagship.finance_ledger.periodlock;

import com.flagship.finance_ledger.exception.ValidationException;

import java.time.YearMonth;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsing and range rules for accounting periods ("YYYY-MM").
 */
public final class Periods {

    public static final int MIN_YEAR = 2000;
    public static final int MAX_YEAR = 2099;

    private static final Pattern PERIOD = Pattern.compile("^(\\d{4})-(\\d{2})$");

    private Periods() {
        // Utility class
    }

    /**
     * @throws ValidationException if the value is not YYYY-MM with a year in 2000..2099
     */
    public static YearMonth parse(String value) {
        if (value == null) {
            throw new ValidationException("Period is required (YYYY-MM)");
        }
        Matcher matcher = PERIOD.matcher(value.strip());
        if (!matcher.matches()) {
            throw new ValidationException("Invalid period format: '" + value + "'. Expected YYYY-MM");
        }
        int year = Integer.parseInt(matcher.group(1));
        int month = Integer.parseInt(matcher.group(2));
        if (month < 1 || month > 12) {
            throw new ValidationException("Invalid month in period " + value + ": must be 01-12");
        }
        return validate(YearMonth.of(year, month));
    }

    public static YearMonth validate(YearMonth period) {
        if (period.getYear() < MIN_YEAR || period.getYear() > MAX_YEAR) {
            throw new ValidationException(String.format(
                    "Period %s is out of range: year must be %d-%d", period, MIN_YEAR, MAX_YEAR));
        }
        return period;
    }

    public static String format(YearMonth period) {
        return period.toString();
    }
}
