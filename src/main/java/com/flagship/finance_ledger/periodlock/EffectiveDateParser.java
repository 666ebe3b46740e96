package com.flagship.finance_ledger.periodlock;

import com.flagship.finance_ledger.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns the effective-date strings business documents carry into a {@link LocalDate}.
 *
 * Accepted: {@code 2025-06-15}, {@code 2025-06-15T10:30:00}, {@code 2025-06-15T10:30:00Z},
 * {@code 2025-06-15T10:30:00+05:30} and {@code 2025-06-15T10:30:00+05:30[Asia/Kolkata]}. The
 * date is taken as written, with no zone conversion, so the period matches what the document
 * shows.
 *
 * Anything else falls back to a leading {@code yyyy-MM-dd} prefix, with a warning. Without such
 * a prefix the value is rejected: an unparseable date never skips a lock check.
 */
@Slf4j
public final class EffectiveDateParser {

    private static final DateTimeFormatter ISO_DATE_OR_DATE_TIME = new DateTimeFormatterBuilder()
            .append(DateTimeFormatter.ISO_LOCAL_DATE)
            .optionalStart()
                .appendLiteral('T')
                .append(DateTimeFormatter.ISO_LOCAL_TIME)
                .optionalStart().appendOffsetId().optionalEnd()
                .optionalStart()
                    .appendLiteral('[').parseCaseSensitive().appendZoneRegionId().appendLiteral(']')
                .optionalEnd()
            .optionalEnd()
            .toFormatter()
            .withResolverStyle(ResolverStyle.STRICT);

    private static final Pattern DATE_PREFIX = Pattern.compile("^(\\d{4}-\\d{2}-\\d{2})");

    private EffectiveDateParser() {
        // Utility class
    }

    /**
     * @throws ValidationException if the value is blank or has no recognizable date
     */
    public static LocalDate parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException("Effective date is required");
        }
        String value = raw.strip();
        try {
            return LocalDate.from(ISO_DATE_OR_DATE_TIME.parse(value));
        } catch (DateTimeParseException e) {
            return parsePrefix(value, e);
        }
    }

    private static LocalDate parsePrefix(String value, DateTimeParseException cause) {
        Matcher matcher = DATE_PREFIX.matcher(value);
        if (matcher.find()) {
            try {
                LocalDate date = LocalDate.parse(matcher.group(1));
                log.warn("Effective date '{}' is not ISO-8601 ({}); using date prefix {}",
                        value, cause.getMessage(), date);
                return date;
            } catch (DateTimeParseException e) {
                log.warn("Effective date '{}' has an invalid date prefix: {}", value, e.getMessage());
            }
        }
        throw new ValidationException("Unparseable effective date: '" + value + "'");
    }
}
