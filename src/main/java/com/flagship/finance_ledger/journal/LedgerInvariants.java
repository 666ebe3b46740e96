package com.flagship.finance_ledger.journal;

import com.flagship.finance_ledger.exception.InternalInvariantViolationException;

import java.math.BigDecimal;
import java.util.List;

/**
 * Checks a set of journal lines before anything is persisted.
 *
 * Posting rules only ever produce valid lines from validated payloads, so a failure here is a
 * bug in the rules, never a caller error. Nothing is corrected automatically.
 */
public final class LedgerInvariants {

    static final int MIN_LINES = 2;

    private LedgerInvariants() {
        // Utility class
    }

    /**
     * @throws InternalInvariantViolationException if the lines do not form a balanced entry
     */
    public static void verify(String context, List<JournalLine> lines) {
        if (lines == null || lines.size() < MIN_LINES) {
            throw violation(context, "entry must have at least " + MIN_LINES + " lines, got "
                    + (lines == null ? 0 : lines.size()));
        }

        BigDecimal debits = BigDecimal.ZERO;
        BigDecimal credits = BigDecimal.ZERO;
        for (JournalLine line : lines) {
            if (line.getAccountCode() == null || line.getAccountCode().isBlank()) {
                throw violation(context, "line without account code");
            }
            if (line.getDebit().signum() < 0 || line.getCredit().signum() < 0) {
                throw violation(context, "negative amount on account " + line.getAccountCode());
            }
            if (line.getDebit().signum() > 0 && line.getCredit().signum() > 0) {
                throw violation(context, "both debit and credit on account " + line.getAccountCode());
            }
            if (line.isZero()) {
                throw violation(context, "zero line on account " + line.getAccountCode());
            }
            debits = debits.add(line.getDebit());
            credits = credits.add(line.getCredit());
        }

        if (debits.signum() <= 0) {
            throw violation(context, "entry has no amounts");
        }
        if (debits.compareTo(credits) != 0) {
            throw violation(context, String.format("entry not balanced: debit=%s, credit=%s", debits, credits));
        }
    }

    private static InternalInvariantViolationException violation(String context, String detail) {
        return new InternalInvariantViolationException(context + ": " + detail);
    }
}
