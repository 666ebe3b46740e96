package com.flagship.finance_ledger.periodlock;

import java.time.Instant;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;

/**
 * Persistence port for period locks.
 *
 * Writes are conditional so that concurrent transitions on the same (organization, period)
 * serialize: exactly one of two racing callers succeeds, the other sees {@code false}.
 */
public interface PeriodLockStore {

    Optional<PeriodLock> find(String organizationId, YearMonth period);

    /**
     * All records of an organization ordered by period; {@code year} narrows to one calendar year.
     */
    List<PeriodLock> findByOrganization(String organizationId, Integer year);

    /**
     * Amendment windows, across all organizations, whose expiry is at or before {@code now}.
     */
    List<PeriodLock> findExpiredAmendments(Instant now);

    long countExpiredAmendments(Instant now);

    /**
     * Creates the first record for a period.
     *
     * @return false if a record for (organization, period) already exists
     */
    boolean insert(PeriodLock lock);

    /**
     * Replaces {@code expected} with {@code replacement} if the stored row still has the
     * expected status, extension count and version.
     *
     * @return false if the row changed since {@code expected} was read
     */
    boolean compareAndSet(PeriodLock expected, PeriodLock replacement);
}
