package com.flagship.finance_ledger.periodlock;

import com.flagship.finance_ledger.actor.Actor;
import com.flagship.finance_ledger.actor.UserRole;
import com.flagship.finance_ledger.audit.AuditAction;
import com.flagship.finance_ledger.audit.AuditLogEntry;
import com.flagship.finance_ledger.audit.AuditLogWriter;
import com.flagship.finance_ledger.exception.ConflictException;
import com.flagship.finance_ledger.exception.FinanceException;
import com.flagship.finance_ledger.exception.ForbiddenException;
import com.flagship.finance_ledger.exception.NotFoundException;
import com.flagship.finance_ledger.exception.PeriodLockedException;
import com.flagship.finance_ledger.exception.ValidationException;
import com.flagship.finance_ledger.observability.LedgerMetrics;
import com.flagship.finance_ledger.outbox.OutboxAggregate;
import com.flagship.finance_ledger.outbox.OutboxService;
import com.flagship.finance_ledger.periodlock.event.PeriodLockEvent;
import com.flagship.finance_ledger.periodlock.event.PeriodLockEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Period lock lifecycle: lock, unlock for amendment, extend, auto-relock, fiscal-year close,
 * and the {@link #check} every financial write goes through.
 *
 * Each transition reads the current record, computes the next state on the immutable
 * {@link PeriodLock}, and writes it back with a single compare-and-set. When two callers race
 * on the same period, the one whose CAS misses gets {@link ConflictException}.
 *
 * Every successful transition emits an outbox event in the same transaction and an audit
 * record (best-effort, separate transaction).
 */
@Service
@Slf4j
public class PeriodLockService {

    public static final String RESOURCE_TYPE = "period_lock";

    static final Set<UserRole> LOCK_ROLES = EnumSet.of(UserRole.ADMIN, UserRole.OWNER, UserRole.ACCOUNTANT);
    static final Set<UserRole> UNLOCK_ROLES = EnumSet.of(UserRole.ADMIN, UserRole.OWNER);
    static final int MIN_UNLOCK_REASON_LENGTH = 10;
    static final int MAX_WINDOW_HOURS = 168;

    private final PeriodLockStore store;
    private final AuditLogWriter auditLogWriter;
    private final OutboxService outboxService;
    private final LedgerMetrics metrics;
    private final TransactionOperations transactions;
    private final Clock clock;

    private final int defaultWindowHours;
    private final int maxExtensions;
    private final Duration maxTotalUnlockWindow;
    private final int defaultFiscalYearStartMonth;

    public PeriodLockService(PeriodLockStore store,
                             AuditLogWriter auditLogWriter,
                             OutboxService outboxService,
                             LedgerMetrics metrics,
                             TransactionOperations transactions,
                             Clock clock,
                             @Value("${ledger.period-lock.default-window-hours:72}") int defaultWindowHours,
                             @Value("${ledger.period-lock.max-extensions:2}") int maxExtensions,
                             @Value("${ledger.period-lock.max-total-unlock-days:7}") int maxTotalUnlockDays,
                             @Value("${ledger.fiscal-year.start-month:4}") int defaultFiscalYearStartMonth) {
        this.store = store;
        this.auditLogWriter = auditLogWriter;
        this.outboxService = outboxService;
        this.metrics = metrics;
        this.transactions = transactions;
        this.clock = clock;
        this.defaultWindowHours = defaultWindowHours;
        this.maxExtensions = maxExtensions;
        this.maxTotalUnlockWindow = Duration.ofDays(maxTotalUnlockDays);
        this.defaultFiscalYearStartMonth = defaultFiscalYearStartMonth;
    }

    // ==================== Enforcement ====================

    /**
     * Rejects a financial write dated in a locked period.
     *
     * @return the period the date falls in
     * @throws PeriodLockedException if the period is locked for the organization
     * @throws ValidationException if organization or date is missing, or the date is unparseable
     */
    public YearMonth check(String organizationId, String effectiveDate) {
        return check(organizationId, effectiveDate, MissingContextPolicy.REJECT)
                .orElseThrow(() -> new IllegalStateException("REJECT policy never skips the check"));
    }

    /**
     * Variant that lets system-triggered callers opt into skipping the check when the
     * organization or date is absent. The skip is logged and counted; it is never silent.
     *
     * @return the checked period, or empty if the check was skipped
     */
    public Optional<YearMonth> check(String organizationId, String effectiveDate, MissingContextPolicy policy) {
        boolean missingOrganization = organizationId == null || organizationId.isBlank();
        boolean missingDate = effectiveDate == null || effectiveDate.isBlank();

        if (missingOrganization || missingDate) {
            if (policy == MissingContextPolicy.SKIP_AND_LOG) {
                metrics.recordCheckBypassed();
                log.warn("Period lock check skipped: organizationId={}, effectiveDate={} (caller opted in)",
                        organizationId, effectiveDate);
                return Optional.empty();
            }
            throw new ValidationException(missingOrganization
                    ? "Organization is required for the period lock check"
                    : "Effective date is required for the period lock check");
        }

        return Optional.of(check(organizationId, EffectiveDateParser.parse(effectiveDate)));
    }

    public YearMonth check(String organizationId, LocalDate effectiveDate) {
        YearMonth period = YearMonth.from(effectiveDate);
        Optional<PeriodLock> lock = store.find(organizationId, period);
        if (lock.isPresent() && lock.get().blocksWritesAt(clock.instant())) {
            PeriodLock locked = lock.get();
            metrics.recordPostingBlocked();
            log.warn("Write blocked by locked period: organizationId={}, period={}, lockedBy={}",
                    organizationId, period, locked.getLockedBy());
            throw new PeriodLockedException(Periods.format(period), locked.getLockedBy(), locked.getLockedAt());
        }
        return period;
    }

    // ==================== Transitions ====================

    /**
     * Locks a period, creating its record on first use or closing an amendment window.
     *
     * @throws ForbiddenException unless the actor is admin, owner or accountant
     * @throws ConflictException if the period is already locked
     */
    @Transactional
    public PeriodLock lock(String organizationId, String period, Actor actor, String reason) {
        requireRole(actor, LOCK_ROLES, "lock periods");
        return doLock(requireOrganization(organizationId), Periods.parse(period), actor, reason);
    }

    /**
     * Opens a locked period for amendment until {@code now + windowHours}.
     *
     * @param windowHours window length, defaults to the configured 72 hours when null
     */
    @Transactional
    public PeriodLock unlock(String organizationId, String period, Actor actor, String reason, Integer windowHours) {
        requireRole(actor, UNLOCK_ROLES, "unlock periods");
        String org = requireOrganization(organizationId);
        YearMonth yearMonth = Periods.parse(period);
        String trimmedReason = reason == null ? "" : reason.strip();
        if (trimmedReason.length() < MIN_UNLOCK_REASON_LENGTH) {
            throw new ValidationException(String.format(
                    "Unlock reason must be at least %d characters", MIN_UNLOCK_REASON_LENGTH));
        }
        int hours = windowHours == null ? defaultWindowHours : windowHours;
        if (hours < 1 || hours > MAX_WINDOW_HOURS) {
            throw new ValidationException(String.format(
                    "Unlock window must be between 1 and %d hours", MAX_WINDOW_HOURS));
        }

        PeriodLock current = store.find(org, yearMonth)
                .orElseThrow(() -> new NotFoundException("No lock record for period " + yearMonth));

        Instant now = clock.instant();
        PeriodLock unlocked = current.unlock(actor.getUserId(), trimmedReason, Duration.ofHours(hours), now);
        apply(current, unlocked, "unlock");

        publish(PeriodLockEventType.PERIOD_UNLOCKED, unlocked, actor, now);
        auditLogWriter.append(org, actor, AuditAction.UNLOCK_PERIOD, RESOURCE_TYPE,
                Periods.format(yearMonth), current, unlocked);

        log.info("Period unlocked for amendment: organizationId={}, period={}, by={}, expiresAt={}",
                org, yearMonth, actor.getUserId(), unlocked.getUnlockExpiresAt());
        return unlocked;
    }

    /**
     * Extends an open amendment window, capped at two extensions and seven days from the unlock.
     *
     * @param additionalHours defaults to the configured 72 hours when null
     */
    @Transactional
    public PeriodLock extend(String organizationId, String period, Actor actor, Integer additionalHours) {
        requireRole(actor, UNLOCK_ROLES, "extend amendment windows");
        String org = requireOrganization(organizationId);
        YearMonth yearMonth = Periods.parse(period);
        int hours = additionalHours == null ? defaultWindowHours : additionalHours;
        if (hours < 1) {
            throw new ValidationException("Additional hours must be positive");
        }

        PeriodLock current = store.find(org, yearMonth)
                .orElseThrow(() -> new NotFoundException("No lock record for period " + yearMonth));

        Instant now = clock.instant();
        PeriodLock extended;
        try {
            extended = current.extend(Duration.ofHours(hours), maxExtensions, maxTotalUnlockWindow, now);
        } catch (ConflictException e) {
            metrics.recordLockTransition("extend", "conflict");
            throw e;
        }
        apply(current, extended, "extend");

        publish(PeriodLockEventType.PERIOD_UNLOCK_EXTENDED, extended, actor, now);
        auditLogWriter.append(org, actor, AuditAction.EXTEND_UNLOCK, RESOURCE_TYPE,
                Periods.format(yearMonth), current, extended);

        log.info("Amendment window extended: organizationId={}, period={}, extension={}/{}, expiresAt={}",
                org, yearMonth, extended.getUnlockExtensionCount(), maxExtensions, extended.getUnlockExpiresAt());
        return extended;
    }

    /**
     * Manually triggered sweep; same effect as the scheduled one.
     *
     * @throws ForbiddenException unless the actor is admin or owner
     */
    public int autoRelock(Actor actor) {
        requireRole(actor, UNLOCK_ROLES, "run the auto-relock sweep");
        log.info("Auto-relock sweep requested by {}", actor.getUserId());
        return autoRelock();
    }

    /**
     * Relocks every amendment window that has expired, across all organizations.
     *
     * Each record is relocked in its own transaction. A record another instance relocked first
     * is skipped without error, so concurrent sweeps are safe and a second run is a no-op.
     *
     * @return number of periods this call relocked
     */
    public int autoRelock() {
        Instant now = clock.instant();
        List<PeriodLock> expired = store.findExpiredAmendments(now);
        if (expired.isEmpty()) {
            return 0;
        }

        Actor system = Actor.system(Actor.AUTO_RELOCK_USER);
        int relocked = 0;
        for (PeriodLock lock : expired) {
            try {
                Boolean won = transactions.execute(status -> relockExpired(lock, system, now));
                if (Boolean.TRUE.equals(won)) {
                    relocked++;
                }
            } catch (DataAccessException | TransactionException e) {
                log.error("Auto-relock failed: organizationId={}, period={}, error={}",
                        lock.getOrganizationId(), lock.getPeriod(), e.getMessage(), e);
            }
        }

        metrics.recordAutoRelocked(relocked);
        log.info("Auto-relock sweep: expired={}, relocked={}", expired.size(), relocked);
        return relocked;
    }

    /**
     * Locks the twelve periods of a fiscal year starting at {@code startMonth} (default from
     * configuration). Periods are locked independently: one failure does not undo the others,
     * and every period is reported in the result.
     */
    public List<FiscalYearLockResult> lockFiscalYear(String organizationId, int year, Actor actor, Integer startMonth) {
        requireRole(actor, LOCK_ROLES, "lock periods");
        String org = requireOrganization(organizationId);
        int firstMonth = startMonth == null ? defaultFiscalYearStartMonth : startMonth;
        if (firstMonth < 1 || firstMonth > 12) {
            throw new ValidationException("Fiscal year start month must be between 1 and 12");
        }
        if (year < Periods.MIN_YEAR || year > Periods.MAX_YEAR) {
            throw new ValidationException(String.format(
                    "Fiscal year must be between %d and %d", Periods.MIN_YEAR, Periods.MAX_YEAR));
        }

        String reason = String.format("Fiscal year %d-%d close", year, year + 1);
        YearMonth first = YearMonth.of(year, firstMonth);
        List<FiscalYearLockResult> results = new ArrayList<>(12);

        for (int i = 0; i < 12; i++) {
            YearMonth period = first.plusMonths(i);
            String label = Periods.format(period);
            try {
                Periods.validate(period);
                transactions.executeWithoutResult(status -> doLock(org, period, actor, reason));
                results.add(FiscalYearLockResult.locked(label, reason));
            } catch (ConflictException e) {
                results.add(FiscalYearLockResult.skipped(label, e.getMessage()));
            } catch (FinanceException | DataAccessException | TransactionException e) {
                log.error("Fiscal year lock failed for period: organizationId={}, period={}, error={}",
                        org, label, e.getMessage());
                results.add(FiscalYearLockResult.failed(label, e.getMessage()));
            }
        }

        log.info("Fiscal year {} close: organizationId={}, locked={}, skipped={}, failed={}",
                year, org,
                count(results, FiscalYearLockResult.Outcome.LOCKED),
                count(results, FiscalYearLockResult.Outcome.SKIPPED),
                count(results, FiscalYearLockResult.Outcome.FAILED));
        return results;
    }

    // ==================== Queries ====================

    public Optional<PeriodLock> get(String organizationId, String period) {
        return store.find(requireOrganization(organizationId), Periods.parse(period));
    }

    public List<PeriodLock> list(String organizationId, Integer year) {
        return store.findByOrganization(requireOrganization(organizationId), year);
    }

    public List<AuditLogEntry> history(String organizationId, String period) {
        YearMonth yearMonth = Periods.parse(period);
        return auditLogWriter.history(requireOrganization(organizationId), RESOURCE_TYPE, Periods.format(yearMonth));
    }

    // ==================== Internals ====================

    private PeriodLock doLock(String organizationId, YearMonth period, Actor actor, String reason) {
        Instant now = clock.instant();
        Optional<PeriodLock> existing = store.find(organizationId, period);

        PeriodLock locked;
        if (existing.isEmpty()) {
            locked = PeriodLock.create(organizationId, period, actor.getUserId(), reason, now);
            if (!store.insert(locked)) {
                metrics.recordLockTransition("lock", "conflict");
                throw new ConflictException(String.format(
                        "Period %s was locked concurrently by another request", period));
            }
            metrics.recordLockTransition("lock", "success");
        } else {
            try {
                locked = existing.get().relock(actor.getUserId(), reason, now);
            } catch (ConflictException e) {
                metrics.recordLockTransition("lock", "conflict");
                throw e;
            }
            apply(existing.get(), locked, "lock");
        }

        publish(PeriodLockEventType.PERIOD_LOCKED, locked, actor, now);
        auditLogWriter.append(organizationId, actor, AuditAction.LOCK_PERIOD, RESOURCE_TYPE,
                Periods.format(period), existing.orElse(null), locked);

        log.info("Period locked: organizationId={}, period={}, by={}", organizationId, period, actor.getUserId());
        return locked;
    }

    private boolean relockExpired(PeriodLock expired, Actor system, Instant now) {
        PeriodLock relocked = expired.autoRelock(system.getUserId(), now);
        if (!store.compareAndSet(expired, relocked)) {
            log.debug("Auto-relock skipped, record changed concurrently: organizationId={}, period={}",
                    expired.getOrganizationId(), expired.getPeriod());
            return false;
        }
        metrics.recordLockTransition("auto_relock", "success");
        publish(PeriodLockEventType.PERIOD_AUTO_RELOCKED, relocked, system, now);
        auditLogWriter.append(expired.getOrganizationId(), system, AuditAction.AUTO_RELOCK_PERIOD, RESOURCE_TYPE,
                Periods.format(expired.getPeriod()), expired, relocked);
        log.info("Period auto-relocked: organizationId={}, period={}, windowExpiredAt={}",
                expired.getOrganizationId(), expired.getPeriod(), expired.getUnlockExpiresAt());
        return true;
    }

    private void apply(PeriodLock expected, PeriodLock replacement, String action) {
        if (!store.compareAndSet(expected, replacement)) {
            metrics.recordLockTransition(action, "conflict");
            throw new ConflictException(String.format(
                    "Period %s was modified concurrently; reload and retry", expected.getPeriod()));
        }
        metrics.recordLockTransition(action, "success");
    }

    private void publish(PeriodLockEventType type, PeriodLock lock, Actor actor, Instant now) {
        outboxService.saveEvent(OutboxAggregate.PERIOD_LOCK, lock.getLockId(), lock.getOrganizationId(),
                type.eventName(), PeriodLockEvent.of(type, lock, actor, now));
    }

    private static void requireRole(Actor actor, Set<UserRole> allowed, String operation) {
        if (actor == null || !actor.hasAnyRole(allowed)) {
            throw new ForbiddenException(String.format(
                    "Role '%s' is not allowed to %s",
                    actor == null ? "unknown" : actor.getRole().wireValue(), operation));
        }
    }

    private static String requireOrganization(String organizationId) {
        if (organizationId == null || organizationId.isBlank()) {
            throw new ValidationException("Organization ID is required");
        }
        return organizationId;
    }

    private static long count(List<FiscalYearLockResult> results, FiscalYearLockResult.Outcome outcome) {
        return results.stream().filter(r -> r.getStatus() == outcome).count();
    }
}
