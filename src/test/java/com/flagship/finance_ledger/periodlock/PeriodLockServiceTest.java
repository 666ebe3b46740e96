package com.flagship.finance_ledger.periodlock;

import com.flagship.finance_ledger.actor.Actor;
import com.flagship.finance_ledger.actor.UserRole;
import com.flagship.finance_ledger.audit.AuditAction;
import com.flagship.finance_ledger.audit.AuditLogWriter;
import com.flagship.finance_ledger.exception.ConflictException;
import com.flagship.finance_ledger.exception.ForbiddenException;
import com.flagship.finance_ledger.exception.NotFoundException;
import com.flagship.finance_ledger.exception.PeriodLockedException;
import com.flagship.finance_ledger.exception.ValidationException;
import com.flagship.finance_ledger.observability.LedgerMetrics;
import com.flagship.finance_ledger.outbox.OutboxAggregate;
import com.flagship.finance_ledger.outbox.OutboxService;
import com.flagship.finance_ledger.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class PeriodLockServiceTest {

    private static final String ORG = "org-garage-1";
    private static final String JUNE = "2025-06";
    private static final Instant NOW = Instant.parse("2025-07-10T06:00:00Z");

    private static final Actor ADMIN = Actor.of("u-admin", UserRole.ADMIN, "10.0.0.1");
    private static final Actor ACCOUNTANT = Actor.of("u-accountant", UserRole.ACCOUNTANT, "10.0.0.2");
    private static final Actor TECHNICIAN = Actor.of("u-tech", UserRole.TECHNICIAN, "10.0.0.3");

    private InMemoryPeriodLockStore store;
    private AuditLogWriter auditLogWriter;
    private OutboxService outboxService;
    private SimpleMeterRegistry registry;
    private MutableClock clock;
    private PeriodLockService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryPeriodLockStore();
        auditLogWriter = mock(AuditLogWriter.class);
        outboxService = mock(OutboxService.class);
        registry = new SimpleMeterRegistry();
        clock = new MutableClock(NOW);
        service = newService(store);
    }

    private PeriodLockService newService(PeriodLockStore periodLockStore) {
        return newService(periodLockStore, TransactionOperations.withoutTransaction());
    }

    private PeriodLockService newService(PeriodLockStore periodLockStore, TransactionOperations transactions) {
        return new PeriodLockService(periodLockStore, auditLogWriter, outboxService, new LedgerMetrics(registry),
                transactions, clock, 72, 2, 7, 4);
    }

    /**
     * Runs callbacks without a transaction, except the n-th, which fails as if no connection
     * could be obtained.
     */
    private static TransactionOperations failingOnCall(int failingCall) {
        AtomicInteger calls = new AtomicInteger();
        return new TransactionOperations() {
            @Override
            public <T> T execute(TransactionCallback<T> action) {
                if (calls.incrementAndGet() == failingCall) {
                    throw new CannotCreateTransactionException("pool exhausted");
                }
                return TransactionOperations.withoutTransaction().execute(action);
            }
        };
    }

    private double counter(String name, String... tags) {
        return registry.counter(name, tags).count();
    }

    @Nested
    @DisplayName("lock")
    class Lock {

        @Test
        @DisplayName("First lock creates the record, publishes PeriodLocked and audits")
        void firstLock() {
            PeriodLock lock = service.lock(ORG, JUNE, ACCOUNTANT, "June close");

            assertEquals(PeriodLockStatus.LOCKED, lock.getStatus());
            assertEquals("u-accountant", lock.getLockedBy());
            assertEquals(NOW, lock.getLockedAt());
            assertEquals(Optional.of(lock), store.find(ORG, YearMonth.of(2025, 6)));

            verify(outboxService).saveEvent(eq(OutboxAggregate.PERIOD_LOCK), eq(lock.getLockId()), eq(ORG),
                    eq("PeriodLocked"), any());
            verify(auditLogWriter).append(eq(ORG), eq(ACCOUNTANT), eq(AuditAction.LOCK_PERIOD),
                    eq(PeriodLockService.RESOURCE_TYPE), eq(JUNE), isNull(), eq(lock));
            assertEquals(1.0, counter("period_lock.transitions", "action", "lock", "result", "success"));
        }

        @Test
        @DisplayName("Locking a locked period is a conflict and writes nothing")
        void alreadyLocked() {
            service.lock(ORG, JUNE, ADMIN, "June close");

            assertThrows(ConflictException.class, () -> service.lock(ORG, JUNE, ADMIN, "again"));
            verify(outboxService, times(1)).saveEvent(any(), any(), anyString(), anyString(), any());
            assertEquals(1.0, counter("period_lock.transitions", "action", "lock", "result", "conflict"));
        }

        @Test
        @DisplayName("Roles outside admin, owner and accountant cannot lock")
        void forbiddenRole() {
            assertThrows(ForbiddenException.class, () -> service.lock(ORG, JUNE, TECHNICIAN, "June close"));
            assertTrue(store.find(ORG, YearMonth.of(2025, 6)).isEmpty());
        }

        @Test
        @DisplayName("Invalid period and missing organization are validation errors")
        void validation() {
            assertThrows(ValidationException.class, () -> service.lock(ORG, "2025-13", ADMIN, null));
            assertThrows(ValidationException.class, () -> service.lock(" ", JUNE, ADMIN, null));
        }
    }

    @Nested
    @DisplayName("unlock and extend")
    class Unlock {

        @BeforeEach
        void lockJune() {
            service.lock(ORG, JUNE, ADMIN, "June close");
        }

        @Test
        @DisplayName("Unlock opens a default 72 hour window")
        void unlockDefaultWindow() {
            PeriodLock open = service.unlock(ORG, JUNE, ADMIN, "Correct vendor bill amount", null);

            assertEquals(PeriodLockStatus.UNLOCKED_AMENDMENT, open.getStatus());
            assertEquals(NOW.plus(Duration.ofHours(72)), open.getUnlockExpiresAt());
            assertEquals("Correct vendor bill amount", open.getUnlockReason());
            verify(auditLogWriter).append(eq(ORG), eq(ADMIN), eq(AuditAction.UNLOCK_PERIOD), anyString(),
                    eq(JUNE), any(), eq(open));
        }

        @Test
        @DisplayName("Accountants cannot unlock")
        void accountantCannotUnlock() {
            assertThrows(ForbiddenException.class,
                    () -> service.unlock(ORG, JUNE, ACCOUNTANT, "Correct vendor bill amount", 24));
        }

        @Test
        @DisplayName("Reason shorter than ten characters and windows outside 1..168 hours are rejected")
        void unlockValidation() {
            assertThrows(ValidationException.class, () -> service.unlock(ORG, JUNE, ADMIN, "  fix   ", 24));
            assertThrows(ValidationException.class,
                    () -> service.unlock(ORG, JUNE, ADMIN, "Correct vendor bill amount", 0));
            assertThrows(ValidationException.class,
                    () -> service.unlock(ORG, JUNE, ADMIN, "Correct vendor bill amount", 169));
        }

        @Test
        @DisplayName("Unlocking a period with no record is not found")
        void unlockUnknownPeriod() {
            assertThrows(NotFoundException.class,
                    () -> service.unlock(ORG, "2025-05", ADMIN, "Correct vendor bill amount", 24));
        }

        @Test
        @DisplayName("Two extensions are allowed, the third is a conflict")
        void extensionLimit() {
            service.unlock(ORG, JUNE, ADMIN, "Correct vendor bill amount", 24);

            assertEquals(1, service.extend(ORG, JUNE, ADMIN, 24).getUnlockExtensionCount());
            PeriodLock second = service.extend(ORG, JUNE, ADMIN, 24);
            assertEquals(2, second.getUnlockExtensionCount());
            assertEquals(NOW.plus(Duration.ofHours(72)), second.getUnlockExpiresAt());

            assertThrows(ConflictException.class, () -> service.extend(ORG, JUNE, ADMIN, 24));
        }

        @Test
        @DisplayName("An expired window cannot be extended")
        void extendExpired() {
            service.unlock(ORG, JUNE, ADMIN, "Correct vendor bill amount", 1);
            clock.advance(Duration.ofHours(2));

            assertThrows(ConflictException.class, () -> service.extend(ORG, JUNE, ADMIN, 24));
        }

        @Test
        @DisplayName("A lost compare-and-set is reported as a conflict")
        void concurrentModification() {
            PeriodLockService racing = newService(new InMemoryPeriodLockStore() {
                {
                    put(store.find(ORG, YearMonth.of(2025, 6)).orElseThrow());
                }

                @Override
                public boolean compareAndSet(PeriodLock expected, PeriodLock replacement) {
                    return false;
                }
            });

            ConflictException e = assertThrows(ConflictException.class,
                    () -> racing.unlock(ORG, JUNE, ADMIN, "Correct vendor bill amount", 24));
            assertTrue(e.getMessage().contains("modified concurrently"));
        }
    }

    @Nested
    @DisplayName("check")
    class Check {

        @Test
        @DisplayName("Dates in a period without a record are open")
        void openPeriod() {
            assertEquals(YearMonth.of(2025, 6), service.check(ORG, "2025-06-15"));
        }

        @Test
        @DisplayName("Locked period rejects writes with the lock details")
        void lockedPeriod() {
            service.lock(ORG, JUNE, ADMIN, "June close");

            PeriodLockedException e = assertThrows(PeriodLockedException.class,
                    () -> service.check(ORG, "2025-06-30T23:00:00+05:30"));
            assertEquals(JUNE, e.getPeriod());
            assertEquals("u-admin", e.getLockedBy());
            assertEquals(NOW, e.getLockedAt());
            assertEquals(1.0, registry.counter("ledger.postings.blocked").count());
        }

        @Test
        @DisplayName("Locks are scoped to the organization")
        void otherOrganization() {
            service.lock(ORG, JUNE, ADMIN, "June close");

            assertEquals(YearMonth.of(2025, 6), service.check("org-other", LocalDate.of(2025, 6, 1)));
        }

        @Test
        @DisplayName("Open amendment window allows writes until it expires, even before the sweep runs")
        void amendmentWindow() {
            service.lock(ORG, JUNE, ADMIN, "June close");
            service.unlock(ORG, JUNE, ADMIN, "Correct vendor bill amount", 1);

            assertEquals(YearMonth.of(2025, 6), service.check(ORG, LocalDate.of(2025, 6, 10)));

            clock.advance(Duration.ofHours(1));
            assertThrows(PeriodLockedException.class, () -> service.check(ORG, LocalDate.of(2025, 6, 10)));
        }

        @Test
        @DisplayName("Missing context is rejected unless the caller opts into skipping")
        void missingContext() {
            assertThrows(ValidationException.class, () -> service.check(ORG, (String) null));
            assertThrows(ValidationException.class, () -> service.check(null, "2025-06-15"));
            assertThrows(ValidationException.class, () -> service.check(ORG, "not-a-date"));

            assertTrue(service.check(ORG, null, MissingContextPolicy.SKIP_AND_LOG).isEmpty());
            assertEquals(1.0, registry.counter("period_lock.check.bypassed").count());
        }
    }

    @Nested
    @DisplayName("auto-relock")
    class AutoRelock {

        @Test
        @DisplayName("Expired windows are relocked once; a second sweep is a no-op")
        void relocksExpired() {
            service.lock(ORG, JUNE, ADMIN, "June close");
            service.lock(ORG, "2025-05", ADMIN, "May close");
            service.unlock(ORG, JUNE, ADMIN, "Correct vendor bill amount", 1);
            service.unlock(ORG, "2025-05", ADMIN, "Correct vendor bill amount", 48);
            clock.advance(Duration.ofHours(2));

            assertEquals(1, service.autoRelock());
            assertEquals(0, service.autoRelock());

            PeriodLock june = store.find(ORG, YearMonth.of(2025, 6)).orElseThrow();
            assertEquals(PeriodLockStatus.LOCKED, june.getStatus());
            assertEquals(Actor.AUTO_RELOCK_USER, june.getLockedBy());
            assertEquals(PeriodLock.AUTO_RELOCK_REASON, june.getLockReason());
            assertEquals(PeriodLockStatus.UNLOCKED_AMENDMENT,
                    store.find(ORG, YearMonth.of(2025, 5)).orElseThrow().getStatus());
            verify(outboxService).saveEvent(eq(OutboxAggregate.PERIOD_LOCK), eq(june.getLockId()), eq(ORG),
                    eq("PeriodAutoRelocked"), any());
        }

        @Test
        @DisplayName("A record relocked by another instance is skipped without error")
        void lostRace() {
            service.lock(ORG, JUNE, ADMIN, "June close");
            service.unlock(ORG, JUNE, ADMIN, "Correct vendor bill amount", 1);
            clock.advance(Duration.ofHours(2));

            PeriodLockService racing = newService(new InMemoryPeriodLockStore() {
                {
                    put(store.find(ORG, YearMonth.of(2025, 6)).orElseThrow());
                }

                @Override
                public boolean compareAndSet(PeriodLock expected, PeriodLock replacement) {
                    return false;
                }
            });

            assertEquals(0, racing.autoRelock());
            verify(auditLogWriter, never()).append(anyString(), any(), eq(AuditAction.AUTO_RELOCK_PERIOD),
                    anyString(), anyString(), any(), any());
        }

        @Test
        @DisplayName("A window whose transaction cannot be opened does not stop the sweep")
        void transactionFailureIsPerRecord() {
            for (String period : List.of("2025-04", "2025-05", JUNE)) {
                service.lock(ORG, period, ADMIN, "Close");
                service.unlock(ORG, period, ADMIN, "Correct vendor bill amount", 1);
            }
            clock.advance(Duration.ofHours(2));

            PeriodLockService flaky = newService(store, failingOnCall(1));

            assertEquals(2, flaky.autoRelock());
            assertEquals(2.0, counter("period_lock.auto_relocked"));
            assertEquals(1, store.findExpiredAmendments(clock.instant()).size());
            assertEquals(1, service.autoRelock());
        }

        @Test
        @DisplayName("Manual trigger requires admin or owner")
        void manualTrigger() {
            assertThrows(ForbiddenException.class, () -> service.autoRelock(ACCOUNTANT));
            assertEquals(0, service.autoRelock(ADMIN));
        }
    }

    @Nested
    @DisplayName("fiscal year close")
    class FiscalYear {

        @Test
        @DisplayName("Locks April to March and reports already locked months as skipped")
        void locksTwelveMonths() {
            service.lock(ORG, JUNE, ADMIN, "June close");

            List<FiscalYearLockResult> results = service.lockFiscalYear(ORG, 2025, ADMIN, null);

            assertEquals(12, results.size());
            assertEquals("2025-04", results.get(0).getPeriod());
            assertEquals("2026-03", results.get(11).getPeriod());
            assertEquals(FiscalYearLockResult.Outcome.SKIPPED, results.get(2).getStatus());
            assertEquals(11, results.stream()
                    .filter(r -> r.getStatus() == FiscalYearLockResult.Outcome.LOCKED).count());
            assertEquals("Fiscal year 2025-2026 close",
                    store.find(ORG, YearMonth.of(2026, 1)).orElseThrow().getLockReason());
        }

        @Test
        @DisplayName("Calendar fiscal year when the start month is January")
        void calendarYear() {
            List<FiscalYearLockResult> results = service.lockFiscalYear(ORG, 2024, ADMIN, 1);

            assertEquals("2024-01", results.get(0).getPeriod());
            assertEquals("2024-12", results.get(11).getPeriod());
        }

        @Test
        @DisplayName("A period whose transaction cannot be opened is reported as failed, the rest still lock")
        void transactionFailureIsPerPeriod() {
            PeriodLockService flaky = newService(store, failingOnCall(3));

            List<FiscalYearLockResult> results = flaky.lockFiscalYear(ORG, 2024, ADMIN, 4);

            assertEquals(12, results.size());
            assertEquals("2024-06", results.get(2).getPeriod());
            assertEquals(FiscalYearLockResult.Outcome.FAILED, results.get(2).getStatus());
            assertEquals("pool exhausted", results.get(2).getReason());
            assertEquals(11, results.stream()
                    .filter(r -> r.getStatus() == FiscalYearLockResult.Outcome.LOCKED).count());
            assertTrue(store.find(ORG, YearMonth.of(2024, 6)).isEmpty());
            assertTrue(store.find(ORG, YearMonth.of(2025, 3)).isPresent());
        }

        @Test
        @DisplayName("Start month outside 1..12 is rejected")
        void invalidStartMonth() {
            assertThrows(ValidationException.class, () -> service.lockFiscalYear(ORG, 2025, ADMIN, 13));
            assertThrows(ForbiddenException.class, () -> service.lockFiscalYear(ORG, 2025, TECHNICIAN, 4));
        }
    }
}
