package com.flagship.finance_ledger.journal;

import com.flagship.finance_ledger.actor.Actor;
import com.flagship.finance_ledger.actor.UserRole;
import com.flagship.finance_ledger.audit.AuditAction;
import com.flagship.finance_ledger.audit.AuditLogWriter;
import com.flagship.finance_ledger.exception.ForbiddenException;
import com.flagship.finance_ledger.exception.NotFoundException;
import com.flagship.finance_ledger.exception.PeriodLockedException;
import com.flagship.finance_ledger.exception.PostingFailedException;
import com.flagship.finance_ledger.exception.ValidationException;
import com.flagship.finance_ledger.journal.posting.InvoicePosting;
import com.flagship.finance_ledger.journal.posting.PaymentReceivedPosting;
import com.flagship.finance_ledger.journal.posting.PaymentMode;
import com.flagship.finance_ledger.observability.LedgerMetrics;
import com.flagship.finance_ledger.outbox.OutboxAggregate;
import com.flagship.finance_ledger.outbox.OutboxService;
import com.flagship.finance_ledger.periodlock.PeriodLockService;
import com.flagship.finance_ledger.tax.TaxSplit;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JournalEntryPosterTest {

    private static final String ORG = "org-garage-1";
    private static final Instant NOW = Instant.parse("2025-07-10T06:00:00Z");
    private static final Actor ACCOUNTANT = Actor.of("u-accountant", UserRole.ACCOUNTANT, "10.0.0.2");

    private InMemoryJournalEntryStore store;
    private PeriodLockService periodLockService;
    private PostingIdempotencyCache idempotencyCache;
    private OutboxService outboxService;
    private AuditLogWriter auditLogWriter;
    private SimpleMeterRegistry registry;
    private JournalEntryPoster poster;

    @BeforeEach
    void setUp() {
        store = new InMemoryJournalEntryStore();
        periodLockService = mock(PeriodLockService.class);
        idempotencyCache = mock(PostingIdempotencyCache.class);
        outboxService = mock(OutboxService.class);
        auditLogWriter = mock(AuditLogWriter.class);
        registry = new SimpleMeterRegistry();
        poster = newPoster(store);
    }

    private JournalEntryPoster newPoster(JournalEntryStore journalEntryStore) {
        return new JournalEntryPoster(journalEntryStore, periodLockService, idempotencyCache, outboxService,
                auditLogWriter, new LedgerMetrics(registry), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static InvoicePosting invoice(String invoiceId) {
        return new InvoicePosting(ORG, invoiceId, "INV-" + invoiceId, "Ravi Motors", LocalDate.of(2025, 6, 15),
                new BigDecimal("1000.00"), TaxSplit.intraState(new BigDecimal("90"), new BigDecimal("90")));
    }

    @Nested
    @DisplayName("post")
    class Post {

        @Test
        @DisplayName("New invoice is written with a reference number, outbox event and audit record")
        void postsInvoice() {
            PostingResult result = poster.post(invoice("inv-1"), ACCOUNTANT);

            assertTrue(result.isOk());
            assertFalse(result.isDuplicate());
            JournalEntry entry = result.getEntry();
            assertEquals("JE-SLS-202506-00001", entry.getReferenceNumber());
            assertEquals(SourceDocumentType.INVOICE, entry.getSourceDocumentType());
            assertEquals("inv-1", entry.getSourceDocumentId());
            assertEquals("u-accountant", entry.getCreatedBy());
            assertEquals(NOW, entry.getCreatedAt());
            assertEquals(new BigDecimal("1180.00"), entry.totalDebit());
            assertEquals(entry.totalDebit(), entry.totalCredit());

            verify(periodLockService).check(ORG, LocalDate.of(2025, 6, 15));
            verify(outboxService).saveEvent(eq(OutboxAggregate.JOURNAL_ENTRY), eq(entry.getEntryId()), eq(ORG),
                    eq("JournalEntryPosted"), any());
            verify(auditLogWriter).append(eq(ORG), eq(ACCOUNTANT), eq(AuditAction.POST_JOURNAL_ENTRY),
                    eq(JournalEntryPoster.RESOURCE_TYPE), eq(entry.getEntryId().toString()), isNull(), eq(entry));
            verify(idempotencyCache).store(ORG, SourceDocumentType.INVOICE, "inv-1", entry.getEntryId());
        }

        @Test
        @DisplayName("Reference numbers are sequential per type and month")
        void sequentialReferences() {
            poster.post(invoice("inv-1"), ACCOUNTANT);
            PostingResult second = poster.post(invoice("inv-2"), ACCOUNTANT);
            PostingResult receipt = poster.post(new PaymentReceivedPosting(ORG, "pay-1", "PAY-1", "Ravi Motors",
                    "INV-inv-1", LocalDate.of(2025, 6, 20), new BigDecimal("1180"), PaymentMode.BANK), ACCOUNTANT);

            assertEquals("JE-SLS-202506-00002", second.getEntry().getReferenceNumber());
            assertEquals("JE-RCP-202506-00001", receipt.getEntry().getReferenceNumber());
        }

        @Test
        @DisplayName("Second posting of the same document returns the existing entry")
        void duplicateFromDatabase() {
            JournalEntry first = poster.post(invoice("inv-1"), ACCOUNTANT).getEntry();

            PostingResult again = poster.post(invoice("inv-1"), ACCOUNTANT);

            assertTrue(again.isOk());
            assertTrue(again.isDuplicate());
            assertEquals(first.getEntryId(), again.getEntry().getEntryId());
            assertEquals(1, store.size());
            assertEquals(1.0, registry.counter("ledger.idempotency", "result", "db_hit").count());
        }

        @Test
        @DisplayName("Cache hit short-circuits the database lookup")
        void duplicateFromCache() {
            JournalEntry first = poster.post(invoice("inv-1"), ACCOUNTANT).getEntry();
            when(idempotencyCache.lookup(ORG, SourceDocumentType.INVOICE, "inv-1"))
                    .thenReturn(Optional.of(first.getEntryId()));

            PostingResult again = poster.post(invoice("inv-1"), ACCOUNTANT);

            assertTrue(again.isDuplicate());
            assertEquals(1.0, registry.counter("ledger.idempotency", "result", "cache_hit").count());
        }

        @Test
        @DisplayName("Losing an insert race returns the winner's entry")
        void lostRace() {
            JournalEntry winner = poster.post(invoice("inv-1"), ACCOUNTANT).getEntry();
            AtomicBoolean hideOnce = new AtomicBoolean(true);
            JournalEntryPoster racing = newPoster(new InMemoryJournalEntryStore() {
                {
                    insert(winner);
                }

                @Override
                public Optional<JournalEntry> findBySource(String organizationId, SourceDocumentType sourceType,
                                                           String sourceId) {
                    if (hideOnce.getAndSet(false)) {
                        return Optional.empty();
                    }
                    return super.findBySource(organizationId, sourceType, sourceId);
                }
            });

            PostingResult result = racing.post(invoice("inv-1"), ACCOUNTANT);

            assertTrue(result.isDuplicate());
            assertEquals(winner.getEntryId(), result.getEntry().getEntryId());
        }

        @Test
        @DisplayName("Locked period rejects the posting before anything is written")
        void lockedPeriod() {
            when(periodLockService.check(eq(ORG), any(LocalDate.class)))
                    .thenThrow(new PeriodLockedException("2025-06", "u-admin", NOW));

            assertThrows(PeriodLockedException.class, () -> poster.post(invoice("inv-1"), ACCOUNTANT));
            assertEquals(0, store.size());
            verify(outboxService, never()).saveEvent(any(), any(), anyString(), anyString(), any());
        }

        @Test
        @DisplayName("Database failure surfaces as a posting failure")
        void persistenceFailure() {
            JournalEntryPoster failing = newPoster(new InMemoryJournalEntryStore() {
                @Override
                public boolean insert(JournalEntry entry) {
                    throw new DataAccessResourceFailureException("connection refused");
                }
            });

            PostingFailedException e = assertThrows(PostingFailedException.class,
                    () -> failing.post(invoice("inv-1"), ACCOUNTANT));
            assertTrue(e.getMessage().contains("invoice inv-1"));
            verify(auditLogWriter, never()).append(anyString(), any(), any(), anyString(), anyString(), any(), any());
        }
    }

    @Nested
    @DisplayName("reverse")
    class Reverse {

        private JournalEntry original;

        @BeforeEach
        void postOriginal() {
            original = poster.post(invoice("inv-1"), ACCOUNTANT).getEntry();
        }

        @Test
        @DisplayName("Reversal swaps every line and leaves the original untouched")
        void reverses() {
            PostingResult result = poster.reverse(ORG, original.getEntryId(), LocalDate.of(2025, 7, 2),
                    "Wrong customer", ACCOUNTANT);

            JournalEntry reversal = result.getEntry();
            assertFalse(result.isDuplicate());
            assertEquals(original.getEntryId(), reversal.getReversalOf());
            assertEquals(SourceDocumentType.REVERSAL, reversal.getSourceDocumentType());
            assertEquals(original.getEntryId().toString(), reversal.getSourceDocumentId());
            assertEquals("JE-SLS-202507-00001", reversal.getReferenceNumber());
            assertEquals("Reversal of JE-SLS-202506-00001: Wrong customer", reversal.getDescription());
            for (int i = 0; i < original.getLines().size(); i++) {
                assertEquals(original.getLines().get(i).getDebit(), reversal.getLines().get(i).getCredit());
                assertEquals(original.getLines().get(i).getCredit(), reversal.getLines().get(i).getDebit());
            }
            assertEquals(Optional.of(original), store.findById(ORG, original.getEntryId()));
            verify(outboxService).saveEvent(eq(OutboxAggregate.JOURNAL_ENTRY), eq(reversal.getEntryId()), eq(ORG),
                    eq("JournalEntryReversed"), any());
        }

        @Test
        @DisplayName("Reversing twice returns the first reversal")
        void reverseTwice() {
            JournalEntry first = poster.reverse(ORG, original.getEntryId(), LocalDate.of(2025, 7, 2),
                    "Wrong customer", ACCOUNTANT).getEntry();

            PostingResult again = poster.reverse(ORG, original.getEntryId(), LocalDate.of(2025, 7, 3),
                    "Wrong customer", ACCOUNTANT);

            assertTrue(again.isDuplicate());
            assertEquals(first.getEntryId(), again.getEntry().getEntryId());
        }

        @Test
        @DisplayName("Only admin, owner and accountant may reverse")
        void forbidden() {
            Actor technician = Actor.of("u-tech", UserRole.TECHNICIAN, null);

            assertThrows(ForbiddenException.class, () -> poster.reverse(ORG, original.getEntryId(),
                    LocalDate.of(2025, 7, 2), "Wrong customer", technician));
        }

        @Test
        @DisplayName("Unknown entry and missing reason are rejected")
        void invalid() {
            assertThrows(NotFoundException.class, () -> poster.reverse(ORG, UUID.randomUUID(),
                    LocalDate.of(2025, 7, 2), "Wrong customer", ACCOUNTANT));
            assertThrows(NotFoundException.class, () -> poster.reverse("org-other", original.getEntryId(),
                    LocalDate.of(2025, 7, 2), "Wrong customer", ACCOUNTANT));
            assertThrows(ValidationException.class, () -> poster.reverse(ORG, original.getEntryId(),
                    LocalDate.of(2025, 7, 2), " ", ACCOUNTANT));
        }

        @Test
        @DisplayName("Reversal dated in a locked period is rejected")
        void lockedReversalDate() {
            when(periodLockService.check(ORG, LocalDate.of(2025, 6, 30)))
                    .thenThrow(new PeriodLockedException("2025-06", "u-admin", NOW));

            assertThrows(PeriodLockedException.class, () -> poster.reverse(ORG, original.getEntryId(),
                    LocalDate.of(2025, 6, 30), "Wrong customer", ACCOUNTANT));
        }
    }
}
