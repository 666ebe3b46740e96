package com.flagship.finance_ledger.journal;

import com.flagship.finance_ledger.actor.Actor;
import com.flagship.finance_ledger.actor.UserRole;
import com.flagship.finance_ledger.audit.AuditAction;
import com.flagship.finance_ledger.audit.AuditLogWriter;
import com.flagship.finance_ledger.exception.ForbiddenException;
import com.flagship.finance_ledger.exception.NotFoundException;
import com.flagship.finance_ledger.exception.PostingFailedException;
import com.flagship.finance_ledger.exception.ValidationException;
import com.flagship.finance_ledger.journal.event.JournalEntryEvent;
import com.flagship.finance_ledger.journal.event.JournalEntryEventType;
import com.flagship.finance_ledger.journal.posting.PostingDraft;
import com.flagship.finance_ledger.journal.posting.PostingEvent;
import com.flagship.finance_ledger.journal.posting.PostingRules;
import com.flagship.finance_ledger.observability.LedgerMetrics;
import com.flagship.finance_ledger.outbox.OutboxAggregate;
import com.flagship.finance_ledger.outbox.OutboxService;
import com.flagship.finance_ledger.periodlock.PeriodLockService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Turns business events into balanced journal entries.
 *
 * Order of work for a posting:
 * 1. Period lock check for the event date (nothing is written if the period is locked)
 * 2. Idempotency lookup: Redis fast path, then the database
 * 3. Lines from {@link PostingRules}, verified by {@link LedgerInvariants}
 * 4. Insert guarded by the (organization, source type, source id) unique index
 * 5. Outbox event in the same transaction, audit record in its own
 *
 * Postings commit in their own transaction so a ledger failure never rolls back the
 * business operation that triggered it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JournalEntryPoster {

    public static final String RESOURCE_TYPE = "journal_entry";

    static final Set<UserRole> REVERSE_ROLES = EnumSet.of(UserRole.ADMIN, UserRole.OWNER, UserRole.ACCOUNTANT);

    private final JournalEntryStore store;
    private final PeriodLockService periodLockService;
    private final PostingIdempotencyCache idempotencyCache;
    private final OutboxService outboxService;
    private final AuditLogWriter auditLogWriter;
    private final LedgerMetrics metrics;
    private final Clock clock;

    /**
     * Posts one business event. A second call for the same source document returns the
     * existing entry.
     *
     * @throws com.flagship.finance_ledger.exception.PeriodLockedException if the event date is in a locked period
     * @throws com.flagship.finance_ledger.exception.InternalInvariantViolationException if the rules produced an unbalanced entry
     * @throws PostingFailedException if the entry could not be persisted
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public PostingResult post(PostingEvent event, Actor actor) {
        String organizationId = event.organizationId();
        periodLockService.check(organizationId, event.effectiveDate());

        Optional<JournalEntry> existing = findExisting(organizationId, event.sourceDocumentType(),
                event.sourceDocumentId());
        if (existing.isPresent()) {
            log.info("Journal entry already exists for {} {}: {}", event.sourceDocumentType().wireValue(),
                    event.sourceDocumentId(), existing.get().getReferenceNumber());
            return PostingResult.duplicate(existing.get());
        }

        PostingDraft draft = PostingRules.draft(event);
        LedgerInvariants.verify(context(event.sourceDocumentType(), event.sourceDocumentId()), draft.getLines());

        JournalEntry entry = newEntry(organizationId, event.effectiveDate(), draft.getEntryType(),
                draft.getDescription(), event.sourceDocumentType(), event.sourceDocumentId(), actor, null,
                draft.getLines());

        return persist(entry, actor, AuditAction.POST_JOURNAL_ENTRY, JournalEntryEventType.JOURNAL_ENTRY_POSTED);
    }

    /**
     * Writes a new entry that swaps debit and credit on every line of {@code entryId}. The
     * original entry is left untouched. Reversing the same entry twice returns the first reversal.
     */
    @Transactional
    public PostingResult reverse(String organizationId, UUID entryId, LocalDate reversalDate, String reason,
                                 Actor actor) {
        if (actor == null || !actor.hasAnyRole(REVERSE_ROLES)) {
            throw new ForbiddenException(String.format("Role '%s' is not allowed to reverse journal entries",
                    actor == null ? "unknown" : actor.getRole().wireValue()));
        }
        if (reversalDate == null) {
            throw new ValidationException("Reversal date is required");
        }
        if (reason == null || reason.isBlank()) {
            throw new ValidationException("Reversal reason is required");
        }

        periodLockService.check(organizationId, reversalDate);

        JournalEntry original = store.findById(organizationId, entryId)
                .orElseThrow(() -> new NotFoundException("Journal entry not found: " + entryId));

        String sourceId = entryId.toString();
        Optional<JournalEntry> existing = findExisting(organizationId, SourceDocumentType.REVERSAL, sourceId);
        if (existing.isPresent()) {
            log.info("Journal entry {} already reversed by {}", original.getReferenceNumber(),
                    existing.get().getReferenceNumber());
            return PostingResult.duplicate(existing.get());
        }

        List<JournalLine> lines = original.getLines().stream().map(JournalLine::swapped).toList();
        LedgerInvariants.verify(context(SourceDocumentType.REVERSAL, sourceId), lines);

        JournalEntry reversal = newEntry(organizationId, reversalDate, original.getEntryType(),
                "Reversal of " + original.getReferenceNumber() + ": " + reason.strip(),
                SourceDocumentType.REVERSAL, sourceId, actor, entryId, lines);

        return persist(reversal, actor, AuditAction.REVERSE_JOURNAL_ENTRY,
                JournalEntryEventType.JOURNAL_ENTRY_REVERSED);
    }

    // ==================== Queries ====================

    @Transactional(readOnly = true)
    public Optional<JournalEntry> get(String organizationId, UUID entryId) {
        return store.findById(organizationId, entryId);
    }

    @Transactional(readOnly = true)
    public List<JournalEntry> list(String organizationId, JournalEntryFilter filter) {
        return store.list(organizationId, filter);
    }

    // ==================== Internals ====================

    private Optional<JournalEntry> findExisting(String organizationId, SourceDocumentType sourceType, String sourceId) {
        Optional<UUID> cached = idempotencyCache.lookup(organizationId, sourceType, sourceId);
        if (cached.isPresent()) {
            Optional<JournalEntry> entry = store.findById(organizationId, cached.get());
            if (entry.isPresent()) {
                metrics.recordIdempotencyHit("cache");
                return entry;
            }
        }

        Optional<JournalEntry> stored = store.findBySource(organizationId, sourceType, sourceId);
        if (stored.isPresent()) {
            metrics.recordIdempotencyHit("db");
            idempotencyCache.store(organizationId, sourceType, sourceId, stored.get().getEntryId());
        } else {
            metrics.recordIdempotencyMiss();
        }
        return stored;
    }

    private JournalEntry newEntry(String organizationId, LocalDate entryDate, EntryType entryType, String description,
                                  SourceDocumentType sourceType, String sourceId, Actor actor, UUID reversalOf,
                                  List<JournalLine> lines) {
        String referenceNumber;
        try {
            referenceNumber = store.nextReferenceNumber(organizationId, entryType, YearMonth.from(entryDate));
        } catch (DataAccessException e) {
            throw new PostingFailedException("Could not allocate reference number for "
                    + context(sourceType, sourceId) + ": " + e.getMessage(), e);
        }

        return JournalEntry.builder()
                .entryId(UUID.randomUUID())
                .organizationId(organizationId)
                .entryDate(entryDate)
                .referenceNumber(referenceNumber)
                .description(description)
                .entryType(entryType)
                .sourceDocumentType(sourceType)
                .sourceDocumentId(sourceId)
                .createdBy(actor == null ? null : actor.getUserId())
                .reversalOf(reversalOf)
                .lines(lines)
                .createdAt(clock.instant())
                .build();
    }

    private PostingResult persist(JournalEntry entry, Actor actor, AuditAction action, JournalEntryEventType eventType) {
        String context = context(entry.getSourceDocumentType(), entry.getSourceDocumentId());
        try {
            if (!store.insert(entry)) {
                JournalEntry winner = store.findBySource(entry.getOrganizationId(), entry.getSourceDocumentType(),
                                entry.getSourceDocumentId())
                        .orElseThrow(() -> new PostingFailedException(
                                "Concurrent posting for " + context + " is not visible", null));
                log.info("Lost posting race for {}, returning {}", context, winner.getReferenceNumber());
                return PostingResult.duplicate(winner);
            }

            String actorUserId = actor == null ? null : actor.getUserId();
            outboxService.saveEvent(OutboxAggregate.JOURNAL_ENTRY, entry.getEntryId(), entry.getOrganizationId(),
                    eventType.eventName(), JournalEntryEvent.of(eventType, entry, actorUserId, clock.instant()));
        } catch (DataAccessException e) {
            throw new PostingFailedException("Failed to persist journal entry for " + context + ": " + e.getMessage(), e);
        }

        if (actor != null) {
            auditLogWriter.append(entry.getOrganizationId(), actor, action, RESOURCE_TYPE,
                    entry.getEntryId().toString(), null, entry);
        }
        idempotencyCache.store(entry.getOrganizationId(), entry.getSourceDocumentType(), entry.getSourceDocumentId(),
                entry.getEntryId());

        log.info("Journal entry {} posted: type={}, source={}, amount={}, lines={}",
                entry.getReferenceNumber(), entry.getEntryType(), context, entry.totalDebit(), entry.getLines().size());
        return PostingResult.posted(entry);
    }

    private static String context(SourceDocumentType sourceType, String sourceId) {
        return sourceType.wireValue() + " " + sourceId;
    }
}
