package com.flagship.finance_ledger.journal;

import com.flagship.finance_ledger.actor.Actor;
import com.flagship.finance_ledger.exception.InternalInvariantViolationException;
import com.flagship.finance_ledger.exception.PeriodLockedException;
import com.flagship.finance_ledger.exception.PostingFailedException;
import com.flagship.finance_ledger.journal.posting.PostingEvent;
import com.flagship.finance_ledger.observability.CorrelationContext;
import com.flagship.finance_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.LocalDate;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Single entry point for every money-moving call site.
 *
 * Failure policy:
 * - locked period: thrown, nothing is written
 * - invalid payload: thrown verbatim
 * - invariant violation: logged as a bug, returned as ok=false with a generic message
 * - persistence failure, anywhere from the lock check to the commit: logged for manual
 *   reconciliation, returned as ok=false so the calling business operation still completes
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PostingGate {

    static final String SYSTEM_POSTING_USER = "system_posting";

    private final JournalEntryPoster poster;
    private final LedgerMetrics metrics;

    /**
     * Posts any event kind. Without an actor the entry is attributed to the system.
     */
    public PostingResult post(PostingEvent event, Actor actor) {
        Actor effectiveActor = actor == null ? Actor.system(SYSTEM_POSTING_USER) : actor;
        String kind = event.sourceDocumentType().wireValue();
        return guarded(event.organizationId(), kind, event.sourceDocumentId(),
                () -> poster.post(event, effectiveActor));
    }

    public PostingResult reverse(String organizationId, UUID entryId, LocalDate reversalDate, String reason,
                                 Actor actor) {
        return guarded(organizationId, SourceDocumentType.REVERSAL.wireValue(), entryId.toString(),
                () -> poster.reverse(organizationId, entryId, reversalDate, reason, actor));
    }

    private PostingResult guarded(String organizationId, String kind, String sourceId, Supplier<PostingResult> posting) {
        long startTime = System.currentTimeMillis();
        String previousOrganization = MDC.get(CorrelationContext.ORGANIZATION_ID_MDC_KEY);
        MDC.put(CorrelationContext.ORGANIZATION_ID_MDC_KEY, organizationId);
        MDC.put(CorrelationContext.SOURCE_DOCUMENT_MDC_KEY, kind + ":" + sourceId);

        try {
            PostingResult result = posting.get();
            metrics.recordPosting(kind, result.isDuplicate() ? "duplicate" : "posted");
            return result;

        } catch (PeriodLockedException e) {
            metrics.recordPosting(kind, "blocked");
            log.warn("Posting blocked, period {} is locked: source={}:{}", e.getPeriod(), kind, sourceId);
            throw e;

        } catch (InternalInvariantViolationException e) {
            metrics.recordPosting(kind, "invariant_violation");
            log.error("BUG: ledger invariant violated while posting {}:{}: {}", kind, sourceId, e.getMessage(), e);
            return PostingResult.failed(PostingResult.MESSAGE_FAILED);

        } catch (PostingFailedException e) {
            metrics.recordPosting(kind, "failed");
            log.error("Posting failed for {}:{}, manual reconciliation required: {}", kind, sourceId,
                    e.getMessage(), e);
            return PostingResult.failed(e.getMessage());

        } catch (DataAccessException | TransactionException e) {
            // lock check, idempotency lookup or commit of the posting transaction
            metrics.recordPosting(kind, "failed");
            log.error("Posting failed for {}:{}, manual reconciliation required: {}", kind, sourceId,
                    e.getMessage(), e);
            return PostingResult.failed(PostingResult.MESSAGE_FAILED + ": " + e.getMessage());

        } finally {
            metrics.recordPostingLatency(kind, System.currentTimeMillis() - startTime);
            MDC.remove(CorrelationContext.SOURCE_DOCUMENT_MDC_KEY);
            if (previousOrganization == null) {
                MDC.remove(CorrelationContext.ORGANIZATION_ID_MDC_KEY);
            } else {
                MDC.put(CorrelationContext.ORGANIZATION_ID_MDC_KEY, previousOrganization);
            }
        }
    }
}
