package com.flagship.finance_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer meters for period locking and journal posting.
 *
 * Metrics exposed:
 * - ledger.postings{kind,status}: posting outcomes (posted, duplicate, blocked, failed, invariant_violation)
 * - ledger.posting.latency{kind}: time spent in the posting gate
 * - ledger.postings.blocked: writes rejected because the period is locked
 * - ledger.idempotency{result}: duplicate-posting lookups (cache_hit, db_hit, miss)
 * - period_lock.transitions{action,result}: lock/unlock/extend/relock attempts
 * - period_lock.auto_relocked: windows closed by the sweep
 * - period_lock.check.bypassed: lock checks skipped for missing context
 * - audit.write.failures{action}: best-effort audit writes that were dropped
 * - consumer.events{event_type,result}: business-document events consumed
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter postingsBlocked;
    private final Counter autoRelocked;
    private final Counter checksBypassed;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.postingsBlocked = Counter.builder("ledger.postings.blocked")
                .description("Financial writes rejected because the period is locked")
                .register(registry);

        this.autoRelocked = Counter.builder("period_lock.auto_relocked")
                .description("Amendment windows closed by the auto-relock sweep")
                .register(registry);

        this.checksBypassed = Counter.builder("period_lock.check.bypassed")
                .description("Period lock checks skipped because organization or date was missing")
                .register(registry);
    }

    // ==================== Posting ====================

    public void recordPosting(String kind, String status) {
        registry.counter("ledger.postings",
                "kind", sanitizeTag(kind),
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordPostingLatency(String kind, long durationMs) {
        registry.timer("ledger.posting.latency",
                "kind", sanitizeTag(kind)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordPostingBlocked() {
        postingsBlocked.increment();
    }

    public void recordIdempotencyHit(String source) {
        registry.counter("ledger.idempotency", "result", sanitizeTag(source + "_hit")).increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("ledger.idempotency", "result", "miss").increment();
    }

    // ==================== Period locks ====================

    public void recordLockTransition(String action, String result) {
        registry.counter("period_lock.transitions",
                "action", sanitizeTag(action),
                "result", sanitizeTag(result)
        ).increment();
    }

    public void recordAutoRelocked(int count) {
        autoRelocked.increment(count);
    }

    public void recordCheckBypassed() {
        checksBypassed.increment();
    }

    // ==================== Audit / consumer ====================

    public void recordAuditWriteFailure(String action) {
        registry.counter("audit.write.failures", "action", sanitizeTag(action)).increment();
    }

    public void recordEventConsumed(String eventType, String result) {
        registry.counter("consumer.events",
                "event_type", sanitizeTag(eventType),
                "result", sanitizeTag(result)
        ).increment();
    }

    /**
     * Keeps tag values short and free of special characters to bound cardinality.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
