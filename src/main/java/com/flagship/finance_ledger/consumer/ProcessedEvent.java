package com.flagship.finance_ledger.consumer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Record that a consumer group has handled an incoming document event.
 *
 * The aggregate is the business document the event describes, identified by its source
 * document type and id.
 */
@Value
public class ProcessedEvent {
    UUID eventId;
    String eventType;
    String aggregateType;
    String aggregateId;
    String consumerGroup;
    Instant processedAt;
    ProcessingResult result;
    String errorMessage;

    public enum ProcessingResult {
        SUCCESS,
        SKIPPED     // would fail the same way on every redelivery
    }

    public static ProcessedEvent success(UUID eventId, String eventType, String aggregateType, String aggregateId,
                                         String consumerGroup, Instant processedAt) {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId, consumerGroup, processedAt,
                ProcessingResult.SUCCESS, null);
    }

    public static ProcessedEvent skipped(UUID eventId, String eventType, String aggregateType, String aggregateId,
                                         String consumerGroup, Instant processedAt, String reason) {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId, consumerGroup, processedAt,
                ProcessingResult.SKIPPED, reason);
    }
}
