package com.flagship.finance_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A domain event waiting in the outbox table.
 *
 * Written in the same transaction as the lock transition or journal entry it describes, then
 * published to Kafka by {@link OutboxPublisher}. The organization id is the Kafka key, which
 * keeps one organization's events in order on a single partition.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;
    UUID aggregateId;
    String organizationId;
    String eventType;
    String payload;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(OutboxAggregate aggregate, UUID aggregateId, String organizationId,
                                     String eventType, String payload, Instant now) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregate.typeName(),
            aggregateId,
            organizationId,
            eventType,
            payload,
            now,
            null,
            0,
            null,
            null
        );
    }

    public OutboxAggregate aggregate() {
        return OutboxAggregate.fromTypeName(aggregateType);
    }
}
