package com.flagship.finance_ledger.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Writes ledger events to the transactional outbox.
 *
 * {@link #saveEvent} joins the caller's transaction (MANDATORY): if a lock transition or
 * journal entry commits, its event commits with it; if it rolls back, so does the event.
 * Publishing to Kafka is left to {@link OutboxPublisher}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    /**
     * Saves an event within the current transaction.
     *
     * @param aggregateId lock id or journal entry id
     * @param organizationId tenant, used as the Kafka key
     * @param payload event object, serialized to JSON
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(OutboxAggregate aggregate, UUID aggregateId, String organizationId,
                                 String eventType, Object payload) {
        OutboxEvent event = OutboxEvent.create(aggregate, aggregateId, organizationId, eventType,
                serializePayload(payload), clock.instant());

        OutboxEventEntity saved = repository.save(OutboxEventEntity.fromDomain(event));

        log.debug("Saved outbox event: type={}, aggregateType={}, aggregateId={}",
                eventType, aggregate.typeName(), aggregateId);

        return saved.toDomain();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findPublishableEvents(int limit) {
        return repository.findPublishableForUpdate(limit, maxRetries)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished(clock.instant());
            repository.save(entity);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markFailed(errorMessage);
            repository.save(entity);
            if (entity.getRetryCount() >= maxRetries) {
                log.error("Outbox event {} dead-lettered after {} attempts: {}",
                        eventId, entity.getRetryCount(), errorMessage);
            } else {
                log.warn("Outbox event {} failed (retry #{}): {}",
                        eventId, entity.getRetryCount(), errorMessage);
            }
        });
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForAggregate(OutboxAggregate aggregate, UUID aggregateId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(
                        aggregate.typeName(), aggregateId)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    private String serializePayload(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }
}
