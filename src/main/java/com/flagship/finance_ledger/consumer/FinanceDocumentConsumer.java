package com.flagship.finance_ledger.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.finance_ledger.actor.Actor;
import com.flagship.finance_ledger.actor.UserRole;
import com.flagship.finance_ledger.exception.PeriodLockedException;
import com.flagship.finance_ledger.exception.PostingFailedException;
import com.flagship.finance_ledger.exception.ValidationException;
import com.flagship.finance_ledger.journal.PostingGate;
import com.flagship.finance_ledger.journal.PostingResult;
import com.flagship.finance_ledger.journal.posting.PostingEvent;
import com.flagship.finance_ledger.observability.CorrelationContext;
import com.flagship.finance_ledger.observability.LedgerMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.UUID;

/**
 * Posts business-document events from the finance-documents topic to the ledger.
 *
 * Offsets are committed manually, after the event is posted or recorded as skipped. Events for
 * a locked period, unknown event types and invalid payloads are recorded as skipped: retrying
 * them would fail the same way. A posting that could not be persisted is thrown so Kafka
 * redelivers it.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class FinanceDocumentConsumer {

    static final String CONSUMER_GROUP = "finance-document-consumer";
    static final String UNKNOWN_AGGREGATE = "unknown";

    private final IdempotentEventProcessor eventProcessor;
    private final PostingGate postingGate;
    private final LedgerMetrics metrics;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.finance-documents:finance-documents}",
        groupId = "${spring.kafka.consumer.group-id:finance-ledger-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        EventEnvelope envelope = parseEnvelope(record.value());
        if (envelope == null) {
            log.warn("Could not parse event envelope at offset {}, acknowledging to skip", record.offset());
            metrics.recordEventConsumed(UNKNOWN_AGGREGATE, "unparseable");
            ack.acknowledge();
            return;
        }

        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, correlationId(record, envelope));
        MDC.put(CorrelationContext.ORGANIZATION_ID_MDC_KEY, envelope.organizationId());
        try {
            String outcome = handle(envelope);
            ack.acknowledge();
            metrics.recordEventConsumed(envelope.eventType(), outcome);
            log.info("Processed event: type={}, eventId={}, outcome={}",
                    envelope.eventType(), envelope.eventId(), outcome);

        } catch (RuntimeException e) {
            metrics.recordEventConsumed(envelope.eventType(), "error");
            log.error("Error processing event {} at offset {}, leaving it for redelivery: {}",
                    envelope.eventId(), record.offset(), e.getMessage(), e);
            throw e;

        } finally {
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
            MDC.remove(CorrelationContext.ORGANIZATION_ID_MDC_KEY);
        }
    }

    /**
     * @return the metric outcome: posted, duplicate, already_processed, period_locked, invalid or skipped
     */
    String handle(EventEnvelope envelope) {
        PostingEvent event;
        try {
            Optional<PostingEvent> mapped = FinanceDocumentMapper.toPostingEvent(
                    envelope.eventType(), envelope.organizationId(), envelope.payload());
            if (mapped.isEmpty()) {
                log.debug("Event type {} is not posted to the ledger, skipping", envelope.eventType());
                skip(envelope, UNKNOWN_AGGREGATE, envelope.eventId().toString(), "Unknown event type");
                return "skipped";
            }
            event = mapped.get();
        } catch (ValidationException e) {
            log.warn("Invalid {} payload in event {}: {}", envelope.eventType(), envelope.eventId(), e.getMessage());
            skip(envelope, UNKNOWN_AGGREGATE, envelope.eventId().toString(), "Invalid payload: " + e.getMessage());
            return "invalid";
        }

        String aggregateType = event.sourceDocumentType().wireValue();
        String aggregateId = event.sourceDocumentId();
        try {
            IdempotentEventProcessor.ProcessingResult<PostingResult> result = eventProcessor.processEvent(
                    envelope.eventId(), envelope.eventType(), aggregateType, aggregateId, CONSUMER_GROUP,
                    () -> requirePersisted(postingGate.post(event, envelope.actor()), aggregateType, aggregateId));

            if (result.wasSkipped()) {
                return "already_processed";
            }
            return result.getValue().isDuplicate() ? "duplicate" : "posted";

        } catch (PeriodLockedException e) {
            skip(envelope, aggregateType, aggregateId, "Period " + e.getPeriod() + " is locked");
            return "period_locked";

        } catch (ValidationException e) {
            log.warn("Event {} rejected by the ledger: {}", envelope.eventId(), e.getMessage());
            skip(envelope, aggregateType, aggregateId, "Invalid payload: " + e.getMessage());
            return "invalid";
        }
    }

    private static PostingResult requirePersisted(PostingResult result, String aggregateType, String aggregateId) {
        if (!result.isOk()) {
            throw new PostingFailedException(
                    "Posting failed for " + aggregateType + " " + aggregateId + ": " + result.getMessage(), null);
        }
        return result;
    }

    private void skip(EventEnvelope envelope, String aggregateType, String aggregateId, String reason) {
        eventProcessor.skipEvent(envelope.eventId(), envelope.eventType(), aggregateType, aggregateId,
                CONSUMER_GROUP, reason);
    }

    EventEnvelope parseEnvelope(String json) {
        if (json == null) {
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(json);
            String eventId = text(node, "eventId");
            String eventType = text(node, "eventType");
            String organizationId = text(node, "organizationId");
            if (eventId == null || eventType == null || organizationId == null) {
                log.warn("Event envelope is missing eventId, eventType or organizationId");
                return null;
            }
            return new EventEnvelope(UUID.fromString(eventId), eventType, organizationId,
                    text(node, "userId"), text(node, "userRole"), node.get("payload"));

        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.error("Failed to parse event envelope: {}", e.getMessage());
            return null;
        }
    }

    private static String correlationId(ConsumerRecord<String, String> record, EventEnvelope envelope) {
        Header header = record.headers().lastHeader(CorrelationContext.CORRELATION_ID_HEADER);
        if (header != null && header.value() != null) {
            return new String(header.value(), StandardCharsets.UTF_8);
        }
        return envelope.eventId().toString().substring(0, 8);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() || value.asText().isBlank() ? null : value.asText();
    }

    /**
     * Common fields of a document event. Without a user id the posting is attributed to the system.
     */
    record EventEnvelope(UUID eventId, String eventType, String organizationId, String userId, String userRole,
                         JsonNode payload) {

        Actor actor() {
            return userId == null ? null : Actor.of(userId, UserRole.fromString(userRole), null);
        }
    }
}
