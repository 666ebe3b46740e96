package com.flagship.finance_ledger.consumer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Runs a handler at most once per (event id, consumer group).
 *
 * A handler that throws leaves no record, so the redelivered message is handled again.
 * Outcomes that would fail the same way on every retry are recorded through
 * {@link #skipEvent} instead.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;
    private final Clock clock;

    /**
     * @return the handler's value, or a skipped result when the event was already processed
     */
    @Transactional
    public <T> ProcessingResult<T> processEvent(UUID eventId, String eventType,
                                                String aggregateType, String aggregateId,
                                                String consumerGroup, Supplier<T> handler) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            log.info("Event {} already processed by consumer group {}, skipping", eventId, consumerGroup);
            return ProcessingResult.skipped();
        }

        T result = handler.get();
        recordProcessed(ProcessedEvent.success(eventId, eventType, aggregateType, aggregateId, consumerGroup,
                clock.instant()));

        log.debug("Processed event {} by consumer group {}", eventId, consumerGroup);
        return ProcessingResult.success(result);
    }

    /**
     * Marks an event as handled without running anything, so a replay does not retry it.
     */
    @Transactional
    public void skipEvent(UUID eventId, String eventType, String aggregateType, String aggregateId,
                          String consumerGroup, String reason) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            return;
        }

        recordProcessed(ProcessedEvent.skipped(eventId, eventType, aggregateType, aggregateId, consumerGroup,
                clock.instant(), reason));

        log.debug("Skipped event {} by consumer group {}: {}", eventId, consumerGroup, reason);
    }

    public boolean isAlreadyProcessed(UUID eventId, String consumerGroup) {
        return repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup);
    }

    private void recordProcessed(ProcessedEvent event) {
        repository.save(ProcessedEventEntity.fromDomain(event));
    }

    public static class ProcessingResult<T> {
        private final T value;
        private final boolean processed;

        private ProcessingResult(T value, boolean processed) {
            this.value = value;
            this.processed = processed;
        }

        public static <T> ProcessingResult<T> success(T value) {
            return new ProcessingResult<>(value, true);
        }

        public static <T> ProcessingResult<T> skipped() {
            return new ProcessingResult<>(null, false);
        }

        public T getValue() {
            return value;
        }

        public boolean wasProcessed() {
            return processed;
        }

        public boolean wasSkipped() {
            return !processed;
        }
    }
}
