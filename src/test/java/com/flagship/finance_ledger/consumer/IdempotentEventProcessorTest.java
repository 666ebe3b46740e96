package com.flagship.finance_ledger.consumer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exactly-once handling of finance document events per consumer group.
 */
@SpringBootTest
@Testcontainers
class IdempotentEventProcessorTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("finance_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("ledger.period-lock.auto-relock.enabled", () -> "false");
    }

    @Autowired
    private IdempotentEventProcessor eventProcessor;

    @Autowired
    private ProcessedEventRepository repository;

    private static final String CONSUMER_GROUP = "test-consumer";
    private static final String EVENT_TYPE = "InvoiceCreated";
    private static final String AGGREGATE_TYPE = "invoice";

    @BeforeEach
    void setUp() {
        repository.deleteAll();
    }

    @Test
    @DisplayName("First delivery runs the handler and records success")
    void firstDeliveryRunsHandler() {
        UUID eventId = UUID.randomUUID();
        AtomicInteger calls = new AtomicInteger();

        IdempotentEventProcessor.ProcessingResult<String> result = eventProcessor.processEvent(
                eventId, EVENT_TYPE, AGGREGATE_TYPE, "INV-1", CONSUMER_GROUP,
                () -> {
                    calls.incrementAndGet();
                    return "posted";
                });

        assertTrue(result.wasProcessed());
        assertEquals("posted", result.getValue());
        assertEquals(1, calls.get());

        ProcessedEventEntity stored = repository.findById(eventId).orElseThrow();
        assertEquals(ProcessedEvent.ProcessingResult.SUCCESS, stored.getProcessingResult());
        assertEquals("INV-1", stored.getAggregateId());
    }

    @Test
    @DisplayName("Redelivery is skipped without running the handler")
    void redeliveryIsSkipped() {
        UUID eventId = UUID.randomUUID();
        AtomicInteger calls = new AtomicInteger();

        eventProcessor.processEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE, "INV-2", CONSUMER_GROUP,
                calls::incrementAndGet);
        IdempotentEventProcessor.ProcessingResult<Integer> second = eventProcessor.processEvent(
                eventId, EVENT_TYPE, AGGREGATE_TYPE, "INV-2", CONSUMER_GROUP, calls::incrementAndGet);

        assertTrue(second.wasSkipped());
        assertNull(second.getValue());
        assertEquals(1, calls.get());
        assertEquals(1, repository.count());
    }

    @Test
    @DisplayName("A handler that throws leaves no record, so the event is retried")
    void failedHandlerIsNotRecorded() {
        UUID eventId = UUID.randomUUID();

        assertThrows(IllegalStateException.class, () -> eventProcessor.processEvent(
                eventId, EVENT_TYPE, AGGREGATE_TYPE, "INV-3", CONSUMER_GROUP,
                () -> {
                    throw new IllegalStateException("ledger unavailable");
                }));

        assertFalse(eventProcessor.isAlreadyProcessed(eventId, CONSUMER_GROUP));

        IdempotentEventProcessor.ProcessingResult<String> retry = eventProcessor.processEvent(
                eventId, EVENT_TYPE, AGGREGATE_TYPE, "INV-3", CONSUMER_GROUP, () -> "posted");
        assertTrue(retry.wasProcessed());
    }

    @Test
    @DisplayName("Skipped events are recorded with their reason and never handled later")
    void skipEventRecordsReason() {
        UUID eventId = UUID.randomUUID();

        eventProcessor.skipEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE, "INV-4", CONSUMER_GROUP,
                "Period 2025-06 is locked");
        eventProcessor.skipEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE, "INV-4", CONSUMER_GROUP, "again");

        ProcessedEventEntity stored = repository.findById(eventId).orElseThrow();
        assertEquals(ProcessedEvent.ProcessingResult.SKIPPED, stored.getProcessingResult());
        assertEquals("Period 2025-06 is locked", stored.getErrorMessage());

        IdempotentEventProcessor.ProcessingResult<String> later = eventProcessor.processEvent(
                eventId, EVENT_TYPE, AGGREGATE_TYPE, "INV-4", CONSUMER_GROUP, () -> "posted");
        assertTrue(later.wasSkipped());
    }

    @Test
    @DisplayName("Concurrent deliveries of the same event leave a single record")
    void concurrentDeliveries() throws Exception {
        UUID eventId = UUID.randomUUID();
        int threads = 5;
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        ExecutorService executor = Executors.newFixedThreadPool(threads);

        try {
            for (int i = 0; i < threads; i++) {
                executor.submit(() -> {
                    try {
                        start.await();
                        eventProcessor.processEvent(eventId, EVENT_TYPE, AGGREGATE_TYPE, "INV-5", CONSUMER_GROUP,
                                () -> {
                                    calls.incrementAndGet();
                                    return "posted";
                                });
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } catch (RuntimeException e) {
                        // losers of the primary key race fail at commit
                    } finally {
                        done.countDown();
                    }
                });
            }
            start.countDown();
            assertTrue(done.await(30, TimeUnit.SECONDS));
        } finally {
            executor.shutdown();
        }

        assertTrue(eventProcessor.isAlreadyProcessed(eventId, CONSUMER_GROUP));
        assertEquals(1, repository.count());
        assertTrue(calls.get() >= 1);
    }
}
