package com.flagship.finance_ledger.observability;

import com.flagship.finance_ledger.outbox.OutboxEventRepository;
import com.flagship.finance_ledger.periodlock.PeriodLockStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Actuator health indicators for the ledger service.
 */
public class HealthIndicators {

    /**
     * Unhealthy if too many events are waiting to be published.
     */
    @Component("outboxHealth")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxEventRepository outboxRepository;

        public OutboxHealthIndicator(OutboxEventRepository outboxRepository) {
            this.outboxRepository = outboxRepository;
        }

        @Override
        public Health health() {
            try {
                long backlogSize = outboxRepository.countUnpublished();

                Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                        ? Health.up()
                        : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                        ? Health.status("WARNING")
                        : Health.down();

                return builder
                        .withDetail("backlogSize", backlogSize)
                        .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                        .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * Amendment windows that have expired but are still waiting for the relock sweep.
     * A growing count means the sweep is not running.
     */
    @Component("amendmentWindowHealth")
    public static class AmendmentWindowHealthIndicator implements HealthIndicator {

        private static final long OVERDUE_WARNING_THRESHOLD = 10;

        private final PeriodLockStore periodLockStore;
        private final Clock clock;

        public AmendmentWindowHealthIndicator(PeriodLockStore periodLockStore, Clock clock) {
            this.periodLockStore = periodLockStore;
            this.clock = clock;
        }

        @Override
        public Health health() {
            try {
                long overdue = periodLockStore.countExpiredAmendments(clock.instant());

                Health.Builder builder = overdue < OVERDUE_WARNING_THRESHOLD
                        ? Health.up()
                        : Health.status("WARNING");

                return builder
                        .withDetail("overdueAmendmentWindows", overdue)
                        .withDetail("warningThreshold", OVERDUE_WARNING_THRESHOLD)
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage())
                        .build();
            }
        }
    }

    /**
     * Redis backs only the posting idempotency fast path, so an outage degrades rather than
     * fails the service.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final ObjectProvider<StringRedisTemplate> redisTemplate;

        public RedisHealthIndicator(ObjectProvider<StringRedisTemplate> redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            StringRedisTemplate template = redisTemplate.getIfAvailable();
            if (template == null || template.getConnectionFactory() == null) {
                return Health.status("DEGRADED")
                        .withDetail("error", "Redis not configured")
                        .withDetail("note", "Posting idempotency falls back to the database")
                        .build();
            }

            try (var connection = template.getConnectionFactory().getConnection()) {
                String result = connection.ping();

                if ("PONG".equals(result)) {
                    return Health.up()
                            .withDetail("response", result)
                            .build();
                }
                return Health.down()
                        .withDetail("response", result != null ? result : "null")
                        .build();

            } catch (Exception e) {
                return Health.status("DEGRADED")
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .withDetail("note", "Posting idempotency falls back to the database")
                        .build();
            }
        }
    }
}
