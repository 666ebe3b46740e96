package com.flagship.finance_ledger.journal;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Redis fast path for "has this source document been posted already".
 *
 * Best-effort only: the unique index on journal_entries is the source of truth. Redis being
 * absent or down turns every lookup into a miss and every store into a no-op.
 */
@Component
@Slf4j
public class PostingIdempotencyCache {

    private static final String KEY_PREFIX = "posting:";
    private static final Duration TTL = Duration.ofDays(7);

    private final Optional<RedisTemplate<String, String>> redisTemplate;

    public PostingIdempotencyCache(Optional<RedisTemplate<String, String>> redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    public Optional<UUID> lookup(String organizationId, SourceDocumentType sourceType, String sourceId) {
        if (redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        String key = key(organizationId, sourceType, sourceId);
        try {
            String entryId = redisTemplate.get().opsForValue().get(key);
            return Optional.ofNullable(entryId).map(UUID::fromString);
        } catch (RuntimeException e) {
            log.warn("Redis lookup failed for {}, falling back to database: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    public void store(String organizationId, SourceDocumentType sourceType, String sourceId, UUID entryId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        String key = key(organizationId, sourceType, sourceId);
        try {
            redisTemplate.get().opsForValue().set(key, entryId.toString(), TTL);
        } catch (RuntimeException e) {
            log.warn("Failed to cache posting key {}: {}", key, e.getMessage());
        }
    }

    static String key(String organizationId, SourceDocumentType sourceType, String sourceId) {
        return KEY_PREFIX + organizationId + ":" + sourceType.wireValue() + ":" + sourceId;
    }
}
