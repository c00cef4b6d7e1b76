package com.chunkforge.engine.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * One cached conversation context. Immutable: a hit replaces the entry with
 * a copy carrying the new hit count and last-use time.
 *
 * @param id        the cache key
 * @param cacheData JSON of the per-message signatures and the truncated system prompt
 */
public record CacheEntry(String id,
                         String projectId,
                         String contextHash,
                         String systemPromptHash,
                         String cacheData,
                         int tokenCount,
                         Instant createdAt,
                         Instant lastUsedAt,
                         long hitCount,
                         String modelName,
                         String taskType) {

    CacheEntry recordHit(Instant now) {
        return new CacheEntry(id, projectId, contextHash, systemPromptHash, cacheData, tokenCount,
                createdAt, now, hitCount + 1, modelName, taskType);
    }

    boolean isExpired(Instant now, Duration ttl) {
        return Duration.between(createdAt, now).compareTo(ttl) >= 0;
    }

    /**
     * Eviction score: frequent and recent use raise it, age and size lower it.
     * The lowest-scoring entries are evicted first.
     */
    double evictionScore(Instant now) {
        double age     = Duration.between(createdAt, now).toMillis();
        double recency = Duration.between(lastUsedAt, now).toMillis();
        return (hitCount * 1000.0) / (recency + 1) - (age / 60_000.0) - (tokenCount / 1000.0);
    }
}
