package com.chunkforge.engine.cache;

import com.chunkforge.engine.config.PromptCacheProperties;
import com.chunkforge.engine.util.ContentHash;
import com.chunkforge.engine.util.TokenEstimator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * In-process cache of conversation contexts already sent to the generation
 * backend, keyed by project, model, system prompt and message sequence.
 *
 * <p>A lookup first tries the exact key. Failing that, it looks for the cached
 * conversation of the same project, model and system prompt that shares the
 * longest leading run of messages with the new one; the shared prefix counts
 * as reusable when it covers at least {@code minReuseThreshold} of that entry.
 *
 * <p>Storage is an access-ordered {@link LinkedHashMap} (O(1) touch, least
 * recently used first) capped by {@code hardLimit}, plus a per-project index
 * and a running token total. Under capacity pressure the lowest-scoring 20% of
 * entries are evicted (see {@link CacheEntry#evictionScore}).
 *
 * <p>All public methods are synchronized. Lookup problems never reach the
 * caller: they degrade to a miss.
 *
 * <p>Lifecycle: the expiry sweep starts with the first stored context;
 * {@link #shutdown()} cancels it and clears every map.
 */
public class PromptCache {

    private static final Logger log = LoggerFactory.getLogger(PromptCache.class);

    private static final double EVICTION_FRACTION      = 0.2;
    private static final int    SYSTEM_PROMPT_SNAPSHOT = 1000;

    /** What cacheData holds: enough to compare message prefixes later. */
    record CachedContext(List<String> messages, String systemPrompt) {}

    private final ObjectMapper  json;
    private final MeterRegistry meterRegistry;
    private final Clock         clock;

    private PromptCacheProperties config;

    private final LinkedHashMap<String, CacheEntry> entries;
    // projectId → (cache key → entry); mirrors entries without touching access order
    private final Map<String, Map<String, CacheEntry>> projectIndex = new HashMap<>();
    private long totalTokens;

    private long hits;
    private long misses;
    private long totalTimeSavedMs;

    private ScheduledExecutorService sweeper;

    public PromptCache(PromptCacheProperties config, ObjectMapper json,
                       MeterRegistry meterRegistry, Clock clock) {
        this.config        = config;
        this.json          = json;
        this.meterRegistry = meterRegistry;
        this.clock         = clock;
        this.entries = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, CacheEntry> eldest) {
                if (size() > PromptCache.this.config.hardLimit()) {
                    unindex(eldest.getValue());
                    return true;
                }
                return false;
            }
        };
        meterRegistry.gauge("chunkforge.cache.entries", this, PromptCache::size);
        meterRegistry.gauge("chunkforge.cache.tokens", this, PromptCache::totalTokens);
    }

    // ------------------------------------------------------------------
    // Configuration
    // ------------------------------------------------------------------

    public synchronized void configure(PromptCacheProperties newConfig) {
        this.config = newConfig;
        log.info("Prompt cache configured: {}", newConfig);
    }

    public synchronized boolean isEnabled() {
        return config.enabled();
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    /**
     * Find reusable context for a conversation about to be sent.
     * Never throws: any failure is logged and reported as a miss.
     */
    public synchronized CacheHit findCacheHit(String projectId, String systemPrompt,
                                              List<ChatMessage> messages, String modelName) {
        if (!config.enabled()) {
            return recordMiss();
        }
        try {
            Instant now = clock.instant();
            String systemPromptHash = ContentHash.of(systemPrompt);
            String key = cacheKey(projectId, modelName, systemPromptHash, contextHash(messages));

            CacheEntry exact = entries.get(key);
            if (exact != null && !exact.isExpired(now, config.ttl())) {
                CacheEntry refreshed = exact.recordHit(now);
                put(refreshed);
                long saved = estimateTimeSaved(refreshed.tokenCount());
                recordHit("exact", saved);
                log.debug("Prompt cache hit (exact): project={} tokens={} savedMs={}",
                        projectId, refreshed.tokenCount(), saved);
                return new CacheHit(true, refreshed, refreshed.tokenCount(), saved, false);
            }

            Optional<CacheHit> prefix = findPrefixMatch(projectId, systemPromptHash, messages, modelName, now);
            if (prefix.isPresent()) {
                recordHit("prefix", prefix.get().timeSavedMs());
                log.debug("Prompt cache hit (prefix): project={} reusableTokens={} savedMs={}",
                        projectId, prefix.get().reusableTokens(), prefix.get().timeSavedMs());
                return prefix.get();
            }
        } catch (RuntimeException e) {
            log.warn("Prompt cache lookup failed for project {}; treating as miss: {}",
                    projectId, e.getMessage(), e);
        }
        return recordMiss();
    }

    private Optional<CacheHit> findPrefixMatch(String projectId, String systemPromptHash,
                                               List<ChatMessage> messages, String modelName, Instant now) {
        Map<String, CacheEntry> candidates = projectIndex.get(projectId);
        if (candidates == null) return Optional.empty();

        List<String> signatures = signatures(messages);
        CacheEntry best = null;
        int bestOverlap = 0;

        for (CacheEntry entry : candidates.values()) {
            if (!entry.systemPromptHash().equals(systemPromptHash)) continue;
            if (!entry.modelName().equals(modelName)) continue;
            if (entry.isExpired(now, config.ttl())) continue;

            int overlap = prefixOverlap(entry, signatures, messages);
            if (overlap > bestOverlap && overlap >= config.minReuseThreshold() * entry.tokenCount()) {
                best = entry;
                bestOverlap = overlap;
            }
        }
        if (best == null) return Optional.empty();

        CacheEntry refreshed = best.recordHit(now);
        put(refreshed);
        return Optional.of(new CacheHit(true, refreshed, bestOverlap, estimateTimeSaved(bestOverlap), true));
    }

    /**
     * Token estimate of the leading messages that match the cached conversation,
     * compared position by position up to the first mismatch.
     */
    private int prefixOverlap(CacheEntry entry, List<String> signatures, List<ChatMessage> messages) {
        CachedContext cached;
        try {
            cached = json.readValue(entry.cacheData(), CachedContext.class);
        } catch (JsonProcessingException e) {
            log.debug("Unreadable cache data for entry {}: {}", entry.id(), e.getMessage());
            return 0;
        }
        List<String> cachedSignatures = cached.messages() == null ? List.of() : cached.messages();

        int overlap = 0;
        int limit = Math.min(cachedSignatures.size(), signatures.size());
        for (int i = 0; i < limit; i++) {
            if (!cachedSignatures.get(i).equals(signatures.get(i))) break;
            overlap += TokenEstimator.estimate(messages.get(i).content());
        }
        return overlap;
    }

    // ------------------------------------------------------------------
    // Storage
    // ------------------------------------------------------------------

    /**
     * Cache a conversation context after it was sent.
     *
     * @return the cache key, or an empty string when the cache is disabled or
     *         the context exceeds {@code maxTokensPerEntry}
     */
    public synchronized String storeContext(String projectId, String systemPrompt,
                                            List<ChatMessage> messages, String modelName, String taskType) {
        if (!config.enabled()) return "";
        ensureSweeper();

        int tokenCount = TokenEstimator.estimate(systemPrompt)
                + messages.stream().mapToInt(m -> TokenEstimator.estimate(m.content())).sum();
        if (tokenCount > config.maxTokensPerEntry()) {
            log.warn("Context too large for prompt cache: project={} tokens={} max={}",
                    projectId, tokenCount, config.maxTokensPerEntry());
            return "";
        }

        String systemPromptHash = ContentHash.of(systemPrompt);
        String contextHash = contextHash(messages);
        String key = cacheKey(projectId, modelName, systemPromptHash, contextHash);

        // Re-storing a known context replaces it.
        CacheEntry previous = entries.remove(key);
        if (previous != null) unindex(previous);

        Instant now = clock.instant();
        enforceCapacity(tokenCount, now);

        CacheEntry entry = new CacheEntry(key, projectId, contextHash, systemPromptHash,
                serialize(systemPrompt, messages), tokenCount, now, now, 0, modelName, taskType);
        put(entry);

        log.debug("Context cached: project={} tokens={} key={}", projectId, tokenCount, key);
        return key;
    }

    /**
     * Make room before an insert. When the entry count or token total has
     * reached its limit, drop the lowest-scoring 20% (at least one). Then keep
     * dropping the lowest-scoring entry while the incoming tokens would push the
     * total over the ceiling.
     */
    private void enforceCapacity(int incomingTokens, Instant now) {
        int evicted = 0;
        if (entries.size() >= config.maxEntries() || totalTokens >= config.maxTotalTokens()) {
            int toRemove = Math.max(1, (int) Math.floor(entries.size() * EVICTION_FRACTION));
            for (CacheEntry victim : lowestScoring(toRemove, now)) {
                removeEntry(victim.id());
                evicted++;
            }
        }
        while (!entries.isEmpty() && totalTokens + incomingTokens > config.maxTotalTokens()) {
            removeEntry(lowestScoring(1, now).get(0).id());
            evicted++;
        }
        if (evicted > 0) {
            meterRegistry.counter("chunkforge.cache.evictions").increment(evicted);
            log.info("Prompt cache eviction: removed={} remaining={} tokens={}",
                    evicted, entries.size(), totalTokens);
        }
    }

    // Stable sort over access order: equal scores evict the least recently used first.
    private List<CacheEntry> lowestScoring(int count, Instant now) {
        return entries.values().stream()
                .sorted(Comparator.comparingDouble(e -> e.evictionScore(now)))
                .limit(count)
                .toList();
    }

    // ------------------------------------------------------------------
    // Invalidation
    // ------------------------------------------------------------------

    /** Drop every entry of a project; returns how many were removed. */
    public synchronized int invalidateProject(String projectId) {
        Map<String, CacheEntry> projectEntries = projectIndex.get(projectId);
        if (projectEntries == null) return 0;

        int removed = 0;
        for (String key : new ArrayList<>(projectEntries.keySet())) {
            if (removeEntry(key)) removed++;
        }
        projectIndex.remove(projectId);
        log.info("Prompt cache invalidated for project {}: {} entries removed", projectId, removed);
        return removed;
    }

    public synchronized boolean invalidateEntry(String cacheKey) {
        return removeEntry(cacheKey);
    }

    /** Purge every entry older than the TTL; returns how many were removed. */
    public synchronized int sweepExpired() {
        Instant now = clock.instant();
        List<String> expired = entries.values().stream()
                .filter(e -> e.isExpired(now, config.ttl()))
                .map(CacheEntry::id)
                .toList();
        expired.forEach(this::removeEntry);
        if (!expired.isEmpty()) {
            log.info("Expired prompt cache entries removed: {}", expired.size());
        }
        return expired.size();
    }

    // ------------------------------------------------------------------
    // Introspection
    // ------------------------------------------------------------------

    public synchronized CacheStats getStats() {
        long memoryBytes = entries.values().stream()
                .mapToLong(e -> e.cacheData().length() * 2L)
                .sum();
        long requests = hits + misses;
        double hitRate = requests > 0 ? (double) hits / requests : 0.0;
        long avgSaved = hits > 0 ? Math.round((double) totalTimeSavedMs / hits) : 0;
        double memoryMb = Math.round(memoryBytes / (1024.0 * 1024.0) * 100) / 100.0;
        return new CacheStats(entries.size(), totalTokens, hitRate, hits, misses, avgSaved, memoryMb);
    }

    public synchronized List<CacheEntry> getProjectEntries(String projectId) {
        Map<String, CacheEntry> projectEntries = projectIndex.get(projectId);
        return projectEntries == null ? List.of() : List.copyOf(projectEntries.values());
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized long totalTokens() {
        return totalTokens;
    }

    public synchronized void clearAll() {
        entries.clear();
        projectIndex.clear();
        totalTokens = 0;
        resetStats();
        log.info("Prompt cache cleared");
    }

    public synchronized void resetStats() {
        hits = 0;
        misses = 0;
        totalTimeSavedMs = 0;
    }

    /** Cancel the expiry sweep and drop all state. */
    public synchronized void shutdown() {
        if (sweeper != null) {
            sweeper.shutdownNow();
            sweeper = null;
        }
        clearAll();
        log.info("Prompt cache shut down");
    }

    // ------------------------------------------------------------------
    // Helpers (caller holds the monitor)
    // ------------------------------------------------------------------

    private void ensureSweeper() {
        if (sweeper != null) return;
        sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "prompt-cache-sweeper");
            t.setDaemon(true);
            return t;
        });
        long periodMs = config.sweepInterval().toMillis();
        sweeper.scheduleAtFixedRate(this::sweepQuietly, periodMs, periodMs, TimeUnit.MILLISECONDS);
        log.debug("Prompt cache sweep scheduled every {} ms", periodMs);
    }

    // A scheduled task that throws is silently cancelled, so log instead.
    private void sweepQuietly() {
        try {
            sweepExpired();
        } catch (RuntimeException e) {
            log.warn("Prompt cache sweep failed: {}", e.getMessage(), e);
        }
    }

    private void put(CacheEntry entry) {
        CacheEntry previous = entries.put(entry.id(), entry);
        if (previous != null) {
            totalTokens -= previous.tokenCount();
        }
        totalTokens += entry.tokenCount();
        projectIndex.computeIfAbsent(entry.projectId(), k -> new LinkedHashMap<>()).put(entry.id(), entry);
    }

    private boolean removeEntry(String key) {
        CacheEntry removed = entries.remove(key);
        if (removed == null) return false;
        unindex(removed);
        return true;
    }

    private void unindex(CacheEntry entry) {
        totalTokens -= entry.tokenCount();
        Map<String, CacheEntry> projectEntries = projectIndex.get(entry.projectId());
        if (projectEntries != null) {
            projectEntries.remove(entry.id());
            if (projectEntries.isEmpty()) projectIndex.remove(entry.projectId());
        }
    }

    private CacheHit recordMiss() {
        misses++;
        meterRegistry.counter("chunkforge.cache.lookups", "result", "miss").increment();
        return CacheHit.miss();
    }

    private void recordHit(String kind, long timeSavedMs) {
        hits++;
        totalTimeSavedMs += timeSavedMs;
        meterRegistry.counter("chunkforge.cache.lookups", "result", kind).increment();
    }

    private long estimateTimeSaved(int tokens) {
        return (long) Math.floor(tokens / config.assumedTokensPerSecond() * 1000);
    }

    private String serialize(String systemPrompt, List<ChatMessage> messages) {
        String prompt = systemPrompt == null ? "" : systemPrompt;
        CachedContext context = new CachedContext(
                signatures(messages),
                prompt.length() > SYSTEM_PROMPT_SNAPSHOT ? prompt.substring(0, SYSTEM_PROMPT_SNAPSHOT) : prompt);
        try {
            return json.writeValueAsString(context);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize cached context", e);
        }
    }

    private static List<String> signatures(List<ChatMessage> messages) {
        return messages.stream()
                .map(m -> m.role() + ":" + ContentHash.of(m.content()))
                .toList();
    }

    private static String contextHash(List<ChatMessage> messages) {
        StringBuilder sb = new StringBuilder();
        for (ChatMessage m : messages) {
            sb.append(m.role()).append('\u0000').append(m.content()).append('\u0001');
        }
        return ContentHash.of(sb.toString());
    }

    private static String cacheKey(String projectId, String modelName, String systemPromptHash, String contextHash) {
        return projectId + ":" + modelName + ":" + systemPromptHash + ":" + contextHash;
    }
}
