package com.chunkforge.engine.cache;

/** Snapshot of cache occupancy and effectiveness since the last reset. */
public record CacheStats(int totalEntries,
                         long totalTokensCached,
                         double hitRate,
                         long totalHits,
                         long totalMisses,
                         long avgTimeSavedMs,
                         double memoryUsageMb) {
}
