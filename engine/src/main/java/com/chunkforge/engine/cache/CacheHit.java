package com.chunkforge.engine.cache;

/**
 * Result of a cache lookup.
 *
 * @param entry          the matched entry (after recording the hit), null on a miss
 * @param reusableTokens tokens of context the backend does not need to process again
 * @param timeSavedMs    estimated generation time saved
 * @param prefixMatch    true when the hit came from a shared message prefix rather than the exact key
 */
public record CacheHit(boolean hit, CacheEntry entry, int reusableTokens, long timeSavedMs, boolean prefixMatch) {

    private static final CacheHit MISS = new CacheHit(false, null, 0, 0, false);

    public static CacheHit miss() {
        return MISS;
    }
}
