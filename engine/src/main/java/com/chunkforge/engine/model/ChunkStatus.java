package com.chunkforge.engine.model;

/**
 * Execution state of a single Chunk.
 *
 * Transitions:
 *   PENDING     → IN_PROGRESS (selected for a round, all dependencies COMPLETED)
 *   IN_PROGRESS → COMPLETED   (executor reported success)
 *   IN_PROGRESS → PENDING     (failed, retry budget left)
 *   IN_PROGRESS → FAILED      (failed, retries exhausted or auto-retry off)
 *   PENDING     → SKIPPED     (pipeline cancelled)
 */
public enum ChunkStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED,
    SKIPPED
}
