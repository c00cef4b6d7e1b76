package com.chunkforge.engine.scheduler;

/**
 * Result of {@link PipelineScheduler#executeNextChunk}: whether a chunk ran,
 * which one, and whether that attempt succeeded.
 */
public record ChunkStepResult(boolean executed, String chunkId, boolean success) {

    public static ChunkStepResult notExecuted() {
        return new ChunkStepResult(false, null, false);
    }
}
