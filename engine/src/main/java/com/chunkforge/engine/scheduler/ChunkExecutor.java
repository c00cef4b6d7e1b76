package com.chunkforge.engine.scheduler;

import com.chunkforge.engine.model.Chunk;

/**
 * Performs the generation work of one chunk.
 *
 * Implementations must be safe to call again for the same chunk: the scheduler
 * re-invokes a failed chunk while its retry budget lasts. Per-call timeouts are
 * the implementation's own responsibility. Any exception thrown is treated as a
 * failed outcome carrying the exception message.
 */
@FunctionalInterface
public interface ChunkExecutor {

    ExecutionOutcome execute(Chunk chunk) throws Exception;
}
