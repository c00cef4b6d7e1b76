package com.chunkforge.engine.scheduler;

/**
 * Thrown by {@link PipelineScheduler#createPipeline} when the submitted chunks
 * do not form a valid graph (duplicate ids or a dependency cycle).
 */
public class InvalidChunkGraphException extends RuntimeException {

    public InvalidChunkGraphException(String message) {
        super(message);
    }
}
