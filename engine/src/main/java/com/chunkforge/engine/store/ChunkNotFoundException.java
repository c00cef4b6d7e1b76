package com.chunkforge.engine.store;

/** Thrown when an operation names a chunk the pipeline does not have. */
public class ChunkNotFoundException extends RuntimeException {

    public ChunkNotFoundException(String pipelineId, String chunkId) {
        super("Chunk not found: " + chunkId + " in pipeline " + pipelineId);
    }
}
