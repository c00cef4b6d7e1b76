package com.chunkforge.engine.store;

/** Thrown when an operation names a pipeline id the store does not know. */
public class PipelineNotFoundException extends RuntimeException {

    private final String pipelineId;

    public PipelineNotFoundException(String pipelineId) {
        super("Pipeline not found: " + pipelineId);
        this.pipelineId = pipelineId;
    }

    public String getPipelineId() { return pipelineId; }
}
