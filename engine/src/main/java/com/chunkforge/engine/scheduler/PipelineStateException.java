package com.chunkforge.engine.scheduler;

import com.chunkforge.engine.model.PipelineStatus;

/**
 * Thrown when a lifecycle control is not allowed from the pipeline's current
 * status (e.g. resuming a pipeline that is not paused).
 */
public class PipelineStateException extends RuntimeException {

    private final PipelineStatus current;
    private final PipelineStatus requested;

    public PipelineStateException(String pipelineId, PipelineStatus current, PipelineStatus requested) {
        super("Pipeline " + pipelineId + " cannot move from " + current + " to " + requested);
        this.current   = current;
        this.requested = requested;
    }

    public PipelineStatus getCurrent()   { return current; }
    public PipelineStatus getRequested() { return requested; }
}
