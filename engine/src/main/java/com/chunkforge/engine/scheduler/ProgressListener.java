package com.chunkforge.engine.scheduler;

/** Receives a progress snapshot after every round of a running pipeline. */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = progress -> {};

    void onProgress(PipelineProgress progress);
}
