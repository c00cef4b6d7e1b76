package com.chunkforge.engine.model;

/** Aggregate output of a pipeline, accumulated from successful chunks. */
public record PipelineStats(long totalTokensUsed,
                            long totalFilesGenerated,
                            long totalLinesGenerated,
                            Long durationMs) {

    public static final PipelineStats EMPTY = new PipelineStats(0, 0, 0, null);
}
