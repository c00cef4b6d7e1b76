package com.chunkforge.engine.scheduler;

import com.chunkforge.engine.model.ChunkType;
import com.chunkforge.engine.model.PipelineStats;
import com.chunkforge.engine.model.PipelineStatus;

/**
 * Point-in-time view of a pipeline, emitted once per round and returned by
 * {@link PipelineScheduler#getProgress(String)}.
 *
 * @param currentTask the chunk in progress when the snapshot was taken, or null
 */
public record PipelineProgress(String pipelineId,
                               String name,
                               PipelineStatus status,
                               int totalChunks,
                               int completedChunks,
                               int failedChunks,
                               CurrentTask currentTask,
                               int progressPercent,
                               PipelineStats stats) {

    public record CurrentTask(String id, String title, ChunkType type) {}
}
