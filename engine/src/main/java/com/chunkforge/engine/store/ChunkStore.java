package com.chunkforge.engine.store;

import com.chunkforge.engine.model.Chunk;
import com.chunkforge.engine.model.ChunkDraft;
import com.chunkforge.engine.model.ChunkResult;
import com.chunkforge.engine.model.ChunkStatus;
import com.chunkforge.engine.model.Pipeline;
import com.chunkforge.engine.model.PipelineStatus;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Durable record of pipelines, their chunks and chunk status.
 *
 * <p>Every method is atomic with respect to the others. Returned entities are
 * detached copies: mutating them has no effect on the store.
 *
 * <p>Ready-chunk ordering: pending chunks are considered by priority
 * (highest first), then by creation order within the pipeline.
 */
public interface ChunkStore {

    // ------------------------------------------------------------------
    // Pipelines
    // ------------------------------------------------------------------

    Pipeline savePipeline(Pipeline pipeline);

    /**
     * Persist a pipeline together with all of its chunks, atomically: on any
     * failure neither the pipeline nor any of its chunks is stored. Every draft
     * must carry an id.
     *
     * @throws IllegalArgumentException if two drafts share an id or the pipeline id is taken
     */
    Pipeline createPipeline(Pipeline pipeline, List<ChunkDraft> drafts);

    Optional<Pipeline> findPipeline(String pipelineId);

    /** All pipelines of a project, oldest first. */
    List<Pipeline> findProjectPipelines(String projectId);

    /**
     * Compare-and-set the pipeline status.
     *
     * @return true if the pipeline was in one of {@code allowedFrom} and is now {@code next}
     * @throws PipelineNotFoundException if no such pipeline exists
     */
    boolean transitionPipeline(String pipelineId, PipelineStatus next, Set<PipelineStatus> allowedFrom);

    void updatePipelineProgress(String pipelineId, int completedChunks, int failedChunks, String currentChunkId);

    void addPipelineStats(String pipelineId, long tokensUsed, long filesGenerated, long linesGenerated);

    // ------------------------------------------------------------------
    // Chunks
    // ------------------------------------------------------------------

    /**
     * Persist a chunk for a pipeline. The draft must carry an id.
     *
     * @throws IllegalArgumentException if the pipeline already has a chunk with that id
     */
    Chunk createChunk(String pipelineId, String projectId, ChunkDraft draft);

    Optional<Chunk> findChunk(String pipelineId, String chunkId);

    /** All chunks of a pipeline in ready-selection order. */
    List<Chunk> getPipelineChunks(String pipelineId);

    /** All chunks of a project across its pipelines: priority descending, then oldest first. */
    List<Chunk> getProjectChunks(String projectId);

    /** Single-chunk mode: the first ready chunk, if any. */
    default Optional<Chunk> getNextPendingChunk(String pipelineId) {
        return getParallelReadyChunks(pipelineId, 1).stream().findFirst();
    }

    /**
     * Up to {@code limit} PENDING chunks whose dependencies are all COMPLETED
     * chunks of the same pipeline.
     */
    List<Chunk> getParallelReadyChunks(String pipelineId, int limit);

    /**
     * @param result files and errors to record; only applied for COMPLETED and FAILED. May be null.
     * @throws ChunkNotFoundException if no such chunk exists
     */
    void updateChunkStatus(String pipelineId, String chunkId, ChunkStatus status, ChunkResult result);

    void setChunkOutput(String pipelineId, String chunkId, String output, Integer actualTokens);

    /** @return the new retry count */
    int incrementRetry(String pipelineId, String chunkId);

    /** Force every PENDING chunk of the pipeline to SKIPPED; returns how many changed. */
    int skipPendingChunks(String pipelineId);
}
