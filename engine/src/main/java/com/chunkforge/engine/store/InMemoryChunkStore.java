package com.chunkforge.engine.store;

import com.chunkforge.engine.model.Chunk;
import com.chunkforge.engine.model.ChunkDraft;
import com.chunkforge.engine.model.ChunkResult;
import com.chunkforge.engine.model.ChunkStatus;
import com.chunkforge.engine.model.Pipeline;
import com.chunkforge.engine.model.PipelineStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Reference {@link ChunkStore} kept entirely in process memory.
 *
 * All operations synchronize on the store, so the read-then-write sequences
 * of concurrent callers (run loop, lifecycle controls) never interleave.
 * State is lost when the process exits.
 */
public class InMemoryChunkStore implements ChunkStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryChunkStore.class);

    private static final Comparator<Chunk> PROJECT_ORDER = Comparator
            .comparingInt(Chunk::getPriority).reversed()
            .thenComparing(Chunk::getCreatedAt)
            .thenComparingLong(Chunk::getSequence);

    private final Map<String, Pipeline> pipelines = new LinkedHashMap<>();
    // pipelineId → (chunk id → chunk), in creation order
    private final Map<String, Map<String, Chunk>> chunksByPipeline = new HashMap<>();

    private final Clock clock;

    public InMemoryChunkStore(Clock clock) {
        this.clock = clock;
    }

    // ------------------------------------------------------------------
    // Pipelines
    // ------------------------------------------------------------------

    @Override
    public synchronized Pipeline savePipeline(Pipeline pipeline) {
        pipelines.put(pipeline.getId(), pipeline.copy());
        return pipeline.copy();
    }

    @Override
    public synchronized Pipeline createPipeline(Pipeline pipeline, List<ChunkDraft> drafts) {
        if (pipelines.containsKey(pipeline.getId())) {
            throw new IllegalArgumentException("Pipeline id already exists: " + pipeline.getId());
        }
        Set<String> ids = new HashSet<>();
        for (ChunkDraft draft : drafts) {
            if (draft.id() == null || !ids.add(draft.id())) {
                throw new IllegalArgumentException("Missing or duplicate chunk id: " + draft.id());
            }
        }
        // Validated up front, so nothing below can fail half way.
        savePipeline(pipeline);
        for (ChunkDraft draft : drafts) {
            createChunk(pipeline.getId(), pipeline.getProjectId(), draft);
        }
        return pipeline.copy();
    }

    @Override
    public synchronized Optional<Pipeline> findPipeline(String pipelineId) {
        return Optional.ofNullable(pipelines.get(pipelineId)).map(Pipeline::copy);
    }

    @Override
    public synchronized List<Pipeline> findProjectPipelines(String projectId) {
        return pipelines.values().stream()
                .filter(p -> p.getProjectId().equals(projectId))
                .sorted(Comparator.comparing(Pipeline::getCreatedAt))
                .map(Pipeline::copy)
                .toList();
    }

    @Override
    public synchronized boolean transitionPipeline(String pipelineId, PipelineStatus next,
                                                   Set<PipelineStatus> allowedFrom) {
        Pipeline pipeline = requirePipeline(pipelineId);
        if (!allowedFrom.contains(pipeline.getStatus())) {
            return false;
        }
        pipeline.transitionTo(next, clock.instant());
        return true;
    }

    @Override
    public synchronized void updatePipelineProgress(String pipelineId, int completedChunks,
                                                    int failedChunks, String currentChunkId) {
        requirePipeline(pipelineId).recordProgress(completedChunks, failedChunks, currentChunkId, clock.instant());
    }

    @Override
    public synchronized void addPipelineStats(String pipelineId, long tokensUsed,
                                              long filesGenerated, long linesGenerated) {
        requirePipeline(pipelineId).addStats(tokensUsed, filesGenerated, linesGenerated, clock.instant());
    }

    // ------------------------------------------------------------------
    // Chunks
    // ------------------------------------------------------------------

    @Override
    public synchronized Chunk createChunk(String pipelineId, String projectId, ChunkDraft draft) {
        Map<String, Chunk> owned = chunksByPipeline.computeIfAbsent(pipelineId, k -> new LinkedHashMap<>());
        if (owned.containsKey(draft.id())) {
            throw new IllegalArgumentException("Chunk id already exists in pipeline " + pipelineId + ": " + draft.id());
        }
        Chunk chunk = new Chunk(draft, pipelineId, projectId, owned.size(), clock.instant());
        owned.put(chunk.getId(), chunk);
        log.debug("Chunk created: pipeline={} id={} type={} title='{}'",
                pipelineId, chunk.getId(), chunk.getType(), chunk.getTitle());
        return chunk.copy();
    }

    @Override
    public synchronized Optional<Chunk> findChunk(String pipelineId, String chunkId) {
        return Optional.ofNullable(chunksByPipeline.getOrDefault(pipelineId, Map.of()).get(chunkId))
                .map(Chunk::copy);
    }

    @Override
    public synchronized List<Chunk> getPipelineChunks(String pipelineId) {
        return pipelineChunks(pipelineId).stream()
                .sorted(ReadyChunks.SELECTION_ORDER)
                .map(Chunk::copy)
                .toList();
    }

    @Override
    public synchronized List<Chunk> getProjectChunks(String projectId) {
        return chunksByPipeline.values().stream()
                .flatMap(owned -> owned.values().stream())
                .filter(c -> c.getProjectId().equals(projectId))
                .sorted(PROJECT_ORDER)
                .map(Chunk::copy)
                .toList();
    }

    @Override
    public synchronized List<Chunk> getParallelReadyChunks(String pipelineId, int limit) {
        return ReadyChunks.select(pipelineChunks(pipelineId), limit).stream()
                .map(Chunk::copy)
                .toList();
    }

    @Override
    public synchronized void updateChunkStatus(String pipelineId, String chunkId, ChunkStatus status, ChunkResult result) {
        requireChunk(pipelineId, chunkId).applyStatus(status, result, clock.instant());
    }

    @Override
    public synchronized void setChunkOutput(String pipelineId, String chunkId, String output, Integer actualTokens) {
        requireChunk(pipelineId, chunkId).setOutput(output, actualTokens);
    }

    @Override
    public synchronized int incrementRetry(String pipelineId, String chunkId) {
        return requireChunk(pipelineId, chunkId).incrementRetry();
    }

    @Override
    public synchronized int skipPendingChunks(String pipelineId) {
        int skipped = 0;
        for (Chunk chunk : pipelineChunks(pipelineId)) {
            if (chunk.getStatus() == ChunkStatus.PENDING) {
                chunk.applyStatus(ChunkStatus.SKIPPED, null, clock.instant());
                skipped++;
            }
        }
        return skipped;
    }

    // ------------------------------------------------------------------
    // Helpers (caller holds the monitor)
    // ------------------------------------------------------------------

    private List<Chunk> pipelineChunks(String pipelineId) {
        return List.copyOf(chunksByPipeline.getOrDefault(pipelineId, Map.of()).values());
    }

    private Pipeline requirePipeline(String pipelineId) {
        Pipeline pipeline = pipelines.get(pipelineId);
        if (pipeline == null) throw new PipelineNotFoundException(pipelineId);
        return pipeline;
    }

    private Chunk requireChunk(String pipelineId, String chunkId) {
        Chunk chunk = chunksByPipeline.getOrDefault(pipelineId, Map.of()).get(chunkId);
        if (chunk == null) throw new ChunkNotFoundException(pipelineId, chunkId);
        return chunk;
    }
}
