package com.chunkforge.engine.store;

import com.chunkforge.engine.model.Chunk;
import com.chunkforge.engine.model.ChunkDraft;
import com.chunkforge.engine.model.ChunkKey;
import com.chunkforge.engine.model.ChunkResult;
import com.chunkforge.engine.model.ChunkStatus;
import com.chunkforge.engine.model.Pipeline;
import com.chunkforge.engine.model.PipelineStatus;
import com.chunkforge.engine.repository.ChunkRepository;
import com.chunkforge.engine.repository.PipelineRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * {@link ChunkStore} backed by the pipelines and chunks tables.
 *
 * Every public method is @Transactional, so each operation is one atomic
 * read-modify-write. Status compare-and-set takes a row lock on the pipeline.
 */
public class JpaChunkStore implements ChunkStore {

    private static final Logger log = LoggerFactory.getLogger(JpaChunkStore.class);

    private final PipelineRepository pipelineRepo;
    private final ChunkRepository    chunkRepo;
    private final Clock              clock;

    public JpaChunkStore(PipelineRepository pipelineRepo, ChunkRepository chunkRepo, Clock clock) {
        this.pipelineRepo = pipelineRepo;
        this.chunkRepo    = chunkRepo;
        this.clock        = clock;
    }

    // ------------------------------------------------------------------
    // Pipelines
    // ------------------------------------------------------------------

    @Override
    @Transactional
    public Pipeline savePipeline(Pipeline pipeline) {
        return pipelineRepo.save(pipeline).copy();
    }

    /** One transaction: a rejected draft rolls back the pipeline row too. */
    @Override
    @Transactional
    public Pipeline createPipeline(Pipeline pipeline, List<ChunkDraft> drafts) {
        if (pipelineRepo.existsById(pipeline.getId())) {
            throw new IllegalArgumentException("Pipeline id already exists: " + pipeline.getId());
        }
        Set<String> ids = new HashSet<>();
        for (ChunkDraft draft : drafts) {
            if (draft.id() == null || !ids.add(draft.id())) {
                throw new IllegalArgumentException("Missing or duplicate chunk id: " + draft.id());
            }
        }
        Pipeline saved = pipelineRepo.save(pipeline);
        long sequence = 0;
        for (ChunkDraft draft : drafts) {
            chunkRepo.save(new Chunk(draft, pipeline.getId(), pipeline.getProjectId(), sequence++, clock.instant()));
        }
        return saved.copy();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Pipeline> findPipeline(String pipelineId) {
        return pipelineRepo.findById(pipelineId).map(Pipeline::copy);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Pipeline> findProjectPipelines(String projectId) {
        return pipelineRepo.findByProjectIdOrderByCreatedAtAsc(projectId).stream()
                .map(Pipeline::copy)
                .toList();
    }

    @Override
    @Transactional
    public boolean transitionPipeline(String pipelineId, PipelineStatus next, Set<PipelineStatus> allowedFrom) {
        Pipeline pipeline = pipelineRepo.findForUpdate(pipelineId)
                .orElseThrow(() -> new PipelineNotFoundException(pipelineId));
        if (!allowedFrom.contains(pipeline.getStatus())) {
            return false;
        }
        pipeline.transitionTo(next, clock.instant());
        pipelineRepo.save(pipeline);
        return true;
    }

    @Override
    @Transactional
    public void updatePipelineProgress(String pipelineId, int completedChunks, int failedChunks, String currentChunkId) {
        Pipeline pipeline = requirePipeline(pipelineId);
        pipeline.recordProgress(completedChunks, failedChunks, currentChunkId, clock.instant());
        pipelineRepo.save(pipeline);
    }

    @Override
    @Transactional
    public void addPipelineStats(String pipelineId, long tokensUsed, long filesGenerated, long linesGenerated) {
        Pipeline pipeline = requirePipeline(pipelineId);
        pipeline.addStats(tokensUsed, filesGenerated, linesGenerated, clock.instant());
        pipelineRepo.save(pipeline);
    }

    // ------------------------------------------------------------------
    // Chunks
    // ------------------------------------------------------------------

    @Override
    @Transactional
    public Chunk createChunk(String pipelineId, String projectId, ChunkDraft draft) {
        if (chunkRepo.existsById(new ChunkKey(pipelineId, draft.id()))) {
            throw new IllegalArgumentException("Chunk id already exists in pipeline " + pipelineId + ": " + draft.id());
        }
        long sequence = chunkRepo.countByPipelineId(pipelineId);
        Chunk chunk = chunkRepo.save(new Chunk(draft, pipelineId, projectId, sequence, clock.instant()));
        log.debug("Chunk created: id={} type={} title='{}'", chunk.getId(), chunk.getType(), chunk.getTitle());
        return chunk.copy();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Chunk> findChunk(String pipelineId, String chunkId) {
        return chunkRepo.findById(new ChunkKey(pipelineId, chunkId)).map(Chunk::copy);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Chunk> getPipelineChunks(String pipelineId) {
        return chunkRepo.findByPipelineIdOrderByPriorityDescSequenceAsc(pipelineId).stream()
                .map(Chunk::copy)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Chunk> getProjectChunks(String projectId) {
        return chunkRepo.findByProjectIdOrderByPriorityDescCreatedAtAscSequenceAsc(projectId).stream()
                .map(Chunk::copy)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Chunk> getParallelReadyChunks(String pipelineId, int limit) {
        List<Chunk> all = chunkRepo.findByPipelineIdOrderByPriorityDescSequenceAsc(pipelineId);
        return ReadyChunks.select(all, limit).stream()
                .map(Chunk::copy)
                .toList();
    }

    @Override
    @Transactional
    public void updateChunkStatus(String pipelineId, String chunkId, ChunkStatus status, ChunkResult result) {
        Chunk chunk = requireChunk(pipelineId, chunkId);
        chunk.applyStatus(status, result, clock.instant());
        chunkRepo.save(chunk);
    }

    @Override
    @Transactional
    public void setChunkOutput(String pipelineId, String chunkId, String output, Integer actualTokens) {
        Chunk chunk = requireChunk(pipelineId, chunkId);
        chunk.setOutput(output, actualTokens);
        chunkRepo.save(chunk);
    }

    @Override
    @Transactional
    public int incrementRetry(String pipelineId, String chunkId) {
        Chunk chunk = requireChunk(pipelineId, chunkId);
        int retries = chunk.incrementRetry();
        chunkRepo.save(chunk);
        return retries;
    }

    @Override
    @Transactional
    public int skipPendingChunks(String pipelineId) {
        List<Chunk> pending = chunkRepo.findByPipelineIdAndStatus(pipelineId, ChunkStatus.PENDING);
        pending.forEach(c -> c.applyStatus(ChunkStatus.SKIPPED, null, clock.instant()));
        chunkRepo.saveAll(pending);
        return pending.size();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Pipeline requirePipeline(String pipelineId) {
        return pipelineRepo.findById(pipelineId)
                .orElseThrow(() -> new PipelineNotFoundException(pipelineId));
    }

    private Chunk requireChunk(String pipelineId, String chunkId) {
        return chunkRepo.findById(new ChunkKey(pipelineId, chunkId))
                .orElseThrow(() -> new ChunkNotFoundException(pipelineId, chunkId));
    }
}
