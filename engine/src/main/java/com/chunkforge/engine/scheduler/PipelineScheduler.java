package com.chunkforge.engine.scheduler;

import com.chunkforge.engine.decomposition.TaskDecomposition;
import com.chunkforge.engine.model.Chunk;
import com.chunkforge.engine.model.ChunkDraft;
import com.chunkforge.engine.model.ChunkResult;
import com.chunkforge.engine.model.ChunkStatus;
import com.chunkforge.engine.model.Pipeline;
import com.chunkforge.engine.model.PipelineConfig;
import com.chunkforge.engine.model.PipelineStatus;
import com.chunkforge.engine.store.ChunkStore;
import com.chunkforge.engine.store.PipelineNotFoundException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Drives a pipeline's chunks to completion in rounds.
 *
 * Each round asks the store for up to {@code parallelism} ready chunks, runs
 * them concurrently on the shared worker pool and waits for the whole batch
 * before reconciling any result. A chunk therefore never starts in the same
 * round as one of its dependencies.
 *
 * The calling thread is the only writer to the store for the pipeline it runs:
 * worker threads execute chunks and return outcomes, nothing more. Pause and
 * cancel go through the store's status compare-and-set and are observed at the
 * top of the next round; in-flight chunks are never interrupted.
 *
 * Chunk failures are recorded on the chunk and in the pipeline status; they are
 * never thrown to the caller.
 */
@Service
public class PipelineScheduler {

    private static final Logger log = LoggerFactory.getLogger(PipelineScheduler.class);

    private static final Set<PipelineStatus> STARTABLE   = EnumSet.of(PipelineStatus.PENDING, PipelineStatus.PAUSED, PipelineStatus.RUNNING);
    private static final Set<PipelineStatus> PAUSABLE    = EnumSet.of(PipelineStatus.PENDING, PipelineStatus.RUNNING);
    private static final Set<PipelineStatus> RESUMABLE   = EnumSet.of(PipelineStatus.PAUSED);
    private static final Set<PipelineStatus> CANCELLABLE = EnumSet.of(PipelineStatus.PENDING, PipelineStatus.RUNNING, PipelineStatus.PAUSED);
    private static final Set<PipelineStatus> ACTIVE      = EnumSet.of(PipelineStatus.RUNNING);

    private static final String UNKNOWN_ERROR = "Unknown error";

    private final ChunkStore      store;
    private final ExecutorService workers;
    private final MeterRegistry   meterRegistry;
    private final Clock           clock;

    public PipelineScheduler(ChunkStore store,
                             @Qualifier("chunkWorkers") ExecutorService workers,
                             MeterRegistry meterRegistry,
                             Clock clock) {
        this.store         = store;
        this.workers       = workers;
        this.meterRegistry = meterRegistry;
        this.clock         = clock;
    }

    // ------------------------------------------------------------------
    // Creation
    // ------------------------------------------------------------------

    /**
     * Persist a new pipeline (status PENDING) and all of its chunks.
     *
     * Drafts without an id get a UUID. Dependencies naming an id outside the
     * submission are accepted with a warning: such a chunk can never become
     * ready, and the run loop reports it as a deadlock.
     *
     * @param config execution policy; null means {@link PipelineConfig#defaults()}
     * @return the new pipeline id
     * Chunk ids only need to be unique within the submission; another
     * pipeline may reuse them. Nothing is stored when the graph is rejected.
     *
     * @throws InvalidChunkGraphException on duplicate chunk ids or a dependency cycle
     */
    public String createPipeline(String projectId, String name, String prompt,
                                 List<ChunkDraft> chunks, PipelineConfig config) {
        PipelineConfig effective = config != null ? config : PipelineConfig.defaults();
        List<ChunkDraft> drafts = ChunkGraph.assignIds(chunks);

        Set<String> dangling = ChunkGraph.validate(drafts);
        if (!dangling.isEmpty()) {
            log.warn("Pipeline '{}' has dependencies on unknown chunk ids {}; dependent chunks will never run",
                    name, dangling);
        }

        String pipelineId = UUID.randomUUID().toString();
        store.createPipeline(new Pipeline(pipelineId, projectId, name, prompt, effective,
                drafts.size(), clock.instant()), drafts);

        log.info("Pipeline created: id={} project={} chunks={} parallelism={}",
                pipelineId, projectId, drafts.size(), effective.parallelism());
        return pipelineId;
    }

    /**
     * Create a pipeline from a decomposition, keeping its chunk ids so the
     * decomposition's suggested order and parallel groups still apply.
     */
    public String createPipelineFromDecomposition(String projectId, String name, String prompt,
                                                  TaskDecomposition decomposition, PipelineConfig config) {
        String pipelineId = createPipeline(projectId, name, prompt, decomposition.chunks(), config);
        log.info("Pipeline {} created from decomposition: ~{} tokens, {} parallel group(s)",
                pipelineId, decomposition.estimatedTotalTokens(), decomposition.parallelGroups().size());
        return pipelineId;
    }

    // ------------------------------------------------------------------
    // Lifecycle controls
    // ------------------------------------------------------------------

    /** PENDING, PAUSED or RUNNING → RUNNING; stamps startedAt the first time. */
    public void start(String pipelineId) {
        transitionOrThrow(pipelineId, PipelineStatus.RUNNING, STARTABLE);
        log.info("Pipeline {} started", pipelineId);
    }

    /** Stops the run loop at the top of its next round. */
    public void pause(String pipelineId) {
        transitionOrThrow(pipelineId, PipelineStatus.PAUSED, PAUSABLE);
        log.info("Pipeline {} paused", pipelineId);
    }

    public void resume(String pipelineId) {
        transitionOrThrow(pipelineId, PipelineStatus.RUNNING, RESUMABLE);
        log.info("Pipeline {} resumed", pipelineId);
    }

    /**
     * Cancel the pipeline and force every PENDING chunk to SKIPPED.
     * Chunks already in flight finish normally.
     */
    public void cancel(String pipelineId) {
        transitionOrThrow(pipelineId, PipelineStatus.CANCELLED, CANCELLABLE);
        int skipped = store.skipPendingChunks(pipelineId);
        recordCounters(pipelineId);
        log.info("Pipeline {} cancelled ({} pending chunk(s) skipped)", pipelineId, skipped);
    }

    // ------------------------------------------------------------------
    // Execution
    // ------------------------------------------------------------------

    public PipelineProgress runPipeline(String pipelineId, ChunkExecutor executor) {
        return runPipeline(pipelineId, executor, ProgressListener.NONE);
    }

    /**
     * Run rounds until no chunk can make progress.
     *
     * The loop stops when the pipeline is paused or cancelled, when no chunk is
     * ready (a deadlock if chunks are still pending), or after a round with a
     * terminal chunk failure when {@code stopOnError} is set. In the last case
     * the remaining PENDING chunks are left as they are.
     *
     * @return the final progress snapshot
     */
    public PipelineProgress runPipeline(String pipelineId, ChunkExecutor executor, ProgressListener listener) {
        start(pipelineId);
        PipelineConfig config = requirePipeline(pipelineId).getConfig();
        int rounds = 0;

        while (true) {
            PipelineStatus status = requirePipeline(pipelineId).getStatus();
            if (status != PipelineStatus.RUNNING) {
                log.info("Pipeline {} is {}; run loop stopped after {} round(s)", pipelineId, status, rounds);
                break;
            }

            List<Chunk> ready = store.getParallelReadyChunks(pipelineId, config.parallelism());
            if (ready.isEmpty()) {
                failIfDeadlocked(pipelineId);
                break;
            }

            rounds++;
            RoundSummary round = executeRound(pipelineId, ready, executor, config);
            notifyListener(listener, refreshProgress(pipelineId));

            if (config.stopOnError() && round.terminalFailures() > 0) {
                failPipeline(pipelineId, round.terminalFailures() + " chunk(s) failed and stopOnError is set");
                break;
            }
        }

        PipelineProgress last = refreshProgress(pipelineId);
        log.info("Pipeline {} finished run: status={} completed={}/{} failed={} rounds={}",
                pipelineId, last.status(), last.completedChunks(), last.totalChunks(),
                last.failedChunks(), rounds);
        return last;
    }

    public ChunkStepResult executeNextChunk(String pipelineId, ChunkExecutor executor) {
        return executeNextChunk(pipelineId, executor, ProgressListener.NONE);
    }

    /**
     * Stepped execution: run exactly one ready chunk.
     *
     * A PENDING pipeline is started first. A paused, cancelled or finished
     * pipeline runs nothing. When no chunk is ready the deadlock check still
     * applies.
     */
    public ChunkStepResult executeNextChunk(String pipelineId, ChunkExecutor executor, ProgressListener listener) {
        Pipeline pipeline = requirePipeline(pipelineId);
        if (pipeline.getStatus() == PipelineStatus.PENDING) {
            start(pipelineId);
        } else if (pipeline.getStatus() != PipelineStatus.RUNNING) {
            log.debug("Pipeline {} is {}; nothing executed", pipelineId, pipeline.getStatus());
            return ChunkStepResult.notExecuted();
        }

        Optional<Chunk> next = store.getNextPendingChunk(pipelineId);
        if (next.isEmpty()) {
            failIfDeadlocked(pipelineId);
            refreshProgress(pipelineId);
            return ChunkStepResult.notExecuted();
        }

        PipelineConfig config = pipeline.getConfig();
        RoundSummary round = executeRound(pipelineId, List.of(next.get()), executor, config);
        notifyListener(listener, refreshProgress(pipelineId));

        if (config.stopOnError() && round.terminalFailures() > 0) {
            failPipeline(pipelineId, "chunk " + next.get().getId() + " failed and stopOnError is set");
        }
        return new ChunkStepResult(true, next.get().getId(), round.outcomes().get(0).success());
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    public Pipeline getPipeline(String pipelineId) {
        return requirePipeline(pipelineId);
    }

    public List<Pipeline> getProjectPipelines(String projectId) {
        return store.findProjectPipelines(projectId);
    }

    public List<Chunk> getPipelineChunks(String pipelineId) {
        return store.getPipelineChunks(pipelineId);
    }

    /** Every chunk of a project across its pipelines, highest priority first. */
    public List<Chunk> getProjectChunks(String projectId) {
        return store.getProjectChunks(projectId);
    }

    public PipelineProgress getProgress(String pipelineId) {
        Pipeline pipeline = requirePipeline(pipelineId);

        PipelineProgress.CurrentTask currentTask = null;
        if (pipeline.getCurrentChunkId() != null) {
            currentTask = store.findChunk(pipelineId, pipeline.getCurrentChunkId())
                    .map(c -> new PipelineProgress.CurrentTask(c.getId(), c.getTitle(), c.getType()))
                    .orElse(null);
        }

        int percent = pipeline.getTotalChunks() > 0
                ? (int) Math.round(pipeline.getCompletedChunks() * 100.0 / pipeline.getTotalChunks())
                : 0;

        return new PipelineProgress(
                pipeline.getId(),
                pipeline.getName(),
                pipeline.getStatus(),
                pipeline.getTotalChunks(),
                pipeline.getCompletedChunks(),
                pipeline.getFailedChunks(),
                currentTask,
                percent,
                pipeline.getStats(clock.instant()));
    }

    // ------------------------------------------------------------------
    // Round execution
    // ------------------------------------------------------------------

    private record RoundSummary(List<ExecutionOutcome> outcomes, int terminalFailures) {}

    /**
     * Mark the batch IN_PROGRESS, fan out, join, then reconcile results in
     * selection order. Completion order of the workers has no effect.
     */
    private RoundSummary executeRound(String pipelineId, List<Chunk> batch,
                                      ChunkExecutor executor, PipelineConfig config) {
        List<Chunk> running = new ArrayList<>(batch.size());
        for (Chunk chunk : batch) {
            store.updateChunkStatus(pipelineId, chunk.getId(), ChunkStatus.IN_PROGRESS, null);
            running.add(store.findChunk(pipelineId, chunk.getId()).orElse(chunk));
        }
        recordCounters(pipelineId);
        log.debug("Pipeline {} round: executing {}", pipelineId,
                running.stream().map(Chunk::getId).toList());

        List<CompletableFuture<ExecutionOutcome>> futures = new ArrayList<>(running.size());
        for (Chunk chunk : running) {
            futures.add(submit(chunk, executor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();

        List<ExecutionOutcome> outcomes = new ArrayList<>(running.size());
        int terminalFailures = 0;
        for (int i = 0; i < running.size(); i++) {
            ExecutionOutcome outcome = futures.get(i).join();
            outcomes.add(outcome);
            if (reconcile(pipelineId, running.get(i), outcome, config)) {
                terminalFailures++;
            }
        }
        skipIfCancelled(pipelineId);
        meterRegistry.counter("chunkforge.pipeline.rounds").increment();
        return new RoundSummary(outcomes, terminalFailures);
    }

    private CompletableFuture<ExecutionOutcome> submit(Chunk chunk, ChunkExecutor executor) {
        try {
            return CompletableFuture.supplyAsync(() -> invoke(chunk, executor), workers);
        } catch (RejectedExecutionException e) {
            log.error("Worker pool rejected chunk {}: {}", chunk.getId(), e.getMessage());
            return CompletableFuture.completedFuture(
                    ExecutionOutcome.failure("Worker pool rejected chunk: " + e.getMessage()));
        }
    }

    /** Runs on a worker thread. Never throws. */
    private ExecutionOutcome invoke(Chunk chunk, ChunkExecutor executor) {
        MDC.put("pipelineId", chunk.getPipelineId());
        MDC.put("chunkId",    chunk.getId());
        MDC.put("chunkType",  chunk.getType().name());
        MDC.put("attempt",    String.valueOf(chunk.getRetryCount() + 1));
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            log.info("Executing chunk '{}' (attempt {}/{})",
                    chunk.getTitle(), chunk.getRetryCount() + 1, chunk.getMaxRetries() + 1);
            ExecutionOutcome outcome = executor.execute(chunk);
            return outcome != null ? outcome : ExecutionOutcome.failure("Executor returned no outcome");
        } catch (Exception e) {
            log.warn("Executor threw for chunk {}: {}", chunk.getId(), e.getMessage(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return ExecutionOutcome.failure(message);
        } finally {
            sample.stop(meterRegistry.timer("chunkforge.chunk.duration",
                    "type", chunk.getType().name().toLowerCase()));
            // Pool threads are reused; never leak one chunk's context into the next.
            MDC.clear();
        }
    }

    /**
     * Apply one outcome to the store.
     *
     * @return true if the chunk failed terminally
     */
    private boolean reconcile(String pipelineId, Chunk chunk, ExecutionOutcome outcome, PipelineConfig config) {
        if (outcome.success()) {
            store.updateChunkStatus(pipelineId, chunk.getId(), ChunkStatus.COMPLETED,
                    ChunkResult.success(outcome.filesCreated(), outcome.filesModified()));
            if (outcome.output() != null) {
                store.setChunkOutput(pipelineId, chunk.getId(), outcome.output(),
                        outcome.tokensUsed() > 0 ? (int) outcome.tokensUsed() : null);
            }
            store.addPipelineStats(pipelineId, outcome.tokensUsed(),
                    outcome.filesCreated().size(), outcome.linesGenerated());
            countOutcome("completed");
            log.info("Chunk {} '{}' completed ({} file(s) created, {} tokens)",
                    chunk.getId(), chunk.getTitle(), outcome.filesCreated().size(), outcome.tokensUsed());
            return false;
        }

        if (config.autoRetry() && chunk.getRetryCount() < chunk.getMaxRetries()) {
            int retries = store.incrementRetry(pipelineId, chunk.getId());
            store.updateChunkStatus(pipelineId, chunk.getId(), ChunkStatus.PENDING, null);
            countOutcome("retried");
            log.warn("Chunk {} failed (retry {}/{}), will retry. Errors: {}",
                    chunk.getId(), retries, chunk.getMaxRetries(), outcome.errors());
            return false;
        }

        List<String> errors = outcome.errors().isEmpty() ? List.of(UNKNOWN_ERROR) : outcome.errors();
        store.updateChunkStatus(pipelineId, chunk.getId(), ChunkStatus.FAILED, ChunkResult.failure(errors));
        countOutcome("failed");
        log.error("Chunk {} '{}' permanently failed after {} attempt(s): {}",
                chunk.getId(), chunk.getTitle(), chunk.getRetryCount() + 1, errors);
        return true;
    }

    // ------------------------------------------------------------------
    // Status bookkeeping
    // ------------------------------------------------------------------

    /**
     * A cancel that lands while a round is in flight skips what was PENDING
     * then; chunks sent back for retry by that round are skipped here.
     */
    private void skipIfCancelled(String pipelineId) {
        if (requirePipeline(pipelineId).getStatus() == PipelineStatus.CANCELLED) {
            int skipped = store.skipPendingChunks(pipelineId);
            if (skipped > 0) {
                log.info("Pipeline {} was cancelled mid-round; {} retried chunk(s) skipped", pipelineId, skipped);
            }
        }
    }

    /**
     * Recompute counters from the chunk records and, once {@code totalChunks}
     * chunks are COMPLETED or FAILED, settle a RUNNING pipeline to COMPLETED
     * or FAILED.
     */
    private PipelineProgress refreshProgress(String pipelineId) {
        ChunkCounts counts = recordCounters(pipelineId);
        if (counts.completed() + counts.failed() == requirePipeline(pipelineId).getTotalChunks()) {
            PipelineStatus target = counts.failed() > 0 ? PipelineStatus.FAILED : PipelineStatus.COMPLETED;
            if (store.transitionPipeline(pipelineId, target, ACTIVE)) {
                log.info("Pipeline {} {}", pipelineId, target);
            }
        }
        return getProgress(pipelineId);
    }

    private record ChunkCounts(int total, int completed, int failed, int pending, int inProgress) {}

    private ChunkCounts recordCounters(String pipelineId) {
        List<Chunk> chunks = store.getPipelineChunks(pipelineId);
        int completed = 0, failed = 0, pending = 0, inProgress = 0;
        String currentChunkId = null;
        for (Chunk chunk : chunks) {
            switch (chunk.getStatus()) {
                case COMPLETED -> completed++;
                case FAILED    -> failed++;
                case PENDING   -> pending++;
                case IN_PROGRESS -> {
                    inProgress++;
                    if (currentChunkId == null) currentChunkId = chunk.getId();
                }
                case SKIPPED   -> { }
            }
        }
        store.updatePipelineProgress(pipelineId, completed, failed, currentChunkId);
        return new ChunkCounts(chunks.size(), completed, failed, pending, inProgress);
    }

    /** Unfinished chunks, none ready, nothing in flight: the pipeline can never finish. */
    private void failIfDeadlocked(String pipelineId) {
        ChunkCounts counts = recordCounters(pipelineId);
        int unfinished = requirePipeline(pipelineId).getTotalChunks() - counts.completed() - counts.failed();
        if (unfinished > 0 && counts.inProgress() == 0) {
            meterRegistry.counter("chunkforge.pipeline.deadlocks").increment();
            failPipeline(pipelineId, unfinished
                    + " chunk(s) can never run: unsatisfiable dependencies (deadlock)");
        }
    }

    private void failPipeline(String pipelineId, String reason) {
        if (store.transitionPipeline(pipelineId, PipelineStatus.FAILED, ACTIVE)) {
            log.error("Pipeline {} FAILED: {}", pipelineId, reason);
        }
    }

    private void transitionOrThrow(String pipelineId, PipelineStatus next, Set<PipelineStatus> allowedFrom) {
        if (!store.transitionPipeline(pipelineId, next, allowedFrom)) {
            throw new PipelineStateException(pipelineId, requirePipeline(pipelineId).getStatus(), next);
        }
    }

    private Pipeline requirePipeline(String pipelineId) {
        return store.findPipeline(pipelineId)
                .orElseThrow(() -> new PipelineNotFoundException(pipelineId));
    }

    private void countOutcome(String outcome) {
        meterRegistry.counter("chunkforge.chunk.outcomes", "outcome", outcome).increment();
    }

    private void notifyListener(ProgressListener listener, PipelineProgress progress) {
        try {
            listener.onProgress(progress);
        } catch (RuntimeException e) {
            log.warn("Progress listener failed for pipeline {}: {}", progress.pipelineId(), e.getMessage(), e);
        }
    }
}
