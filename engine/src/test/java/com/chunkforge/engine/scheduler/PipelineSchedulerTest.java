package com.chunkforge.engine.scheduler;

import com.chunkforge.engine.model.Chunk;
import com.chunkforge.engine.decomposition.PromptDecomposer;
import com.chunkforge.engine.decomposition.TaskDecomposition;
import com.chunkforge.engine.model.ChunkDraft;
import com.chunkforge.engine.model.ChunkStatus;
import com.chunkforge.engine.model.ChunkType;
import com.chunkforge.engine.model.Pipeline;
import com.chunkforge.engine.model.PipelineConfig;
import com.chunkforge.engine.model.PipelineStatus;
import com.chunkforge.engine.store.InMemoryChunkStore;
import com.chunkforge.engine.store.PipelineNotFoundException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Scheduler tests against the in-memory store and a real worker pool.
 * Executors are plain lambdas; no Spring context.
 */
class PipelineSchedulerTest {

    private static final String PROJECT = "project-1";

    InMemoryChunkStore  store;
    ExecutorService     workers;
    SimpleMeterRegistry meters;
    PipelineScheduler   scheduler;

    @BeforeEach
    void setUp() {
        store     = new InMemoryChunkStore(Clock.systemUTC());
        workers   = Executors.newFixedThreadPool(4);
        meters    = new SimpleMeterRegistry();
        scheduler = new PipelineScheduler(store, workers, meters, Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
    }

    // ------------------------------------------------------------------
    // Happy path and ordering
    // ------------------------------------------------------------------

    @Test
    void runPipeline_independentChunksRunTogether_dependentChunkRunsInLaterRound() {
        String id = scheduler.createPipeline(PROJECT, "app", "build an app", List.of(
                draft("A"), draft("B"), draft("C", "A", "B")), PipelineConfig.defaults().withParallelism(2));

        // Both A and B must be in flight before either returns, so they share a round.
        CountDownLatch bothStarted = new CountDownLatch(2);
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        List<String> order = Collections.synchronizedList(new ArrayList<>());

        PipelineProgress progress = scheduler.runPipeline(id, chunk -> {
            int now = inFlight.incrementAndGet();
            maxInFlight.accumulateAndGet(now, Math::max);
            order.add(chunk.getId());
            if (!chunk.getId().equals("C")) {
                bothStarted.countDown();
                assertThat(bothStarted.await(5, TimeUnit.SECONDS)).isTrue();
            }
            inFlight.decrementAndGet();
            return ExecutionOutcome.success(List.of(chunk.getId() + ".java"), List.of(), 100, 10);
        });

        assertThat(progress.status()).isEqualTo(PipelineStatus.COMPLETED);
        assertThat(progress.completedChunks()).isEqualTo(3);
        assertThat(progress.failedChunks()).isZero();
        assertThat(progress.progressPercent()).isEqualTo(100);
        assertThat(progress.stats().totalTokensUsed()).isEqualTo(300);
        assertThat(progress.stats().totalFilesGenerated()).isEqualTo(3);
        assertThat(progress.stats().totalLinesGenerated()).isEqualTo(30);
        assertThat(maxInFlight.get()).isEqualTo(2);
        assertThat(order.get(2)).isEqualTo("C");
        assertThat(meters.counter("chunkforge.pipeline.rounds").count()).isEqualTo(2.0);

        var pipeline = scheduler.getPipeline(id);
        assertThat(pipeline.getStartedAt()).isNotNull();
        assertThat(pipeline.getCompletedAt()).isNotNull();
    }

    @Test
    void runPipeline_roundNeverExceedsParallelism() {
        List<ChunkDraft> drafts = new ArrayList<>();
        for (int i = 0; i < 6; i++) drafts.add(draft("c" + i));
        String id = scheduler.createPipeline(PROJECT, "wide", "", drafts, PipelineConfig.defaults().withParallelism(2));

        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();

        PipelineProgress progress = scheduler.runPipeline(id, chunk -> {
            maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
            Thread.sleep(20);
            inFlight.decrementAndGet();
            return ExecutionOutcome.success(List.of(), List.of(), 1, 1);
        });

        assertThat(progress.status()).isEqualTo(PipelineStatus.COMPLETED);
        assertThat(maxInFlight.get()).isLessThanOrEqualTo(2);
        assertThat(meters.counter("chunkforge.pipeline.rounds").count()).isEqualTo(3.0);
    }

    @Test
    void runPipeline_higherPriorityChunkRunsFirst() {
        String id = scheduler.createPipeline(PROJECT, "prio", "", List.of(
                ChunkDraft.builder(ChunkType.DOCUMENTATION, "docs").id("docs").build(),
                ChunkDraft.builder(ChunkType.ARCHITECTURE, "arch").id("arch").build(),
                ChunkDraft.builder(ChunkType.TESTING, "tests").id("tests").priority(200).build()),
                PipelineConfig.defaults());

        List<String> order = Collections.synchronizedList(new ArrayList<>());
        scheduler.runPipeline(id, chunk -> {
            order.add(chunk.getId());
            return ExecutionOutcome.success(List.of(), List.of(), 0, 0);
        });

        assertThat(order).containsExactly("tests", "arch", "docs");
    }

    @Test
    void runPipeline_emptyPipelineCompletesImmediately() {
        String id = scheduler.createPipeline(PROJECT, "empty", "", List.of(), null);

        PipelineProgress progress = scheduler.runPipeline(id, chunk -> {
            throw new AssertionError("nothing to execute");
        });

        assertThat(progress.status()).isEqualTo(PipelineStatus.COMPLETED);
        assertThat(progress.progressPercent()).isZero();
    }

    // ------------------------------------------------------------------
    // Failures and retries
    // ------------------------------------------------------------------

    @Test
    void runPipeline_alwaysFailingChunk_failsAfterOnePlusMaxRetriesAttempts() {
        String id = scheduler.createPipeline(PROJECT, "retry", "", List.of(
                ChunkDraft.builder(ChunkType.API, "flaky").id("flaky").maxRetries(2).build()),
                PipelineConfig.defaults());

        AtomicInteger attempts = new AtomicInteger();
        PipelineProgress progress = scheduler.runPipeline(id, chunk -> {
            attempts.incrementAndGet();
            return ExecutionOutcome.failure("compile error");
        });

        assertThat(attempts.get()).isEqualTo(3);
        assertThat(progress.status()).isEqualTo(PipelineStatus.FAILED);
        assertThat(progress.failedChunks()).isEqualTo(1);

        Chunk chunk = store.findChunk(id, "flaky").orElseThrow();
        assertThat(chunk.getStatus()).isEqualTo(ChunkStatus.FAILED);
        assertThat(chunk.getRetryCount()).isEqualTo(2);
        assertThat(chunk.getErrors()).containsExactly("compile error");
        assertThat(chunk.getCompletedAt()).isNotNull();
    }

    @Test
    void runPipeline_failureWithoutErrors_recordsUnknownError() {
        String id = scheduler.createPipeline(PROJECT, "silent", "", List.of(draft("A")),
                PipelineConfig.defaults().withAutoRetry(false));

        scheduler.runPipeline(id, chunk -> new ExecutionOutcome(false, null, null, null, 0, 0, null));

        assertThat(store.findChunk(id, "A").orElseThrow().getErrors()).containsExactly("Unknown error");
    }

    @Test
    void runPipeline_executorThrows_treatedAsFailureAndRetried() {
        String id = scheduler.createPipeline(PROJECT, "throws", "", List.of(
                ChunkDraft.builder(ChunkType.SCHEMA, "schema").id("schema").maxRetries(1).build()),
                PipelineConfig.defaults());

        AtomicInteger attempts = new AtomicInteger();
        PipelineProgress progress = scheduler.runPipeline(id, chunk -> {
            if (attempts.incrementAndGet() == 1) {
                throw new IllegalStateException("backend timeout");
            }
            return ExecutionOutcome.success(List.of("schema.sql"), List.of(), 50, 5);
        });

        assertThat(attempts.get()).isEqualTo(2);
        assertThat(progress.status()).isEqualTo(PipelineStatus.COMPLETED);
        assertThat(store.findChunk(id, "schema").orElseThrow().getRetryCount()).isEqualTo(1);
    }

    @Test
    void runPipeline_unknownDependency_deadlocksAndFails() {
        String id = scheduler.createPipeline(PROJECT, "dangling", "", List.of(
                draft("A"), draft("B", "ghost")), PipelineConfig.defaults());

        PipelineProgress progress = scheduler.runPipeline(id, chunk ->
                ExecutionOutcome.success(List.of(), List.of(), 0, 0));

        assertThat(progress.status()).isEqualTo(PipelineStatus.FAILED);
        assertThat(progress.completedChunks()).isEqualTo(1);
        assertThat(store.findChunk(id, "B").orElseThrow().getStatus()).isEqualTo(ChunkStatus.PENDING);
        assertThat(meters.counter("chunkforge.pipeline.deadlocks").count()).isEqualTo(1.0);
    }

    @Test
    void runPipeline_failedDependency_leavesDependentPendingAndPipelineFailed() {
        String id = scheduler.createPipeline(PROJECT, "blocked", "", List.of(
                draft("A"), draft("B", "A")), PipelineConfig.defaults().withAutoRetry(false));

        PipelineProgress progress = scheduler.runPipeline(id, chunk -> ExecutionOutcome.failure("boom"));

        assertThat(progress.status()).isEqualTo(PipelineStatus.FAILED);
        assertThat(progress.failedChunks()).isEqualTo(1);
        assertThat(store.findChunk(id, "B").orElseThrow().getStatus()).isEqualTo(ChunkStatus.PENDING);
    }

    @Test
    void runPipeline_stopOnError_abortsAndLeavesPendingChunksUntouched() {
        String id = scheduler.createPipeline(PROJECT, "strict", "", List.of(
                ChunkDraft.builder(ChunkType.ARCHITECTURE, "first").id("first").build(),
                ChunkDraft.builder(ChunkType.COMPONENT, "second").id("second").build(),
                ChunkDraft.builder(ChunkType.STYLING, "third").id("third").build()),
                PipelineConfig.defaults().withStopOnError(true).withAutoRetry(false));

        List<String> executed = Collections.synchronizedList(new ArrayList<>());
        PipelineProgress progress = scheduler.runPipeline(id, chunk -> {
            executed.add(chunk.getId());
            return ExecutionOutcome.failure("bad output");
        });

        assertThat(executed).containsExactly("first");
        assertThat(progress.status()).isEqualTo(PipelineStatus.FAILED);
        assertThat(store.findChunk(id, "second").orElseThrow().getStatus()).isEqualTo(ChunkStatus.PENDING);
        assertThat(store.findChunk(id, "third").orElseThrow().getStatus()).isEqualTo(ChunkStatus.PENDING);
    }

    // ------------------------------------------------------------------
    // Lifecycle controls
    // ------------------------------------------------------------------

    @Test
    void cancel_beforeRun_skipsAllPendingChunks() {
        String id = scheduler.createPipeline(PROJECT, "doomed", "", List.of(draft("A"), draft("B", "A")), null);

        scheduler.cancel(id);

        assertThat(scheduler.getPipeline(id).getStatus()).isEqualTo(PipelineStatus.CANCELLED);
        assertThat(scheduler.getPipelineChunks(id))
                .extracting(Chunk::getStatus)
                .containsOnly(ChunkStatus.SKIPPED);
        assertThatThrownBy(() -> scheduler.runPipeline(id, chunk -> ExecutionOutcome.failure("never")))
                .isInstanceOf(PipelineStateException.class);
    }

    @Test
    void cancel_duringRun_inFlightChunkFinishesAndRestAreSkipped() {
        String id = scheduler.createPipeline(PROJECT, "interrupted", "", List.of(
                draft("A"), draft("B", "A"), draft("C", "B")), null);

        PipelineProgress progress = scheduler.runPipeline(id, chunk -> {
            if (chunk.getId().equals("A")) scheduler.cancel(id);
            return ExecutionOutcome.success(List.of(), List.of(), 0, 0);
        });

        assertThat(progress.status()).isEqualTo(PipelineStatus.CANCELLED);
        assertThat(store.findChunk(id, "A").orElseThrow().getStatus()).isEqualTo(ChunkStatus.COMPLETED);
        assertThat(store.findChunk(id, "B").orElseThrow().getStatus()).isEqualTo(ChunkStatus.SKIPPED);
        assertThat(store.findChunk(id, "C").orElseThrow().getStatus()).isEqualTo(ChunkStatus.SKIPPED);
    }

    @Test
    void cancel_duringRun_failingChunkWithRetriesLeftIsSkipped() {
        String id = scheduler.createPipeline(PROJECT, "cancelled retry", "", List.of(
                draft("A"), draft("B", "A")), null);

        PipelineProgress progress = scheduler.runPipeline(id, chunk -> {
            scheduler.cancel(id);
            return ExecutionOutcome.failure("compile error");
        });

        assertThat(progress.status()).isEqualTo(PipelineStatus.CANCELLED);
        Chunk a = store.findChunk(id, "A").orElseThrow();
        assertThat(a.getStatus()).isEqualTo(ChunkStatus.SKIPPED);
        assertThat(a.getRetryCount()).isEqualTo(1);
        assertThat(store.findChunk(id, "B").orElseThrow().getStatus()).isEqualTo(ChunkStatus.SKIPPED);
        assertThat(scheduler.getPipelineChunks(id))
                .extracting(Chunk::getStatus)
                .doesNotContain(ChunkStatus.PENDING);
    }

    @Test
    void pause_duringRun_failingChunkWithRetriesLeftStaysPendingForResume() {
        String id = scheduler.createPipeline(PROJECT, "paused retry", "", List.of(draft("A")), null);
        AtomicInteger attempts = new AtomicInteger();

        PipelineProgress paused = scheduler.runPipeline(id, chunk -> {
            if (attempts.incrementAndGet() == 1) {
                scheduler.pause(id);
                return ExecutionOutcome.failure("flaky");
            }
            return ExecutionOutcome.success(List.of(), List.of(), 0, 0);
        });

        assertThat(paused.status()).isEqualTo(PipelineStatus.PAUSED);
        assertThat(store.findChunk(id, "A").orElseThrow().getStatus()).isEqualTo(ChunkStatus.PENDING);

        scheduler.resume(id);
        assertThat(scheduler.runPipeline(id, chunk -> ExecutionOutcome.success(List.of(), List.of(), 0, 0))
                .status()).isEqualTo(PipelineStatus.COMPLETED);
    }

    @Test
    void pause_duringRun_stopsLoop_resumeFinishes() {
        String id = scheduler.createPipeline(PROJECT, "pausable", "", List.of(draft("A"), draft("B", "A")), null);

        PipelineProgress paused = scheduler.runPipeline(id, chunk -> {
            if (chunk.getId().equals("A")) scheduler.pause(id);
            return ExecutionOutcome.success(List.of(), List.of(), 0, 0);
        });

        assertThat(paused.status()).isEqualTo(PipelineStatus.PAUSED);
        assertThat(paused.completedChunks()).isEqualTo(1);
        assertThat(store.findChunk(id, "B").orElseThrow().getStatus()).isEqualTo(ChunkStatus.PENDING);

        scheduler.resume(id);
        PipelineProgress done = scheduler.runPipeline(id, chunk ->
                ExecutionOutcome.success(List.of(), List.of(), 0, 0));

        assertThat(done.status()).isEqualTo(PipelineStatus.COMPLETED);
        assertThat(done.completedChunks()).isEqualTo(2);
    }

    @Test
    void illegalTransitions_throwPipelineStateException() {
        String id = scheduler.createPipeline(PROJECT, "p", "", List.of(draft("A")), null);

        assertThatThrownBy(() -> scheduler.resume(id))
                .isInstanceOf(PipelineStateException.class)
                .satisfies(e -> {
                    PipelineStateException ex = (PipelineStateException) e;
                    assertThat(ex.getCurrent()).isEqualTo(PipelineStatus.PENDING);
                    assertThat(ex.getRequested()).isEqualTo(PipelineStatus.RUNNING);
                });

        scheduler.runPipeline(id, chunk -> ExecutionOutcome.success(List.of(), List.of(), 0, 0));

        assertThatThrownBy(() -> scheduler.pause(id)).isInstanceOf(PipelineStateException.class);
        assertThatThrownBy(() -> scheduler.cancel(id)).isInstanceOf(PipelineStateException.class);
        assertThatThrownBy(() -> scheduler.start(id)).isInstanceOf(PipelineStateException.class);
    }

    @Test
    void unknownPipeline_throwsNotFound() {
        assertThatThrownBy(() -> scheduler.start("missing"))
                .isInstanceOf(PipelineNotFoundException.class);
        assertThatThrownBy(() -> scheduler.getProgress("missing"))
                .isInstanceOf(PipelineNotFoundException.class);
    }

    // ------------------------------------------------------------------
    // Creation
    // ------------------------------------------------------------------

    @Test
    void createPipeline_rejectsCycle() {
        assertThatThrownBy(() -> scheduler.createPipeline(PROJECT, "loop", "", List.of(
                draft("A", "C"), draft("B", "A"), draft("C", "B")), null))
                .isInstanceOf(InvalidChunkGraphException.class)
                .hasMessageContaining("cycle");
        assertThat(scheduler.getProjectPipelines(PROJECT)).isEmpty();
    }

    @Test
    void createPipeline_secondPipelineMayReuseChunkIds() {
        List<ChunkDraft> drafts = List.of(draft("schema"), draft("api", "schema"));
        ChunkExecutor ok = chunk -> ExecutionOutcome.success(List.of(chunk.getId() + ".ts"), List.of(), 10, 1);

        String first = scheduler.createPipeline(PROJECT, "v1", "", drafts, null);
        scheduler.runPipeline(first, ok);
        String second = scheduler.createPipeline(PROJECT, "v2", "", drafts, null);

        assertThat(scheduler.getPipelineChunks(second))
                .extracting(Chunk::getStatus)
                .containsOnly(ChunkStatus.PENDING);

        PipelineProgress progress = scheduler.runPipeline(second, ok);

        assertThat(progress.status()).isEqualTo(PipelineStatus.COMPLETED);
        assertThat(progress.completedChunks()).isEqualTo(2);
        assertThat(progress.totalChunks()).isEqualTo(2);
        assertThat(scheduler.getPipelineChunks(second)).hasSize(2);
        assertThat(scheduler.getProjectChunks(PROJECT)).hasSize(4)
                .extracting(Chunk::getPipelineId)
                .containsOnly(first, second);
    }

    @Test
    void createPipeline_duplicateIdsInOneSubmission_storesNothing() {
        assertThatThrownBy(() -> scheduler.createPipeline(PROJECT, "dup", "", List.of(
                draft("A"), draft("A")), null))
                .isInstanceOf(InvalidChunkGraphException.class);

        assertThat(scheduler.getProjectPipelines(PROJECT)).isEmpty();
        assertThat(scheduler.getProjectChunks(PROJECT)).isEmpty();
    }

    @Test
    void runPipeline_fewerStoredChunksThanTotal_failsInsteadOfCompleting() {
        store.savePipeline(new Pipeline("short", PROJECT, "short", "", PipelineConfig.defaults(), 2,
                Instant.now()));
        store.createChunk("short", PROJECT, draft("A"));

        PipelineProgress progress = scheduler.runPipeline("short",
                chunk -> ExecutionOutcome.success(List.of(), List.of(), 0, 0));

        assertThat(progress.status()).isEqualTo(PipelineStatus.FAILED);
        assertThat(progress.completedChunks()).isEqualTo(1);
        assertThat(progress.totalChunks()).isEqualTo(2);
    }

    @Test
    void createPipelineFromDecomposition_keepsDecomposedIdsAndRunsInGroups() {
        TaskDecomposition decomposition = new PromptDecomposer()
                .decompose("An order app with a database and REST api");
        List<String> executed = Collections.synchronizedList(new ArrayList<>());

        String id = scheduler.createPipelineFromDecomposition(PROJECT, "orders", "An order app",
                decomposition, PipelineConfig.defaults().withParallelism(4));
        scheduler.runPipeline(id, chunk -> {
            executed.add(chunk.getId());
            return ExecutionOutcome.success(List.of(), List.of(), 0, 0);
        });

        assertThat(scheduler.getPipeline(id).getTotalChunks()).isEqualTo(decomposition.chunks().size());
        assertThat(scheduler.getPipeline(id).getStatus()).isEqualTo(PipelineStatus.COMPLETED);
        assertThat(scheduler.getPipelineChunks(id))
                .extracting(Chunk::getId)
                .containsExactlyInAnyOrderElementsOf(decomposition.suggestedOrder());
        assertThat(executed.indexOf("api")).isGreaterThan(executed.indexOf("schema"));
    }

    @Test
    void createPipeline_assignsIdsAndDefaults() {
        String id = scheduler.createPipeline(PROJECT, "defaults", "prompt", List.of(
                ChunkDraft.builder(ChunkType.SCHEMA, "tables").prompt("create the tables").build()), null);

        assertThat(scheduler.getPipeline(id).getStatus()).isEqualTo(PipelineStatus.PENDING);
        assertThat(scheduler.getPipeline(id).getConfig()).isEqualTo(PipelineConfig.defaults());
        assertThat(scheduler.getPipeline(id).getTotalChunks()).isEqualTo(1);

        Chunk chunk = scheduler.getPipelineChunks(id).get(0);
        assertThat(chunk.getId()).isNotBlank();
        assertThat(chunk.getPriority()).isEqualTo(ChunkType.SCHEMA.defaultPriority());
        assertThat(chunk.getMaxRetries()).isEqualTo(ChunkDraft.DEFAULT_MAX_RETRIES);
        assertThat(chunk.getEstimatedTokens()).isPositive();
        assertThat(scheduler.getProjectPipelines(PROJECT)).extracting(p -> p.getId()).containsExactly(id);
    }

    // ------------------------------------------------------------------
    // Stepped execution and progress
    // ------------------------------------------------------------------

    @Test
    void executeNextChunk_runsOneChunkPerCall() {
        String id = scheduler.createPipeline(PROJECT, "stepped", "", List.of(draft("A"), draft("B", "A")), null);
        ChunkExecutor ok = chunk -> ExecutionOutcome.success(List.of(), List.of(), 0, 0);

        ChunkStepResult first = scheduler.executeNextChunk(id, ok);
        assertThat(first).isEqualTo(new ChunkStepResult(true, "A", true));
        assertThat(scheduler.getPipeline(id).getStatus()).isEqualTo(PipelineStatus.RUNNING);

        ChunkStepResult second = scheduler.executeNextChunk(id, ok);
        assertThat(second.chunkId()).isEqualTo("B");
        assertThat(scheduler.getPipeline(id).getStatus()).isEqualTo(PipelineStatus.COMPLETED);

        assertThat(scheduler.executeNextChunk(id, ok).executed()).isFalse();
    }

    @Test
    void executeNextChunk_pausedPipeline_executesNothing() {
        String id = scheduler.createPipeline(PROJECT, "paused", "", List.of(draft("A")), null);
        scheduler.pause(id);

        ChunkStepResult result = scheduler.executeNextChunk(id, chunk -> {
            throw new AssertionError("must not run");
        });

        assertThat(result.executed()).isFalse();
    }

    @Test
    void runPipeline_listenerReceivesProgressEachRound_andItsFailuresAreIgnored() {
        String id = scheduler.createPipeline(PROJECT, "observed", "", List.of(draft("A"), draft("B", "A")), null);
        Map<Integer, PipelineProgress> snapshots = new ConcurrentHashMap<>();
        AtomicInteger calls = new AtomicInteger();

        PipelineProgress progress = scheduler.runPipeline(id,
                chunk -> ExecutionOutcome.success(List.of(), List.of(), 0, 0),
                p -> {
                    snapshots.put(calls.incrementAndGet(), p);
                    throw new IllegalStateException("listener bug");
                });

        assertThat(progress.status()).isEqualTo(PipelineStatus.COMPLETED);
        assertThat(snapshots).hasSize(2);
        assertThat(snapshots.get(1).completedChunks()).isEqualTo(1);
        assertThat(snapshots.get(1).progressPercent()).isEqualTo(50);
        assertThat(snapshots.get(2).status()).isEqualTo(PipelineStatus.COMPLETED);
    }

    @Test
    void runPipeline_outputIsStoredOnChunk() {
        String id = scheduler.createPipeline(PROJECT, "output", "", List.of(draft("A")), null);

        scheduler.runPipeline(id, chunk ->
                ExecutionOutcome.success(List.of("A.java"), List.of("pom.xml"), 42, 7).withOutput("class A {}"));

        Chunk chunk = store.findChunk(id, "A").orElseThrow();
        assertThat(chunk.getOutput()).isEqualTo("class A {}");
        assertThat(chunk.getActualTokens()).isEqualTo(42);
        assertThat(chunk.getFilesCreated()).containsExactly("A.java");
        assertThat(chunk.getFilesModified()).containsExactly("pom.xml");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static ChunkDraft draft(String id, String... dependsOn) {
        return ChunkDraft.builder(ChunkType.COMPONENT, "chunk " + id)
                .id(id)
                .prompt("generate " + id)
                .dependsOn(dependsOn)
                .build();
    }
}
