package com.chunkforge.engine;

import com.chunkforge.engine.cache.PromptCache;
import com.chunkforge.engine.model.ChunkDraft;
import com.chunkforge.engine.model.ChunkType;
import com.chunkforge.engine.model.PipelineConfig;
import com.chunkforge.engine.model.PipelineStatus;
import com.chunkforge.engine.scheduler.ExecutionOutcome;
import com.chunkforge.engine.scheduler.PipelineProgress;
import com.chunkforge.engine.scheduler.PipelineScheduler;
import com.chunkforge.engine.store.ChunkStore;
import com.chunkforge.engine.store.JpaChunkStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Full context on H2 with the JPA store: wiring, property binding and one
 * pipeline run through the real beans.
 */
@SpringBootTest(properties = {
        "chunkforge.store.type=jpa",
        "chunkforge.cache.max-entries=50"
})
class EngineApplicationTest {

    @Autowired PipelineScheduler scheduler;
    @Autowired ChunkStore        store;
    @Autowired PromptCache       cache;
    @Autowired MeterRegistry     meterRegistry;

    @Test
    void contextWiresJpaStoreAndCache() {
        assertThat(store).isInstanceOf(JpaChunkStore.class);
        assertThat(cache.isEnabled()).isTrue();
    }

    @Test
    void pipelineRunsAgainstDatabase() {
        String id = scheduler.createPipeline("wiring", "smoke", "two chunks", List.of(
                ChunkDraft.builder(ChunkType.SCHEMA, "tables").id("wiring-tables").build(),
                ChunkDraft.builder(ChunkType.API, "endpoints").id("wiring-api").dependsOn("wiring-tables").build()),
                PipelineConfig.defaults().withParallelism(2));

        PipelineProgress progress = scheduler.runPipeline(id, chunk ->
                ExecutionOutcome.success(List.of(chunk.getId() + ".sql"), List.of(), 25, 3));

        assertThat(progress.status()).isEqualTo(PipelineStatus.COMPLETED);
        assertThat(progress.completedChunks()).isEqualTo(2);
        assertThat(progress.stats().totalTokensUsed()).isEqualTo(50);
        assertThat(scheduler.getProjectPipelines("wiring")).hasSize(1);
        assertThat(meterRegistry.find("chunkforge.chunk.duration").timers()).isNotEmpty();
    }

    @Test
    void secondPipelineReusingChunkIdsRunsAgainstDatabase() {
        List<ChunkDraft> drafts = List.of(
                ChunkDraft.builder(ChunkType.SCHEMA, "tables").id("schema").build(),
                ChunkDraft.builder(ChunkType.API, "endpoints").id("api").dependsOn("schema").build());

        String first = scheduler.createPipeline("reuse", "v1", "", drafts, null);
        scheduler.runPipeline(first, chunk -> ExecutionOutcome.success(List.of(), List.of(), 1, 1));
        String second = scheduler.createPipeline("reuse", "v2", "", drafts, null);
        PipelineProgress progress = scheduler.runPipeline(second, chunk ->
                ExecutionOutcome.success(List.of(), List.of(), 1, 1));

        assertThat(progress.status()).isEqualTo(PipelineStatus.COMPLETED);
        assertThat(progress.completedChunks()).isEqualTo(2);
        assertThat(scheduler.getProjectChunks("reuse")).hasSize(4);
    }
}
