package com.chunkforge.engine.config;

import com.chunkforge.engine.cache.PromptCache;
import com.chunkforge.engine.repository.ChunkRepository;
import com.chunkforge.engine.repository.PipelineRepository;
import com.chunkforge.engine.store.ChunkStore;
import com.chunkforge.engine.store.InMemoryChunkStore;
import com.chunkforge.engine.store.JpaChunkStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Engine wiring: time source, worker pool, chunk store and prompt cache.
 *
 * The chunk store is chosen by {@code chunkforge.store.type}:
 * <ul>
 *   <li>{@code memory} (default): {@link InMemoryChunkStore}</li>
 *   <li>{@code jpa}: {@link JpaChunkStore} on the configured datasource</li>
 * </ul>
 */
@Configuration
public class EngineConfiguration {

    private static final Logger log = LoggerFactory.getLogger(EngineConfiguration.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Shared by every running pipeline; per-pipeline concurrency is capped by its parallelism. */
    @Bean(name = "chunkWorkers", destroyMethod = "shutdown")
    public ExecutorService chunkWorkers(SchedulerProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(properties.workerThreads(), r -> {
            Thread t = new Thread(r, "chunk-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        log.info("Chunk worker pool started: threads={}", properties.workerThreads());
        return pool;
    }

    @Bean
    @ConditionalOnProperty(prefix = "chunkforge.store", name = "type", havingValue = "memory", matchIfMissing = true)
    public ChunkStore inMemoryChunkStore(Clock clock) {
        log.info("Chunk store: in-memory");
        return new InMemoryChunkStore(clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "chunkforge.store", name = "type", havingValue = "jpa")
    public ChunkStore jpaChunkStore(PipelineRepository pipelineRepo, ChunkRepository chunkRepo, Clock clock) {
        log.info("Chunk store: JPA");
        return new JpaChunkStore(pipelineRepo, chunkRepo, clock);
    }

    @Bean(destroyMethod = "shutdown")
    public PromptCache promptCache(PromptCacheProperties properties, ObjectMapper objectMapper,
                                   MeterRegistry meterRegistry, Clock clock) {
        log.info("Prompt cache: enabled={} maxEntries={} maxTotalTokens={} ttl={}",
                properties.enabled(), properties.maxEntries(), properties.maxTotalTokens(), properties.ttl());
        return new PromptCache(properties, objectMapper, meterRegistry, clock);
    }
}
