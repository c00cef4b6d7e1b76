package com.chunkforge.engine.model;

/**
 * Execution policy of a pipeline. Every recognised option is listed here:
 *
 * <ul>
 *   <li>{@code parallelism}: max chunks executed in one round (≥ 1)</li>
 *   <li>{@code stopOnError}: abort the pipeline after a round with a terminal chunk failure</li>
 *   <li>{@code autoRetry}: put failed chunks back to PENDING while retries remain</li>
 *   <li>{@code maxContextTokens}: context budget handed to executors (&gt; 0)</li>
 * </ul>
 */
public record PipelineConfig(int parallelism,
                             boolean stopOnError,
                             boolean autoRetry,
                             int maxContextTokens) {

    public static final int DEFAULT_MAX_CONTEXT_TOKENS = 32_000;

    public PipelineConfig {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1, got " + parallelism);
        }
        if (maxContextTokens < 1) {
            throw new IllegalArgumentException("maxContextTokens must be > 0, got " + maxContextTokens);
        }
    }

    public static PipelineConfig defaults() {
        return new PipelineConfig(1, false, true, DEFAULT_MAX_CONTEXT_TOKENS);
    }

    public PipelineConfig withParallelism(int parallelism) {
        return new PipelineConfig(parallelism, stopOnError, autoRetry, maxContextTokens);
    }

    public PipelineConfig withStopOnError(boolean stopOnError) {
        return new PipelineConfig(parallelism, stopOnError, autoRetry, maxContextTokens);
    }

    public PipelineConfig withAutoRetry(boolean autoRetry) {
        return new PipelineConfig(parallelism, stopOnError, autoRetry, maxContextTokens);
    }
}
