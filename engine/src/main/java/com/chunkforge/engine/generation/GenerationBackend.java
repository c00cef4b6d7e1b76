package com.chunkforge.engine.generation;

/**
 * The text-generation service that does the actual work of a chunk.
 * Implementations own transport, timeouts and retries on transient errors.
 */
@FunctionalInterface
public interface GenerationBackend {

    GenerationResponse generate(GenerationRequest request) throws Exception;
}
