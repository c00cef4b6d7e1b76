package com.chunkforge.engine.model;

/**
 * Kind of generation work a chunk performs.
 * The default priority decides admission order when more chunks are ready than
 * the pipeline's parallelism allows (higher first).
 */
public enum ChunkType {
    ARCHITECTURE(100),
    SCHEMA(90),
    API(80),
    COMPONENT(70),
    STYLING(60),
    INTEGRATION(50),
    TESTING(40),
    DOCUMENTATION(30),
    REFACTOR(20);

    private final int defaultPriority;

    ChunkType(int defaultPriority) {
        this.defaultPriority = defaultPriority;
    }

    public int defaultPriority() {
        return defaultPriority;
    }
}
