package com.chunkforge.engine.model;

import java.util.List;

/** Files produced and errors reported by one chunk execution. */
public record ChunkResult(List<String> filesCreated, List<String> filesModified, List<String> errors) {

    public ChunkResult {
        filesCreated  = filesCreated  == null ? List.of() : List.copyOf(filesCreated);
        filesModified = filesModified == null ? List.of() : List.copyOf(filesModified);
        errors        = errors        == null ? List.of() : List.copyOf(errors);
    }

    public static ChunkResult success(List<String> filesCreated, List<String> filesModified) {
        return new ChunkResult(filesCreated, filesModified, List.of());
    }

    public static ChunkResult failure(List<String> errors) {
        return new ChunkResult(List.of(), List.of(), errors);
    }
}
