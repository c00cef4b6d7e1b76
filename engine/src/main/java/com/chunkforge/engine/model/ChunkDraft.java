package com.chunkforge.engine.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Caller-side description of one chunk, submitted with a new pipeline.
 *
 * {@code id} is optional: when null the scheduler assigns a UUID. Dependencies
 * name the ids of other drafts in the same submission.
 * {@code priority}, {@code estimatedTokens} and {@code maxRetries} fall back to
 * the chunk type's priority, the prompt's token estimate and 3 respectively.
 */
public record ChunkDraft(String id,
                         ChunkType type,
                         String title,
                         String description,
                         String prompt,
                         List<String> targetFiles,
                         List<String> dependencies,
                         List<String> contextFiles,
                         Integer priority,
                         Integer estimatedTokens,
                         Integer maxRetries,
                         String parentChunkId) {

    public static final int DEFAULT_MAX_RETRIES = 3;

    // Compact constructor: null lists become empty, required fields checked.
    public ChunkDraft {
        if (type == null) throw new IllegalArgumentException("chunk type is required");
        if (title == null || title.isBlank()) throw new IllegalArgumentException("chunk title is required");
        if (maxRetries != null && maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, got " + maxRetries);
        }
        targetFiles  = targetFiles  == null ? List.of() : List.copyOf(targetFiles);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        contextFiles = contextFiles == null ? List.of() : List.copyOf(contextFiles);
        if (prompt == null) prompt = "";
    }

    public ChunkDraft withId(String newId) {
        return new ChunkDraft(newId, type, title, description, prompt, targetFiles, dependencies,
                contextFiles, priority, estimatedTokens, maxRetries, parentChunkId);
    }

    public int effectivePriority() {
        return priority != null ? priority : type.defaultPriority();
    }

    public int effectiveMaxRetries() {
        return maxRetries != null ? maxRetries : DEFAULT_MAX_RETRIES;
    }

    public static Builder builder(ChunkType type, String title) {
        return new Builder(type, title);
    }

    public static class Builder {
        private final ChunkType type;
        private final String title;
        private String id;
        private String description;
        private String prompt = "";
        private final List<String> targetFiles  = new ArrayList<>();
        private final List<String> dependencies = new ArrayList<>();
        private final List<String> contextFiles = new ArrayList<>();
        private Integer priority;
        private Integer estimatedTokens;
        private Integer maxRetries;
        private String parentChunkId;

        private Builder(ChunkType type, String title) {
            this.type  = type;
            this.title = title;
        }

        public Builder id(String id)                     { this.id = id; return this; }
        public Builder description(String description)   { this.description = description; return this; }
        public Builder prompt(String prompt)             { this.prompt = prompt; return this; }
        public Builder targetFiles(String... files)      { targetFiles.addAll(Arrays.asList(files)); return this; }
        public Builder dependsOn(String... ids)          { dependencies.addAll(Arrays.asList(ids)); return this; }
        public Builder contextFiles(String... files)     { contextFiles.addAll(Arrays.asList(files)); return this; }
        public Builder priority(int priority)            { this.priority = priority; return this; }
        public Builder estimatedTokens(int tokens)       { this.estimatedTokens = tokens; return this; }
        public Builder maxRetries(int maxRetries)        { this.maxRetries = maxRetries; return this; }
        public Builder parentChunkId(String parentId)    { this.parentChunkId = parentId; return this; }

        public ChunkDraft build() {
            return new ChunkDraft(id, type, title, description, prompt, targetFiles, dependencies,
                    contextFiles, priority, estimatedTokens, maxRetries, parentChunkId);
        }
    }
}
