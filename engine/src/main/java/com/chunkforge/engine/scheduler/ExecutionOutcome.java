package com.chunkforge.engine.scheduler;

import java.util.List;

/**
 * Structured result of one {@link ChunkExecutor} call.
 *
 * @param output raw generated text, stored on the chunk when non-null
 */
public record ExecutionOutcome(boolean success,
                               List<String> filesCreated,
                               List<String> filesModified,
                               List<String> errors,
                               long tokensUsed,
                               long linesGenerated,
                               String output) {

    public ExecutionOutcome {
        filesCreated  = filesCreated  == null ? List.of() : List.copyOf(filesCreated);
        filesModified = filesModified == null ? List.of() : List.copyOf(filesModified);
        errors        = errors        == null ? List.of() : List.copyOf(errors);
    }

    public static ExecutionOutcome success(List<String> filesCreated, List<String> filesModified,
                                           long tokensUsed, long linesGenerated) {
        return new ExecutionOutcome(true, filesCreated, filesModified, List.of(), tokensUsed, linesGenerated, null);
    }

    public static ExecutionOutcome failure(String... errors) {
        return new ExecutionOutcome(false, List.of(), List.of(), List.of(errors), 0, 0, null);
    }

    public ExecutionOutcome withOutput(String text) {
        return new ExecutionOutcome(success, filesCreated, filesModified, errors, tokensUsed, linesGenerated, text);
    }
}
