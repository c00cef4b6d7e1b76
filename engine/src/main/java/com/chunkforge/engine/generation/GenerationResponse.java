package com.chunkforge.engine.generation;

import java.util.List;

public record GenerationResponse(String text,
                                 List<String> filesCreated,
                                 List<String> filesModified,
                                 long tokensUsed,
                                 long linesGenerated) {

    public GenerationResponse {
        filesCreated  = filesCreated  == null ? List.of() : List.copyOf(filesCreated);
        filesModified = filesModified == null ? List.of() : List.copyOf(filesModified);
    }
}
