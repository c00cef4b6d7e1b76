package com.chunkforge.engine.generation;

import com.chunkforge.engine.cache.ChatMessage;

import java.util.List;

/**
 * One call to the {@link GenerationBackend}.
 *
 * @param reusableTokens tokens at the start of the conversation the backend
 *                       already processed recently; 0 when nothing is reusable
 */
public record GenerationRequest(String projectId,
                                String model,
                                String systemPrompt,
                                List<ChatMessage> messages,
                                int reusableTokens) {

    public GenerationRequest {
        messages = List.copyOf(messages);
    }
}
