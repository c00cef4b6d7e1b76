package com.chunkforge.engine.cache;

/**
 * A single message in a conversation with the generation backend.
 * role is "user" or "assistant".
 */
public record ChatMessage(String role, String content) {

    public ChatMessage {
        if (role == null) throw new IllegalArgumentException("role is required");
        if (content == null) content = "";
    }

    public static ChatMessage user(String content)      { return new ChatMessage("user", content); }
    public static ChatMessage assistant(String content) { return new ChatMessage("assistant", content); }
}
