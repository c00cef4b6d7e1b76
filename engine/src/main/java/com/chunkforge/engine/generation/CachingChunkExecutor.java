package com.chunkforge.engine.generation;

import com.chunkforge.engine.cache.CacheHit;
import com.chunkforge.engine.cache.ChatMessage;
import com.chunkforge.engine.cache.PromptCache;
import com.chunkforge.engine.model.Chunk;
import com.chunkforge.engine.scheduler.ChunkExecutor;
import com.chunkforge.engine.scheduler.ExecutionOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * {@link ChunkExecutor} that sends each chunk to a {@link GenerationBackend},
 * consulting the {@link PromptCache} first and recording the conversation after.
 *
 * Conversation layout:
 * <pre>
 *   [preamble messages...]   shared by every chunk of a pipeline
 *   user: chunk request      title, description, prompt, target and context files
 * </pre>
 * Because the preamble is identical across chunks, later chunks of the same
 * project hit the cache through a prefix match and the backend is told how many
 * leading tokens it can reuse.
 *
 * After a successful call the conversation, including the assistant reply, is
 * stored. A retry of the same chunk then matches it through its full request
 * prefix.
 */
public class CachingChunkExecutor implements ChunkExecutor {

    private static final Logger log = LoggerFactory.getLogger(CachingChunkExecutor.class);

    private final GenerationBackend backend;
    private final PromptCache       cache;
    private final String            model;
    private final String            systemPrompt;
    private final List<ChatMessage> preamble;

    public CachingChunkExecutor(GenerationBackend backend, PromptCache cache,
                                String model, String systemPrompt, List<ChatMessage> preamble) {
        this.backend      = backend;
        this.cache        = cache;
        this.model        = model;
        this.systemPrompt = systemPrompt == null ? "" : systemPrompt;
        this.preamble     = List.copyOf(preamble);
    }

    @Override
    public ExecutionOutcome execute(Chunk chunk) {
        List<ChatMessage> conversation = new ArrayList<>(preamble);
        conversation.add(ChatMessage.user(renderRequest(chunk)));

        CacheHit hit = cache.findCacheHit(chunk.getProjectId(), systemPrompt, conversation, model);
        if (hit.hit()) {
            log.debug("Chunk {} reuses {} cached tokens (prefix={})",
                    chunk.getId(), hit.reusableTokens(), hit.prefixMatch());
        }

        GenerationResponse response;
        try {
            response = backend.generate(new GenerationRequest(
                    chunk.getProjectId(), model, systemPrompt, conversation, hit.reusableTokens()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ExecutionOutcome.failure("Generation interrupted");
        } catch (Exception e) {
            log.warn("Generation backend failed for chunk {}: {}", chunk.getId(), e.getMessage());
            return ExecutionOutcome.failure("Generation failed: " + e.getMessage());
        }

        if (response == null || response.text() == null || response.text().isBlank()) {
            return ExecutionOutcome.failure("Generation returned no content");
        }

        conversation.add(ChatMessage.assistant(response.text()));
        cache.storeContext(chunk.getProjectId(), systemPrompt, conversation, model, chunk.getType().name());

        return ExecutionOutcome.success(response.filesCreated(), response.filesModified(),
                        response.tokensUsed(), response.linesGenerated())
                .withOutput(response.text());
    }

    static String renderRequest(Chunk chunk) {
        StringBuilder sb = new StringBuilder();
        sb.append("## ").append(chunk.getTitle()).append(" (").append(chunk.getType()).append(")\n");
        if (chunk.getDescription() != null && !chunk.getDescription().isBlank()) {
            sb.append('\n').append(chunk.getDescription()).append('\n');
        }
        if (chunk.getPrompt() != null && !chunk.getPrompt().isBlank()) {
            sb.append('\n').append(chunk.getPrompt()).append('\n');
        }
        appendList(sb, "Target files", chunk.getTargetFiles());
        appendList(sb, "Context files", chunk.getContextFiles());
        return sb.toString();
    }

    private static void appendList(StringBuilder sb, String heading, List<String> items) {
        if (items.isEmpty()) return;
        sb.append('\n').append(heading).append(":\n");
        items.forEach(item -> sb.append("- ").append(item).append('\n'));
    }
}
