package com.chunkforge.engine.store;

import com.chunkforge.engine.model.Chunk;
import com.chunkforge.engine.model.ChunkStatus;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Ready-chunk selection shared by the store implementations.
 */
final class ReadyChunks {

    /** Priority descending, then creation order. */
    static final Comparator<Chunk> SELECTION_ORDER = Comparator
            .comparingInt(Chunk::getPriority).reversed()
            .thenComparingLong(Chunk::getSequence);

    private ReadyChunks() {}

    /**
     * Pick up to {@code limit} ready chunks from one pipeline's chunks.
     * A dependency id that is not a chunk of this pipeline is never satisfied.
     */
    static List<Chunk> select(List<Chunk> pipelineChunks, int limit) {
        Map<String, ChunkStatus> statusById = pipelineChunks.stream()
                .collect(Collectors.toMap(Chunk::getId, Chunk::getStatus));

        List<Chunk> ordered = pipelineChunks.stream().sorted(SELECTION_ORDER).toList();
        List<Chunk> ready = new ArrayList<>();
        for (Chunk chunk : ordered) {
            if (ready.size() >= limit) break;
            if (chunk.getStatus() != ChunkStatus.PENDING) continue;
            boolean satisfied = chunk.getDependencies().stream()
                    .allMatch(dep -> statusById.get(dep) == ChunkStatus.COMPLETED);
            if (satisfied) ready.add(chunk);
        }
        return ready;
    }
}
