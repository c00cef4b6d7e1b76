package com.chunkforge.engine.decomposition;

import com.chunkforge.engine.model.ChunkDraft;
import com.chunkforge.engine.scheduler.InvalidChunkGraphException;
import com.chunkforge.engine.util.TokenEstimator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A request split into chunk drafts, with a suggested execution order.
 *
 * {@code parallelGroups} are dependency levels: every chunk in a group depends
 * only on chunks in earlier groups, so a group can run as one round.
 * {@code suggestedOrder} is the groups flattened, highest priority first
 * within a group.
 */
public record TaskDecomposition(List<ChunkDraft> chunks,
                                int estimatedTotalTokens,
                                List<String> suggestedOrder,
                                List<List<String>> parallelGroups) {

    public TaskDecomposition {
        chunks         = List.copyOf(chunks);
        suggestedOrder = List.copyOf(suggestedOrder);
        parallelGroups = parallelGroups.stream().map(List::copyOf).toList();
    }

    /**
     * Build a decomposition from drafts. Drafts without an id get
     * {@code chunk-<index>}. Dependencies on ids outside the list do not
     * hold a chunk back here.
     *
     * @throws InvalidChunkGraphException on a duplicate id or a dependency cycle
     */
    public static TaskDecomposition of(List<ChunkDraft> drafts) {
        Map<String, ChunkDraft> byId = new LinkedHashMap<>();
        for (int i = 0; i < drafts.size(); i++) {
            ChunkDraft draft = drafts.get(i);
            if (draft.id() == null) draft = draft.withId("chunk-" + i);
            if (byId.put(draft.id(), draft) != null) {
                throw new InvalidChunkGraphException("Duplicate chunk id: " + draft.id());
            }
        }

        List<String> inputOrder = new ArrayList<>(byId.keySet());
        Comparator<String> byPriority = Comparator
                .comparingInt((String id) -> byId.get(id).effectivePriority()).reversed()
                .thenComparingInt(inputOrder::indexOf);

        List<List<String>> groups = new ArrayList<>();
        Set<String> placed = new HashSet<>();
        List<String> remaining = new ArrayList<>(inputOrder);
        while (!remaining.isEmpty()) {
            List<String> level = new ArrayList<>();
            for (String id : remaining) {
                boolean ready = byId.get(id).dependencies().stream()
                        .allMatch(dep -> placed.contains(dep) || !byId.containsKey(dep));
                if (ready) level.add(id);
            }
            if (level.isEmpty()) {
                throw new InvalidChunkGraphException("Dependency cycle among chunks " + remaining);
            }
            level.sort(byPriority);
            groups.add(level);
            placed.addAll(level);
            remaining.removeAll(level);
        }

        int tokens = 0;
        for (ChunkDraft draft : byId.values()) {
            tokens += draft.estimatedTokens() != null
                    ? draft.estimatedTokens()
                    : TokenEstimator.estimate(draft.prompt());
        }

        List<String> order = groups.stream().flatMap(List::stream).toList();
        return new TaskDecomposition(new ArrayList<>(byId.values()), tokens, order, groups);
    }
}
