package com.chunkforge.engine.scheduler;

import com.chunkforge.engine.model.ChunkDraft;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Validation of a submitted chunk set before it is persisted.
 */
final class ChunkGraph {

    private enum Mark { VISITING, DONE }

    private ChunkGraph() {}

    /** Give every draft without an id a random UUID. */
    static List<ChunkDraft> assignIds(List<ChunkDraft> drafts) {
        List<ChunkDraft> withIds = new ArrayList<>(drafts.size());
        for (ChunkDraft draft : drafts) {
            withIds.add(draft.id() == null ? draft.withId(UUID.randomUUID().toString()) : draft);
        }
        return withIds;
    }

    /**
     * Reject duplicate ids and dependency cycles.
     *
     * @return dependency ids that name no draft in this submission; chunks
     *         depending on them can never become ready
     * @throws InvalidChunkGraphException on a duplicate id or a cycle
     */
    static Set<String> validate(List<ChunkDraft> drafts) {
        Map<String, ChunkDraft> byId = new LinkedHashMap<>();
        for (ChunkDraft draft : drafts) {
            if (byId.put(draft.id(), draft) != null) {
                throw new InvalidChunkGraphException("Duplicate chunk id: " + draft.id());
            }
        }

        Set<String> dangling = new LinkedHashSet<>();
        for (ChunkDraft draft : drafts) {
            for (String dep : draft.dependencies()) {
                if (!byId.containsKey(dep)) dangling.add(dep);
            }
        }

        Map<String, Mark> marks = new HashMap<>();
        for (String id : byId.keySet()) {
            if (!marks.containsKey(id)) {
                visit(id, byId, marks, new ArrayDeque<>());
            }
        }
        return dangling;
    }

    // Depth-first search; a VISITING node reached again closes a cycle.
    private static void visit(String id, Map<String, ChunkDraft> byId,
                              Map<String, Mark> marks, Deque<String> path) {
        marks.put(id, Mark.VISITING);
        path.addLast(id);
        for (String dep : byId.get(id).dependencies()) {
            if (!byId.containsKey(dep)) continue;
            Mark mark = marks.get(dep);
            if (mark == Mark.VISITING) {
                throw new InvalidChunkGraphException("Dependency cycle: " + describeCycle(path, dep));
            }
            if (mark == null) {
                visit(dep, byId, marks, path);
            }
        }
        path.removeLast();
        marks.put(id, Mark.DONE);
    }

    private static String describeCycle(Deque<String> path, String closingId) {
        List<String> cycle = new ArrayList<>();
        boolean inCycle = false;
        Set<String> seen = new HashSet<>();
        for (String id : path) {
            if (id.equals(closingId)) inCycle = true;
            if (inCycle && seen.add(id)) cycle.add(id);
        }
        cycle.add(closingId);
        return String.join(" -> ", cycle);
    }
}
