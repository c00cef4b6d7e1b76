package com.chunkforge.engine.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a generation Pipeline.
 *
 * Transitions:
 *   PENDING → RUNNING (start)
 *   RUNNING ⇄ PAUSED  (pause / resume)
 *   RUNNING → COMPLETED | FAILED (run loop finished, deadlock, stop-on-error)
 *   PENDING | RUNNING | PAUSED → CANCELLED
 */
public enum PipelineStatus {
    PENDING,
    RUNNING,
    PAUSED,
    COMPLETED,
    FAILED,
    CANCELLED;

    public static final Set<PipelineStatus> TERMINAL = EnumSet.of(COMPLETED, FAILED, CANCELLED);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }
}
