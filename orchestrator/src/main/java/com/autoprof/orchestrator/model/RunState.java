package com.autoprof.orchestrator.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a submitted run.
 *
 * Transitions:
 *   QUEUED  → RUNNING (picked up by a run thread)
 *   RUNNING → DONE    (at least one image succeeded)
 *   RUNNING → FAILED  (every image failed, or the run itself errored)
 */
public enum RunState {
    QUEUED,
    RUNNING,
    DONE,
    FAILED;

    public boolean isActive() {
        return this == QUEUED || this == RUNNING;
    }

    public static Set<RunState> active() {
        return EnumSet.of(QUEUED, RUNNING);
    }

    public static Set<RunState> finished() {
        return EnumSet.of(DONE, FAILED);
    }
}
