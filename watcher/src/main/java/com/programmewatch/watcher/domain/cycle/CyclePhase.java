package com.programmewatch.watcher.domain.cycle;

/**
 * Phases of one market's cycle:
 * IDLE → FETCHING → DIFFING → DISPATCHING → COMMITTING → IDLE, or ABORTED from any
 * of them. An aborted market starts again from IDLE on its next tick.
 */
public enum CyclePhase {
    IDLE,
    FETCHING,
    DIFFING,
    DISPATCHING,
    COMMITTING,
    ABORTED
}
