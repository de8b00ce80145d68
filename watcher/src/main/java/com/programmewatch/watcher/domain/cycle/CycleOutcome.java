package com.programmewatch.watcher.domain.cycle;

public enum CycleOutcome {
    /** Snapshot committed; every dispatched alert delivered. */
    COMPLETED,
    /** Snapshot committed; at least one alert ended FAILED. */
    DEGRADED,
    /** Nothing committed; the next tick repeats the comparison. */
    ABORTED
}
