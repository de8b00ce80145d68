package com.programmewatch.watcher.domain.exceptions;

import com.programmewatch.watcher.domain.cycle.CyclePhase;
import lombok.Getter;

/** Ends one market's cycle without advancing its persisted snapshot. */
@Getter
public class CycleAbortedException extends RuntimeException {

    private final String marketKey;
    private final CyclePhase phase;

    private CycleAbortedException(String marketKey, CyclePhase phase, String message, Throwable cause) {
        super(message, cause);
        this.marketKey = marketKey;
        this.phase = phase;
    }

    public static CycleAbortedException of(String marketKey, CyclePhase phase, Throwable cause) {
        return new CycleAbortedException(
                marketKey, phase, "Cycle for market " + marketKey + " aborted in " + phase + ": " + cause.getMessage(), cause);
    }

    public static CycleAbortedException interrupted(String marketKey, CyclePhase phase, InterruptedException cause) {
        return new CycleAbortedException(
                marketKey, phase, "Cycle for market " + marketKey + " interrupted in " + phase, cause);
    }
}
