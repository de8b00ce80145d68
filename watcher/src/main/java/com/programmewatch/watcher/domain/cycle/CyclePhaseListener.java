package com.programmewatch.watcher.domain.cycle;

@FunctionalInterface
public interface CyclePhaseListener {

    CyclePhaseListener NONE = phase -> {};

    void onPhase(CyclePhase phase);
}
