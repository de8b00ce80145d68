package com.programmewatch.watcher.application.controller.market;

import com.programmewatch.watcher.domain.cycle.CycleOutcome;
import com.programmewatch.watcher.domain.cycle.CyclePhase;
import java.time.Instant;

public record MarketStatusResponse(
        String marketKey,
        CyclePhase phase,
        CycleOutcome lastOutcome,
        String lastCycleId,
        Instant lastStartedAt,
        Instant lastFinishedAt,
        String lastError,
        int consecutiveAborts,
        int lastChangeCount) {}
