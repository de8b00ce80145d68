package com.programmewatch.watcher.domain.cycle;

import java.time.Instant;
import lombok.Builder;

/** Operator view of one market's scheduling state. */
@Builder(toBuilder = true)
public record MarketStatus(
        String marketKey,
        CyclePhase phase,
        CycleOutcome lastOutcome,
        String lastCycleId,
        Instant lastStartedAt,
        Instant lastFinishedAt,
        String lastError,
        int consecutiveAborts,
        int lastChangeCount) {

    public static MarketStatus idle(String marketKey) {
        return MarketStatus.builder()
                .marketKey(marketKey)
                .phase(CyclePhase.IDLE)
                .build();
    }

    public MarketStatus after(CycleReport report) {
        var aborted = report.outcome() == CycleOutcome.ABORTED;
        return toBuilder()
                .phase(aborted ? CyclePhase.ABORTED : CyclePhase.IDLE)
                .lastOutcome(report.outcome())
                .lastCycleId(report.cycleId())
                .lastStartedAt(report.startedAt())
                .lastFinishedAt(report.finishedAt())
                .lastError(report.error())
                .consecutiveAborts(aborted ? consecutiveAborts + 1 : 0)
                .lastChangeCount(aborted ? lastChangeCount : report.changes().size())
                .build();
    }
}
