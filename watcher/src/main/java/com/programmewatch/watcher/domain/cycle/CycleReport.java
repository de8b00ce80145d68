package com.programmewatch.watcher.domain.cycle;

import com.programmewatch.watcher.domain.alert.DeliveryRecord;
import com.programmewatch.watcher.domain.change.Change;
import java.time.Instant;
import java.util.List;
import lombok.Builder;

@Builder(toBuilder = true)
public record CycleReport(
        String cycleId,
        String marketKey,
        CycleOutcome outcome,
        List<Change> changes,
        List<DeliveryRecord> deliveries,
        boolean committed,
        Instant startedAt,
        Instant finishedAt,
        String error) {

    public CycleReport {
        changes = changes == null ? List.of() : List.copyOf(changes);
        deliveries = deliveries == null ? List.of() : List.copyOf(deliveries);
    }

    public static CycleReport aborted(String cycleId, String marketKey, Instant startedAt, Instant finishedAt, String error) {
        return CycleReport.builder()
                .cycleId(cycleId)
                .marketKey(marketKey)
                .outcome(CycleOutcome.ABORTED)
                .committed(false)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .error(error)
                .build();
    }

    public long deliveredCount() {
        return deliveries.stream().filter(DeliveryRecord::isDelivered).count();
    }

    public long failedCount() {
        return deliveries.stream().filter(DeliveryRecord::isFailed).count();
    }
}
