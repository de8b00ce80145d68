package com.programmewatch.watcher.application.controller.market;

import com.programmewatch.watcher.application.controller.delivery.DeliveryRecordResponse;
import com.programmewatch.watcher.domain.cycle.CycleOutcome;
import java.time.Instant;
import java.util.List;

public record CycleReportResponse(
        String cycleId,
        String marketKey,
        CycleOutcome outcome,
        List<ChangeResponse> changes,
        List<DeliveryRecordResponse> deliveries,
        boolean committed,
        Instant startedAt,
        Instant finishedAt,
        String error) {}
