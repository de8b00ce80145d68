package com.programmewatch.watcher.application.controller.delivery;

import com.programmewatch.watcher.domain.alert.DeliveryStatus;
import com.programmewatch.watcher.domain.change.ChangeKind;
import java.time.Instant;

public record DeliveryRecordResponse(
        String id,
        String marketKey,
        String programmeId,
        String programmeName,
        ChangeKind kind,
        DeliveryStatus status,
        int attempts,
        Instant lastAttemptAt,
        String lastError) {}
