package com.programmewatch.watcher.domain.alert;

import com.programmewatch.watcher.domain.change.Change;
import java.time.Instant;
import lombok.Builder;

@Builder(toBuilder = true)
public record DeliveryRecord(
        String id,
        Change change,
        int attempts,
        Instant lastAttemptAt,
        DeliveryStatus status,
        String lastError) {

    public static DeliveryRecord pending(String id, Change change) {
        return DeliveryRecord.builder()
                .id(id)
                .change(change)
                .attempts(0)
                .status(DeliveryStatus.PENDING)
                .build();
    }

    public boolean isDelivered() {
        return status == DeliveryStatus.DELIVERED;
    }

    public boolean isFailed() {
        return status == DeliveryStatus.FAILED;
    }
}
