package com.programmewatch.watcher.domain.alert;

public enum DeliveryStatus {
    PENDING,
    DELIVERED,
    FAILED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
