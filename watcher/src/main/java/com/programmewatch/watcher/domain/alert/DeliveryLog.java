package com.programmewatch.watcher.domain.alert;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Most recent terminal delivery records across all markets, newest first.
 * Bounded: the oldest record is evicted once {@code capacity} is reached.
 */
public class DeliveryLog {

    private final int capacity;
    private final Deque<DeliveryRecord> records = new ArrayDeque<>();

    public DeliveryLog(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive, got " + capacity);
        }
        this.capacity = capacity;
    }

    public synchronized void append(DeliveryRecord record) {
        if (records.size() == capacity) {
            records.removeLast();
        }
        records.addFirst(record);
    }

    /** @param status filter, or {@code null} for every status */
    public synchronized List<DeliveryRecord> recent(DeliveryStatus status, int limit) {
        var result = new ArrayList<DeliveryRecord>(Math.min(limit, records.size()));
        for (var record : records) {
            if (result.size() >= limit) {
                break;
            }
            if (status == null || record.status() == status) {
                result.add(record);
            }
        }
        return result;
    }

    public synchronized int size() {
        return records.size();
    }

    public int capacity() {
        return capacity;
    }
}
