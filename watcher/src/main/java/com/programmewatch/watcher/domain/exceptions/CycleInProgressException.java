package com.programmewatch.watcher.domain.exceptions;

public class CycleInProgressException extends RuntimeException {

    private CycleInProgressException(String message) {
        super(message);
    }

    public static CycleInProgressException of(String marketKey) {
        return new CycleInProgressException("A cycle is already running for market " + marketKey);
    }
}
