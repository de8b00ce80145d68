package com.programmewatch.watcher.domain.exceptions;

public class StorageException extends RuntimeException {

    private StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    public static StorageException readFailed(String marketKey, Object location, Throwable cause) {
        return new StorageException("Cannot read snapshot of market " + marketKey + " from " + location, cause);
    }

    public static StorageException corrupt(String marketKey, Object location, Throwable cause) {
        return new StorageException("Snapshot of market " + marketKey + " at " + location + " is unreadable", cause);
    }

    public static StorageException writeFailed(String marketKey, Object location, Throwable cause) {
        return new StorageException("Cannot commit snapshot of market " + marketKey + " to " + location, cause);
    }
}
