package com.programmewatch.watcher.domain.exceptions;

public class NotifyException extends RuntimeException {

    private NotifyException(String message, Throwable cause) {
        super(message, cause);
    }

    public static NotifyException of(String message, Throwable cause) {
        return new NotifyException(message, cause);
    }

    public static NotifyException noRecipients() {
        return new NotifyException("No recipients configured", null);
    }
}
