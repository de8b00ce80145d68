package com.programmewatch.watcher.domain.exceptions;

public class UnknownMarketException extends RuntimeException {

    private UnknownMarketException(String message) {
        super(message);
    }

    public static UnknownMarketException of(String marketKey) {
        return new UnknownMarketException("Market is not watched: " + marketKey);
    }
}
