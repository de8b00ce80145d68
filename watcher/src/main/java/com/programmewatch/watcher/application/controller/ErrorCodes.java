package com.programmewatch.watcher.application.controller;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class ErrorCodes {

    public static final String MARKET_NOT_FOUND = "MARKET_NOT_FOUND";
    public static final String CYCLE_IN_PROGRESS = "CYCLE_IN_PROGRESS";
    public static final String INVALID_REQUEST = "INVALID_REQUEST";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";
}
