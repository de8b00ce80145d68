package com.programmewatch.watcher.domain.alert;

import java.time.Duration;
import lombok.Builder;

/**
 * Exponential backoff between notification attempts:
 * {@code backoffBase * backoffFactor^(attempt - 1)}, never above {@code backoffMax}.
 */
@Builder
public record RetryPolicy(int maxAttempts, Duration backoffBase, double backoffFactor, Duration backoffMax) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got " + maxAttempts);
        }
        if (backoffBase == null || backoffBase.isNegative()) {
            throw new IllegalArgumentException("backoffBase must be zero or positive");
        }
        if (backoffFactor < 1.0) {
            throw new IllegalArgumentException("backoffFactor must be at least 1.0, got " + backoffFactor);
        }
        if (backoffMax == null || backoffMax.compareTo(backoffBase) < 0) {
            backoffMax = backoffBase;
        }
    }

    /** Delay to wait after the given (1-based) attempt failed. */
    public Duration delayAfter(int failedAttempt) {
        var millis = backoffBase.toMillis() * Math.pow(backoffFactor, Math.max(0, failedAttempt - 1));
        if (millis >= backoffMax.toMillis()) {
            return backoffMax;
        }
        return Duration.ofMillis(Math.round(millis));
    }

    public boolean exhaustedAfter(int attempt) {
        return attempt >= maxAttempts;
    }
}
