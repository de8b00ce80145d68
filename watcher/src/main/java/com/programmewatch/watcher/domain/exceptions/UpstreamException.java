package com.programmewatch.watcher.domain.exceptions;

import lombok.Getter;

/**
 * Failure of the affiliate network. TRANSIENT failures (timeouts, 5xx, rate limits)
 * are retried by the next scheduled tick; PERMANENT ones (rejected credentials,
 * schema mismatch) need an operator.
 */
@Getter
public class UpstreamException extends RuntimeException {

    public enum Kind {
        TRANSIENT,
        PERMANENT
    }

    private final Kind kind;
    private final String marketKey;

    private UpstreamException(Kind kind, String marketKey, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.marketKey = marketKey;
    }

    public static UpstreamException transientFailure(String marketKey, String message, Throwable cause) {
        return new UpstreamException(Kind.TRANSIENT, marketKey, message, cause);
    }

    public static UpstreamException permanentFailure(String marketKey, String message, Throwable cause) {
        return new UpstreamException(Kind.PERMANENT, marketKey, message, cause);
    }

    public static UpstreamException schemaMismatch(String marketKey, String detail, Throwable cause) {
        return permanentFailure(marketKey, "Unexpected programme payload for market " + marketKey + ": " + detail, cause);
    }

    public boolean isPermanent() {
        return kind == Kind.PERMANENT;
    }
}
