package com.quotagate.storage;

import com.quotagate.core.RateLimitException;

/**
 * The shared store could not complete an operation. Every transport fault
 * surfaces as this single condition; callers decide the fallback.
 */
public class StorageException extends RateLimitException {

    public enum Reason {
        UNAVAILABLE,
        TIMEOUT,
        BAD_RESPONSE
    }

    private final Reason reason;

    public StorageException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public StorageException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
