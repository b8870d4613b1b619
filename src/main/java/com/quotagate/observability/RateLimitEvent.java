package com.quotagate.observability;

import com.quotagate.core.RateLimitScope;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published for every check (CHECKED), then for its outcome
 * (ALLOWED, DENIED or FAIL_OPEN).
 */
@Value
@Builder
public class RateLimitEvent {

    @Builder.Default
    UUID eventId = UUID.randomUUID();

    RateLimitEventType type;

    String operationId;

    /**
     * Bucket key, null when the check failed before a key existed
     */
    String key;

    RateLimitScope scope;

    int cost;

    long remainingTokens;

    double retryAfterSeconds;

    long latencyNanos;

    /**
     * Only set on FAIL_OPEN events
     */
    FailOpenReason failOpenReason;

    Instant occurredAt;
}
