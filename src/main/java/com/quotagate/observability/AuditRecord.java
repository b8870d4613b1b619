package com.quotagate.observability;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Policy-relevant outcome kept for compliance: denials and fail-opens only.
 */
@Value
@Builder
public class AuditRecord {

    public enum Outcome {
        DENIED,
        FAIL_OPEN
    }

    Outcome outcome;

    String operationId;

    String key;

    /**
     * Client address, when the boundary knows it
     */
    String clientAddress;

    String principalId;

    /**
     * Request path at the boundary, null for programmatic checks
     */
    String path;

    long limit;

    double retryAfterSeconds;

    /**
     * Fail-open cause; null for denials
     */
    FailOpenReason reason;

    Instant occurredAt;
}
