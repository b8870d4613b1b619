package com.quotagate.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Outcome of one admission check. Ephemeral: returned to the caller, never stored.
 */
@Value
@Builder
@Jacksonized
public class Decision {

    boolean allowed;

    /**
     * Seconds until enough tokens exist for the same cost; 0 when allowed
     */
    double retryAfterSeconds;

    /**
     * Whole tokens left after this check, truncated so quota is never over-reported
     */
    long remainingTokens;

    /**
     * Bucket capacity, or 0 when no rule governed the check
     */
    long limit;

    /**
     * Seconds until the bucket is full again
     */
    long resetSeconds;

    /**
     * Admission used when the limiter cannot enforce a rule. The caller keeps
     * its full quota: a failure is never charged against it.
     */
    public static Decision failOpen(RateLimitRule rule) {
        return Decision.builder()
                .allowed(true)
                .retryAfterSeconds(0.0)
                .remainingTokens(rule.getCapacity())
                .limit(rule.getCapacity())
                .resetSeconds(0)
                .build();
    }

    /**
     * Admission for operations no rule governs.
     */
    public static Decision unmetered() {
        return Decision.builder()
                .allowed(true)
                .retryAfterSeconds(0.0)
                .remainingTokens(0)
                .limit(0)
                .resetSeconds(0)
                .build();
    }

    @JsonIgnore
    public boolean isMetered() {
        return limit > 0;
    }
}
