package com.quotagate.core;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Token bucket state as held by the shared store.
 * Tokens are real-valued; only the reported remaining count is truncated.
 */
@Value
@Builder
@Jacksonized
public class BucketState {

    double tokens;

    long lastRefillEpochMillis;

    /**
     * State of a bucket observed for the first time: full.
     */
    public static BucketState full(long capacity, long nowEpochMillis) {
        return new BucketState(capacity, nowEpochMillis);
    }
}
