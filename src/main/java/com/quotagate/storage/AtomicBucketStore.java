package com.quotagate.storage;

import com.quotagate.core.Decision;
import com.quotagate.core.RateLimitRule;
import com.quotagate.core.ScopeKey;

import java.time.Instant;

/**
 * Shared store holding every bucket.
 * Allows swapping backends without changing the limiter.
 */
public interface AtomicBucketStore {

    /**
     * Refill, check and conditionally consume in one atomic step executed by
     * the store. Two callers racing for the last token can never both be
     * admitted. The bucket is created full on first sight, written back for
     * both outcomes and given a TTL of time-to-full-refill plus a margin.
     *
     * @param cost tokens to consume; 0 only reads
     * @throws StorageException on timeout, transport failure or a malformed reply
     */
    Decision evaluate(ScopeKey key, RateLimitRule rule, int cost, Instant now) throws StorageException;

    /**
     * Drop the bucket so the next evaluation sees it full.
     */
    void reset(ScopeKey key) throws StorageException;

    /**
     * Health check
     */
    boolean isAvailable();
}
