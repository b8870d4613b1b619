package com.quotagate.storage;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.quotagate.algorithms.TokenBucketAlgorithm;
import com.quotagate.core.BucketState;
import com.quotagate.core.Decision;
import com.quotagate.core.RateLimitRule;
import com.quotagate.core.ScopeKey;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-local bucket store for single-node deployments and tests.
 *
 * Atomicity comes from Caffeine's per-key {@code compute}: the refill, check
 * and write for one key run under the map's bin lock, so concurrent callers
 * on the same key are serialized while other keys proceed in parallel.
 * Entries expire after the rule's TTL, so idle buckets vanish without a sweep.
 */
@Slf4j
public class InMemoryBucketStore implements AtomicBucketStore {

    private final Cache<String, Entry> buckets;
    private final Duration ttlMargin;

    public InMemoryBucketStore(Duration ttlMargin, long maxBuckets) {
        this.ttlMargin = ttlMargin;
        this.buckets = Caffeine.newBuilder()
                .maximumSize(maxBuckets)
                .expireAfter(new EntryExpiry())
                .build();
        log.info("In-memory bucket store initialized: maxBuckets={}, ttlMargin={}", maxBuckets, ttlMargin);
    }

    @Override
    public Decision evaluate(ScopeKey key, RateLimitRule rule, int cost, Instant now) {
        long nowMillis = now.toEpochMilli();
        long ttlMillis = rule.bucketTtl(ttlMargin).toMillis();
        AtomicReference<Decision> result = new AtomicReference<>();

        buckets.asMap().compute(key.getValue(), (k, existing) -> {
            BucketState current = existing != null && existing.expiresAtMillis > nowMillis ? existing.state : null;
            TokenBucketAlgorithm.Outcome outcome = TokenBucketAlgorithm.evaluate(rule, Math.max(0, cost), current, nowMillis);
            result.set(outcome.getDecision());
            return new Entry(outcome.getNextState(), nowMillis + ttlMillis, ttlMillis);
        });

        return result.get();
    }

    @Override
    public void reset(ScopeKey key) {
        buckets.invalidate(key.getValue());
        log.debug("Reset bucket {}", key);
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    /**
     * Stored state for a key, or null if absent. Test hook.
     */
    BucketState peek(String key) {
        Entry entry = buckets.getIfPresent(key);
        return entry == null ? null : entry.state;
    }

    long size() {
        buckets.cleanUp();
        return buckets.estimatedSize();
    }

    private static final class Entry {
        private final BucketState state;
        private final long expiresAtMillis;
        private final long ttlMillis;

        private Entry(BucketState state, long expiresAtMillis, long ttlMillis) {
            this.state = state;
            this.expiresAtMillis = expiresAtMillis;
            this.ttlMillis = ttlMillis;
        }
    }

    private static final class EntryExpiry implements Expiry<String, Entry> {

        @Override
        public long expireAfterCreate(String key, Entry value, long currentTime) {
            return Duration.ofMillis(value.ttlMillis).toNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Entry value, long currentTime, long currentDuration) {
            return Duration.ofMillis(value.ttlMillis).toNanos();
        }

        @Override
        public long expireAfterRead(String key, Entry value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
