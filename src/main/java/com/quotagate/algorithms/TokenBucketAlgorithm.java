package com.quotagate.algorithms;

import com.quotagate.core.BucketState;
import com.quotagate.core.Decision;
import com.quotagate.core.RateLimitRule;
import lombok.Value;

/**
 * Token bucket refill-check-consume as a pure function of the stored state.
 *
 * Given capacity C, refill R tokens/minute, cost K, stored tokens T0 at t0 and now t:
 * <pre>
 *   elapsed = max(0, t - t0)
 *   T1      = min(C, T0 + elapsed * R / 60)
 *   T1 >= K : allow, T2 = T1 - K
 *   else    : deny,  retryAfter = (K - T1) / (R / 60)
 * </pre>
 * The new state is returned for both outcomes and must be written back either way.
 * A cost above capacity is not special-cased; it simply never admits.
 *
 * Redis executes the same arithmetic in {@code lua/token_bucket.lua}; keep both in step.
 */
public final class TokenBucketAlgorithm {

    private static final double MILLIS_PER_MINUTE = 60_000.0;

    private TokenBucketAlgorithm() {
    }

    /**
     * @param current stored state, or null when the bucket has never been seen
     * @param cost tokens to consume; 0 reads the bucket without consuming
     */
    public static Outcome evaluate(RateLimitRule rule, int cost, BucketState current, long nowEpochMillis) {
        long capacity = rule.getCapacity();
        double ratePerMinute = rule.getRefillRatePerMinute();

        BucketState state = current != null ? current : BucketState.full(capacity, nowEpochMillis);

        long elapsedMillis = Math.max(0L, nowEpochMillis - state.getLastRefillEpochMillis());
        // multiply before dividing: 12_000 ms at 5/min must give exactly 1.0 token
        double refilled = Math.min(capacity, state.getTokens() + (elapsedMillis * ratePerMinute) / MILLIS_PER_MINUTE);

        boolean allowed = refilled >= cost;
        double tokensAfter = allowed ? refilled - cost : refilled;
        double retryAfter = allowed ? 0.0 : ((cost - refilled) * 60.0) / ratePerMinute;

        // clock skew: never move the refill timestamp backwards
        long stamp = Math.max(nowEpochMillis, state.getLastRefillEpochMillis());

        Decision decision = Decision.builder()
                .allowed(allowed)
                .retryAfterSeconds(retryAfter)
                .remainingTokens((long) Math.floor(tokensAfter))
                .limit(capacity)
                .resetSeconds(secondsUntilFull(capacity, tokensAfter, ratePerMinute))
                .build();

        BucketState next = BucketState.builder()
                .tokens(tokensAfter)
                .lastRefillEpochMillis(stamp)
                .build();
        return new Outcome(decision, next);
    }

    static long secondsUntilFull(long capacity, double tokens, double ratePerMinute) {
        double missing = capacity - tokens;
        if (missing <= 0) {
            return 0L;
        }
        return (long) Math.ceil((missing * 60.0) / ratePerMinute);
    }

    /**
     * Decision plus the state to persist.
     */
    @Value
    public static class Outcome {
        Decision decision;
        BucketState nextState;
    }
}
