package com.quotagate.core;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Quota descriptor for one registered operation.
 * Immutable: a reload replaces the whole rule set, never a rule in place.
 */
@Value
@Builder(toBuilder = true)
public class RateLimitRule {

    /**
     * Longest accepted time for an empty bucket to fill up; also bounds the store TTL
     */
    public static final Duration MAX_FULL_REFILL = Duration.ofDays(365);

    /**
     * Operation this rule governs; also namespaces the bucket key
     */
    String operationId;

    /**
     * Maximum tokens in the bucket (burst size)
     */
    long capacity;

    /**
     * Tokens added per minute. 5.0 means one token every 12 seconds.
     */
    double refillRatePerMinute;

    /**
     * Dimension the quota is tracked over
     */
    RateLimitScope scope;

    /**
     * Tokens consumed by a single call unless the caller overrides it
     */
    @Builder.Default
    int cost = 1;

    /**
     * Disabled rules always admit without touching the store
     */
    @Builder.Default
    boolean enabled = true;

    /**
     * Collects every problem with this rule instead of stopping at the first.
     */
    public List<String> violations() {
        List<String> problems = new ArrayList<>();
        String name = operationId == null ? "<unnamed>" : operationId;
        if (operationId == null || operationId.isBlank()) {
            problems.add("operationId must not be blank");
        }
        if (capacity <= 0) {
            problems.add(name + ": capacity must be positive, got " + capacity);
        }
        if (!(refillRatePerMinute > 0) || Double.isInfinite(refillRatePerMinute)) {
            problems.add(name + ": refillRatePerMinute must be positive, got " + refillRatePerMinute);
        } else if (capacity > 0 && capacity * 60.0 / refillRatePerMinute > MAX_FULL_REFILL.getSeconds()) {
            problems.add(name + ": refillRatePerMinute " + refillRatePerMinute + " is too slow, refilling "
                    + capacity + " tokens would take longer than " + MAX_FULL_REFILL.toDays() + " days");
        }
        if (cost <= 0) {
            problems.add(name + ": cost must be positive, got " + cost);
        }
        if (scope == null) {
            problems.add(name + ": scope must be one of IP, USER, USER_RESOURCE, GLOBAL");
        }
        return problems;
    }

    public void validate() {
        List<String> problems = violations();
        if (!problems.isEmpty()) {
            throw new RuleConfigurationException(problems);
        }
    }

    /**
     * A rule whose cost exceeds its capacity can never admit a call.
     */
    public boolean isSatisfiable() {
        return cost <= capacity;
    }

    public double secondsPerToken() {
        return 60.0 / refillRatePerMinute;
    }

    /**
     * Seconds for an empty bucket to become full again, rounded up.
     */
    public long secondsToFullRefill() {
        return (long) Math.ceil(capacity * 60.0 / refillRatePerMinute);
    }

    /**
     * Store TTL: an idle bucket is full again after {@link #secondsToFullRefill()},
     * so dropping it after that plus a margin loses no information.
     */
    public Duration bucketTtl(Duration safetyMargin) {
        return Duration.ofSeconds(secondsToFullRefill()).plus(safetyMargin);
    }
}
