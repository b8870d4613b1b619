package com.quotagate.algorithms;

import com.quotagate.config.RateLimitRuleRegistry;
import com.quotagate.core.Decision;
import com.quotagate.core.RateLimitRule;
import com.quotagate.core.RateLimiter;
import com.quotagate.core.RequestContext;
import com.quotagate.core.ScopeKey;
import com.quotagate.core.ScopeKeyBuilder;
import com.quotagate.core.ScopeResolutionException;
import com.quotagate.observability.AuditRecord;
import com.quotagate.observability.AuditSink;
import com.quotagate.observability.FailOpenReason;
import com.quotagate.observability.RateLimitEvent;
import com.quotagate.observability.RateLimitEventPublisher;
import com.quotagate.observability.RateLimitEventType;
import com.quotagate.storage.AtomicBucketStore;
import com.quotagate.storage.StorageException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Token bucket admission control over a shared {@link AtomicBucketStore}.
 *
 * Holds no counters: all quota state lives in the store, so any number of
 * instances enforce one quota and no in-process lock is needed. The store
 * call is the only blocking point and is bounded by the store's timeout.
 *
 * Fail-open: an unknown operation, a request missing the identity its scope
 * needs, or any store failure admits the call with the full capacity reported
 * and is logged, published and audited. Nothing but a genuine quota denial
 * ever returns {@code allowed=false}, and no exception reaches the caller
 * from {@link #check}.
 */
@Slf4j
public class TokenBucketRateLimiter implements RateLimiter {

    private static final String LAYER = "limiter";

    private final RateLimitRuleRegistry rules;
    private final ScopeKeyBuilder keyBuilder;
    private final AtomicBucketStore store;
    private final List<RateLimitEventPublisher> publishers;
    private final AuditSink auditSink;
    private final Clock clock;
    private final boolean enabled;

    public TokenBucketRateLimiter(
            RateLimitRuleRegistry rules,
            ScopeKeyBuilder keyBuilder,
            AtomicBucketStore store,
            List<RateLimitEventPublisher> publishers,
            AuditSink auditSink,
            Clock clock,
            boolean enabled) {

        this.rules = rules;
        this.keyBuilder = keyBuilder;
        this.store = store;
        this.publishers = List.copyOf(publishers);
        this.auditSink = auditSink;
        this.clock = clock;
        this.enabled = enabled;

        log.info("TokenBucket limiter initialized: enabled={}, rules={}, publishers={}",
                enabled, rules.size(), this.publishers.size());
    }

    @Override
    public Decision check(String operationId, RequestContext context, int cost) {
        long start = System.nanoTime();

        if (!enabled) {
            return Decision.unmetered();
        }

        Optional<RateLimitRule> found = rules.find(operationId);
        if (found.isEmpty()) {
            log.warn("ratelimit fail_open reason=rule_not_found operation={} layer={}", operationId, LAYER);
            failOpen(operationId, null, null, 0, 0, FailOpenReason.RULE_NOT_FOUND, context, start);
            return Decision.unmetered();
        }

        RateLimitRule rule = found.get();
        if (!rule.isEnabled()) {
            log.debug("ratelimit bypass reason=rule_disabled operation={}", operationId);
            return Decision.failOpen(rule);
        }

        int effectiveCost = cost > 0 ? cost : rule.getCost();

        ScopeKey key;
        try {
            key = keyBuilder.buildKey(rule, context);
        } catch (ScopeResolutionException e) {
            log.warn("ratelimit fail_open reason=scope_unresolved operation={} scope={} layer={}: {}",
                    operationId, e.getScope(), LAYER, e.getMessage());
            failOpen(operationId, rule, null, effectiveCost, rule.getCapacity(),
                    FailOpenReason.SCOPE_UNRESOLVED, context, start);
            return Decision.failOpen(rule);
        } catch (RuntimeException e) {
            log.error("ratelimit fail_open reason=unexpected operation={} layer={}", operationId, LAYER, e);
            failOpen(operationId, rule, null, effectiveCost, rule.getCapacity(),
                    FailOpenReason.UNEXPECTED_ERROR, context, start);
            return Decision.failOpen(rule);
        }

        Decision decision;
        try {
            decision = store.evaluate(key, rule, effectiveCost, clock.instant());
        } catch (StorageException e) {
            log.error("ratelimit fail_open reason={} operation={} key={} layer={}",
                    e.getReason(), operationId, key, LAYER, e);
            failOpen(operationId, rule, key, effectiveCost, rule.getCapacity(), reasonFor(e), context, start);
            return Decision.failOpen(rule);
        } catch (RuntimeException e) {
            log.error("ratelimit fail_open reason=unexpected operation={} key={} layer={}",
                    operationId, key, LAYER, e);
            failOpen(operationId, rule, key, effectiveCost, rule.getCapacity(),
                    FailOpenReason.UNEXPECTED_ERROR, context, start);
            return Decision.failOpen(rule);
        }

        long latency = System.nanoTime() - start;
        publish(event(RateLimitEventType.CHECKED, operationId, rule, key, effectiveCost, decision, latency));
        publish(event(decision.isAllowed() ? RateLimitEventType.ALLOWED : RateLimitEventType.DENIED,
                operationId, rule, key, effectiveCost, decision, latency));

        log.debug("ratelimit decision operation={} key={} cost={} allowed={} remaining={} retryAfter={} latencyMicros={} layer={}",
                operationId, key, effectiveCost, decision.isAllowed(), decision.getRemainingTokens(),
                decision.getRetryAfterSeconds(), latency / 1_000, LAYER);

        return decision;
    }

    @Override
    public long getRemaining(String operationId, RequestContext context) {
        Optional<RateLimitRule> found = rules.find(operationId);
        if (!enabled || found.isEmpty()) {
            return 0L;
        }
        RateLimitRule rule = found.get();
        if (!rule.isEnabled()) {
            return rule.getCapacity();
        }
        try {
            ScopeKey key = keyBuilder.buildKey(rule, context);
            return store.evaluate(key, rule, 0, clock.instant()).getRemainingTokens();
        } catch (ScopeResolutionException | StorageException e) {
            log.warn("ratelimit remaining unavailable operation={} layer={}: {}", operationId, LAYER, e.getMessage());
            return rule.getCapacity();
        } catch (RuntimeException e) {
            log.error("ratelimit remaining unavailable operation={} layer={}", operationId, LAYER, e);
            return rule.getCapacity();
        }
    }

    @Override
    public void reset(String operationId, RequestContext context) {
        Optional<RateLimitRule> found = rules.find(operationId);
        if (found.isEmpty()) {
            log.debug("Nothing to reset, no rule for operation {}", operationId);
            return;
        }
        ScopeKey key = keyBuilder.buildKey(found.get(), context);
        store.reset(key);
        log.info("Rate limit reset operation={} key={}", operationId, key);
    }

    private void failOpen(String operationId, RateLimitRule rule, ScopeKey key, int cost, long remaining,
                          FailOpenReason reason, RequestContext context, long start) {
        long latency = System.nanoTime() - start;
        Instant now = clock.instant();
        String keyValue = key == null ? null : key.getValue();

        RateLimitEvent.RateLimitEventBuilder base = RateLimitEvent.builder()
                .operationId(operationId)
                .key(keyValue)
                .scope(rule == null ? null : rule.getScope())
                .cost(cost)
                .remainingTokens(remaining)
                .retryAfterSeconds(0.0)
                .latencyNanos(latency)
                .occurredAt(now);

        publish(base.type(RateLimitEventType.CHECKED).build());
        publish(base.type(RateLimitEventType.FAIL_OPEN).failOpenReason(reason).build());

        try {
            auditSink.record(AuditRecord.builder()
                    .outcome(AuditRecord.Outcome.FAIL_OPEN)
                    .operationId(operationId)
                    .key(keyValue)
                    .clientAddress(keyBuilder.clientAddress(context))
                    .principalId(context == null ? null : context.getPrincipalId())
                    .limit(rule == null ? 0 : rule.getCapacity())
                    .reason(reason)
                    .occurredAt(now)
                    .build());
        } catch (RuntimeException e) {
            log.warn("Failed to audit fail-open for operation {}", operationId, e);
        }
    }

    private RateLimitEvent event(RateLimitEventType type, String operationId, RateLimitRule rule, ScopeKey key,
                                 int cost, Decision decision, long latency) {
        return RateLimitEvent.builder()
                .type(type)
                .operationId(operationId)
                .key(key.getValue())
                .scope(rule.getScope())
                .cost(cost)
                .remainingTokens(decision.getRemainingTokens())
                .retryAfterSeconds(decision.getRetryAfterSeconds())
                .latencyNanos(latency)
                .occurredAt(clock.instant())
                .build();
    }

    private void publish(RateLimitEvent event) {
        for (RateLimitEventPublisher publisher : publishers) {
            try {
                publisher.publish(event);
            } catch (RuntimeException e) {
                log.warn("Failed to publish {} event for operation {}", event.getType(), event.getOperationId(), e);
            }
        }
    }

    private static FailOpenReason reasonFor(StorageException e) {
        switch (e.getReason()) {
            case TIMEOUT:
                return FailOpenReason.STORE_TIMEOUT;
            case BAD_RESPONSE:
                return FailOpenReason.STORE_BAD_RESPONSE;
            case UNAVAILABLE:
            default:
                return FailOpenReason.STORE_UNAVAILABLE;
        }
    }
}
