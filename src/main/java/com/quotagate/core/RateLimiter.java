package com.quotagate.core;

/**
 * Admission control for registered operations.
 * Implementations decide against a quota shared by every process instance.
 */
public interface RateLimiter {

    /**
     * Check the call against the operation's rule, consuming the rule's cost.
     * Never throws for store or identity problems: those resolve to an allow.
     *
     * @param operationId registered operation (e.g. "login", "export")
     * @param context caller identity
     * @return the decision; {@code allowed=false} only for a real quota denial
     */
    default Decision check(String operationId, RequestContext context) {
        return check(operationId, context, 0);
    }

    /**
     * Same as {@link #check(String, RequestContext)} with an explicit cost.
     *
     * @param cost tokens to consume; {@code <= 0} means the rule's default
     */
    Decision check(String operationId, RequestContext context, int cost);

    /**
     * Whole tokens currently available, without consuming any.
     * Falls back to the rule capacity if the store cannot be read.
     *
     * @return remaining tokens, or 0 when no enabled rule governs the operation
     */
    long getRemaining(String operationId, RequestContext context);

    /**
     * Refill the caller's bucket for this operation. Administrative; unlike
     * checks this does not fail open and surfaces store errors.
     */
    void reset(String operationId, RequestContext context);
}
