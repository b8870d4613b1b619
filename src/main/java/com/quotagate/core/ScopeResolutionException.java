package com.quotagate.core;

/**
 * The request lacks the identity a rule's scope needs, e.g. a USER-scoped
 * operation reached without an authenticated principal. Indicates a server
 * misconfiguration; the limiter resolves it as a fail-open allow.
 */
public class ScopeResolutionException extends RateLimitException {

    private final RateLimitScope scope;

    public ScopeResolutionException(RateLimitScope scope, String message) {
        super(message);
        this.scope = scope;
    }

    public RateLimitScope getScope() {
        return scope;
    }
}
