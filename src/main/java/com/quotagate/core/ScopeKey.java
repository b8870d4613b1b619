package com.quotagate.core;

import lombok.Value;

/**
 * Addresses exactly one bucket: scope tag, identifier, operation.
 * For example {@code ip:203.0.113.1:login} or {@code global:export}.
 */
@Value
public class ScopeKey {

    RateLimitScope scope;

    String operationId;

    String value;

    @Override
    public String toString() {
        return value;
    }
}
