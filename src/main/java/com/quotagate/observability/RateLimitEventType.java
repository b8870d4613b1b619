package com.quotagate.observability;

public enum RateLimitEventType {
    CHECKED,
    ALLOWED,
    DENIED,
    FAIL_OPEN
}
