package com.quotagate.observability;

import java.util.Locale;

/**
 * Why a check was admitted without being enforced.
 */
public enum FailOpenReason {
    RULE_NOT_FOUND,
    SCOPE_UNRESOLVED,
    STORE_UNAVAILABLE,
    STORE_TIMEOUT,
    STORE_BAD_RESPONSE,
    UNEXPECTED_ERROR;

    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
