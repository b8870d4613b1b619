package com.quotagate.core;

import java.util.List;

/**
 * Invalid or missing rule configuration. Fatal: raised while the rule set is
 * loaded and allowed to abort application startup.
 */
public class RuleConfigurationException extends RateLimitException {

    private final List<String> violations;

    public RuleConfigurationException(String message) {
        this(List.of(message));
    }

    public RuleConfigurationException(List<String> violations) {
        super("Invalid rate limit configuration: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
