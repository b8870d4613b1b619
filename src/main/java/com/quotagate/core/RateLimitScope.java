package com.quotagate.core;

/**
 * Dimension over which a quota is tracked independently.
 * The tag is the first segment of every {@link ScopeKey}.
 */
public enum RateLimitScope {

    /** One bucket per client address. */
    IP("ip"),

    /** One bucket per authenticated principal. */
    USER("user"),

    /** One bucket per principal and resource pair. */
    USER_RESOURCE("user_resource"),

    /** One bucket shared by every caller. */
    GLOBAL("global");

    private final String tag;

    RateLimitScope(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /**
     * Lenient lookup used by configuration binding: accepts the enum name or
     * the tag, in any case, with '-' treated as '_'.
     *
     * @return the scope, or null if nothing matches
     */
    public static RateLimitScope fromString(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().replace('-', '_');
        for (RateLimitScope scope : values()) {
            if (scope.name().equalsIgnoreCase(normalized) || scope.tag.equalsIgnoreCase(normalized)) {
                return scope;
            }
        }
        return null;
    }
}
