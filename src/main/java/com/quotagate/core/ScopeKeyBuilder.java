package com.quotagate.core;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives the bucket key for a rule from the caller's identity.
 *
 * Key layout, namespaced by scope and by operation so rules never share a bucket:
 * <pre>
 *   ip:{address}:{operation}
 *   user:{principal}:{operation}
 *   user_resource:{principal}:{resource}:{operation}
 *   global:{operation}
 * </pre>
 * Addresses never make this throw: anything unparseable becomes {@value #UNKNOWN_ADDRESS}.
 */
public class ScopeKeyBuilder {

    public static final String UNKNOWN_ADDRESS = "unknown";

    private static final Pattern IPV4 = Pattern.compile("^(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})\\.(\\d{1,3})$");
    private static final Pattern IPV6_CHARS = Pattern.compile("^[0-9a-fA-F:.]+$");

    private final boolean trustForwardedHeaders;

    public ScopeKeyBuilder(boolean trustForwardedHeaders) {
        this.trustForwardedHeaders = trustForwardedHeaders;
    }

    public ScopeKey buildKey(RateLimitRule rule, RequestContext context) {
        RateLimitScope scope = rule.getScope();
        String operation = rule.getOperationId();
        if (context == null && scope != RateLimitScope.GLOBAL) {
            throw new ScopeResolutionException(scope,
                    "Operation " + operation + " is " + scope + " scoped but the check carries no request context");
        }
        String value;
        switch (scope) {
            case IP:
                value = join(scope.tag(), clientAddress(context), operation);
                break;
            case USER:
                value = join(scope.tag(), requirePrincipal(rule, context), operation);
                break;
            case USER_RESOURCE: {
                String principal = requirePrincipal(rule, context);
                String resource = context.getResourceId();
                if (resource == null || resource.isBlank()) {
                    throw new ScopeResolutionException(scope,
                            "Operation " + operation + " is USER_RESOURCE scoped but the request has no resource id");
                }
                value = join(scope.tag(), principal, escape(resource.trim()), operation);
                break;
            }
            case GLOBAL:
                value = join(scope.tag(), operation);
                break;
            default:
                throw new IllegalStateException("Unhandled scope " + scope);
        }
        return new ScopeKey(scope, operation, value);
    }

    /**
     * Client address: first hop of the forwarding chain when forwarded headers
     * are trusted, otherwise the socket peer.
     */
    public String clientAddress(RequestContext context) {
        if (context == null) {
            return UNKNOWN_ADDRESS;
        }
        if (trustForwardedHeaders) {
            List<String> chain = context.getForwardedFor();
            if (chain != null && !chain.isEmpty()) {
                return normalizeAddress(chain.get(0));
            }
        }
        return normalizeAddress(context.getRemoteAddress());
    }

    private static String requirePrincipal(RateLimitRule rule, RequestContext context) {
        if (!context.isAuthenticated()) {
            throw new ScopeResolutionException(rule.getScope(),
                    "Operation " + rule.getOperationId() + " is " + rule.getScope()
                            + " scoped but the request has no authenticated principal");
        }
        return escape(context.getPrincipalId().trim());
    }

    /**
     * Canonical literal for an address: strips brackets and ports, drops
     * leading zeros in IPv4 octets, expands IPv6. Never resolves host names.
     */
    public static String normalizeAddress(String raw) {
        if (raw == null) {
            return UNKNOWN_ADDRESS;
        }
        String candidate = raw.trim();
        if (candidate.isEmpty()) {
            return UNKNOWN_ADDRESS;
        }

        // [v6]:port or [v6]
        if (candidate.startsWith("[")) {
            int close = candidate.indexOf(']');
            if (close < 0) {
                return UNKNOWN_ADDRESS;
            }
            candidate = candidate.substring(1, close);
        } else if (candidate.indexOf(':') >= 0 && candidate.indexOf(':') == candidate.lastIndexOf(':')) {
            // v4:port
            candidate = candidate.substring(0, candidate.indexOf(':'));
        }

        String v4 = canonicalIpv4(candidate);
        if (v4 != null) {
            return v4;
        }
        if (candidate.indexOf(':') >= 0 && IPV6_CHARS.matcher(candidate).matches()) {
            try {
                // literal only: the pattern above rules out host names, so no lookup happens
                return InetAddress.getByName(candidate).getHostAddress();
            } catch (UnknownHostException | SecurityException e) {
                return UNKNOWN_ADDRESS;
            }
        }
        return UNKNOWN_ADDRESS;
    }

    private static String canonicalIpv4(String candidate) {
        Matcher matcher = IPV4.matcher(candidate);
        if (!matcher.matches()) {
            return null;
        }
        StringBuilder sb = new StringBuilder(15);
        for (int i = 1; i <= 4; i++) {
            int octet = Integer.parseInt(matcher.group(i));
            if (octet > 255) {
                return null;
            }
            if (i > 1) {
                sb.append('.');
            }
            sb.append(octet);
        }
        return sb.toString();
    }

    // ':' separates key segments, so it must not appear inside user-supplied ids
    private static String escape(String identifier) {
        return identifier.replace("%", "%25").replace(":", "%3A");
    }

    private static String join(String... parts) {
        return String.join(":", parts);
    }
}
