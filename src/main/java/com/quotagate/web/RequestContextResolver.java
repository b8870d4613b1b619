package com.quotagate.web;

import com.quotagate.core.RequestContext;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.servlet.HandlerMapping;

import java.security.Principal;
import java.util.Map;

/**
 * Builds the caller identity from a servlet request.
 * Records what the request claims; {@link com.quotagate.core.ScopeKeyBuilder}
 * decides what to trust and normalizes addresses.
 */
public class RequestContextResolver {

    static final String FORWARDED_FOR = "X-Forwarded-For";
    static final String REAL_IP = "X-Real-IP";

    private final String principalHeader;

    public RequestContextResolver(String principalHeader) {
        this.principalHeader = principalHeader;
    }

    public RequestContext resolve(HttpServletRequest request, String resourceVariable) {
        RequestContext.RequestContextBuilder builder = RequestContext.builder()
                .remoteAddress(request.getRemoteAddr())
                .principalId(principal(request));

        String forwarded = request.getHeader(FORWARDED_FOR);
        if (forwarded != null && !forwarded.isBlank()) {
            for (String hop : forwarded.split(",")) {
                if (!hop.isBlank()) {
                    builder.forwardedHop(hop.trim());
                }
            }
        } else {
            String realIp = request.getHeader(REAL_IP);
            if (realIp != null && !realIp.isBlank()) {
                builder.forwardedHop(realIp.trim());
            }
        }

        if (resourceVariable != null && !resourceVariable.isEmpty()) {
            builder.resourceId(uriVariable(request, resourceVariable));
        }
        return builder.build();
    }

    private String principal(HttpServletRequest request) {
        Principal principal = request.getUserPrincipal();
        if (principal != null && principal.getName() != null && !principal.getName().isBlank()) {
            return principal.getName();
        }
        if (principalHeader == null || principalHeader.isEmpty()) {
            return null;
        }
        String header = request.getHeader(principalHeader);
        return header == null || header.isBlank() ? null : header.trim();
    }

    @SuppressWarnings("unchecked")
    private static String uriVariable(HttpServletRequest request, String name) {
        Object attribute = request.getAttribute(HandlerMapping.URI_TEMPLATE_VARIABLES_ATTRIBUTE);
        if (!(attribute instanceof Map)) {
            return null;
        }
        return ((Map<String, String>) attribute).get(name);
    }
}
