package com.quotagate.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Identity of the caller as seen at the admission boundary.
 * Any field may be absent; the rule's scope decides which ones are required.
 */
@Value
@Builder
public class RequestContext {

    /**
     * Socket peer address
     */
    String remoteAddress;

    /**
     * Forwarding chain, client first, as reported by trusted proxies
     */
    @Singular("forwardedHop")
    List<String> forwardedFor;

    /**
     * Authenticated principal id, null for anonymous requests
     */
    String principalId;

    /**
     * Resource discriminator for USER_RESOURCE rules
     */
    String resourceId;

    public static RequestContext ofAddress(String remoteAddress) {
        return RequestContext.builder().remoteAddress(remoteAddress).build();
    }

    public static RequestContext ofPrincipal(String principalId) {
        return RequestContext.builder().principalId(principalId).build();
    }

    public boolean isAuthenticated() {
        return principalId != null && !principalId.isBlank();
    }
}
