package com.quotagate.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class ScopeKeyBuilderTest {

    private final ScopeKeyBuilder builder = new ScopeKeyBuilder(true);

    private static RateLimitRule rule(String operation, RateLimitScope scope) {
        return RateLimitRule.builder()
                .operationId(operation)
                .capacity(5)
                .refillRatePerMinute(5.0)
                .scope(scope)
                .build();
    }

    @Test
    @DisplayName("Should build IP key from the first forwarded hop")
    void shouldUseFirstForwardedHop() {
        RequestContext context = RequestContext.builder()
                .remoteAddress("10.0.0.2")
                .forwardedHop("203.0.113.1")
                .forwardedHop("10.0.0.1")
                .build();

        ScopeKey key = builder.buildKey(rule("login", RateLimitScope.IP), context);

        assertEquals("ip:203.0.113.1:login", key.getValue());
        assertEquals(RateLimitScope.IP, key.getScope());
        assertEquals("login", key.getOperationId());
    }

    @Test
    @DisplayName("Should ignore forwarded headers when they are not trusted")
    void shouldUseRemoteAddressWhenForwardingUntrusted() {
        ScopeKeyBuilder untrusting = new ScopeKeyBuilder(false);
        RequestContext context = RequestContext.builder()
                .remoteAddress("198.51.100.7")
                .forwardedHop("203.0.113.1")
                .build();

        assertEquals("ip:198.51.100.7:login",
                untrusting.buildKey(rule("login", RateLimitScope.IP), context).getValue());
    }

    @Test
    @DisplayName("Should map malformed addresses to a canonical literal instead of throwing")
    void shouldNormalizeMalformedAddress() {
        RequestContext context = RequestContext.builder().forwardedHop("not-an-ip; drop table").build();

        assertEquals("ip:unknown:login", builder.buildKey(rule("login", RateLimitScope.IP), context).getValue());
        assertEquals("ip:unknown:login",
                builder.buildKey(rule("login", RateLimitScope.IP), RequestContext.builder().build()).getValue());
    }

    @ParameterizedTest
    @CsvSource({
            "203.0.113.1, 203.0.113.1",
            "' 203.0.113.1 ', 203.0.113.1",
            "203.000.113.001, 203.0.113.1",
            "203.0.113.1:8443, 203.0.113.1",
            "256.1.1.1, unknown",
            "[2001:db8::1]:443, 2001:db8:0:0:0:0:0:1",
            "2001:DB8::1, 2001:db8:0:0:0:0:0:1",
            "example.com, unknown",
            "fe80::1%eth0, unknown"
    })
    @DisplayName("Should normalize address literals")
    void shouldNormalizeAddresses(String raw, String expected) {
        assertEquals(expected, ScopeKeyBuilder.normalizeAddress(raw));
    }

    @Test
    @DisplayName("Should build USER key from the principal")
    void shouldBuildUserKey() {
        ScopeKey key = builder.buildKey(rule("data", RateLimitScope.USER), RequestContext.ofPrincipal("user-42"));

        assertEquals("user:user-42:data", key.getValue());
    }

    @Test
    @DisplayName("Should refuse USER scope without a principal")
    void shouldRequirePrincipalForUserScope() {
        ScopeResolutionException e = assertThrows(ScopeResolutionException.class,
                () -> builder.buildKey(rule("data", RateLimitScope.USER), RequestContext.ofAddress("203.0.113.1")));

        assertEquals(RateLimitScope.USER, e.getScope());
    }

    @Test
    @DisplayName("Should build USER_RESOURCE key and require the resource id")
    void shouldBuildUserResourceKey() {
        RateLimitRule rule = rule("provider_sync", RateLimitScope.USER_RESOURCE);
        RequestContext context = RequestContext.builder().principalId("user-42").resourceId("schwab").build();

        assertEquals("user_resource:user-42:schwab:provider_sync", builder.buildKey(rule, context).getValue());
        assertThrows(ScopeResolutionException.class,
                () -> builder.buildKey(rule, RequestContext.ofPrincipal("user-42")));
    }

    @Test
    @DisplayName("Should escape separators inside identifiers so keys cannot collide")
    void shouldEscapeSeparators() {
        RateLimitRule rule = rule("provider_sync", RateLimitScope.USER_RESOURCE);

        String a = builder.buildKey(rule, RequestContext.builder().principalId("a:b").resourceId("c").build()).getValue();
        String b = builder.buildKey(rule, RequestContext.builder().principalId("a").resourceId("b:c").build()).getValue();

        assertNotEquals(a, b);
        assertEquals("user_resource:a%3Ab:c:provider_sync", a);
    }

    @Test
    @DisplayName("Should use one constant key per operation for GLOBAL scope")
    void shouldBuildGlobalKey() {
        RateLimitRule rule = rule("broadcast", RateLimitScope.GLOBAL);

        assertEquals("global:broadcast", builder.buildKey(rule, RequestContext.ofAddress("1.2.3.4")).getValue());
        assertEquals("global:broadcast", builder.buildKey(rule, RequestContext.ofPrincipal("someone")).getValue());
    }

    @Test
    @DisplayName("Same identity under different operations must address different buckets")
    void shouldNamespacePerOperation() {
        RequestContext context = RequestContext.ofAddress("203.0.113.1");

        assertNotEquals(
                builder.buildKey(rule("login", RateLimitScope.IP), context),
                builder.buildKey(rule("register", RateLimitScope.IP), context));
    }

    @Test
    @DisplayName("Should refuse identity-scoped keys when there is no request context at all")
    void shouldRejectMissingContext() {
        ScopeResolutionException e = assertThrows(ScopeResolutionException.class,
                () -> builder.buildKey(rule("login", RateLimitScope.IP), null));

        assertEquals(RateLimitScope.IP, e.getScope());
        assertThrows(ScopeResolutionException.class, () -> builder.buildKey(rule("data", RateLimitScope.USER), null));
        assertEquals("global:broadcast", builder.buildKey(rule("broadcast", RateLimitScope.GLOBAL), null).getValue());
        assertEquals(ScopeKeyBuilder.UNKNOWN_ADDRESS, builder.clientAddress(null));
    }
}
