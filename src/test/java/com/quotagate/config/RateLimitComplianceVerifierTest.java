package com.quotagate.config;

import com.quotagate.core.RateLimitRule;
import com.quotagate.core.RateLimitScope;
import com.quotagate.core.RuleConfigurationException;
import com.quotagate.web.RateLimited;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.method.HandlerMethod;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class RateLimitComplianceVerifierTest {

    static class Handlers {

        @RateLimited(operation = "login")
        public void login() {
        }

        @RateLimited(operation = "provider_sync", resourceVariable = "providerId")
        public void sync() {
        }

        @RateLimited(operation = "provider_sync")
        public void syncWithoutResource() {
        }

        @RateLimited(operation = "unlisted")
        public void unlisted() {
        }

        public void open() {
        }
    }

    private static final RateLimitRuleRegistry RULES = RateLimitRuleRegistry.of(List.of(
            RateLimitRule.builder().operationId("login").capacity(20).refillRatePerMinute(5.0)
                    .scope(RateLimitScope.IP).build(),
            RateLimitRule.builder().operationId("provider_sync").capacity(100).refillRatePerMinute(100.0)
                    .scope(RateLimitScope.USER_RESOURCE).build()));

    private static HandlerMethod handler(String name) throws NoSuchMethodException {
        return new HandlerMethod(new Handlers(), Handlers.class.getMethod(name));
    }

    @Test
    @DisplayName("Collects annotated operations and ignores plain handlers")
    void shouldAcceptCoveredHandlers() throws Exception {
        RateLimitRuleRegistry rules = RateLimitRuleRegistry.of(RULES.snapshot().values());

        Set<String> operations = RateLimitComplianceVerifier.verify(
                List.of(handler("login"), handler("sync"), handler("open")), rules);

        assertEquals(Set.of("login", "provider_sync"), operations);
    }

    @Test
    @DisplayName("A handler whose operation has no rule aborts startup")
    void shouldRejectUncoveredOperation() throws Exception {
        RateLimitRuleRegistry rules = RateLimitRuleRegistry.of(RULES.snapshot().values());

        RuleConfigurationException e = assertThrows(RuleConfigurationException.class,
                () -> RateLimitComplianceVerifier.verify(List.of(handler("login"), handler("unlisted")), rules));

        assertTrue(e.getMessage().contains("unlisted"));
    }

    @Test
    @DisplayName("USER_RESOURCE operations must name their resource variable")
    void shouldRequireResourceVariable() throws Exception {
        RateLimitRuleRegistry rules = RateLimitRuleRegistry.of(RULES.snapshot().values());

        RuleConfigurationException e = assertThrows(RuleConfigurationException.class,
                () -> RateLimitComplianceVerifier.verify(List.of(handler("syncWithoutResource")), rules));

        assertTrue(e.getViolations().get(0).contains("resourceVariable"));
    }
}
