package com.quotagate.config;

import com.quotagate.core.RateLimitRule;
import com.quotagate.core.RateLimitScope;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything under {@code ratelimit.*} in application.yml.
 */
@Data
@ConfigurationProperties(prefix = "ratelimit")
public class RateLimitProperties {

    /**
     * Master switch. When off every check admits and the store is never called.
     */
    private boolean enabled = true;

    /**
     * Header carrying the principal id set by the authenticating proxy,
     * consulted when the servlet request has no Principal.
     */
    private String principalHeader = "X-Authenticated-User";

    private Store store = new Store();

    private Redis redis = new Redis();

    private ClientIp clientIp = new ClientIp();

    /**
     * Operation id to rule definition.
     */
    private Map<String, RuleDefinition> rules = new LinkedHashMap<>();

    public List<RateLimitRule> toRules() {
        List<RateLimitRule> result = new ArrayList<>();
        rules.forEach((operationId, definition) -> result.add(definition.toRule(operationId)));
        return result;
    }

    public enum StoreType {
        REDIS,
        MEMORY
    }

    @Data
    public static class Store {

        private StoreType type = StoreType.REDIS;

        /**
         * Prepended to every bucket key in the shared store
         */
        private String keyPrefix = "ratelimit:";

        /**
         * Added to the time-to-full-refill when setting bucket TTLs
         */
        private Duration ttlMargin = Duration.ofSeconds(60);

        /**
         * Upper bound on buckets held by the in-memory store
         */
        private long memoryMaxBuckets = 100_000;
    }

    @Data
    public static class Redis {

        private String host = "localhost";

        private int port = 6379;

        private String password;

        private int database = 0;

        /**
         * Bound on connect, read and pool borrow. A timeout is a store failure.
         */
        private Duration timeout = Duration.ofMillis(10);

        private Pool pool = new Pool();
    }

    @Data
    public static class Pool {

        private int maxTotal = 128;

        private int maxIdle = 32;

        private int minIdle = 8;
    }

    @Data
    public static class ClientIp {

        /**
         * Use the first hop of X-Forwarded-For / X-Real-IP. Only enable behind a
         * proxy that overwrites these headers.
         */
        private boolean trustForwardedHeaders = true;
    }

    @Data
    public static class RuleDefinition {

        private Long capacity;

        private Double refillRatePerMinute;

        /**
         * ip, user, user_resource or global
         */
        private String scope;

        private Integer cost = 1;

        private Boolean enabled = true;

        RateLimitRule toRule(String operationId) {
            return RateLimitRule.builder()
                    .operationId(operationId)
                    .capacity(capacity == null ? 0L : capacity)
                    .refillRatePerMinute(refillRatePerMinute == null ? 0.0 : refillRatePerMinute)
                    .scope(RateLimitScope.fromString(scope))
                    .cost(cost == null ? 1 : cost)
                    .enabled(enabled == null || enabled)
                    .build();
        }
    }
}
