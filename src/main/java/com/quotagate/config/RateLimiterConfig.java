package com.quotagate.config;

import com.quotagate.algorithms.TokenBucketRateLimiter;
import com.quotagate.core.RateLimiter;
import com.quotagate.core.ScopeKeyBuilder;
import com.quotagate.observability.AuditSink;
import com.quotagate.observability.LoggingAuditSink;
import com.quotagate.observability.MetricsEventPublisher;
import com.quotagate.observability.RateLimitEventPublisher;
import com.quotagate.storage.AtomicBucketStore;
import com.quotagate.storage.InMemoryBucketStore;
import com.quotagate.storage.RedisBucketStore;
import com.quotagate.web.RequestContextResolver;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.mvc.method.annotation.RequestMappingHandlerMapping;

import java.time.Clock;
import java.util.List;

/**
 * Spring configuration for rate limiter components
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(RateLimitProperties.class)
public class RateLimiterConfig {

    @Bean
    @ConditionalOnProperty(prefix = "ratelimit.store", name = "type", havingValue = "redis", matchIfMissing = true)
    public RedisBucketStore redisBucketStore(RateLimitProperties properties) {
        RateLimitProperties.Redis redis = properties.getRedis();
        log.info("Initializing Redis bucket store at {}:{}", redis.getHost(), redis.getPort());
        return new RedisBucketStore(
                RedisBucketStore.createPool(
                        redis.getHost(),
                        redis.getPort(),
                        redis.getPassword(),
                        redis.getDatabase(),
                        redis.getTimeout(),
                        redis.getPool().getMaxTotal(),
                        redis.getPool().getMaxIdle(),
                        redis.getPool().getMinIdle()),
                properties.getStore().getKeyPrefix(),
                properties.getStore().getTtlMargin());
    }

    /**
     * Single-node store; buckets are not shared between instances
     */
    @Bean
    @ConditionalOnProperty(prefix = "ratelimit.store", name = "type", havingValue = "memory")
    public InMemoryBucketStore inMemoryBucketStore(RateLimitProperties properties) {
        log.warn("Using in-memory bucket store: quotas are per instance, not cluster-wide");
        return new InMemoryBucketStore(properties.getStore().getTtlMargin(), properties.getStore().getMemoryMaxBuckets());
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Fails startup on any invalid rule.
     */
    @Bean
    public RateLimitRuleRegistry rateLimitRuleRegistry(RateLimitProperties properties) {
        return RateLimitRuleRegistry.of(properties.toRules());
    }

    @Bean
    public ScopeKeyBuilder scopeKeyBuilder(RateLimitProperties properties) {
        return new ScopeKeyBuilder(properties.getClientIp().isTrustForwardedHeaders());
    }

    @Bean
    public RequestContextResolver requestContextResolver(RateLimitProperties properties) {
        return new RequestContextResolver(properties.getPrincipalHeader());
    }

    @Bean
    public MetricsEventPublisher metricsEventPublisher(MeterRegistry meterRegistry) {
        return new MetricsEventPublisher(meterRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditSink auditSink() {
        return new LoggingAuditSink();
    }

    @Bean
    public RateLimiter rateLimiter(
            RateLimitRuleRegistry rules,
            ScopeKeyBuilder keyBuilder,
            AtomicBucketStore store,
            List<RateLimitEventPublisher> publishers,
            AuditSink auditSink,
            Clock clock,
            RateLimitProperties properties) {

        return new TokenBucketRateLimiter(rules, keyBuilder, store, publishers, auditSink, clock, properties.isEnabled());
    }

    /**
     * Refuses to start when a {@code @RateLimited} operation has no rule.
     */
    @Bean
    public RateLimitComplianceVerifier rateLimitComplianceVerifier(
            @Qualifier("requestMappingHandlerMapping") RequestMappingHandlerMapping handlerMapping,
            RateLimitRuleRegistry rules) {
        return new RateLimitComplianceVerifier(handlerMapping, rules);
    }
}
