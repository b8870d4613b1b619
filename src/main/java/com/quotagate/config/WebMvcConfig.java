package com.quotagate.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quotagate.core.RateLimiter;
import com.quotagate.core.ScopeKeyBuilder;
import com.quotagate.observability.AuditSink;
import com.quotagate.web.RateLimitInterceptor;
import com.quotagate.web.RequestContextResolver;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.time.Clock;

/**
 * Registers the admission interceptor for every path; unannotated handlers pass straight through.
 */
@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    private final RateLimitInterceptor rateLimitInterceptor;

    public WebMvcConfig(RateLimiter rateLimiter,
                        RateLimitRuleRegistry rateLimitRuleRegistry,
                        RequestContextResolver requestContextResolver,
                        ScopeKeyBuilder scopeKeyBuilder,
                        AuditSink auditSink,
                        ObjectMapper objectMapper,
                        Clock clock) {
        this.rateLimitInterceptor = new RateLimitInterceptor(
                rateLimiter, rateLimitRuleRegistry, requestContextResolver, scopeKeyBuilder,
                auditSink, objectMapper, clock);
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(rateLimitInterceptor).addPathPatterns("/**");
    }
}
