package com.quotagate.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quotagate.config.RateLimitRuleRegistry;
import com.quotagate.core.Decision;
import com.quotagate.core.RateLimiter;
import com.quotagate.core.RequestContext;
import com.quotagate.core.ScopeKeyBuilder;
import com.quotagate.observability.AuditRecord;
import com.quotagate.observability.AuditSink;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

import java.io.IOException;
import java.time.Clock;

/**
 * Admission boundary for {@link RateLimited} handlers.
 *
 * Allowed: the request proceeds with X-RateLimit-* headers attached.
 * Denied: the handler never runs; the response is 429 with Retry-After and
 * a problem body, and the denial is audited.
 */
@Slf4j
public class RateLimitInterceptor implements HandlerInterceptor {

    private final RateLimiter rateLimiter;
    private final RateLimitRuleRegistry rules;
    private final RequestContextResolver contextResolver;
    private final ScopeKeyBuilder keyBuilder;
    private final AuditSink auditSink;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RateLimitInterceptor(RateLimiter rateLimiter,
                                RateLimitRuleRegistry rules,
                                RequestContextResolver contextResolver,
                                ScopeKeyBuilder keyBuilder,
                                AuditSink auditSink,
                                ObjectMapper objectMapper,
                                Clock clock) {
        this.rateLimiter = rateLimiter;
        this.rules = rules;
        this.contextResolver = contextResolver;
        this.keyBuilder = keyBuilder;
        this.auditSink = auditSink;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
            throws IOException {

        if (!(handler instanceof HandlerMethod)) {
            return true;
        }
        RateLimited rateLimited = ((HandlerMethod) handler).getMethodAnnotation(RateLimited.class);
        if (rateLimited == null) {
            return true;
        }

        RequestContext context;
        Decision decision;
        try {
            context = contextResolver.resolve(request, rateLimited.resourceVariable());
            decision = rateLimiter.check(rateLimited.operation(), context, rateLimited.cost());
        } catch (RuntimeException e) {
            // the limiter absorbs its own failures; this only guards the boundary
            log.error("ratelimit fail_open reason=interceptor_error operation={} path={} layer=interceptor",
                    rateLimited.operation(), request.getRequestURI(), e);
            return true;
        }

        RateLimitResponses.writeHeaders(decision, response::setHeader);
        if (decision.isAllowed()) {
            return true;
        }

        audit(rateLimited.operation(), request, context, decision);

        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(),
                RateLimitResponses.problem(decision, request.getRequestURI()));
        return false;
    }

    private void audit(String operation, HttpServletRequest request, RequestContext context, Decision decision) {
        try {
            auditSink.record(AuditRecord.builder()
                    .outcome(AuditRecord.Outcome.DENIED)
                    .operationId(operation)
                    .key(bucketKey(operation, context))
                    .clientAddress(keyBuilder.clientAddress(context))
                    .principalId(context.getPrincipalId())
                    .path(request.getMethod() + " " + request.getRequestURI())
                    .limit(decision.getLimit())
                    .retryAfterSeconds(decision.getRetryAfterSeconds())
                    .occurredAt(clock.instant())
                    .build());
        } catch (RuntimeException e) {
            log.warn("Failed to audit denial for operation {}", operation, e);
        }
    }

    private String bucketKey(String operation, RequestContext context) {
        return rules.find(operation)
                .map(rule -> keyBuilder.buildKey(rule, context).getValue())
                .orElse(null);
    }
}
