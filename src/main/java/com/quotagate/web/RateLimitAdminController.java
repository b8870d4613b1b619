package com.quotagate.web;

import com.quotagate.config.RateLimitRuleRegistry;
import com.quotagate.core.RateLimitRule;
import com.quotagate.core.RateLimiter;
import com.quotagate.core.RequestContext;
import com.quotagate.core.ScopeResolutionException;
import com.quotagate.storage.StorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * Operator endpoints: inspect rules, read and reset individual buckets.
 * The bucket is addressed by the same identity fields a request would carry.
 */
@Slf4j
@RestController
@RequestMapping("/admin/rate-limits")
public class RateLimitAdminController {

    private final RateLimiter rateLimiter;
    private final RateLimitRuleRegistry rules;

    public RateLimitAdminController(RateLimiter rateLimiter, RateLimitRuleRegistry rules) {
        this.rateLimiter = rateLimiter;
        this.rules = rules;
    }

    @GetMapping
    public Map<String, RateLimitRule> rules() {
        return rules.snapshot();
    }

    @GetMapping("/{operationId}")
    public ResponseEntity<Map<String, Object>> remaining(
            @PathVariable String operationId,
            @RequestParam(required = false) String ip,
            @RequestParam(required = false) String user,
            @RequestParam(required = false) String resource) {

        if (rules.find(operationId).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        Map<String, Object> response = new HashMap<>();
        response.put("operation", operationId);
        response.put("remaining", rateLimiter.getRemaining(operationId, context(ip, user, resource)));
        return ResponseEntity.ok(response);
    }

    @DeleteMapping("/{operationId}")
    public ResponseEntity<Void> reset(
            @PathVariable String operationId,
            @RequestParam(required = false) String ip,
            @RequestParam(required = false) String user,
            @RequestParam(required = false) String resource) {

        if (rules.find(operationId).isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        rateLimiter.reset(operationId, context(ip, user, resource));
        return ResponseEntity.noContent().build();
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<Map<String, String>> storeFailure(StorageException e) {
        log.error("Admin rate limit operation failed: {}", e.getMessage(), e);
        Map<String, String> error = new HashMap<>();
        error.put("error", "store_unavailable");
        error.put("message", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(error);
    }

    @ExceptionHandler(ScopeResolutionException.class)
    public ResponseEntity<Map<String, String>> missingIdentity(ScopeResolutionException e) {
        Map<String, String> error = new HashMap<>();
        error.put("error", "missing_identity");
        error.put("message", e.getMessage());
        return ResponseEntity.badRequest().body(error);
    }

    private static RequestContext context(String ip, String user, String resource) {
        return RequestContext.builder()
                .remoteAddress(ip)
                .principalId(user)
                .resourceId(resource)
                .build();
    }
}
