package com.quotagate.web;

import com.quotagate.config.RateLimitRuleRegistry;
import com.quotagate.core.Decision;
import com.quotagate.core.RateLimitRule;
import com.quotagate.core.RateLimiter;
import com.quotagate.core.RequestContext;
import com.quotagate.storage.AtomicBucketStore;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

/**
 * Demo API showing each scope, plus one handler that checks programmatically
 * with a per-request cost.
 */
@Slf4j
@RestController
@RequestMapping("/api")
public class DemoController {

    private final RateLimiter rateLimiter;
    private final RateLimitRuleRegistry rules;
    private final RequestContextResolver contextResolver;
    private final AtomicBucketStore store;

    public DemoController(RateLimiter rateLimiter, RateLimitRuleRegistry rules,
                          RequestContextResolver contextResolver, AtomicBucketStore store) {
        this.rateLimiter = rateLimiter;
        this.rules = rules;
        this.contextResolver = contextResolver;
        this.store = store;
    }

    /**
     * Login, limited per client address to slow down credential stuffing
     */
    @PostMapping("/login")
    @RateLimited(operation = "login")
    public ResponseEntity<Map<String, Object>> login(@RequestBody Map<String, String> credentials) {
        Map<String, Object> response = new HashMap<>();
        response.put("message", "Login accepted");
        response.put("username", credentials.getOrDefault("username", "unknown"));
        return ResponseEntity.ok(response);
    }

    /**
     * Standard read endpoint, limited per authenticated user
     */
    @GetMapping("/data")
    @RateLimited(operation = "data")
    public ResponseEntity<Map<String, Object>> getData() {
        Map<String, Object> response = new HashMap<>();
        response.put("message", "Success!");
        response.put("data", Map.of("timestamp", System.currentTimeMillis()));
        return ResponseEntity.ok(response);
    }

    /**
     * Provider sync, limited per user per provider
     */
    @PostMapping("/providers/{providerId}/sync")
    @RateLimited(operation = "provider_sync", resourceVariable = "providerId")
    public ResponseEntity<Map<String, Object>> syncProvider(@PathVariable String providerId) {
        Map<String, Object> response = new HashMap<>();
        response.put("message", "Sync started");
        response.put("provider", providerId);
        return ResponseEntity.accepted().body(response);
    }

    /**
     * Expensive export; the rule's cost applies
     */
    @PostMapping("/reports/export")
    @RateLimited(operation = "export")
    public ResponseEntity<Map<String, Object>> export() {
        Map<String, Object> response = new HashMap<>();
        response.put("message", "Export queued");
        return ResponseEntity.accepted().body(response);
    }

    /**
     * Maintenance broadcast, one shared bucket for everyone
     */
    @PostMapping("/broadcast")
    @RateLimited(operation = "broadcast")
    public ResponseEntity<Map<String, Object>> broadcast() {
        Map<String, Object> response = new HashMap<>();
        response.put("message", "Broadcast sent");
        return ResponseEntity.ok(response);
    }

    /**
     * Batch endpoint: the cost is the batch size, so it checks in code.
     * Sizes the bucket could never hold are rejected before charging anything.
     */
    @PostMapping("/batch")
    public ResponseEntity<Map<String, Object>> processBatch(
            @RequestBody Map<String, Object> batch,
            HttpServletRequest request) {

        Object size = batch.getOrDefault("size", 1);
        long maxSize = Math.min(Integer.MAX_VALUE,
                rules.find("batch").map(RateLimitRule::getCapacity).orElse((long) Integer.MAX_VALUE));
        if (!(size instanceof Integer || size instanceof Long)
                || ((Number) size).longValue() < 1 || ((Number) size).longValue() > maxSize) {
            log.debug("Batch rejected, size {} outside 1..{}", size, maxSize);
            Map<String, Object> error = new HashMap<>();
            error.put("error", "invalid_batch_size");
            error.put("message", "size must be a whole number between 1 and " + maxSize);
            return ResponseEntity.badRequest().body(error);
        }
        int batchSize = ((Number) size).intValue();

        RequestContext context = contextResolver.resolve(request, null);
        Decision decision = rateLimiter.check("batch", context, batchSize);

        if (!decision.isAllowed()) {
            log.info("Batch of {} rejected, retry in {}s", batchSize, decision.getRetryAfterSeconds());
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                    .headers(RateLimitResponses.headers(decision))
                    .contentType(MediaType.APPLICATION_PROBLEM_JSON)
                    .body(RateLimitResponses.problem(decision, request.getRequestURI()));
        }

        Map<String, Object> response = new HashMap<>();
        response.put("message", "Batch processed");
        response.put("items_processed", batchSize);
        response.put("tokens_remaining", decision.getRemainingTokens());
        return ResponseEntity.ok()
                .headers(RateLimitResponses.headers(decision))
                .body(response);
    }

    /**
     * Health check endpoint (not rate limited)
     */
    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        boolean storeUp = store.isAvailable();
        Map<String, String> status = new HashMap<>();
        status.put("status", "UP");
        status.put("store", storeUp ? "UP" : "DOWN");
        status.put("timestamp", String.valueOf(System.currentTimeMillis()));
        return ResponseEntity.ok(status);
    }
}
