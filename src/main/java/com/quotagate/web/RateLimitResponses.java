package com.quotagate.web;

import com.quotagate.core.Decision;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * Quota headers and the 429 problem body, shared by the interceptor and
 * handlers that check programmatically.
 */
public final class RateLimitResponses {

    public static final String LIMIT = "X-RateLimit-Limit";
    public static final String REMAINING = "X-RateLimit-Remaining";
    public static final String RESET = "X-RateLimit-Reset";

    static final String PROBLEM_TYPE = "/errors/rate-limit-exceeded";

    private RateLimitResponses() {
    }

    /**
     * Whole seconds for Retry-After: rounded up, at least 1.
     */
    public static long retryAfterSeconds(Decision decision) {
        return Math.max(1L, (long) Math.ceil(decision.getRetryAfterSeconds()));
    }

    /**
     * Writes quota metadata; nothing for unmetered decisions.
     */
    public static void writeHeaders(Decision decision, BiConsumer<String, String> setter) {
        if (!decision.isMetered()) {
            return;
        }
        setter.accept(LIMIT, String.valueOf(decision.getLimit()));
        setter.accept(REMAINING, String.valueOf(decision.getRemainingTokens()));
        setter.accept(RESET, String.valueOf(decision.getResetSeconds()));
        if (!decision.isAllowed()) {
            setter.accept(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds(decision)));
        }
    }

    public static HttpHeaders headers(Decision decision) {
        HttpHeaders headers = new HttpHeaders();
        writeHeaders(decision, headers::set);
        return headers;
    }

    /**
     * RFC 7807 problem document for a denial.
     */
    public static Map<String, Object> problem(Decision decision, String path) {
        long retryAfter = retryAfterSeconds(decision);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", PROBLEM_TYPE);
        body.put("title", "Rate Limit Exceeded");
        body.put("status", HttpStatus.TOO_MANY_REQUESTS.value());
        body.put("detail", "Too many requests. Please try again in " + retryAfter + " seconds.");
        body.put("instance", path);
        body.put("retry_after", retryAfter);
        return body;
    }
}
