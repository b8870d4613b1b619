package com.quotagate.web;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a handler method as admission-controlled.
 *
 * <pre>
 * &#64;PostMapping("/providers/{providerId}/sync")
 * &#64;RateLimited(operation = "provider_sync", resourceVariable = "providerId")
 * public ResponseEntity&lt;?&gt; sync(...)
 * </pre>
 *
 * Every operation named here must have a rule under {@code ratelimit.rules},
 * otherwise the application refuses to start.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.METHOD)
public @interface RateLimited {

    /**
     * Operation id, the key of the rule under {@code ratelimit.rules}.
     */
    String operation();

    /**
     * Tokens per call; 0 uses the rule's cost.
     */
    int cost() default 0;

    /**
     * URI template variable holding the resource id for USER_RESOURCE rules.
     */
    String resourceVariable() default "";
}
