package com.quotagate.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

/**
 * Turns limiter events into Micrometer meters.
 *
 * <ul>
 *   <li>{@code quotagate.checks} by operation and outcome</li>
 *   <li>{@code quotagate.fail_open} by operation and reason</li>
 *   <li>{@code quotagate.check.latency} by operation</li>
 * </ul>
 */
public class MetricsEventPublisher implements RateLimitEventPublisher {

    static final String CHECKS = "quotagate.checks";
    static final String FAIL_OPEN = "quotagate.fail_open";
    static final String LATENCY = "quotagate.check.latency";

    private final MeterRegistry registry;

    public MetricsEventPublisher(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void publish(RateLimitEvent event) {
        String operation = event.getOperationId() == null ? "unknown" : event.getOperationId();
        switch (event.getType()) {
            case CHECKED:
                Timer.builder(LATENCY)
                        .description("Admission check latency including the store round trip")
                        .tag("operation", operation)
                        .register(registry)
                        .record(event.getLatencyNanos(), TimeUnit.NANOSECONDS);
                break;
            case ALLOWED:
                outcome(operation, "allowed");
                break;
            case DENIED:
                outcome(operation, "denied");
                break;
            case FAIL_OPEN:
                outcome(operation, "fail_open");
                Counter.builder(FAIL_OPEN)
                        .description("Checks admitted without enforcement")
                        .tag("operation", operation)
                        .tag("reason", event.getFailOpenReason() == null ? "unknown" : event.getFailOpenReason().tag())
                        .register(registry)
                        .increment();
                break;
            default:
                break;
        }
    }

    private void outcome(String operation, String outcome) {
        Counter.builder(CHECKS)
                .description("Admission decisions")
                .tag("operation", operation)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
