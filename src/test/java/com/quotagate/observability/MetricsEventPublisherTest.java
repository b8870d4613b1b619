package com.quotagate.observability;

import com.quotagate.core.RateLimitScope;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class MetricsEventPublisherTest {

    private SimpleMeterRegistry registry;
    private MetricsEventPublisher publisher;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        publisher = new MetricsEventPublisher(registry);
    }

    private static RateLimitEvent event(RateLimitEventType type, FailOpenReason reason) {
        return RateLimitEvent.builder()
                .type(type)
                .operationId("login")
                .key("ip:203.0.113.1:login")
                .scope(RateLimitScope.IP)
                .cost(1)
                .latencyNanos(2_000_000)
                .failOpenReason(reason)
                .occurredAt(Instant.EPOCH)
                .build();
    }

    @Test
    @DisplayName("Counts outcomes per operation")
    void shouldCountOutcomes() {
        publisher.publish(event(RateLimitEventType.ALLOWED, null));
        publisher.publish(event(RateLimitEventType.ALLOWED, null));
        publisher.publish(event(RateLimitEventType.DENIED, null));

        assertEquals(2.0, registry.get(MetricsEventPublisher.CHECKS)
                .tags("operation", "login", "outcome", "allowed").counter().count());
        assertEquals(1.0, registry.get(MetricsEventPublisher.CHECKS)
                .tags("operation", "login", "outcome", "denied").counter().count());
    }

    @Test
    @DisplayName("Fail-opens are counted with their reason")
    void shouldCountFailOpens() {
        publisher.publish(event(RateLimitEventType.FAIL_OPEN, FailOpenReason.STORE_TIMEOUT));

        assertEquals(1.0, registry.get(MetricsEventPublisher.FAIL_OPEN)
                .tags("operation", "login", "reason", "store_timeout").counter().count());
        assertEquals(1.0, registry.get(MetricsEventPublisher.CHECKS)
                .tags("outcome", "fail_open").counter().count());
    }

    @Test
    @DisplayName("CHECKED records latency")
    void shouldRecordLatency() {
        publisher.publish(event(RateLimitEventType.CHECKED, null));

        assertEquals(1, registry.get(MetricsEventPublisher.LATENCY).timer().count());
    }
}
