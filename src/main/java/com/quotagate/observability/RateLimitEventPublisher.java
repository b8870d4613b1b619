package com.quotagate.observability;

/**
 * Outbound sink for limiter events. The limiter needs nothing beyond
 * publishing; subscribers are the implementation's business.
 */
public interface RateLimitEventPublisher {

    void publish(RateLimitEvent event);
}
