package com.intteq.reliable.subscriber.internal;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Reports the consumer connection state and the active subscriptions.
 */
@RequiredArgsConstructor
public class SubscriberHealthIndicator implements HealthIndicator {

    private final RabbitBusSubscriber subscriber;
    private final SubscriptionRegistry registry;

    @Override
    public Health health() {
        Health.Builder builder = subscriber.isConnectionOpen() ? Health.up() : Health.down();
        return builder
                .withDetail("subscriptions", registry.size())
                .withDetail("channels", registry.keys())
                .build();
    }
}
