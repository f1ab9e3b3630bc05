package com.intteq.reliable.subscriber.internal;

import com.intteq.reliable.subscriber.conventions.Conventions;
import com.rabbitmq.client.Channel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SubscriberHealthIndicatorTest {

    @Mock
    private RabbitBusSubscriber subscriber;

    @Test
    void upWithSubscriptionDetails() {
        SubscriptionRegistry registry = new SubscriptionRegistry();
        Conventions conventions = new Conventions("orders", "orders.order_created", "order_created");
        registry.registerOrReuse(conventions.channelKey(), () -> new ChannelEntry(mock(Channel.class), conventions));
        when(subscriber.isConnectionOpen()).thenReturn(true);

        Health health = new SubscriberHealthIndicator(subscriber, registry).health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails())
                .containsEntry("subscriptions", 1)
                .containsEntry("channels", Set.of("orders:orders.order_created:order_created"));
    }

    @Test
    void downWhenConnectionClosed() {
        when(subscriber.isConnectionOpen()).thenReturn(false);

        Health health = new SubscriberHealthIndicator(subscriber, new SubscriptionRegistry()).health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
    }
}
