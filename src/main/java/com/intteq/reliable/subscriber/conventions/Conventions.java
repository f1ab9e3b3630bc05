package com.intteq.reliable.subscriber.conventions;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Exchange, queue and routing key of a message type. Identifies a subscription.
 */
@Getter
@Accessors(fluent = true)
@ToString
@EqualsAndHashCode
public final class Conventions {

    private final String exchange;
    private final String queue;
    private final String routingKey;

    public Conventions(String exchange, String queue, String routingKey) {
        this.exchange = Objects.requireNonNull(exchange, "exchange must not be null");
        this.queue = Objects.requireNonNull(queue, "queue must not be null");
        this.routingKey = Objects.requireNonNull(routingKey, "routingKey must not be null");
    }

    /**
     * Key under which the subscription's channel is registered.
     */
    public String channelKey() {
        return exchange + ":" + queue + ":" + routingKey;
    }
}
