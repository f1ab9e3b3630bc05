package com.intteq.reliable.subscriber.publisher;

import com.intteq.reliable.subscriber.CorrelationContext;

import java.util.concurrent.CompletableFuture;

/**
 * Outbound side used by the subscriber to publish rejected events.
 */
public interface BusPublisher {

    /**
     * Publishes {@code event} to the exchange and routing key of its conventions.
     *
     * @param event         message to publish
     * @param correlationId correlation id carried over from the message that caused it, may be null
     * @param context       correlation context written to the message headers
     * @return a future completed once the broker accepted the message
     */
    CompletableFuture<Void> publish(Object event, String correlationId, CorrelationContext context);
}
