package com.intteq.reliable.subscriber;

/**
 * Consumer-side entry point: registers handlers for message types.
 *
 * <p>Usage:
 * <pre>
 * {@code
 * subscriber
 *     .subscribe(OrderCreated.class, (message, ctx) -> orders.create(message))
 *     .subscribe(OrderCancelled.class, (message, ctx) -> orders.cancel(message));
 * }
 * </pre>
 *
 * <p>Subscribing the same message type twice is a no-op: the first registration wins.
 * Closing the subscriber closes all of its channels and the consumer connection.
 */
public interface BusSubscriber extends AutoCloseable {

    <T> BusSubscriber subscribe(Class<T> messageType, MessageHandler<T> handler);

    @Override
    void close();
}
