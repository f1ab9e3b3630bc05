package com.intteq.reliable.subscriber;

import com.intteq.reliable.subscriber.exception.MessagingOperationException;
import com.rabbitmq.client.Channel;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Settles one delivery on its channel.
 *
 * <p>Only the first of {@link #ack()}, {@link #nack(boolean)} and {@link #reject(boolean)} reaches
 * the broker; later calls return {@code false} and do nothing. A handler that keeps running after
 * its attempt timed out therefore cannot settle the delivery a second time.
 *
 * <p>Broker I/O failures are wrapped in {@link MessagingOperationException}.
 */
@Slf4j
public final class DeliveryAcknowledgement {

    private final Channel channel;
    private final long deliveryTag;
    private final AtomicBoolean settled = new AtomicBoolean();
    private volatile Disposition disposition;

    public DeliveryAcknowledgement(Channel channel, long deliveryTag) {
        this.channel = Objects.requireNonNull(channel, "channel must not be null");
        this.deliveryTag = deliveryTag;
    }

    public long deliveryTag() {
        return deliveryTag;
    }

    public boolean isSettled() {
        return settled.get();
    }

    /**
     * How the delivery was settled, or {@code null} while it is still in flight.
     */
    public Disposition disposition() {
        return disposition;
    }

    public boolean ack() {
        return settle(Disposition.ACK, () -> channel.basicAck(deliveryTag, false));
    }

    public boolean nack(boolean requeue) {
        return settle(requeue ? Disposition.NACK_REQUEUE : Disposition.NACK,
                () -> channel.basicNack(deliveryTag, false, requeue));
    }

    public boolean reject(boolean requeue) {
        return settle(requeue ? Disposition.REJECT_REQUEUE : Disposition.REJECT,
                () -> channel.basicReject(deliveryTag, requeue));
    }

    private boolean settle(Disposition operation, BrokerOperation action) {
        if (!settled.compareAndSet(false, true)) {
            log.debug("Delivery already settled, skipping {} (tag={})", operation, deliveryTag);
            return false;
        }

        disposition = operation;
        try {
            action.run();
            log.debug("RabbitMQ {} issued (tag={})", operation, deliveryTag);
            return true;
        } catch (IOException | RuntimeException e) {
            log.error("Failed to {} message (tag={})", operation, deliveryTag, e);
            throw new MessagingOperationException("Failed to " + operation + " message (tag=" + deliveryTag + ")", e);
        }
    }

    public enum Disposition {
        ACK,
        NACK,
        NACK_REQUEUE,
        REJECT,
        REJECT_REQUEUE
    }

    @FunctionalInterface
    private interface BrokerOperation {
        void run() throws IOException;
    }
}
