package com.intteq.reliable.subscriber.internal;

import com.intteq.reliable.subscriber.conventions.Conventions;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import lombok.experimental.Accessors;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;

/**
 * A subscription's channel together with the conventions it consumes.
 */
@Slf4j
@Getter
@Accessors(fluent = true)
@ToString(of = {"conventions", "consumerTag"})
public final class ChannelEntry {

    private final Channel channel;
    private final Conventions conventions;

    @Setter
    private volatile String consumerTag;

    /** Completes once the consumer is running, or exceptionally when it could not be started. */
    private final CompletableFuture<Void> provisioned = new CompletableFuture<>();

    public ChannelEntry(Channel channel, Conventions conventions) {
        this.channel = channel;
        this.conventions = conventions;
    }

    /**
     * Closes the channel. Failures are logged; a channel that is already closed is left alone.
     */
    public void close() {
        try {
            if (channel.isOpen()) {
                channel.close();
                log.debug("Closed channel {} for {}", channel.getChannelNumber(), conventions);
            }
        } catch (IOException | TimeoutException | AlreadyClosedException e) {
            log.warn("Failed to close channel for {}", conventions, e);
        }
    }
}
