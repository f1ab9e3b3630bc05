package com.intteq.reliable.subscriber.internal;

import com.intteq.reliable.subscriber.BusSubscriber;
import com.intteq.reliable.subscriber.DeliveryAcknowledgement;
import com.intteq.reliable.subscriber.DeliveryInfo;
import com.intteq.reliable.subscriber.MessageEnvelope;
import com.intteq.reliable.subscriber.MessageHandler;
import com.intteq.reliable.subscriber.MessagingProperties;
import com.intteq.reliable.subscriber.context.CorrelationContextBuilder;
import com.intteq.reliable.subscriber.context.MessageScope;
import com.intteq.reliable.subscriber.conventions.Conventions;
import com.intteq.reliable.subscriber.conventions.ConventionsProvider;
import com.intteq.reliable.subscriber.exception.MessagingOperationException;
import com.intteq.reliable.subscriber.exception.TopologyException;
import com.intteq.reliable.subscriber.plugin.PluginChain;
import com.intteq.reliable.subscriber.plugin.PluginPipeline;
import com.intteq.reliable.subscriber.processing.ExceptionToMessageMapper;
import com.intteq.reliable.subscriber.processing.MessageProcessor;
import com.intteq.reliable.subscriber.publisher.BusPublisher;
import com.intteq.reliable.subscriber.rabbitmq.ConnectionDiagnostics;
import com.intteq.reliable.subscriber.rabbitmq.TopologyProvisioner;
import com.intteq.reliable.subscriber.serialization.MessageSerializer;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ScheduledExecutorService;

/**
 * RabbitMQ {@link BusSubscriber}.
 *
 * <p><b>Responsibilities:</b></p>
 * <ul>
 *     <li>One channel and one consumer per {@code exchange:queue:routingKey}, registered once</li>
 *     <li>Topology declaration before consuming; a failure leaves nothing registered</li>
 *     <li>Per delivery: envelope and correlation context, body decoding, plugin pipeline,
 *     {@link MessageProcessor} as the terminal stage</li>
 *     <li>Rejecting (without requeue) deliveries whose pipeline fails before or around the processor</li>
 *     <li>Connection diagnostics while {@code logger.enabled} and {@code logger.log-connection-status}</li>
 * </ul>
 *
 * <p>The delivery callback only starts the pipeline; handlers, timeouts and retry waits complete
 * asynchronously. Concurrency per channel is bounded by the prefetch count.
 */
@Slf4j
public class RabbitBusSubscriber implements BusSubscriber {

    private final Connection connection;
    private final SubscriptionRegistry registry;
    private final ConventionsProvider conventionsProvider;
    private final TopologyProvisioner topologyProvisioner;
    private final MessageSerializer serializer;
    private final CorrelationContextBuilder contextBuilder;
    private final PluginPipeline pluginPipeline;
    private final ExceptionToMessageMapper exceptionMapper;
    private final BusPublisher publisher;
    private final ScheduledExecutorService scheduler;
    private final MessagingProperties properties;
    private final boolean loggerEnabled;
    private final ConnectionDiagnostics diagnostics;

    @Builder
    public RabbitBusSubscriber(Connection connection,
                               SubscriptionRegistry registry,
                               ConventionsProvider conventionsProvider,
                               TopologyProvisioner topologyProvisioner,
                               MessageSerializer serializer,
                               CorrelationContextBuilder contextBuilder,
                               PluginPipeline pluginPipeline,
                               ExceptionToMessageMapper exceptionMapper,
                               BusPublisher publisher,
                               ScheduledExecutorService scheduler,
                               MessagingProperties properties) {
        this.connection = connection;
        this.registry = registry;
        this.conventionsProvider = conventionsProvider;
        this.topologyProvisioner = topologyProvisioner;
        this.serializer = serializer;
        this.contextBuilder = contextBuilder;
        this.pluginPipeline = pluginPipeline;
        this.exceptionMapper = exceptionMapper != null ? exceptionMapper : ExceptionToMessageMapper.none();
        this.publisher = publisher;
        this.scheduler = scheduler;
        this.properties = properties;
        this.loggerEnabled = properties.getLogger().isEnabled();

        this.diagnostics = loggerEnabled && properties.getLogger().isLogConnectionStatus()
                ? ConnectionDiagnostics.attach(connection)
                : null;
    }

    // =====================================================================
    // SUBSCRIPTION
    // =====================================================================

    @Override
    public <T> BusSubscriber subscribe(Class<T> messageType, MessageHandler<T> handler) {
        Conventions conventions = conventionsProvider.get(messageType);
        String channelKey = conventions.channelKey();

        SubscriptionRegistry.Registration registration =
                registry.registerOrReuse(channelKey, () -> new ChannelEntry(openChannel(conventions), conventions));
        ChannelEntry entry = registration.entry();
        if (!registration.isNew()) {
            awaitProvisioned(entry, messageType);
            return this;
        }

        Channel channel = entry.channel();
        log.trace("Created a channel: {}", channel.getChannelNumber());

        try {
            topologyProvisioner.provision(channel, conventions);

            MessageProcessor<T> processor = new MessageProcessor<>(
                    messageType, handler, exceptionMapper, publisher, scheduler, properties);
            PluginChain pipeline = pluginPipeline.build(processor::process);

            String consumerTag = channel.basicConsume(conventions.queue(), false,
                    new DeliveryConsumer<>(channel, messageType, conventions, pipeline));
            entry.consumerTag(consumerTag);
            entry.provisioned().complete(null);

            log.info("RabbitMQ consumer started → queue={} exchange={} routingKey={} plugins={}",
                    conventions.queue(), conventions.exchange(), conventions.routingKey(), pluginPipeline.size());

        } catch (IOException | RuntimeException e) {
            registry.remove(channelKey, entry);
            entry.close();
            log.error("Failed to subscribe {} → queue={}", messageType.getName(), conventions.queue(), e);
            TopologyException failure = e instanceof TopologyException topologyException
                    ? topologyException
                    : new TopologyException("Failed to start consuming from queue " + conventions.queue(), e);
            entry.provisioned().completeExceptionally(failure);
            throw failure;
        }

        return this;
    }

    /**
     * Blocks a caller that lost the registration race until the winning caller has started the
     * consumer, and fails it the same way when the winner could not.
     */
    private void awaitProvisioned(ChannelEntry entry, Class<?> messageType) {
        try {
            entry.provisioned().join();
        } catch (CompletionException e) {
            throw new TopologyException("Subscription for " + messageType.getName() + " failed to start", e.getCause());
        }
    }

    private Channel openChannel(Conventions conventions) {
        try {
            Channel channel = connection.createChannel();
            if (channel == null) {
                throw new TopologyException("No channel available for " + conventions, null);
            }
            return channel;
        } catch (IOException e) {
            throw new TopologyException("Failed to open a channel for " + conventions, e);
        }
    }

    // =====================================================================
    // DELIVERY
    // =====================================================================

    private final class DeliveryConsumer<T> extends DefaultConsumer {

        private final Class<T> messageType;
        private final PluginChain pipeline;
        private final String info;

        private DeliveryConsumer(Channel channel, Class<T> messageType, Conventions conventions, PluginChain pipeline) {
            super(channel);
            this.messageType = messageType;
            this.pipeline = pipeline;
            this.info = " [queue: '" + conventions.queue() + "', routing key: '" + conventions.routingKey()
                    + "', exchange: '" + conventions.exchange() + "']";
        }

        @Override
        public void handleDelivery(String consumerTag,
                                   Envelope envelope,
                                   AMQP.BasicProperties properties,
                                   byte[] body) {
            DeliveryAcknowledgement acknowledgement =
                    new DeliveryAcknowledgement(getChannel(), envelope.getDeliveryTag());

            try {
                MessageScope scope = contextBuilder.build(properties, body);
                MessageEnvelope message = scope.envelope();
                if (loggerEnabled) {
                    log.info("Received a message with id: '{}', correlation id: '{}', timestamp: {}{}.",
                            message.messageId(), message.correlationId(), message.timestampUnixSeconds(), info);
                }

                T payload = serializer.deserialize(body, messageType);
                DeliveryInfo delivery = new DeliveryInfo(acknowledgement, envelope.isRedeliver(),
                        envelope.getExchange(), envelope.getRoutingKey(), message);

                CompletableFuture<Void> result = pipeline.proceed(payload, scope.correlationContext(), delivery);
                if (result == null) {
                    onPipelineCompleted(acknowledgement, null);
                } else {
                    result.whenComplete((ignored, error) -> onPipelineCompleted(acknowledgement, error));
                }

            } catch (RuntimeException | Error ex) {
                log.error("Message pipeline failed{}: {}", info, ex.toString(), ex);
                try {
                    acknowledgement.reject(false);
                } catch (MessagingOperationException rejectFailure) {
                    ex.addSuppressed(rejectFailure);
                }
                throw ex;
            }
        }

        private void onPipelineCompleted(DeliveryAcknowledgement acknowledgement, Throwable error) {
            try {
                if (error != null) {
                    log.error("Message pipeline failed{}", info, error);
                    acknowledgement.reject(false);
                } else if (!acknowledgement.isSettled()) {
                    log.debug("Pipeline finished without settling delivery {}{}, acknowledging",
                            acknowledgement.deliveryTag(), info);
                    acknowledgement.ack();
                }
            } catch (MessagingOperationException e) {
                log.error("Could not settle delivery {}{}", acknowledgement.deliveryTag(), info, e);
            }
        }
    }

    // =====================================================================
    // SHUTDOWN
    // =====================================================================

    public int subscriptionCount() {
        return registry.size();
    }

    public boolean isConnectionOpen() {
        return connection.isOpen();
    }

    /**
     * Closes every channel, detaches diagnostics and closes the consumer connection.
     */
    @Override
    public void close() {
        log.info("Stopping RabbitMQ subscriptions...");

        for (ChannelEntry entry : registry.drain()) {
            entry.close();
            log.info("Stopped RabbitMQ consumer → queue={}", entry.conventions().queue());
        }

        if (diagnostics != null) {
            diagnostics.close();
        }

        try {
            if (connection.isOpen()) {
                connection.close();
            }
        } catch (IOException | AlreadyClosedException e) {
            log.warn("Failed to close RabbitMQ consumer connection", e);
        }
    }
}
