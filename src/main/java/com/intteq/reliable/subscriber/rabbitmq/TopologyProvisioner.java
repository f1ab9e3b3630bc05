package com.intteq.reliable.subscriber.rabbitmq;

import com.intteq.reliable.subscriber.MessagingProperties;
import com.intteq.reliable.subscriber.conventions.Conventions;
import com.intteq.reliable.subscriber.exception.TopologyException;
import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Channel;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * Declares the broker topology of one subscription on its channel:
 * <ul>
 *     <li>the exchange, when {@code exchange.declare} is set</li>
 *     <li>the queue, when {@code queue.declare} is set, pointing at the dead-letter exchange when
 *     dead-lettering is enabled</li>
 *     <li>the queue → exchange binding with the routing key</li>
 *     <li>basic.qos</li>
 *     <li>optionally the dead-letter exchange and queue, the latter dead-lettering back to the
 *     primary exchange</li>
 * </ul>
 *
 * <p>All declarations are idempotent on the broker side. Failures are not retried; they surface
 * as {@link TopologyException}.
 */
@Slf4j
public class TopologyProvisioner {

    static final String DEAD_LETTER_EXCHANGE = "x-dead-letter-exchange";
    static final String DEAD_LETTER_ROUTING_KEY = "x-dead-letter-routing-key";
    static final String MESSAGE_TTL = "x-message-ttl";

    private final MessagingProperties properties;
    private final QosSettings qos;
    private final DeadLetterSettings deadLetter;

    public TopologyProvisioner(MessagingProperties properties) {
        this.properties = properties;
        this.qos = QosSettings.from(properties.getQos());
        this.deadLetter = DeadLetterSettings.from(properties.getDeadLetter());
    }

    public void provision(Channel channel, Conventions conventions) {
        try {
            declare(channel, conventions);
        } catch (IOException | RuntimeException e) {
            throw new TopologyException("Failed to declare topology for " + conventions, e);
        }
    }

    private void declare(Channel channel, Conventions conventions) throws IOException {
        MessagingProperties.ExchangeConfig exchange = properties.getExchange();
        MessagingProperties.QueueConfig queue = properties.getQueue();
        boolean loggerEnabled = properties.getLogger().isEnabled();

        String deadLetterExchange = deadLetter.exchangeName(conventions.exchange());
        String deadLetterQueue = deadLetter.queueName(conventions.queue());

        if (exchange.isDeclare()) {
            channel.exchangeDeclare(conventions.exchange(), exchange.getType(),
                    exchange.isDurable(), exchange.isAutoDelete(), null);
        }

        if (queue.isDeclare()) {
            if (loggerEnabled) {
                log.info("Declaring a queue: '{}' with routing key: '{}' for an exchange: '{}'.",
                        conventions.queue(), conventions.routingKey(), conventions.exchange());
            }

            Map<String, Object> arguments = new HashMap<>();
            if (deadLetter.enabled()) {
                arguments.put(DEAD_LETTER_EXCHANGE, deadLetterExchange);
                arguments.put(DEAD_LETTER_ROUTING_KEY, deadLetterQueue);
            }
            channel.queueDeclare(conventions.queue(), queue.isDurable(), queue.isExclusive(),
                    queue.isAutoDelete(), arguments);
        }

        channel.queueBind(conventions.queue(), conventions.exchange(), conventions.routingKey());
        channel.basicQos(qos.prefetchSize(), qos.prefetchCount(), qos.global());

        if (!deadLetter.enabled()) {
            return;
        }

        if (deadLetter.declare()) {
            Long ttl = deadLetter.effectiveTtlMillis();

            Map<String, Object> arguments = new HashMap<>();
            arguments.put(DEAD_LETTER_EXCHANGE, conventions.exchange());
            arguments.put(DEAD_LETTER_ROUTING_KEY, conventions.queue());
            if (ttl != null) {
                arguments.put(MESSAGE_TTL, ttl);
            }

            log.info("Declaring a dead letter queue: '{}' for an exchange: '{}'{}",
                    deadLetterQueue, deadLetterExchange, ttl != null ? ", message TTL: " + ttl + " ms." : ".");

            channel.exchangeDeclare(deadLetterExchange, BuiltinExchangeType.DIRECT.getType(),
                    deadLetter.durable(), deadLetter.autoDelete(), null);
            channel.queueDeclare(deadLetterQueue, deadLetter.durable(), deadLetter.exclusive(),
                    deadLetter.autoDelete(), arguments);
        }

        channel.queueBind(deadLetterQueue, deadLetterExchange, deadLetterQueue);
    }

    public QosSettings qos() {
        return qos;
    }

    public DeadLetterSettings deadLetter() {
        return deadLetter;
    }
}
