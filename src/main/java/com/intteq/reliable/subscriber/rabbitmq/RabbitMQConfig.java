package com.intteq.reliable.subscriber.rabbitmq;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory;
import org.springframework.amqp.rabbit.connection.CachingConnectionFactory.CacheMode;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.connection.CorrelationData;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.boot.autoconfigure.amqp.RabbitProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * RabbitMQ infrastructure: the publishing connection factory and template, plus the dedicated
 * consumer connection.
 *
 * SSL is supported automatically if spring.rabbitmq.ssl.enabled=true.
 * No custom SSLContext building is done here; Spring Boot handles that.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
public class RabbitMQConfig {

    private static final String CONSUMER_CONNECTION_NAME = "reliable-subscriber-consumer";

    @Bean
    @ConditionalOnMissingBean(ConnectionFactory.class)
    public CachingConnectionFactory connectionFactory(RabbitProperties rabbitProps, ObjectMapper objectMapper) {
        CachingConnectionFactory factory = new CachingConnectionFactory();

        factory.setHost(rabbitProps.getHost());
        factory.setPort(rabbitProps.determinePort());
        factory.setUsername(rabbitProps.getUsername());
        factory.setPassword(rabbitProps.getPassword());
        if (rabbitProps.getVirtualHost() != null) {
            factory.setVirtualHost(rabbitProps.getVirtualHost());
        }

        var timeout = rabbitProps.getConnectionTimeout();
        factory.setConnectionTimeout(timeout != null ? (int) timeout.toMillis() : 10000);

        var heartbeat = rabbitProps.getRequestedHeartbeat();
        factory.setRequestedHeartBeat(heartbeat != null ? (int) heartbeat.getSeconds() : 60);

        factory.setCacheMode(CacheMode.CHANNEL);
        factory.setChannelCacheSize(50);
        factory.setChannelCheckoutTimeout(10_000);

        // Publisher confirms
        factory.setPublisherConfirmType(CachingConnectionFactory.ConfirmType.CORRELATED);
        factory.setPublisherReturns(true);

        // Delivery callbacks rethrow pipeline failures; keep the channel open when they do.
        factory.getRabbitConnectionFactory().setExceptionHandler(new CallbackExceptionLogger(objectMapper));

        if (Boolean.TRUE.equals(rabbitProps.getSsl().getEnabled())) {
            log.info("RabbitMQ SSL enabled by application properties");
        }

        log.info("RabbitMQ ConnectionFactory initialized: host={} port={}",
                rabbitProps.getHost(), rabbitProps.determinePort());

        return factory;
    }

    /**
     * Opens the consumer connection on the same settings as the publishing factory.
     * Closed by the subscriber on shutdown.
     */
    @Bean
    @ConditionalOnMissingBean
    public ConsumerConnection consumerConnection(CachingConnectionFactory connectionFactory)
            throws IOException, TimeoutException {
        var connection = connectionFactory.getRabbitConnectionFactory().newConnection(CONSUMER_CONNECTION_NAME);
        log.info("RabbitMQ consumer connection opened: {}", connection.getClientProvidedName());
        return new ConsumerConnection(connection);
    }

    @Bean
    @ConditionalOnMissingBean
    public MessageConverter messageConverter(ObjectMapper objectMapper) {
        Jackson2JsonMessageConverter converter = new Jackson2JsonMessageConverter(objectMapper);
        converter.setCreateMessageIds(true);
        return converter;
    }

    @Bean
    @ConditionalOnMissingBean
    public RabbitTemplate rabbitTemplate(
            ConnectionFactory connectionFactory,
            MessageConverter messageConverter
    ) {
        RabbitTemplate template = new RabbitTemplate(connectionFactory);
        template.setMessageConverter(messageConverter);
        template.setMandatory(true);

        template.setConfirmCallback((CorrelationData cd, boolean ack, String cause) -> {
            if (ack) {
                log.debug("Publish confirmed: correlationId={}", cd != null ? cd.getId() : null);
            } else {
                log.error("Publish failed: correlationId={} cause={}",
                        cd != null ? cd.getId() : null, cause);
            }
        });

        template.setReturnsCallback(returned ->
                log.error("Returned message: exchange={} routingKey={} replyCode={} replyText={}",
                        returned.getExchange(),
                        returned.getRoutingKey(),
                        returned.getReplyCode(),
                        returned.getReplyText())
        );

        return template;
    }
}
