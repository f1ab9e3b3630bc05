package com.intteq.reliable.subscriber.rabbitmq;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.Consumer;
import com.rabbitmq.client.impl.ForgivingExceptionHandler;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Connection-level handler for exceptions thrown from client callbacks, most notably a delivery
 * callback rethrowing a pipeline failure.
 *
 * <p>Unlike the client's default handler it never closes the channel: the failed delivery has
 * already been rejected and the consumer keeps running.
 */
@Slf4j
public class CallbackExceptionLogger extends ForgivingExceptionHandler {

    private final ObjectMapper objectMapper;

    public CallbackExceptionLogger(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void handleConsumerException(Channel channel,
                                        Throwable exception,
                                        Consumer consumer,
                                        String consumerTag,
                                        String methodName) {
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("consumerTag", consumerTag);
        detail.put("method", methodName);
        detail.put("channel", channel != null ? channel.getChannelNumber() : null);

        log.error("RabbitMQ callback exception occurred. {}", describe(detail), exception);
    }

    @Override
    public void handleUnexpectedConnectionDriverException(Connection connection, Throwable exception) {
        log.error("RabbitMQ callback exception occurred in the connection driver.", exception);
    }

    private String describe(Map<String, Object> detail) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(detail);
        } catch (JsonProcessingException e) {
            return detail.toString();
        }
    }
}
