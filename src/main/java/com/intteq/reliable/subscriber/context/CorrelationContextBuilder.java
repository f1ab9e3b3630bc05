package com.intteq.reliable.subscriber.context;

import com.intteq.reliable.subscriber.CorrelationContext;
import com.intteq.reliable.subscriber.MessageEnvelope;
import com.rabbitmq.client.AMQP;
import lombok.RequiredArgsConstructor;

import java.util.Date;
import java.util.Map;

/**
 * Reads a delivery's identity and headers into a {@link MessageScope}.
 */
@RequiredArgsConstructor
public class CorrelationContextBuilder {

    private final CorrelationContextProvider contextProvider;

    public MessageScope build(AMQP.BasicProperties properties, byte[] body) {
        Map<String, Object> headers = properties.getHeaders() != null ? properties.getHeaders() : Map.of();
        Date timestamp = properties.getTimestamp();

        MessageEnvelope envelope = new MessageEnvelope(
                properties.getMessageId(),
                properties.getCorrelationId(),
                timestamp != null ? timestamp.getTime() / 1000 : 0L,
                headers,
                body);

        CorrelationContext context = contextProvider.build(envelope.headers());
        return new MessageScope(envelope, context != null ? context : CorrelationContext.empty());
    }
}
