package com.intteq.reliable.subscriber.publisher;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intteq.reliable.subscriber.CorrelationContext;
import com.intteq.reliable.subscriber.context.HeaderCorrelationContextProvider;
import com.intteq.reliable.subscriber.conventions.Conventions;
import com.intteq.reliable.subscriber.conventions.ConventionsProvider;
import com.intteq.reliable.subscriber.conventions.MessageNames;
import com.intteq.reliable.subscriber.exception.MessagingPublishException;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.MessagePostProcessor;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.connection.CorrelationData;
import org.springframework.amqp.rabbit.core.RabbitTemplate;

import java.time.Duration;
import java.util.Date;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * {@link BusPublisher} on top of Spring AMQP's {@link RabbitTemplate}.
 *
 * <p>Supports:
 * <ul>
 *     <li>Exchange and routing key from the event type's conventions</li>
 *     <li>Message id, correlation id, timestamp and the {@code message_context} header</li>
 *     <li>Up to {@value #MAX_ATTEMPTS} attempts with fixed backoff for transient failures</li>
 *     <li>Micrometer metrics</li>
 * </ul>
 */
@Slf4j
@RequiredArgsConstructor
public class RabbitBusPublisher implements BusPublisher {

    private final RabbitTemplate rabbitTemplate;
    private final ConventionsProvider conventionsProvider;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    private static final int MAX_ATTEMPTS = 3;
    private static final Duration RETRY_BACKOFF = Duration.ofMillis(200);

    @Override
    public CompletableFuture<Void> publish(Object event, String correlationId, CorrelationContext context) {
        Objects.requireNonNull(event, "event must not be null");

        String messageName = MessageNames.of(event);
        meterRegistry.counter("rsub.publish.attempt", "message", messageName).increment();

        try {
            Conventions conventions = conventionsProvider.get(event.getClass());
            String messageId = UUID.randomUUID().toString();
            String messageContext = objectMapper.writeValueAsString(
                    context != null ? context.attributes() : CorrelationContext.empty().attributes());

            MessagePostProcessor postProcessor = message -> {
                MessageProperties props = message.getMessageProperties();
                props.setMessageId(messageId);
                props.setCorrelationId(correlationId);
                props.setTimestamp(new Date());
                props.setHeader(HeaderCorrelationContextProvider.HEADER, messageContext);
                return message;
            };

            retry(() -> rabbitTemplate.convertAndSend(
                    conventions.exchange(),
                    conventions.routingKey(),
                    event,
                    postProcessor,
                    new CorrelationData(messageId)));

            meterRegistry.counter("rsub.publish.success", "message", messageName).increment();
            log.debug("Published a message: '{}' [id: '{}'] with correlation id: '{}' to exchange={} routingKey={}",
                    messageName, messageId, correlationId, conventions.exchange(), conventions.routingKey());
            return CompletableFuture.completedFuture(null);

        } catch (Exception ex) {
            meterRegistry.counter("rsub.publish.failure", "message", messageName).increment();
            log.error("Failed to publish a message: '{}' with correlation id: '{}'", messageName, correlationId, ex);
            return CompletableFuture.failedFuture(new MessagingPublishException("Failed to publish message", ex));
        }
    }

    // ========================================================================
    //   Retry Logic
    // ========================================================================

    private void retry(Runnable action) {
        int attempt = 1;

        while (true) {
            try {
                action.run();
                return;

            } catch (RuntimeException ex) {
                if (isNonTransient(ex) || attempt >= MAX_ATTEMPTS) {
                    throw ex;
                }

                log.warn("Publish attempt {} failed. Retrying in {}ms",
                        attempt, RETRY_BACKOFF.toMillis(), ex);

                sleep(RETRY_BACKOFF);
                attempt++;
            }
        }
    }

    private void sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MessagingPublishException("Interrupted while waiting to retry publish", e);
        }
    }

    private boolean isNonTransient(Exception ex) {
        return ex instanceof IllegalArgumentException
                || ex instanceof org.springframework.amqp.support.converter.MessageConversionException;
    }
}
