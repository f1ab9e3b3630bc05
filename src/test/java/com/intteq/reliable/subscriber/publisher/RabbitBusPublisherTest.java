package com.intteq.reliable.subscriber.publisher;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intteq.reliable.subscriber.CorrelationContext;
import com.intteq.reliable.subscriber.MessagingProperties;
import com.intteq.reliable.subscriber.context.HeaderCorrelationContextProvider;
import com.intteq.reliable.subscriber.conventions.AnnotationConventionsProvider;
import com.intteq.reliable.subscriber.exception.MessagingPublishException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.core.MessagePostProcessor;
import org.springframework.amqp.core.MessageProperties;
import org.springframework.amqp.rabbit.connection.CorrelationData;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.MessageConversionException;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("RabbitBusPublisher")
class RabbitBusPublisherTest {

    @Mock
    private RabbitTemplate rabbitTemplate;

    private SimpleMeterRegistry meterRegistry;
    private RabbitBusPublisher publisher;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        publisher = new RabbitBusPublisher(rabbitTemplate,
                new AnnotationConventionsProvider(new MessagingProperties()),
                new ObjectMapper(),
                meterRegistry);
    }

    private void sendFails(RuntimeException... failures) {
        var stubber = doThrow(failures[0]);
        for (int i = 1; i < failures.length; i++) {
            stubber = stubber.doThrow(failures[i]);
        }
        stubber.doNothing().when(rabbitTemplate).convertAndSend(
                anyString(), anyString(), any(Object.class), any(MessagePostProcessor.class), any(CorrelationData.class));
    }

    private double count(String name) {
        return meterRegistry.get(name).tag("message", "order_rejected").counter().count();
    }

    @Test
    @DisplayName("publishes to the event's conventions with id, correlation id and context header")
    void publishesWithMetadata() throws Exception {
        OrderRejected event = new OrderRejected();
        CorrelationContext context = CorrelationContext.of(Map.of("traceId", "t-1"));

        CompletableFuture<Void> result = publisher.publish(event, "c-1", context);

        assertThat(result).isCompleted();
        ArgumentCaptor<MessagePostProcessor> postProcessor = ArgumentCaptor.forClass(MessagePostProcessor.class);
        verify(rabbitTemplate).convertAndSend(eq("default"), eq("order_rejected"), eq(event),
                postProcessor.capture(), any(CorrelationData.class));

        Message message = postProcessor.getValue().postProcessMessage(new Message(new byte[0], new MessageProperties()));
        MessageProperties properties = message.getMessageProperties();
        assertThat(properties.getMessageId()).isNotBlank();
        assertThat(properties.getCorrelationId()).isEqualTo("c-1");
        assertThat(properties.getTimestamp()).isNotNull();
        assertThat((String) properties.getHeader(HeaderCorrelationContextProvider.HEADER))
                .isEqualTo("{\"traceId\":\"t-1\"}");
        assertThat(count("rsub.publish.success")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("transient failures are retried")
    void retriesTransientFailures() {
        sendFails(new AmqpException("connection reset"), new AmqpException("connection reset"));

        assertThat(publisher.publish(new OrderRejected(), "c-1", CorrelationContext.empty())).isCompleted();

        verify(rabbitTemplate, times(3)).convertAndSend(
                anyString(), anyString(), any(Object.class), any(MessagePostProcessor.class), any(CorrelationData.class));
        assertThat(count("rsub.publish.success")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("conversion failures are not retried")
    void conversionFailureNotRetried() {
        doThrow(new MessageConversionException("not serializable")).when(rabbitTemplate).convertAndSend(
                anyString(), anyString(), any(Object.class), any(MessagePostProcessor.class), any(CorrelationData.class));

        CompletableFuture<Void> result = publisher.publish(new OrderRejected(), "c-1", CorrelationContext.empty());

        assertThatThrownBy(result::join).hasCauseInstanceOf(MessagingPublishException.class);
        verify(rabbitTemplate, times(1)).convertAndSend(
                anyString(), anyString(), any(Object.class), any(MessagePostProcessor.class), any(CorrelationData.class));
        assertThat(count("rsub.publish.failure")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("persistent failure completes exceptionally after the last attempt")
    void persistentFailure() {
        AmqpException down = new AmqpException("broker down");
        doThrow(down).when(rabbitTemplate).convertAndSend(
                anyString(), anyString(), any(Object.class), any(MessagePostProcessor.class), any(CorrelationData.class));

        CompletableFuture<Void> result = publisher.publish(new OrderRejected(), "c-1", null);

        assertThat(result).isCompletedExceptionally();
        verify(rabbitTemplate, times(3)).convertAndSend(
                anyString(), anyString(), any(Object.class), any(MessagePostProcessor.class), any(CorrelationData.class));
    }

    static class OrderRejected {
    }
}
