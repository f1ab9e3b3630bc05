package com.intteq.reliable.subscriber.conventions;

import com.intteq.reliable.subscriber.MessagingProperties;
import com.intteq.reliable.subscriber.annotation.MessagingEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AnnotationConventionsProviderTest {

    private MessagingProperties properties;

    @BeforeEach
    void setUp() {
        properties = new MessagingProperties();
        properties.getExchange().setName("shop");
        properties.getQueue().setTemplatePrefix("billing/");
    }

    @Test
    void defaultsComeFromConfigurationAndTypeName() {
        Conventions conventions = new AnnotationConventionsProvider(properties).get(OrderCreated.class);

        assertThat(conventions.exchange()).isEqualTo("shop");
        assertThat(conventions.routingKey()).isEqualTo("order_created");
        assertThat(conventions.queue()).isEqualTo("billing/shop.order_created");
        assertThat(conventions.channelKey()).isEqualTo("shop:billing/shop.order_created:order_created");
    }

    @Test
    void annotationAttributesOverrideDefaults() {
        Conventions conventions = new AnnotationConventionsProvider(properties).get(PaymentCaptured.class);

        assertThat(conventions.exchange()).isEqualTo("payments");
        assertThat(conventions.routingKey()).isEqualTo("payment.captured.v1");
        assertThat(conventions.queue()).isEqualTo("billing/payments.payment.captured.v1");
    }

    @Test
    void explicitQueueIsUsedAsIs() {
        Conventions conventions = new AnnotationConventionsProvider(properties).get(RefundIssued.class);

        assertThat(conventions.queue()).isEqualTo("refunds");
        assertThat(conventions.exchange()).isEqualTo("shop");
    }

    @Test
    void resultsAreCached() {
        AnnotationConventionsProvider provider = new AnnotationConventionsProvider(properties);

        assertThat(provider.get(OrderCreated.class)).isSameAs(provider.get(OrderCreated.class));
    }

    static class OrderCreated {
    }

    @MessagingEvent(exchange = "payments", routingKey = "payment.captured.v1")
    static class PaymentCaptured {
    }

    @MessagingEvent(queue = "refunds")
    static class RefundIssued {
    }
}
