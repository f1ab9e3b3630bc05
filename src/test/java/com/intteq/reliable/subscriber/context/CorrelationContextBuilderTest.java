package com.intteq.reliable.subscriber.context;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intteq.reliable.subscriber.CorrelationContext;
import com.rabbitmq.client.AMQP;
import org.junit.jupiter.api.Test;

import java.util.Date;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CorrelationContextBuilderTest {

    private final CorrelationContextBuilder builder =
            new CorrelationContextBuilder(new HeaderCorrelationContextProvider(new ObjectMapper()));

    @Test
    void readsIdentityTimestampAndContext() {
        AMQP.BasicProperties properties = new AMQP.BasicProperties.Builder()
                .messageId("m-1")
                .correlationId("c-1")
                .timestamp(new Date(1_700_000_000_123L))
                .headers(Map.of(HeaderCorrelationContextProvider.HEADER, "{\"traceId\":\"t-1\",\"attempt\":2}"))
                .build();

        MessageScope scope = builder.build(properties, new byte[]{1, 2, 3});

        assertThat(scope.envelope().messageId()).isEqualTo("m-1");
        assertThat(scope.envelope().correlationId()).isEqualTo("c-1");
        assertThat(scope.envelope().timestampUnixSeconds()).isEqualTo(1_700_000_000L);
        assertThat(scope.envelope().rawBody()).containsExactly(new byte[]{1, 2, 3});
        assertThat(scope.correlationContext().attributes())
                .containsEntry("traceId", "t-1")
                .containsEntry("attempt", 2);
    }

    @Test
    void missingHeadersAndTimestampGiveEmptyDefaults() {
        MessageScope scope = builder.build(new AMQP.BasicProperties(), null);

        assertThat(scope.envelope().headers()).isEmpty();
        assertThat(scope.envelope().timestampUnixSeconds()).isZero();
        assertThat(scope.envelope().rawBody()).isEmpty();
        assertThat(scope.correlationContext()).isEqualTo(CorrelationContext.empty());
    }
}
