package com.intteq.reliable.subscriber.context;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.intteq.reliable.subscriber.CorrelationContext;
import com.rabbitmq.client.impl.LongStringHelper;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class HeaderCorrelationContextProviderTest {

    private final HeaderCorrelationContextProvider provider = new HeaderCorrelationContextProvider(new ObjectMapper());

    @Test
    void readsLongStringHeader() {
        CorrelationContext context = provider.build(Map.of(HeaderCorrelationContextProvider.HEADER,
                LongStringHelper.asLongString("{\"userId\":\"u-1\"}")));

        assertThat(context.get("userId")).contains("u-1");
    }

    @Test
    void readsByteArrayHeader() {
        CorrelationContext context = provider.build(Map.of(HeaderCorrelationContextProvider.HEADER,
                "{\"userId\":\"u-2\"}".getBytes(StandardCharsets.UTF_8)));

        assertThat(context.get("userId")).contains("u-2");
    }

    @Test
    void unreadableHeaderGivesEmptyContext() {
        CorrelationContext context = provider.build(Map.of(HeaderCorrelationContextProvider.HEADER, "{not json"));

        assertThat(context.isEmpty()).isTrue();
    }

    @Test
    void missingHeaderGivesEmptyContext() {
        assertThat(provider.build(Map.of("other", "value")).isEmpty()).isTrue();
        assertThat(provider.build(null).isEmpty()).isTrue();
    }
}
