package com.intteq.reliable.subscriber.context;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.intteq.reliable.subscriber.CorrelationContext;
import com.rabbitmq.client.LongString;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * Reads the correlation context from the {@value #HEADER} header, a JSON object written by the
 * publishing side. A missing or unreadable header yields an empty context.
 */
@Slf4j
@RequiredArgsConstructor
public class HeaderCorrelationContextProvider implements CorrelationContextProvider {

    public static final String HEADER = "message_context";

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    @Override
    public CorrelationContext build(Map<String, Object> headers) {
        if (headers == null) {
            return CorrelationContext.empty();
        }

        String json = asString(headers.get(HEADER));
        if (json == null || json.isBlank()) {
            return CorrelationContext.empty();
        }

        try {
            return CorrelationContext.of(objectMapper.readValue(json, MAP_TYPE));
        } catch (IOException e) {
            log.warn("Ignoring unreadable '{}' header", HEADER, e);
            return CorrelationContext.empty();
        }
    }

    private static String asString(Object value) {
        if (value instanceof LongString longString) {
            return longString.toString();
        }
        if (value instanceof byte[] bytes) {
            return new String(bytes, StandardCharsets.UTF_8);
        }
        return value != null ? value.toString() : null;
    }
}
