package com.intteq.reliable.subscriber.serialization;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;

import java.io.IOException;

/**
 * JSON body serializer backed by the application's {@link ObjectMapper}.
 */
@RequiredArgsConstructor
public class JacksonMessageSerializer implements MessageSerializer {

    private final ObjectMapper objectMapper;

    @Override
    public <T> T deserialize(byte[] body, Class<T> type) {
        try {
            return objectMapper.readValue(body, type);
        } catch (IOException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize message body to " + type.getName(), e);
        }
    }
}
