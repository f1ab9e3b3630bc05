package com.intteq.reliable.subscriber;

import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Identity, headers and raw body of a single delivery, read once when the delivery arrives.
 */
@Getter
@Accessors(fluent = true)
@ToString(exclude = "rawBody")
public final class MessageEnvelope {

    private final String messageId;
    private final String correlationId;
    private final long timestampUnixSeconds;
    private final Map<String, Object> headers;

    @Getter(lombok.AccessLevel.NONE)
    private final byte[] rawBody;

    public MessageEnvelope(String messageId,
                           String correlationId,
                           long timestampUnixSeconds,
                           Map<String, Object> headers,
                           byte[] rawBody) {
        this.messageId = messageId;
        this.correlationId = correlationId;
        this.timestampUnixSeconds = timestampUnixSeconds;
        this.headers = headers == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
        this.rawBody = rawBody == null ? new byte[0] : rawBody.clone();
    }

    public byte[] rawBody() {
        return rawBody.clone();
    }
}
