package com.intteq.reliable.subscriber.exception;

import lombok.Getter;

import java.time.Duration;

/**
 * Raised when a handler attempt does not finish within the configured processing timeout.
 */
@Getter
public class MessageProcessingTimeoutException extends RuntimeException {

    private final String messageId;
    private final String correlationId;

    public MessageProcessingTimeoutException(String messageId, String correlationId, Duration timeout) {
        super("There was a timeout (" + timeout.toMillis() + " ms) when processing a message with id: '"
                + messageId + "', correlation id: '" + correlationId + "'.");
        this.messageId = messageId;
        this.correlationId = correlationId;
    }
}
