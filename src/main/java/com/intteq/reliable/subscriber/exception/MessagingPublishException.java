package com.intteq.reliable.subscriber.exception;

/**
 * Thrown when an outward message (such as a rejected event) cannot be published
 * after retry attempts.
 */
public class MessagingPublishException extends RuntimeException {

    public MessagingPublishException(String message, Throwable cause) {
        super(message, cause);
    }
}
