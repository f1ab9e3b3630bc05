package com.intteq.reliable.subscriber.exception;

/**
 * Wraps checked exceptions raised by broker acknowledgement operations.
 */
public class MessagingOperationException extends RuntimeException {

    public MessagingOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
