package com.intteq.reliable.subscriber.exception;

/**
 * Declaring or binding broker topology for a subscription failed.
 * The subscription is not registered.
 */
public class TopologyException extends RuntimeException {

    public TopologyException(String message, Throwable cause) {
        super(message, cause);
    }
}
