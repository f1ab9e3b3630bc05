package com.intteq.reliable.subscriber.serialization;

/**
 * Turns a delivery body into a message object. Used once per delivery.
 */
public interface MessageSerializer {

    <T> T deserialize(byte[] body, Class<T> type);
}
