package com.intteq.reliable.subscriber.conventions;

/**
 * Resolves the broker conventions of a message type.
 */
public interface ConventionsProvider {

    Conventions get(Class<?> messageType);
}
