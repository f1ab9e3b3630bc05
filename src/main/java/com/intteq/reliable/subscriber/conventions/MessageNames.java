package com.intteq.reliable.subscriber.conventions;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;

/**
 * snake_case names of message types, used for routing keys and log lines.
 */
public final class MessageNames {

    private static final PropertyNamingStrategies.NamingBase SNAKE_CASE =
            new PropertyNamingStrategies.SnakeCaseStrategy();

    private MessageNames() {
    }

    public static String of(Class<?> type) {
        return SNAKE_CASE.translate(type.getSimpleName());
    }

    public static String of(Object message) {
        return message == null ? "null" : of(message.getClass());
    }
}
