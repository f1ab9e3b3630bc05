package com.intteq.reliable.subscriber;

import java.util.concurrent.CompletionStage;

/**
 * Application callback for one message type.
 *
 * <p>The returned stage completing normally acknowledges the message. Completing exceptionally,
 * or throwing, hands the failure to the retry policy.
 *
 * @param <T> message type
 */
@FunctionalInterface
public interface MessageHandler<T> {

    CompletionStage<?> handle(T message, CorrelationContext context) throws Exception;
}
