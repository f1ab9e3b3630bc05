package com.intteq.reliable.subscriber.annotation;

import java.lang.annotation.*;

/**
 * Marks a method of a {@link MessagingListener} bean as the handler of its first parameter's type.
 *
 * <p>Accepted signatures:
 * <ul>
 *   <li>{@code void on(Payload payload)}</li>
 *   <li>{@code void on(Payload payload, CorrelationContext context)}</li>
 *   <li>either of the above returning {@code CompletionStage<?>} for asynchronous handlers</li>
 * </ul>
 *
 * <p>Synchronous handlers run on the subscriber's handler executor. Retry, timeout and
 * acknowledgement are handled by the framework; handlers never acknowledge messages themselves.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface EventHandler {
}
