package com.intteq.reliable.subscriber.annotation;

import java.lang.annotation.*;

/**
 * Marks a bean whose {@link EventHandler} methods are subscribed at startup.
 *
 * <p>Example:
 * <pre>
 * {@code
 * @Component
 * @MessagingListener
 * public class OrderListener {
 *
 *     @EventHandler
 *     public void onOrderCreated(OrderCreated message, CorrelationContext ctx) {
 *         // business logic...
 *     }
 * }
 * }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface MessagingListener {

    /**
     * Optional human-readable description for developers or monitoring systems.
     */
    String description() default "";
}
