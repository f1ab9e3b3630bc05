package com.intteq.reliable.subscriber.annotation;

import java.lang.annotation.*;

/**
 * Overrides the broker conventions of a message type.
 *
 * <p>Without this annotation a message type is routed as:
 * <pre>
 *   exchange   = messaging.rabbitmq.exchange.name
 *   routingKey = snake_case(simple class name)
 *   queue      = messaging.rabbitmq.queue.template-prefix + exchange + "." + routingKey
 * </pre>
 *
 * <p>Example:
 * <pre>
 * {@code
 * @MessagingEvent(exchange = "orders", routingKey = "order.created.v1")
 * public class OrderCreated {
 *     private String orderId;
 * }
 * }
 * </pre>
 *
 * <p>Every attribute is optional; an empty value keeps the default for that part.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface MessagingEvent {

    /**
     * Exchange the message type is published to and consumed from.
     */
    String exchange() default "";

    /**
     * Routing key used to bind the queue and to publish the message.
     */
    String routingKey() default "";

    /**
     * Queue the subscriber consumes from.
     */
    String queue() default "";
}
