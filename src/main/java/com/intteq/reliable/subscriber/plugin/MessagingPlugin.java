package com.intteq.reliable.subscriber.plugin;

import com.intteq.reliable.subscriber.CorrelationContext;
import com.intteq.reliable.subscriber.DeliveryInfo;

import java.util.concurrent.CompletableFuture;

/**
 * Interceptor around message processing, registered as a Spring bean.
 *
 * <p>Plugins run in {@link org.springframework.core.annotation.Order} order, once per delivery,
 * before the retry loop. A plugin may:
 * <ul>
 *     <li>wrap {@code next} with cross-cutting behaviour (metrics, tracing, MDC)</li>
 *     <li>short-circuit by not calling {@code next}</li>
 *     <li>fail, in which case the delivery is rejected without requeue</li>
 * </ul>
 */
@FunctionalInterface
public interface MessagingPlugin {

    CompletableFuture<Void> handle(Object message,
                                   CorrelationContext context,
                                   DeliveryInfo delivery,
                                   PluginChain next);
}
