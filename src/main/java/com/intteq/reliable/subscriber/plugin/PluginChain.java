package com.intteq.reliable.subscriber.plugin;

import com.intteq.reliable.subscriber.CorrelationContext;
import com.intteq.reliable.subscriber.DeliveryInfo;

import java.util.concurrent.CompletableFuture;

/**
 * The remainder of the pipeline as seen from a plugin.
 */
@FunctionalInterface
public interface PluginChain {

    CompletableFuture<Void> proceed(Object message, CorrelationContext context, DeliveryInfo delivery);
}
