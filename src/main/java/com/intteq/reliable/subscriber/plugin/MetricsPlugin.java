package com.intteq.reliable.subscriber.plugin;

import com.intteq.reliable.subscriber.CorrelationContext;
import com.intteq.reliable.subscriber.DeliveryAcknowledgement;
import com.intteq.reliable.subscriber.DeliveryInfo;
import com.intteq.reliable.subscriber.conventions.MessageNames;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Records Micrometer metrics per message type:
 * <ul>
 *     <li>{@code rsub.consume.latency}: time until the delivery was settled</li>
 *     <li>{@code rsub.consume.disposition}: count per final disposition</li>
 *     <li>{@code rsub.consume.failure}: pipeline failures</li>
 * </ul>
 */
@RequiredArgsConstructor
public class MetricsPlugin implements MessagingPlugin {

    private final MeterRegistry meterRegistry;

    @Override
    public CompletableFuture<Void> handle(Object message,
                                          CorrelationContext context,
                                          DeliveryInfo delivery,
                                          PluginChain next) {
        String messageName = MessageNames.of(message);
        long start = System.nanoTime();

        return next.proceed(message, context, delivery).whenComplete((ignored, error) -> {
            meterRegistry.timer("rsub.consume.latency", "message", messageName)
                    .record(System.nanoTime() - start, TimeUnit.NANOSECONDS);

            if (error != null) {
                meterRegistry.counter("rsub.consume.failure", "message", messageName).increment();
                return;
            }

            DeliveryAcknowledgement.Disposition disposition = delivery.acknowledgement().disposition();
            meterRegistry.counter("rsub.consume.disposition",
                            "message", messageName,
                            "disposition", disposition != null ? disposition.name().toLowerCase() : "unsettled")
                    .increment();
        });
    }
}
