package com.intteq.reliable.subscriber;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * Broker-level facts about a delivery, exposed to plugins.
 *
 * <p>A plugin that short-circuits the chain may settle the delivery itself through
 * {@link #acknowledgement()}; otherwise the delivery is settled by the message processor.
 */
@Getter
@Accessors(fluent = true)
@ToString(exclude = "acknowledgement")
@RequiredArgsConstructor
public final class DeliveryInfo {

    private final DeliveryAcknowledgement acknowledgement;
    private final boolean redelivered;
    private final String exchange;
    private final String routingKey;
    private final MessageEnvelope envelope;

    public long deliveryTag() {
        return acknowledgement.deliveryTag();
    }
}
