package com.intteq.reliable.subscriber.context;

import com.intteq.reliable.subscriber.CorrelationContext;
import com.intteq.reliable.subscriber.MessageEnvelope;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.experimental.Accessors;

/**
 * Everything known about one delivery while it is being handled. Lives until the delivery
 * reaches its final disposition.
 */
@Getter
@Accessors(fluent = true)
@RequiredArgsConstructor
public final class MessageScope {

    private final MessageEnvelope envelope;
    private final CorrelationContext correlationContext;
}
