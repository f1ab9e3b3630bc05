package com.intteq.reliable.subscriber.rabbitmq;

import com.intteq.reliable.subscriber.MessagingProperties;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * Effective basic.qos values. The prefetch count is never below 1.
 */
@Getter
@Accessors(fluent = true)
@ToString
public final class QosSettings {

    private final int prefetchSize;
    private final int prefetchCount;
    private final boolean global;

    public QosSettings(int prefetchSize, int prefetchCount, boolean global) {
        this.prefetchSize = prefetchSize;
        this.prefetchCount = Math.max(prefetchCount, 1);
        this.global = global;
    }

    public static QosSettings from(MessagingProperties.QosConfig config) {
        return new QosSettings(config.getPrefetchSize(), config.getPrefetchCount(), config.isGlobal());
    }
}
