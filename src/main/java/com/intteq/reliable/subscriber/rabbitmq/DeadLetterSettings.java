package com.intteq.reliable.subscriber.rabbitmq;

import com.intteq.reliable.subscriber.MessagingProperties;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * Effective dead-letter configuration. Names are derived by wrapping the primary exchange and
 * queue names with the configured prefix and suffix.
 */
@Getter
@Accessors(fluent = true)
@ToString
public final class DeadLetterSettings {

    /** Applied when a TTL is configured but not positive: 24 hours. */
    public static final long DEFAULT_TTL_MILLIS = 86_400_000L;

    private final boolean enabled;
    private final boolean declare;
    private final boolean durable;
    private final boolean exclusive;
    private final boolean autoDelete;
    private final String prefix;
    private final String suffix;
    private final Long ttlMillis;

    public DeadLetterSettings(boolean enabled,
                              boolean declare,
                              boolean durable,
                              boolean exclusive,
                              boolean autoDelete,
                              String prefix,
                              String suffix,
                              Long ttlMillis) {
        this.enabled = enabled;
        this.declare = declare;
        this.durable = durable;
        this.exclusive = exclusive;
        this.autoDelete = autoDelete;
        this.prefix = prefix != null ? prefix : "";
        this.suffix = suffix != null ? suffix : "";
        this.ttlMillis = ttlMillis;
    }

    public static DeadLetterSettings from(MessagingProperties.DeadLetterConfig config) {
        return new DeadLetterSettings(
                config.isEnabled(),
                config.isDeclare(),
                config.isDurable(),
                config.isExclusive(),
                config.isAutoDelete(),
                config.getPrefix(),
                config.getSuffix(),
                config.getTtl());
    }

    public String exchangeName(String exchange) {
        return prefix + exchange + suffix;
    }

    public String queueName(String queue) {
        return prefix + queue + suffix;
    }

    /**
     * TTL to apply to the dead-letter queue, or {@code null} when none is configured.
     */
    public Long effectiveTtlMillis() {
        if (ttlMillis == null) {
            return null;
        }
        return ttlMillis <= 0 ? DEFAULT_TTL_MILLIS : ttlMillis;
    }
}
