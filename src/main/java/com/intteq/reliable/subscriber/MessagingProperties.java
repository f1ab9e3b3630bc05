package com.intteq.reliable.subscriber;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Configuration properties for the reliable subscriber.
 *
 * <p>Prefix: {@code messaging.rabbitmq.*}
 *
 * <p>Examples:
 * <pre>
 * messaging.rabbitmq.exchange.name=orders
 * messaging.rabbitmq.retries=5
 * messaging.rabbitmq.retry-interval=10s
 * messaging.rabbitmq.qos.prefetch-count=20
 * messaging.rabbitmq.dead-letter.enabled=true
 * messaging.rabbitmq.dead-letter.prefix=dlx-
 * messaging.rabbitmq.message-processing-timeout=30s
 * messaging.rabbitmq.logger.enabled=true
 * </pre>
 *
 * <p>Out-of-range numeric values are not rejected: they are normalized by the
 * {@code *OrDefault} accessors, the same way the consumer applies them at runtime.
 */
@Getter
@Setter
@Validated
@ToString
@ConfigurationProperties(prefix = "messaging.rabbitmq")
public class MessagingProperties {

    public static final int DEFAULT_RETRIES = 3;
    public static final Duration DEFAULT_RETRY_INTERVAL = Duration.ofSeconds(2);

    /** Whether the subscriber infrastructure is auto-configured. */
    private boolean enabled = true;

    /** Handler retries after the first failed attempt. Negative values fall back to 3. */
    private int retries = DEFAULT_RETRIES;

    /** Fixed wait between retries. Non-positive values fall back to 2 seconds. */
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration retryInterval = DEFAULT_RETRY_INTERVAL;

    /** Requeue flag used when a message times out or exhausts its retries. */
    private boolean requeueFailedMessages = false;

    /** Optional upper bound for a single handler attempt. */
    private Duration messageProcessingTimeout;

    @Valid
    private final ExchangeConfig exchange = new ExchangeConfig();

    @Valid
    private final QueueConfig queue = new QueueConfig();

    @Valid
    private final QosConfig qos = new QosConfig();

    @Valid
    private final DeadLetterConfig deadLetter = new DeadLetterConfig();

    private final LoggerConfig logger = new LoggerConfig();

    public int getRetriesOrDefault() {
        return retries >= 0 ? retries : DEFAULT_RETRIES;
    }

    public Duration getRetryIntervalOrDefault() {
        return retryInterval != null && !retryInterval.isNegative() && !retryInterval.isZero()
                ? retryInterval
                : DEFAULT_RETRY_INTERVAL;
    }

    // ========================================================================
    // Nested groups
    // ========================================================================

    @Getter
    @Setter
    @ToString
    public static class ExchangeConfig {

        /** Default exchange for message types without an explicit exchange. */
        @NotBlank(message = "messaging.rabbitmq.exchange.name must not be blank")
        private String name = "default";

        /** Exchange type used when the exchange is declared. */
        private String type = "topic";

        private boolean declare = true;
        private boolean durable = true;
        private boolean autoDelete = false;
    }

    @Getter
    @Setter
    @ToString
    public static class QueueConfig {

        private boolean declare = true;
        private boolean durable = true;
        private boolean exclusive = false;
        private boolean autoDelete = false;

        /** Prepended to generated queue names, e.g. the application name followed by a slash. */
        private String templatePrefix = "";
    }

    @Getter
    @Setter
    @ToString
    public static class QosConfig {

        private int prefetchSize = 0;

        /** Values below 1 are raised to 1. */
        private int prefetchCount = 1;

        private boolean global = false;
    }

    @Getter
    @Setter
    @ToString
    public static class DeadLetterConfig {

        private boolean enabled = false;
        private boolean declare = true;
        private boolean durable = true;
        private boolean exclusive = false;
        private boolean autoDelete = false;
        private String prefix = "dlx-";
        private String suffix = "";

        /** Message TTL (ms) on the dead-letter queue. Non-positive values become 24 hours. */
        private Long ttl;
    }

    @Getter
    @Setter
    @ToString
    public static class LoggerConfig {

        private boolean enabled = false;
        private boolean logConnectionStatus = false;
    }
}
