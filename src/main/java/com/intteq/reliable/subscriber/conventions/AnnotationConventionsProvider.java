package com.intteq.reliable.subscriber.conventions;

import com.intteq.reliable.subscriber.MessagingProperties;
import com.intteq.reliable.subscriber.annotation.MessagingEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.AnnotationUtils;
import org.springframework.util.StringUtils;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Default {@link ConventionsProvider}: {@link MessagingEvent} attributes win, configuration and
 * the type name fill in the rest. Results are cached per type.
 */
@Slf4j
public class AnnotationConventionsProvider implements ConventionsProvider {

    private final MessagingProperties properties;
    private final Map<Class<?>, Conventions> cache = new ConcurrentHashMap<>();

    public AnnotationConventionsProvider(MessagingProperties properties) {
        this.properties = properties;
    }

    @Override
    public Conventions get(Class<?> messageType) {
        return cache.computeIfAbsent(messageType, this::resolve);
    }

    private Conventions resolve(Class<?> type) {
        MessagingEvent ann = AnnotationUtils.findAnnotation(type, MessagingEvent.class);

        String exchange = ann != null && StringUtils.hasText(ann.exchange())
                ? ann.exchange()
                : properties.getExchange().getName();
        String routingKey = ann != null && StringUtils.hasText(ann.routingKey())
                ? ann.routingKey()
                : MessageNames.of(type);
        String queue = ann != null && StringUtils.hasText(ann.queue())
                ? ann.queue()
                : properties.getQueue().getTemplatePrefix() + exchange + "." + routingKey;

        Conventions conventions = new Conventions(exchange, queue, routingKey);
        log.debug("Resolved conventions for {} → {}", type.getName(), conventions);
        return conventions;
    }
}
