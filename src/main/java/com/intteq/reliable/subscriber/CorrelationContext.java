package com.intteq.reliable.subscriber;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Metadata linking a message to the chain of messages and requests that caused it.
 *
 * <p>The subscriber treats the content as opaque: it is produced from the delivery headers by a
 * {@link com.intteq.reliable.subscriber.context.CorrelationContextProvider}, handed to every
 * plugin and to the handler, and attached to rejected events published on the message's behalf.
 *
 * <p>Instances are immutable.
 */
@ToString
@EqualsAndHashCode
public final class CorrelationContext {

    private static final CorrelationContext EMPTY = new CorrelationContext(Map.of());

    private final Map<String, Object> attributes;

    private CorrelationContext(Map<String, ?> attributes) {
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static CorrelationContext empty() {
        return EMPTY;
    }

    public static CorrelationContext of(Map<String, ?> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            return EMPTY;
        }
        return new CorrelationContext(attributes);
    }

    public Map<String, Object> attributes() {
        return attributes;
    }

    public Optional<Object> get(String key) {
        return Optional.ofNullable(attributes.get(key));
    }

    public boolean isEmpty() {
        return attributes.isEmpty();
    }
}
