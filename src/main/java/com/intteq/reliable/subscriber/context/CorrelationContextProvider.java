package com.intteq.reliable.subscriber.context;

import com.intteq.reliable.subscriber.CorrelationContext;

import java.util.Map;

/**
 * Builds the correlation context of a delivery from its headers.
 */
@FunctionalInterface
public interface CorrelationContextProvider {

    CorrelationContext build(Map<String, Object> headers);
}
