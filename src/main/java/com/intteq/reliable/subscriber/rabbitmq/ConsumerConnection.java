package com.intteq.reliable.subscriber.rabbitmq;

import com.rabbitmq.client.Connection;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Dedicated broker connection used only for consuming, so that publisher back-pressure
 * never blocks consumer channels.
 */
@Getter
@RequiredArgsConstructor
public class ConsumerConnection {

    private final Connection connection;
}
