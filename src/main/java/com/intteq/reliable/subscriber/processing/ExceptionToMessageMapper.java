package com.intteq.reliable.subscriber.processing;

import java.util.Optional;

/**
 * Maps a handler failure to an event published in place of the failed message.
 *
 * <p>When a mapping is returned the original delivery is acknowledged and no further retries
 * happen. An empty result leaves the failure to the retry policy.
 */
@FunctionalInterface
public interface ExceptionToMessageMapper {

    Optional<Object> map(Throwable exception, Object message);

    static ExceptionToMessageMapper none() {
        return (exception, message) -> Optional.empty();
    }
}
