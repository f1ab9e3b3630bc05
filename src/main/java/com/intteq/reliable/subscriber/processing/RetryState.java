package com.intteq.reliable.subscriber.processing;

import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * Attempt bookkeeping for a single message. Owned by one in-flight processing and never shared.
 *
 * <p>{@code maxAttempts} counts retries: a handler that always fails runs
 * {@code maxAttempts + 1} times.
 */
@Getter
@ToString
public final class RetryState {

    private final int maxAttempts;
    private final Duration interval;
    private int attempt;

    public RetryState(int maxAttempts, Duration interval) {
        this.maxAttempts = maxAttempts;
        this.interval = interval;
    }

    public void recordFailure() {
        attempt++;
    }

    /**
     * Decides what follows an attempt. {@code failure} is null for a successful attempt; for a
     * failed one {@link #recordFailure()} must have been called first.
     */
    public RetryDecision decide(Throwable failure) {
        if (failure == null) {
            return RetryDecision.SUCCEED;
        }
        return attempt - 1 < maxAttempts ? RetryDecision.RETRY : RetryDecision.GIVE_UP;
    }
}
