package com.intteq.reliable.subscriber.processing;

/**
 * Outcome of one handler attempt.
 */
public enum RetryDecision {
    SUCCEED,
    RETRY,
    GIVE_UP
}
