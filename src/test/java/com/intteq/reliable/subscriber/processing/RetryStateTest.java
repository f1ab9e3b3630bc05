package com.intteq.reliable.subscriber.processing;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class RetryStateTest {

    private static final RuntimeException FAILURE = new IllegalStateException("boom");

    @Test
    @DisplayName("successful attempt always succeeds")
    void successDecision() {
        RetryState state = new RetryState(3, Duration.ofSeconds(2));

        assertThat(state.decide(null)).isEqualTo(RetryDecision.SUCCEED);
        assertThat(state.getAttempt()).isZero();
    }

    @Test
    @DisplayName("failures are retried until the budget is spent")
    void retriesUntilBudgetSpent() {
        RetryState state = new RetryState(2, Duration.ofMillis(10));

        state.recordFailure();
        assertThat(state.decide(FAILURE)).isEqualTo(RetryDecision.RETRY);
        state.recordFailure();
        assertThat(state.decide(FAILURE)).isEqualTo(RetryDecision.RETRY);
        state.recordFailure();
        assertThat(state.decide(FAILURE)).isEqualTo(RetryDecision.GIVE_UP);
        assertThat(state.getAttempt()).isEqualTo(3);
    }

    @Test
    @DisplayName("no retries gives up after the first failure")
    void noRetries() {
        RetryState state = new RetryState(0, Duration.ofMillis(10));

        state.recordFailure();

        assertThat(state.decide(FAILURE)).isEqualTo(RetryDecision.GIVE_UP);
    }
}
