package com.dealwatch.feed;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class RetryStateTest {

    @Test
    void failuresShouldDoubleBackoffUntilExhausted() {
        RetryState state = new RetryState(3, 250L, 10_000L);

        state.beginAttempt();
        assertEquals(250L, state.onFailure(true));
        assertEquals(RetryState.Phase.RATE_LIMITED, state.phase());

        state.beginAttempt();
        assertEquals(500L, state.onFailure(false));
        assertEquals(RetryState.Phase.TRANSIENT_ERROR, state.phase());

        state.beginAttempt();
        assertEquals(RetryState.NO_RETRY, state.onFailure(true));
        assertEquals(RetryState.Phase.EXHAUSTED, state.phase());
        assertEquals(3, state.attempts());
    }

    @Test
    void resolvedStateShouldRejectFurtherAttempts() {
        RetryState state = new RetryState(5, 100L, 1_000L);
        state.beginAttempt();
        state.onSuccess();

        assertEquals(RetryState.Phase.SUCCESS, state.phase());
        assertEquals(1, state.attempts());
        assertThrows(IllegalStateException.class, state::beginAttempt);
    }

    @Test
    void singleAttemptBudgetShouldNeverRetry() {
        RetryState state = new RetryState(1, 100L, 1_000L);
        state.beginAttempt();

        assertEquals(RetryState.NO_RETRY, state.onFailure(false));
    }
}
