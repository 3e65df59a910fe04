package com.dealwatch.feed;

/**
 * Per-batch retry bookkeeping. Lives only for the duration of one batch.
 *
 * <p>Transitions: {@code ATTEMPTING -> SUCCESS}, {@code ATTEMPTING -> RATE_LIMITED | TRANSIENT_ERROR
 * -> ATTEMPTING}, and {@code RATE_LIMITED | TRANSIENT_ERROR -> EXHAUSTED} once
 * {@code maxAttempts} requests have failed.</p>
 */
public final class RetryState {

    public enum Phase {
        ATTEMPTING,
        SUCCESS,
        RATE_LIMITED,
        TRANSIENT_ERROR,
        EXHAUSTED
    }

    /** Returned by {@link #onFailure(boolean)} when no further attempt is allowed. */
    public static final long NO_RETRY = -1L;

    private final int maxAttempts;
    private final long maxBackoffMs;
    private int attempts;
    private long backoffMs;
    private Phase phase;

    public RetryState(int maxAttempts, long initialBackoffMs, long maxBackoffMs) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.backoffMs = Math.max(1L, initialBackoffMs);
        this.maxBackoffMs = Math.max(this.backoffMs, maxBackoffMs);
        this.attempts = 0;
        this.phase = Phase.ATTEMPTING;
    }

    public void beginAttempt() {
        if (phase == Phase.SUCCESS || phase == Phase.EXHAUSTED) {
            throw new IllegalStateException("batch already resolved: " + phase);
        }
        phase = Phase.ATTEMPTING;
    }

    public void onSuccess() {
        attempts++;
        phase = Phase.SUCCESS;
    }

    /**
     * Records a failed attempt and returns the base delay before the next one, or {@link #NO_RETRY}
     * when the ceiling is reached. The backoff doubles after each returned delay, capped at the
     * configured maximum.
     */
    public long onFailure(boolean rateLimited) {
        attempts++;
        if (attempts >= maxAttempts) {
            phase = Phase.EXHAUSTED;
            return NO_RETRY;
        }
        phase = rateLimited ? Phase.RATE_LIMITED : Phase.TRANSIENT_ERROR;
        long delay = backoffMs;
        backoffMs = Math.min(maxBackoffMs, backoffMs * 2L);
        return delay;
    }

    public int attempts() {
        return attempts;
    }

    public long currentBackoffMs() {
        return backoffMs;
    }

    public Phase phase() {
        return phase;
    }
}
