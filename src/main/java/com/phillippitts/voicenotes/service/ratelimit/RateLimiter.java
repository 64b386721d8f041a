package com.phillippitts.voicenotes.service.ratelimit;

/**
 * Non-blocking admission control for one provider endpoint.
 *
 * <p>Implementations never sleep: a refused caller gets {@code false} and asks
 * {@link #getTimeUntilTokensAvailable(int)} how long to wait.
 */
public interface RateLimiter {

    /**
     * Attempts to take {@code cost} tokens.
     *
     * @param cost tokens to take; must satisfy {@code 0 < cost <= maxTokens}
     * @return {@code true} if admitted; {@code false} if refused or if {@code cost} is invalid
     */
    boolean acquire(int cost);

    default boolean acquire() {
        return acquire(1);
    }

    /**
     * Milliseconds until {@code tokens} tokens will be available, {@code 0} if they already are.
     */
    long getTimeUntilTokensAvailable(int tokens);

    /** Whole tokens currently available. */
    int getAvailableTokens();

    /** Refills the bucket to capacity. */
    void reset();

    /** Logical endpoint governed by this limiter (e.g. "whisper"). */
    String endpoint();
}
