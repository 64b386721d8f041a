package com.phillippitts.voicenotes.service.ratelimit;

import com.phillippitts.voicenotes.exception.RateLimitException;

/**
 * Turns a refused {@link RateLimiter#acquire()} into a {@link RateLimitException} with a
 * user-facing wait estimate.
 */
public final class RateLimitGate {

    private RateLimitGate() {}

    /**
     * Takes one token or throws.
     *
     * @param limiter   limiter for the endpoint about to be called
     * @param operation human-readable operation name used in the message (e.g. "transcription")
     * @throws RateLimitException if the limiter refuses admission
     */
    public static void admitOrThrow(RateLimiter limiter, String operation) {
        if (limiter.acquire(1)) {
            return;
        }
        long retryAfterMs = limiter.getTimeUntilTokensAvailable(1);
        throw new RateLimitException(message(operation, retryAfterMs), retryAfterMs, limiter.endpoint());
    }

    static String message(String operation, long retryAfterMs) {
        long seconds = (long) Math.ceil(retryAfterMs / 1000.0);
        return "Rate limit exceeded for " + operation + ". Please wait " + seconds
                + " second" + (seconds != 1 ? "s" : "") + " and try again.";
    }
}
