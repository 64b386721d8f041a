package com.phillippitts.voicenotes.service.retry;

import com.phillippitts.voicenotes.exception.ErrorKind;
import com.phillippitts.voicenotes.exception.VoiceNotesException;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Immutable retry policy: attempt budget, exponential delay bounds and the retry decision.
 *
 * @param maxAttempts  total attempts including the first (at least 1)
 * @param initialDelay delay before the second attempt
 * @param maxDelay     cap applied to every delay
 * @param retryOn      decides, per error kind, whether another attempt may help
 */
public record RetryPolicy(int maxAttempts, Duration initialDelay, Duration maxDelay, Predicate<ErrorKind> retryOn) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, got: " + maxAttempts);
        }
        Objects.requireNonNull(initialDelay, "initialDelay must not be null");
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        Objects.requireNonNull(retryOn, "retryOn must not be null");
        if (initialDelay.isNegative() || maxDelay.isNegative()) {
            throw new IllegalArgumentException("Delays must not be negative");
        }
    }

    /** 3 attempts, 1 s initial delay, 8 s cap, {@link #isRetryable(ErrorKind)}. */
    public static RetryPolicy defaults() {
        return of(3, Duration.ofSeconds(1), Duration.ofSeconds(8));
    }

    public static RetryPolicy of(int maxAttempts, Duration initialDelay, Duration maxDelay) {
        return new RetryPolicy(maxAttempts, initialDelay, maxDelay, RetryPolicy::isRetryable);
    }

    /**
     * Default retry decision.
     *
     * <p>Rate-limit refusals are gated by the limiter before admission; validation, schema and
     * credential failures cannot be fixed by calling again.
     */
    public static boolean isRetryable(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION, SCHEMA_VALIDATION, RATE_LIMIT, CREDENTIAL_MISSING, CREDENTIAL_INVALID -> false;
            case TRANSIENT_API, UNKNOWN -> true;
        };
    }

    /**
     * Whether {@code error} may be retried. Errors outside the domain hierarchy count as
     * {@link ErrorKind#UNKNOWN}.
     */
    public boolean shouldRetry(Throwable error) {
        return retryOn.test(kindOf(error));
    }

    /**
     * Delay to wait after the given failed attempt: {@code min(initialDelay * 2^(attempt-1), maxDelay)}.
     *
     * @param attempt 1-based number of the attempt that just failed
     */
    public Duration delayAfterAttempt(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be at least 1, got: " + attempt);
        }
        int shift = Math.min(attempt - 1, 30);
        long initialMs = initialDelay.toMillis();
        long delayMs = initialMs > (Long.MAX_VALUE >> shift) ? Long.MAX_VALUE : initialMs << shift;
        return Duration.ofMillis(Math.min(delayMs, maxDelay.toMillis()));
    }

    public RetryPolicy withRetryOn(Predicate<ErrorKind> predicate) {
        return new RetryPolicy(maxAttempts, initialDelay, maxDelay, predicate);
    }

    static ErrorKind kindOf(Throwable error) {
        return error instanceof VoiceNotesException vne ? vne.getKind() : ErrorKind.UNKNOWN;
    }
}
