package com.phillippitts.voicenotes.exception;

/**
 * Thrown when the local token bucket refuses admission for an endpoint.
 *
 * <p>Surfaced to the caller with a wait estimate instead of being retried internally: until
 * real time passes, every retry would be refused again.
 */
public class RateLimitException extends VoiceNotesException {

    private final long retryAfterMs;
    private final String endpoint;

    public RateLimitException(String message, long retryAfterMs, String endpoint) {
        super(ErrorKind.RATE_LIMIT, message);
        this.retryAfterMs = Math.max(0L, retryAfterMs);
        this.endpoint = endpoint;
    }

    public long getRetryAfterMs() {
        return retryAfterMs;
    }

    public String getEndpoint() {
        return endpoint;
    }
}
