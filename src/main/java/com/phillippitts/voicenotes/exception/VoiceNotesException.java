package com.phillippitts.voicenotes.exception;

import java.util.Objects;

/**
 * Base exception for all voicenotes application-specific errors.
 *
 * <p>Every subclass is tagged with an {@link ErrorKind}; callers branch on the kind rather than
 * on the concrete type. The attempt count is stamped by the retry layer once it gives up.
 */
public class VoiceNotesException extends RuntimeException {

    private final ErrorKind kind;
    private volatile int attempts = 1;

    public VoiceNotesException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public VoiceNotesException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * Returns how many times the failing operation was attempted before this error surfaced.
     */
    public int getAttempts() {
        return attempts;
    }

    /**
     * Records the number of attempts made. Values below one are clamped to one.
     *
     * @param attempts attempts made by the retry layer
     */
    public void recordAttempts(int attempts) {
        this.attempts = Math.max(1, attempts);
    }
}
