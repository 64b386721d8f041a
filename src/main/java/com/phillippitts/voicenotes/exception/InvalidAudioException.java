package com.phillippitts.voicenotes.exception;

/**
 * Thrown when an audio payload fails pre-flight validation (empty, unsupported MIME type,
 * oversized, or outside the configured duration bounds). Always raised before any quota is spent.
 */
public class InvalidAudioException extends VoiceNotesException {

    private final long audioSize;
    private final String mimeType;
    private final Double durationSeconds;
    private final String reason;

    public InvalidAudioException(String reason) {
        this(reason, 0L, null, null);
    }

    public InvalidAudioException(String reason, long audioSize, String mimeType, Double durationSeconds) {
        super(ErrorKind.VALIDATION, "Invalid audio: " + reason);
        this.audioSize = audioSize;
        this.mimeType = mimeType;
        this.durationSeconds = durationSeconds;
        this.reason = reason;
    }

    public long getAudioSize() {
        return audioSize;
    }

    public String getMimeType() {
        return mimeType;
    }

    /** Decoded duration in seconds, or {@code null} when it was never determined. */
    public Double getDurationSeconds() {
        return durationSeconds;
    }

    public String getReason() {
        return reason;
    }
}
