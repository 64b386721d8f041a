package com.phillippitts.voicenotes.domain;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A recording whose pipeline run failed, kept so it can be replayed later.
 *
 * @param id               unique id
 * @param createdAt        when the recording was captured
 * @param failedAt         when the latest failure happened
 * @param audioData        original recording as a data URL, never altered
 * @param transcript       partial transcript when transcription had succeeded, else {@code null}
 * @param detectedLanguage language reported with {@code transcript}, or {@code null}
 * @param errorMessage     sanitized, user-facing message
 * @param errorType        failure category
 * @param retryCount       API attempts made by the failing run plus manual replays
 * @param lastRetryAt      time of the latest manual replay, or {@code null}
 */
public record FailedRecording(
        String id,
        Instant createdAt,
        Instant failedAt,
        String audioData,
        String transcript,
        String detectedLanguage,
        String errorMessage,
        FailedRecordingErrorType errorType,
        int retryCount,
        Instant lastRetryAt
) {

    public FailedRecording {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        Objects.requireNonNull(failedAt, "failedAt must not be null");
        Objects.requireNonNull(audioData, "audioData must not be null");
        Objects.requireNonNull(errorMessage, "errorMessage must not be null");
        Objects.requireNonNull(errorType, "errorType must not be null");
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must not be negative, got: " + retryCount);
        }
    }

    /**
     * Creates a new entry with a fresh id.
     */
    public static FailedRecording create(Instant createdAt, Instant failedAt, String audioData,
                                         String transcript, String detectedLanguage,
                                         String errorMessage, FailedRecordingErrorType errorType,
                                         int retryCount) {
        return new FailedRecording(UUID.randomUUID().toString(), createdAt, failedAt, audioData,
                transcript, detectedLanguage, errorMessage, errorType, retryCount, null);
    }

    /**
     * Returns this entry updated after another failed replay. A transcript obtained during the
     * replay replaces a missing one.
     */
    public FailedRecording afterFailedReplay(Instant now, String errorMessage,
                                             FailedRecordingErrorType errorType,
                                             String transcript, String detectedLanguage) {
        String keptTranscript = transcript != null ? transcript : this.transcript;
        String keptLanguage = transcript != null ? detectedLanguage : this.detectedLanguage;
        return new FailedRecording(id, createdAt, now, audioData, keptTranscript, keptLanguage,
                errorMessage, errorType, retryCount + 1, now);
    }

    public boolean hasTranscript() {
        return transcript != null && !transcript.isBlank();
    }
}
