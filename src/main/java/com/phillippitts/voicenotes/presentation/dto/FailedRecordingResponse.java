package com.phillippitts.voicenotes.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.phillippitts.voicenotes.domain.FailedRecording;

import java.time.Instant;

/**
 * Wire shape of a queued recording. Listings leave {@code audioData} out.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FailedRecordingResponse(
        String id,
        Instant createdAt,
        Instant failedAt,
        String audioData,
        String transcript,
        String detectedLanguage,
        String errorMessage,
        String errorType,
        int retryCount,
        Instant lastRetryAt
) {

    public static FailedRecordingResponse summary(FailedRecording r) {
        return of(r, null);
    }

    public static FailedRecordingResponse full(FailedRecording r) {
        return of(r, r.audioData());
    }

    private static FailedRecordingResponse of(FailedRecording r, String audioData) {
        return new FailedRecordingResponse(r.id(), r.createdAt(), r.failedAt(), audioData, r.transcript(),
                r.detectedLanguage(), r.errorMessage(), r.errorType().wireName(), r.retryCount(), r.lastRetryAt());
    }
}
