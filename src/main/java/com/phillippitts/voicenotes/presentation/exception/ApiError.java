package com.phillippitts.voicenotes.presentation.exception;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * Standardized error response for API clients.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp,
        String failedRecordingId
) {

    ApiError(String errorCode, String message, String details, Instant timestamp) {
        this(errorCode, message, details, timestamp, null);
    }
}
