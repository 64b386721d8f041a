package com.phillippitts.voicenotes.presentation.exception;

import com.phillippitts.voicenotes.exception.ErrorKind;
import com.phillippitts.voicenotes.exception.RateLimitException;
import com.phillippitts.voicenotes.exception.VoiceNotesException;
import com.phillippitts.voicenotes.util.ErrorSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * <p>Maps {@link ErrorKind} to HTTP status: VALIDATION 400, CREDENTIAL_* 401, RATE_LIMIT 429
 * (with {@code Retry-After}), SCHEMA_VALIDATION 502, TRANSIENT_API 503, UNKNOWN 500.
 * Details are always sanitized.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(RateLimitException.class)
    ResponseEntity<ApiError> handleRateLimit(RateLimitException ex) {
        LOG.info("Rate limited: endpoint={}, retryAfterMs={}", ex.getEndpoint(), ex.getRetryAfterMs());
        long seconds = Math.max(1L, (ex.getRetryAfterMs() + 999L) / 1000L);
        return ResponseEntity
            .status(HttpStatus.TOO_MANY_REQUESTS)
            .header(HttpHeaders.RETRY_AFTER, Long.toString(seconds))
            .body(new ApiError(ex.getKind().name(), "Too many requests",
                ErrorSanitizer.userMessage(ex), Instant.now()));
    }

    @ExceptionHandler(VoiceNotesException.class)
    ResponseEntity<ApiError> handleDomain(VoiceNotesException ex) {
        HttpStatus status = statusFor(ex.getKind());
        log(status, ex);
        return ResponseEntity
            .status(status)
            .body(new ApiError(ex.getKind().name(), headline(ex.getKind()),
                ErrorSanitizer.userMessage(ex), Instant.now()));
    }

    /**
     * The recording failed after admission and sits in the replay queue.
     */
    @ExceptionHandler(RecordingQueuedException.class)
    ResponseEntity<ApiError> handleQueued(RecordingQueuedException ex) {
        VoiceNotesException error = ex.getError();
        HttpStatus status = statusFor(error.getKind());
        log(status, error);
        String details = ex.isPersisted()
            ? ErrorSanitizer.userMessage(error) + ". The recording was saved and can be retried."
            : ErrorSanitizer.userMessage(error) + ". The recording could not be saved.";
        return ResponseEntity
            .status(status)
            .body(new ApiError(error.getKind().name(), headline(error.getKind()), details, Instant.now(),
                ex.isPersisted() ? ex.getFailedRecordingId() : null));
    }

    @ExceptionHandler({MissingServletRequestPartException.class, MissingServletRequestParameterException.class,
        MethodArgumentNotValidException.class, IllegalArgumentException.class})
    ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        LOG.warn("Bad request: {}", ErrorSanitizer.describe(ex));
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(ErrorKind.VALIDATION.name(), "Invalid request",
                ErrorSanitizer.userMessage(ex), Instant.now()));
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    ResponseEntity<ApiError> handleTooLarge(MaxUploadSizeExceededException ex) {
        LOG.warn("Upload rejected: {}", ErrorSanitizer.describe(ex));
        return ResponseEntity
            .status(HttpStatus.PAYLOAD_TOO_LARGE)
            .body(new ApiError(ErrorKind.VALIDATION.name(), "Invalid audio",
                "Audio file too large", Instant.now()));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error: {}", ErrorSanitizer.describe(ex));
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case CREDENTIAL_MISSING, CREDENTIAL_INVALID -> HttpStatus.UNAUTHORIZED;
            case RATE_LIMIT -> HttpStatus.TOO_MANY_REQUESTS;
            case SCHEMA_VALIDATION -> HttpStatus.BAD_GATEWAY;
            case TRANSIENT_API -> HttpStatus.SERVICE_UNAVAILABLE;
            case UNKNOWN -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }

    private static String headline(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION -> "Invalid audio";
            case CREDENTIAL_MISSING -> "API key not configured. Please configure your key in Settings";
            case CREDENTIAL_INVALID -> "API key rejected. Please configure your key in Settings";
            case RATE_LIMIT -> "Too many requests";
            case SCHEMA_VALIDATION -> "Content processing returned an unexpected response";
            case TRANSIENT_API -> "Service temporarily unavailable";
            case UNKNOWN -> "An unexpected error occurred";
        };
    }

    private static void log(HttpStatus status, VoiceNotesException ex) {
        if (status.is5xxServerError()) {
            LOG.error("Request failed ({}): {}", status.value(), ErrorSanitizer.describe(ex));
        } else {
            LOG.warn("Request refused ({}): {}", status.value(), ErrorSanitizer.describe(ex));
        }
    }
}
