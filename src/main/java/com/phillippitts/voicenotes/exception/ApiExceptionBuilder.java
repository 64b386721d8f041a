package com.phillippitts.voicenotes.exception;

import com.phillippitts.voicenotes.util.ErrorSanitizer;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder that turns a failed provider call into the right {@link VoiceNotesException}.
 *
 * <p>The HTTP status decides the type: 401 and 403 produce {@link CredentialInvalidException},
 * every other status produces {@link TransientApiException}, and no status at all (I/O error,
 * timeout) produces a network-failure {@link TransientApiException}. Metadata values are
 * sanitized before they reach the message.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * // Non-2xx response
 * throw ApiExceptionBuilder.create("Transcription request failed")
 *         .endpoint("whisper")
 *         .status(500)
 *         .durationMs(1500)
 *         .metadata("body", bodySnippet)
 *         .build();
 *
 * // Network failure
 * throw ApiExceptionBuilder.create("Extraction request failed")
 *         .endpoint("gpt-4o")
 *         .cause(ioException)
 *         .build();
 * </pre>
 */
public final class ApiExceptionBuilder {

    private static final int MAX_METADATA_VALUE_LENGTH = 200;

    private final String message;
    private String endpoint;
    private Throwable cause;
    private Integer status;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private ApiExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static ApiExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new ApiExceptionBuilder(message);
    }

    /**
     * Sets the logical endpoint name (e.g., "whisper", "gpt-4o").
     */
    public ApiExceptionBuilder endpoint(String endpoint) {
        this.endpoint = endpoint;
        return this;
    }

    public ApiExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Sets the HTTP status returned by the provider. Leave unset when no response arrived.
     */
    public ApiExceptionBuilder status(int status) {
        this.status = status;
        return this;
    }

    public ApiExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Values are sanitized and
     * truncated.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public ApiExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            String sanitized = ErrorSanitizer.sanitize(String.valueOf(value));
            this.metadata.put(key, ErrorSanitizer.truncate(sanitized, MAX_METADATA_VALUE_LENGTH));
        }
        return this;
    }

    /**
     * Builds the exception. The final message format is:
     * <pre>
     * {message} (status={status}, durationMs={ms}, {key1}={val1}, ...)
     * </pre>
     *
     * @return credential-invalid for 401/403, transient otherwise
     */
    public VoiceNotesException build() {
        String detailedMessage = buildDetailedMessage();
        if (status != null && (status == 401 || status == 403)) {
            return new CredentialInvalidException(detailedMessage, endpoint, cause);
        }
        return new TransientApiException(detailedMessage, endpoint, status, cause);
    }

    private String buildDetailedMessage() {
        boolean hasDetails = status != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;

        if (status != null) {
            sb.append("status=").append(status);
            first = false;
        }

        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }

        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }

        sb.append(")");
        return sb.toString();
    }
}
