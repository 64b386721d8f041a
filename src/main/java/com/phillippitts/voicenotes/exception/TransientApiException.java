package com.phillippitts.voicenotes.exception;

/**
 * Thrown when a provider call fails in a way that may succeed later: I/O error, timeout,
 * 5xx, or any other non-authentication error status.
 *
 * <p>A {@code null} status code means no HTTP response was received at all.
 */
public class TransientApiException extends VoiceNotesException {

    private final String endpoint;
    private final Integer statusCode;

    public TransientApiException(String message, String endpoint, Integer statusCode) {
        super(ErrorKind.TRANSIENT_API, message);
        this.endpoint = endpoint == null ? "unknown" : endpoint;
        this.statusCode = statusCode;
    }

    public TransientApiException(String message, String endpoint, Integer statusCode, Throwable cause) {
        super(ErrorKind.TRANSIENT_API, message, cause);
        this.endpoint = endpoint == null ? "unknown" : endpoint;
        this.statusCode = statusCode;
    }

    public String getEndpoint() {
        return endpoint;
    }

    /** HTTP status returned by the provider, or {@code null} for network-level failures. */
    public Integer getStatusCode() {
        return statusCode;
    }

    public boolean isNetworkFailure() {
        return statusCode == null;
    }
}
