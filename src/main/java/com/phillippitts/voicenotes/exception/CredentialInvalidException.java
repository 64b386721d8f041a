package com.phillippitts.voicenotes.exception;

/**
 * Thrown when the provider rejects the configured API key (HTTP 401/403).
 */
public class CredentialInvalidException extends VoiceNotesException {

    private final String endpoint;

    public CredentialInvalidException(String message, String endpoint) {
        super(ErrorKind.CREDENTIAL_INVALID, message);
        this.endpoint = endpoint;
    }

    public CredentialInvalidException(String message, String endpoint, Throwable cause) {
        super(ErrorKind.CREDENTIAL_INVALID, message, cause);
        this.endpoint = endpoint;
    }

    public String getEndpoint() {
        return endpoint;
    }
}
