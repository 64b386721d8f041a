package com.phillippitts.voicenotes.exception;

/**
 * Thrown when no API key is available from any configured credential source.
 * Terminal: retrying cannot produce a key the user has not configured.
 */
public class CredentialMissingException extends VoiceNotesException {

    public static final String DEFAULT_MESSAGE =
            "OpenAI API key is not configured. Please add your API key in Settings.";

    public CredentialMissingException() {
        super(ErrorKind.CREDENTIAL_MISSING, DEFAULT_MESSAGE);
    }

    public CredentialMissingException(String message) {
        super(ErrorKind.CREDENTIAL_MISSING, message);
    }
}
