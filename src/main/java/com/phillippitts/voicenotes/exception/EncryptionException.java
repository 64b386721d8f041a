package com.phillippitts.voicenotes.exception;

/**
 * Thrown when data at rest cannot be encrypted or decrypted (wrong key, tampered or
 * truncated ciphertext, unavailable cipher).
 */
public class EncryptionException extends VoiceNotesException {

    public EncryptionException(String message) {
        super(ErrorKind.UNKNOWN, message);
    }

    public EncryptionException(String message, Throwable cause) {
        super(ErrorKind.UNKNOWN, message, cause);
    }
}
