package com.phillippitts.voicenotes.exception;

/**
 * Thrown when the failed-recording queue cannot be read from or written to disk.
 */
public class StorageException extends VoiceNotesException {

    public StorageException(String message, Throwable cause) {
        super(ErrorKind.UNKNOWN, message, cause);
    }
}
