package com.phillippitts.voicenotes.exception;

/**
 * Thrown when a structured-generation response does not satisfy the item schema, most
 * importantly when the populated data field does not match the declared intent.
 * Indicates a provider or prompt defect; never retried.
 */
public class SchemaValidationException extends VoiceNotesException {

    private final String field;

    public SchemaValidationException(String message, String field) {
        super(ErrorKind.SCHEMA_VALIDATION, "Schema validation failed: " + message);
        this.field = field;
    }

    public SchemaValidationException(String message, String field, Throwable cause) {
        super(ErrorKind.SCHEMA_VALIDATION, "Schema validation failed: " + message, cause);
        this.field = field;
    }

    /** Offending field path (for example {@code data.todos}), or {@code null} for the whole body. */
    public String getField() {
        return field;
    }
}
