package com.phillippitts.voicenotes.presentation.exception;

import com.phillippitts.voicenotes.exception.VoiceNotesException;

import java.util.Objects;

/**
 * Carries a pipeline failure whose recording was queued for replay to the exception handler,
 * so the response can name the queue entry.
 */
public class RecordingQueuedException extends RuntimeException {

    private final VoiceNotesException error;
    private final String failedRecordingId;
    private final boolean persisted;

    public RecordingQueuedException(VoiceNotesException error, String failedRecordingId, boolean persisted) {
        super(error.getMessage(), error);
        this.error = Objects.requireNonNull(error, "error must not be null");
        this.failedRecordingId = failedRecordingId;
        this.persisted = persisted;
    }

    public VoiceNotesException getError() {
        return error;
    }

    public String getFailedRecordingId() {
        return failedRecordingId;
    }

    public boolean isPersisted() {
        return persisted;
    }
}
