package com.phillippitts.voicenotes.service.pipeline.event;

import com.phillippitts.voicenotes.domain.FailedRecordingErrorType;
import com.phillippitts.voicenotes.exception.ErrorKind;

import java.time.Instant;

/**
 * Emitted when a run fails after admission and the recording is queued for replay.
 *
 * @param failedRecordingId id of the queue entry
 * @param errorType         failure category stored with the entry
 * @param kind              error classification
 * @param persisted         {@code false} when the queue write itself failed
 * @param timestamp         when the run failed
 */
public record RecordingFailedEvent(
        String failedRecordingId,
        FailedRecordingErrorType errorType,
        ErrorKind kind,
        boolean persisted,
        Instant timestamp
) {}
