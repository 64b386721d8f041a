package com.phillippitts.voicenotes.service.pipeline.event;

import com.phillippitts.voicenotes.exception.ErrorKind;

import java.time.Instant;

/**
 * Emitted when a run is refused without queueing (invalid audio, rate limit, missing key).
 */
public record RunRejectedEvent(
        ErrorKind kind,
        String reason,
        Instant timestamp
) {}
