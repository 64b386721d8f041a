package com.phillippitts.voicenotes.service.pipeline;

/**
 * States of one pipeline run.
 */
public enum PipelineState {
    IDLE,
    VALIDATING,
    RATE_GATE_TRANSCRIPTION,
    TRANSCRIBING,
    RATE_GATE_EXTRACTION,
    EXTRACTING,
    SUCCEEDED,
    FAILED,
    /** Stopped by the user before the first rate gate; nothing was persisted. */
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }
}
