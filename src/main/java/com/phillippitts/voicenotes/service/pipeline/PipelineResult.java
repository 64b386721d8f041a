package com.phillippitts.voicenotes.service.pipeline;

import com.phillippitts.voicenotes.domain.FailedRecording;
import com.phillippitts.voicenotes.domain.Transcript;
import com.phillippitts.voicenotes.domain.VoiceItem;
import com.phillippitts.voicenotes.exception.VoiceNotesException;

import java.util.Objects;

/**
 * Outcome of a pipeline run.
 */
public sealed interface PipelineResult
        permits PipelineResult.Succeeded, PipelineResult.Failed, PipelineResult.Rejected, PipelineResult.Cancelled {

    /** Terminal state the run ended in. */
    PipelineState finalState();

    /**
     * The run produced an item.
     */
    record Succeeded(VoiceItem item) implements PipelineResult {
        public Succeeded {
            Objects.requireNonNull(item, "item must not be null");
        }

        @Override
        public PipelineState finalState() {
            return PipelineState.SUCCEEDED;
        }
    }

    /**
     * The run failed after admission and the recording was queued for replay.
     *
     * @param error           the terminal error
     * @param failedRecording the queue entry (built even if writing it failed)
     * @param persisted       {@code false} when the queue write itself failed
     */
    record Failed(VoiceNotesException error, FailedRecording failedRecording, boolean persisted) implements PipelineResult {
        public Failed {
            Objects.requireNonNull(error, "error must not be null");
            Objects.requireNonNull(failedRecording, "failedRecording must not be null");
        }

        @Override
        public PipelineState finalState() {
            return PipelineState.FAILED;
        }
    }

    /**
     * The run was refused without queueing: invalid audio, a rate-limit refusal or no API key.
     *
     * @param error             the terminal error
     * @param partialTranscript transcript obtained before the refusal, or {@code null}
     */
    record Rejected(VoiceNotesException error, Transcript partialTranscript) implements PipelineResult {
        public Rejected {
            Objects.requireNonNull(error, "error must not be null");
        }

        @Override
        public PipelineState finalState() {
            return PipelineState.FAILED;
        }
    }

    /**
     * The user stopped the run before any provider call.
     */
    record Cancelled() implements PipelineResult {
        @Override
        public PipelineState finalState() {
            return PipelineState.CANCELLED;
        }
    }
}
