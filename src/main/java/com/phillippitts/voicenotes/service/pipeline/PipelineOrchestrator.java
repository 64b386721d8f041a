package com.phillippitts.voicenotes.service.pipeline;

import com.phillippitts.voicenotes.domain.AudioPayload;
import com.phillippitts.voicenotes.domain.FailedRecording;
import com.phillippitts.voicenotes.domain.Transcript;

/**
 * Drives a recording through validation, transcription and extraction.
 *
 * <p>Failures after admission are never lost: they end up in the failed-recording queue.
 */
public interface PipelineOrchestrator {

    default PipelineResult process(AudioPayload payload) {
        return process(payload, new PipelineRun());
    }

    /**
     * Runs the full pipeline.
     *
     * @param run handle the caller can use to stop the run before the first rate gate
     */
    PipelineResult process(AudioPayload payload, PipelineRun run);

    /**
     * Runs extraction only, for a recording whose transcript is already known (live
     * transcription or an earlier partial run).
     */
    PipelineResult processWithTranscript(AudioPayload payload, Transcript transcript, PipelineRun run);

    /**
     * Replays a queued recording. Success removes the entry; failure updates it in place.
     * A stored transcript skips transcription.
     */
    PipelineResult replay(FailedRecording entry, PipelineRun run);
}
