package com.phillippitts.voicenotes.presentation.controller;

import com.phillippitts.voicenotes.presentation.dto.VoiceItemResponse;
import com.phillippitts.voicenotes.presentation.exception.RecordingQueuedException;
import com.phillippitts.voicenotes.service.pipeline.PipelineResult;

/**
 * Turns a pipeline outcome into a response body, or into the exception the handler maps.
 */
final class PipelineResponses {

    private PipelineResponses() {}

    static VoiceItemResponse itemOrThrow(PipelineResult result) {
        if (result instanceof PipelineResult.Succeeded s) {
            return VoiceItemResponse.from(s.item());
        }
        if (result instanceof PipelineResult.Failed f) {
            throw new RecordingQueuedException(f.error(), f.failedRecording().id(), f.persisted());
        }
        if (result instanceof PipelineResult.Rejected r) {
            throw r.error();
        }
        throw new IllegalStateException("Pipeline run was cancelled");
    }
}
