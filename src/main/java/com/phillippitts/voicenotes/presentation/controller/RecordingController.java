package com.phillippitts.voicenotes.presentation.controller;

import com.phillippitts.voicenotes.domain.AudioPayload;
import com.phillippitts.voicenotes.domain.Transcript;
import com.phillippitts.voicenotes.exception.InvalidAudioException;
import com.phillippitts.voicenotes.presentation.dto.VoiceItemResponse;
import com.phillippitts.voicenotes.service.pipeline.PipelineOrchestrator;
import com.phillippitts.voicenotes.service.pipeline.PipelineRun;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.time.Clock;

/**
 * Accepts recordings and runs them through the pipeline.
 */
@RestController
@RequestMapping("/api/recordings")
class RecordingController {

    private static final Logger LOG = LogManager.getLogger(RecordingController.class);

    private final PipelineOrchestrator orchestrator;
    private final Clock clock;

    RecordingController(PipelineOrchestrator orchestrator, Clock clock) {
        this.orchestrator = orchestrator;
        this.clock = clock;
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    ResponseEntity<VoiceItemResponse> create(@RequestParam("file") MultipartFile file,
                                             @RequestParam(value = "durationSeconds", required = false)
                                             Double durationSeconds) {
        AudioPayload payload = toPayload(file, durationSeconds);
        LOG.info("Recording received: {}", payload);
        VoiceItemResponse body = PipelineResponses.itemOrThrow(orchestrator.process(payload, new PipelineRun()));
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    /**
     * Extraction only, for clients that already hold a transcript (live transcription).
     */
    @PostMapping(path = "/transcribed", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    ResponseEntity<VoiceItemResponse> createFromTranscript(@RequestParam("file") MultipartFile file,
                                                           @RequestParam("transcript") String transcript,
                                                           @RequestParam(value = "language", required = false)
                                                           String language,
                                                           @RequestParam(value = "durationSeconds", required = false)
                                                           Double durationSeconds) {
        AudioPayload payload = toPayload(file, durationSeconds);
        VoiceItemResponse body = PipelineResponses.itemOrThrow(orchestrator.processWithTranscript(
                payload, new Transcript(transcript, language), new PipelineRun()));
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    private AudioPayload toPayload(MultipartFile file, Double durationSeconds) {
        try {
            return new AudioPayload(file.getBytes(), file.getContentType(), durationSeconds, clock.instant());
        } catch (IOException e) {
            throw new InvalidAudioException("Could not read uploaded audio");
        }
    }
}
