package com.phillippitts.voicenotes.presentation.controller;

import com.phillippitts.voicenotes.presentation.dto.FailedRecordingResponse;
import com.phillippitts.voicenotes.presentation.dto.VoiceItemResponse;
import com.phillippitts.voicenotes.service.failed.FailedRecordingStore;
import com.phillippitts.voicenotes.service.pipeline.FailedRecordingReplayService;
import com.phillippitts.voicenotes.service.pipeline.ReplaySummary;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Browse, replay and discard queued recordings.
 */
@RestController
@RequestMapping("/api/failed-recordings")
class FailedRecordingController {

    private final FailedRecordingStore store;
    private final FailedRecordingReplayService replayService;

    FailedRecordingController(FailedRecordingStore store, FailedRecordingReplayService replayService) {
        this.store = store;
        this.replayService = replayService;
    }

    @GetMapping
    List<FailedRecordingResponse> list() {
        return store.list().stream().map(FailedRecordingResponse::summary).toList();
    }

    @GetMapping("/count")
    Map<String, Integer> count() {
        return Map.of("count", store.count());
    }

    @GetMapping("/{id}")
    ResponseEntity<FailedRecordingResponse> get(@PathVariable String id) {
        return store.getById(id)
                .map(FailedRecordingResponse::full)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @DeleteMapping("/{id}")
    ResponseEntity<Void> delete(@PathVariable String id) {
        return store.delete(id) ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }

    @DeleteMapping
    ResponseEntity<Void> clear() {
        store.clear();
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/retry")
    ResponseEntity<VoiceItemResponse> retry(@PathVariable String id) {
        return replayService.replay(id)
                .map(PipelineResponses::itemOrThrow)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @PostMapping("/retry-all")
    ReplaySummary retryAll() {
        return replayService.replayAll();
    }
}
