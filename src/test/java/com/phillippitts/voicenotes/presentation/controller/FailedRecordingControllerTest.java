package com.phillippitts.voicenotes.presentation.controller;

import com.phillippitts.voicenotes.domain.FailedRecording;
import com.phillippitts.voicenotes.domain.FailedRecordingErrorType;
import com.phillippitts.voicenotes.exception.RateLimitException;
import com.phillippitts.voicenotes.service.failed.FailedRecordingStore;
import com.phillippitts.voicenotes.service.pipeline.FailedRecordingReplayService;
import com.phillippitts.voicenotes.service.pipeline.PipelineResult;
import com.phillippitts.voicenotes.service.pipeline.ReplaySummary;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(FailedRecordingController.class)
class FailedRecordingControllerTest {

    private static final Instant CREATED = Instant.parse("2026-04-01T08:00:00Z");

    @Autowired
    private MockMvc mvc;

    @MockBean
    private FailedRecordingStore store;

    @MockBean
    private FailedRecordingReplayService replayService;

    private static FailedRecording entry(String id) {
        return new FailedRecording(id, CREATED, CREATED.plusSeconds(30), "data:audio/webm;base64,AQID",
                "Buy milk", "en", "HTTP 503", FailedRecordingErrorType.PROCESSING, 3, null);
    }

    @Test
    void listingOmitsAudioData() throws Exception {
        when(store.list()).thenReturn(List.of(entry("a"), entry("b")));

        mvc.perform(get("/api/failed-recordings"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].errorType").value("processing"))
                .andExpect(jsonPath("$[0].audioData").doesNotExist())
                .andExpect(jsonPath("$[0].lastRetryAt").doesNotExist());
    }

    @Test
    void singleEntryIncludesAudioData() throws Exception {
        when(store.getById("a")).thenReturn(Optional.of(entry("a")));
        when(store.getById("zzz")).thenReturn(Optional.empty());

        mvc.perform(get("/api/failed-recordings/a"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.audioData").value("data:audio/webm;base64,AQID"))
                .andExpect(jsonPath("$.retryCount").value(3));
        mvc.perform(get("/api/failed-recordings/zzz"))
                .andExpect(status().isNotFound());
    }

    @Test
    void countAndDelete() throws Exception {
        when(store.count()).thenReturn(4);
        when(store.delete("a")).thenReturn(true);

        mvc.perform(get("/api/failed-recordings/count"))
                .andExpect(jsonPath("$.count").value(4));
        mvc.perform(delete("/api/failed-recordings/a"))
                .andExpect(status().isNoContent());
        mvc.perform(delete("/api/failed-recordings/b"))
                .andExpect(status().isNotFound());
        mvc.perform(delete("/api/failed-recordings"))
                .andExpect(status().isNoContent());
        verify(store).clear();
    }

    @Test
    void retryUnknownIdIsNotFound() throws Exception {
        when(replayService.replay("nope")).thenReturn(Optional.empty());

        mvc.perform(post("/api/failed-recordings/nope/retry"))
                .andExpect(status().isNotFound());
    }

    @Test
    void retryRefusedByLimiterIs429() throws Exception {
        when(replayService.replay("a")).thenReturn(Optional.of(new PipelineResult.Rejected(
                new RateLimitException("Rate limit exceeded for content processing.", 12_000L, "gpt-4o"), null)));

        mvc.perform(post("/api/failed-recordings/a/retry"))
                .andExpect(status().isTooManyRequests());
    }

    @Test
    void retryAllReturnsSummary() throws Exception {
        when(replayService.replayAll()).thenReturn(new ReplaySummary(3, 2, 0, 1, 1));

        mvc.perform(post("/api/failed-recordings/retry-all"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.attempted").value(3))
                .andExpect(jsonPath("$.succeeded").value(2))
                .andExpect(jsonPath("$.remaining").value(1));
    }
}
