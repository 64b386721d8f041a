package com.phillippitts.voicenotes.service.pipeline;

import com.phillippitts.voicenotes.domain.AudioPayload;
import com.phillippitts.voicenotes.domain.FailedRecording;
import com.phillippitts.voicenotes.domain.FailedRecordingErrorType;
import com.phillippitts.voicenotes.domain.Intent;
import com.phillippitts.voicenotes.domain.Transcript;
import com.phillippitts.voicenotes.domain.VoiceItem;
import com.phillippitts.voicenotes.exception.CredentialInvalidException;
import com.phillippitts.voicenotes.exception.ErrorKind;
import com.phillippitts.voicenotes.exception.SchemaValidationException;
import com.phillippitts.voicenotes.exception.TransientApiException;
import com.phillippitts.voicenotes.service.pipeline.event.RecordingFailedEvent;
import com.phillippitts.voicenotes.service.pipeline.event.RunRejectedEvent;
import com.phillippitts.voicenotes.service.pipeline.event.VoiceItemCreatedEvent;
import com.phillippitts.voicenotes.testutil.TestAudio;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DefaultPipelineOrchestratorTest {

    private static final Instant CAPTURED = Instant.parse("2025-12-31T23:59:00Z");

    private PipelineTestFixture f;
    private AudioPayload audio;

    @BeforeEach
    void setUp() {
        f = new PipelineTestFixture();
        audio = AudioPayload.of(TestAudio.webm(), "audio/webm;codecs=opus", CAPTURED);
        when(f.transcriptionGateway.transcribe(any(), any())).thenReturn(new Transcript("Buy milk", null));
        when(f.extractionGateway.extract(anyString(), anyString(), any())).thenReturn(PipelineTestFixture.todoContent());
    }

    @Test
    void successfulRunBuildsItemAndWalksEveryState() {
        PipelineRun run = new PipelineRun();

        PipelineResult result = f.orchestrator.process(audio, run);

        assertThat(result).isInstanceOf(PipelineResult.Succeeded.class);
        VoiceItem item = ((PipelineResult.Succeeded) result).item();
        assertThat(item.intent()).isEqualTo(Intent.TODO);
        assertThat(item.originalTranscript()).isEqualTo("Buy milk");
        assertThat(item.language()).isEqualTo("en");
        assertThat(item.audioData()).isEqualTo(audio.toDataUrl());
        assertThat(item.createdAt()).isEqualTo(f.clock.instant());
        assertThat(run.stateMachine().getHistory()).containsExactly(
                PipelineState.IDLE, PipelineState.VALIDATING,
                PipelineState.RATE_GATE_TRANSCRIPTION, PipelineState.TRANSCRIBING,
                PipelineState.RATE_GATE_EXTRACTION, PipelineState.EXTRACTING,
                PipelineState.SUCCEEDED);
        assertThat(f.events(VoiceItemCreatedEvent.class)).singleElement()
                .satisfies(e -> assertThat(e.replayed()).isFalse());
        assertThat(f.store.count()).isZero();
        verify(f.extractionGateway).extract(eq("Buy milk"), eq("en"), any());
    }

    @Test
    void detectedLanguageIsPassedToExtractionAndKeptOnItem() {
        when(f.transcriptionGateway.transcribe(any(), any())).thenReturn(new Transcript("Milch kaufen", "de"));

        PipelineResult result = f.orchestrator.process(audio);

        assertThat(((PipelineResult.Succeeded) result).item().language()).isEqualTo("de");
        verify(f.extractionGateway).extract(eq("Milch kaufen"), eq("de"), any());
    }

    @Test
    void knownTranscriptSkipsTranscription() {
        PipelineRun run = new PipelineRun();

        PipelineResult result = f.orchestrator.processWithTranscript(audio, new Transcript("Buy milk", "en"), run);

        assertThat(result).isInstanceOf(PipelineResult.Succeeded.class);
        assertThat(run.stateMachine().getHistory()).doesNotContain(
                PipelineState.RATE_GATE_TRANSCRIPTION, PipelineState.TRANSCRIBING);
        verify(f.transcriptionGateway, never()).transcribe(any(), any());
        assertThat(f.transcriptionLimiter.getAvailableTokens()).isEqualTo(10);
    }

    @Test
    void extractionFailureQueuesOriginalAudioWithPartialTranscript() {
        when(f.extractionGateway.extract(anyString(), anyString(), any()))
                .thenThrow(new TransientApiException("Content processing failed: HTTP 503", "gpt-4o", 503));

        PipelineResult result = f.orchestrator.process(audio);

        assertThat(result).isInstanceOf(PipelineResult.Failed.class);
        PipelineResult.Failed failed = (PipelineResult.Failed) result;
        assertThat(failed.persisted()).isTrue();
        assertThat(failed.error().getKind()).isEqualTo(ErrorKind.TRANSIENT_API);

        FailedRecording entry = f.store.list().get(0);
        assertThat(entry.id()).isEqualTo(failed.failedRecording().id());
        assertThat(entry.audioData()).isEqualTo(audio.toDataUrl());
        assertThat(entry.transcript()).isEqualTo("Buy milk");
        assertThat(entry.errorType()).isEqualTo(FailedRecordingErrorType.PROCESSING);
        assertThat(entry.retryCount()).isEqualTo(3);
        assertThat(entry.createdAt()).isEqualTo(CAPTURED);
        assertThat(entry.lastRetryAt()).isNull();
        assertThat(entry.errorMessage()).contains("HTTP 503");

        verify(f.extractionGateway, times(3)).extract(anyString(), anyString(), any());
        assertThat(f.sleeper.delays()).containsExactly(Duration.ofMillis(100), Duration.ofMillis(200));
        assertThat(f.events(RecordingFailedEvent.class)).singleElement()
                .satisfies(e -> assertThat(e.persisted()).isTrue());
    }

    @Test
    void networkFailureDuringTranscriptionIsClassifiedAsNetwork() {
        when(f.transcriptionGateway.transcribe(any(), any()))
                .thenThrow(new TransientApiException("Transcription request failed: network error", "whisper", null));

        PipelineResult.Failed failed = (PipelineResult.Failed) f.orchestrator.process(audio);

        assertThat(failed.failedRecording().errorType()).isEqualTo(FailedRecordingErrorType.NETWORK);
        assertThat(failed.failedRecording().transcript()).isNull();
        verify(f.extractionGateway, never()).extract(anyString(), anyString(), any());
    }

    @Test
    void rejectedKeyIsQueuedAfterOneAttempt() {
        when(f.transcriptionGateway.transcribe(any(), any()))
                .thenThrow(new CredentialInvalidException("Incorrect API key provided (status=401)", "whisper"));

        PipelineResult.Failed failed = (PipelineResult.Failed) f.orchestrator.process(audio);

        assertThat(failed.error().getKind()).isEqualTo(ErrorKind.CREDENTIAL_INVALID);
        assertThat(failed.failedRecording().errorType()).isEqualTo(FailedRecordingErrorType.TRANSCRIPTION);
        assertThat(failed.failedRecording().retryCount()).isEqualTo(1);
        verify(f.transcriptionGateway, times(1)).transcribe(any(), any());
    }

    @Test
    void schemaViolationIsQueuedAsProcessing() {
        when(f.extractionGateway.extract(anyString(), anyString(), any()))
                .thenThrow(new SchemaValidationException("intent TODO requires data.todos", "data.todos"));

        PipelineResult.Failed failed = (PipelineResult.Failed) f.orchestrator.process(audio);

        assertThat(failed.failedRecording().errorType()).isEqualTo(FailedRecordingErrorType.PROCESSING);
        assertThat(failed.failedRecording().retryCount()).isEqualTo(1);
    }

    @Test
    void invalidAudioIsRejectedBeforeAnyTokenIsSpent() {
        AudioPayload video = AudioPayload.of(TestAudio.webm(), "video/mp4", CAPTURED);

        PipelineResult result = f.orchestrator.process(video);

        assertThat(result).isInstanceOf(PipelineResult.Rejected.class);
        assertThat(((PipelineResult.Rejected) result).error().getKind()).isEqualTo(ErrorKind.VALIDATION);
        assertThat(f.transcriptionLimiter.getAvailableTokens()).isEqualTo(10);
        assertThat(f.store.count()).isZero();
        assertThat(f.events(RunRejectedEvent.class)).singleElement()
                .satisfies(e -> assertThat(e.kind()).isEqualTo(ErrorKind.VALIDATION));
    }

    @Test
    void rateLimitedTranscriptionIsRejectedAndNotQueued() {
        PipelineTestFixture limited = new PipelineTestFixture(1, 10);
        when(limited.transcriptionGateway.transcribe(any(), any())).thenReturn(new Transcript("Buy milk", "en"));
        when(limited.extractionGateway.extract(anyString(), anyString(), any()))
                .thenReturn(PipelineTestFixture.todoContent());

        assertThat(limited.orchestrator.process(audio)).isInstanceOf(PipelineResult.Succeeded.class);
        PipelineResult second = limited.orchestrator.process(audio);

        assertThat(second).isInstanceOf(PipelineResult.Rejected.class);
        assertThat(((PipelineResult.Rejected) second).error().getKind()).isEqualTo(ErrorKind.RATE_LIMIT);
        assertThat(limited.store.count()).isZero();
        verify(limited.transcriptionGateway, times(1)).transcribe(any(), any());
    }

    @Test
    void rateLimitedExtractionKeepsPartialTranscriptButDoesNotQueue() {
        PipelineTestFixture limited = new PipelineTestFixture(10, 1);
        when(limited.transcriptionGateway.transcribe(any(), any())).thenReturn(new Transcript("Buy milk", "en"));
        when(limited.extractionGateway.extract(anyString(), anyString(), any()))
                .thenReturn(PipelineTestFixture.todoContent());
        limited.orchestrator.process(audio);

        PipelineResult second = limited.orchestrator.process(audio);

        assertThat(second).isInstanceOf(PipelineResult.Rejected.class);
        assertThat(((PipelineResult.Rejected) second).partialTranscript().text()).isEqualTo("Buy milk");
        assertThat(limited.store.count()).isZero();
    }

    @Test
    void missingKeyIsRejectedWithoutCallingProvider() {
        f.apiKey.set(null);

        PipelineResult result = f.orchestrator.process(audio);

        assertThat(result).isInstanceOf(PipelineResult.Rejected.class);
        assertThat(((PipelineResult.Rejected) result).error().getKind()).isEqualTo(ErrorKind.CREDENTIAL_MISSING);
        verify(f.transcriptionGateway, never()).transcribe(any(), any());
        assertThat(f.store.count()).isZero();
    }

    @Test
    void cancelBeforeStartEndsInCancelled() {
        PipelineRun run = new PipelineRun();

        assertThat(run.cancel()).isTrue();
        PipelineResult result = f.orchestrator.process(audio, run);

        assertThat(result).isInstanceOf(PipelineResult.Cancelled.class);
        assertThat(run.getState()).isEqualTo(PipelineState.CANCELLED);
        verify(f.transcriptionGateway, never()).transcribe(any(), any());
    }

    @Test
    void cancelAfterAdmissionIsIgnored() {
        PipelineRun run = new PipelineRun();
        when(f.transcriptionGateway.transcribe(any(), any())).thenAnswer(inv -> {
            assertThat(run.cancel()).isFalse();
            return new Transcript("Buy milk", "en");
        });

        PipelineResult result = f.orchestrator.process(audio, run);

        assertThat(result).isInstanceOf(PipelineResult.Succeeded.class);
    }

    @Test
    void storeFailureIsReportedAsNotPersisted() {
        f.store.failWrites(true);
        when(f.extractionGateway.extract(anyString(), anyString(), any()))
                .thenThrow(new TransientApiException("HTTP 500", "gpt-4o", 500));

        PipelineResult.Failed failed = (PipelineResult.Failed) f.orchestrator.process(audio);

        assertThat(failed.persisted()).isFalse();
        assertThat(failed.failedRecording().audioData()).isEqualTo(audio.toDataUrl());
        assertThat(f.events(RecordingFailedEvent.class)).singleElement()
                .satisfies(e -> assertThat(e.persisted()).isFalse());
    }

    @Test
    void runIdIsClearedFromThreadContext() {
        f.orchestrator.process(audio);

        assertThat(ThreadContext.get("pipelineRunId")).isNull();
    }

    @Test
    void classifiesByStateWhenNotNetwork() {
        TransientApiException http = new TransientApiException("HTTP 502", "whisper", 502);

        assertThat(DefaultPipelineOrchestrator.classify(http, PipelineState.TRANSCRIBING))
                .isEqualTo(FailedRecordingErrorType.TRANSCRIPTION);
        assertThat(DefaultPipelineOrchestrator.classify(http, PipelineState.EXTRACTING))
                .isEqualTo(FailedRecordingErrorType.PROCESSING);
        assertThat(DefaultPipelineOrchestrator.classify(http, PipelineState.VALIDATING))
                .isEqualTo(FailedRecordingErrorType.UNKNOWN);
        assertThat(DefaultPipelineOrchestrator.isEphemeral(ErrorKind.RATE_LIMIT)).isTrue();
        assertThat(DefaultPipelineOrchestrator.isEphemeral(ErrorKind.CREDENTIAL_INVALID)).isFalse();
    }
}
