package com.phillippitts.voicenotes.service.pipeline;

import com.phillippitts.voicenotes.domain.AudioPayload;
import com.phillippitts.voicenotes.domain.ExtractedContent;
import com.phillippitts.voicenotes.domain.FailedRecording;
import com.phillippitts.voicenotes.domain.FailedRecordingErrorType;
import com.phillippitts.voicenotes.domain.Transcript;
import com.phillippitts.voicenotes.domain.ValidationResult;
import com.phillippitts.voicenotes.domain.VoiceItem;
import com.phillippitts.voicenotes.exception.ErrorKind;
import com.phillippitts.voicenotes.exception.InvalidAudioException;
import com.phillippitts.voicenotes.exception.TransientApiException;
import com.phillippitts.voicenotes.exception.VoiceNotesException;
import com.phillippitts.voicenotes.service.extraction.ExtractionStage;
import com.phillippitts.voicenotes.service.failed.FailedRecordingStore;
import com.phillippitts.voicenotes.service.metrics.PipelineMetrics;
import com.phillippitts.voicenotes.service.pipeline.event.RecordingFailedEvent;
import com.phillippitts.voicenotes.service.pipeline.event.RunRejectedEvent;
import com.phillippitts.voicenotes.service.pipeline.event.VoiceItemCreatedEvent;
import com.phillippitts.voicenotes.service.transcription.TranscriptionStage;
import com.phillippitts.voicenotes.service.validation.AudioValidator;
import com.phillippitts.voicenotes.util.ErrorSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Default pipeline: validate, transcribe, extract, and queue anything that fails after admission.
 *
 * <p>Pipeline flow:
 * <ol>
 *   <li>Validate the payload; invalid audio is rejected before any quota is spent.</li>
 *   <li>Pass the transcription rate gate and call speech-to-text (skipped when the transcript
 *       is already known).</li>
 *   <li>Pass the extraction rate gate and call structured extraction.</li>
 *   <li>Build the {@link VoiceItem} and publish {@link VoiceItemCreatedEvent}.</li>
 * </ol>
 *
 * <p>Invalid audio, rate-limit refusals and a missing API key return
 * {@link PipelineResult.Rejected} and are not queued. Every other failure writes the original
 * audio, plus any transcript obtained, to the {@link FailedRecordingStore}.
 *
 * <p>Thread-safe: all per-run state lives in {@link PipelineRun}.
 */
public class DefaultPipelineOrchestrator implements PipelineOrchestrator {

    private static final Logger LOG = LogManager.getLogger(DefaultPipelineOrchestrator.class);

    static final String DEFAULT_LANGUAGE = "en";
    private static final String STAGE = "pipeline";
    private static final String RUN_ID_KEY = "pipelineRunId";

    private final AudioValidator validator;
    private final TranscriptionStage transcription;
    private final ExtractionStage extraction;
    private final FailedRecordingStore failedRecordings;
    private final PipelineMetrics metrics;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    public DefaultPipelineOrchestrator(AudioValidator validator,
                                       TranscriptionStage transcription,
                                       ExtractionStage extraction,
                                       FailedRecordingStore failedRecordings,
                                       PipelineMetrics metrics,
                                       ApplicationEventPublisher publisher,
                                       Clock clock) {
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.transcription = Objects.requireNonNull(transcription, "transcription must not be null");
        this.extraction = Objects.requireNonNull(extraction, "extraction must not be null");
        this.failedRecordings = Objects.requireNonNull(failedRecordings, "failedRecordings must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public PipelineResult process(AudioPayload payload, PipelineRun run) {
        return execute(run, payload, null, false, failure -> newEntry(payload, failure), this::enqueue);
    }

    @Override
    public PipelineResult processWithTranscript(AudioPayload payload, Transcript transcript, PipelineRun run) {
        Objects.requireNonNull(transcript, "transcript must not be null");
        return execute(run, payload, transcript, false, failure -> newEntry(payload, failure), this::enqueue);
    }

    @Override
    public PipelineResult replay(FailedRecording entry, PipelineRun run) {
        Objects.requireNonNull(entry, "entry must not be null");
        AudioPayload payload;
        try {
            payload = AudioPayload.fromDataUrl(entry.audioData(), entry.createdAt());
        } catch (IllegalArgumentException e) {
            LOG.warn("Stored audio for failed recording {} is unreadable: {}", entry.id(), ErrorSanitizer.describe(e));
            run.stateMachine().transitionTo(PipelineState.FAILED);
            return new PipelineResult.Rejected(new InvalidAudioException("Stored audio is unreadable"), null);
        }
        Transcript known = entry.hasTranscript() ? new Transcript(entry.transcript(), entry.detectedLanguage()) : null;

        PipelineResult result = execute(run, payload, known, true,
                failure -> entry.afterFailedReplay(now(), failure.message(), failure.errorType(),
                        failure.transcript() == null ? null : failure.transcript().text(),
                        failure.transcript() == null ? null : failure.transcript().language()),
                failedRecordings::update);

        if (result instanceof PipelineResult.Succeeded) {
            metrics.incrementReplay("succeeded");
            removeReplayed(entry.id());
        } else if (result instanceof PipelineResult.Failed) {
            metrics.incrementReplay("failed");
        } else {
            metrics.incrementReplay("rejected");
        }
        return result;
    }

    private PipelineResult execute(PipelineRun run,
                                   AudioPayload payload,
                                   Transcript knownTranscript,
                                   boolean replay,
                                   Function<Failure, FailedRecording> entryFactory,
                                   Predicate<FailedRecording> queueWriter) {
        Objects.requireNonNull(run, "run must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        PipelineStateMachine sm = run.stateMachine();
        ThreadContext.put(RUN_ID_KEY, run.getId().toString());
        long t0 = System.nanoTime();
        Transcript transcript = knownTranscript;
        try {
            if (cancelIfRequested(run)) {
                return new PipelineResult.Cancelled();
            }
            sm.transitionTo(PipelineState.VALIDATING);
            ValidationResult validation = replay ? validator.validateIgnoringDuration(payload) : validator.validate(payload);
            if (!validation.valid()) {
                return reject(sm, new InvalidAudioException(validation.error(), validation.details().sizeBytes(),
                        validation.details().mimeType(), validation.details().durationSeconds()), null);
            }
            if (cancelIfRequested(run)) {
                return new PipelineResult.Cancelled();
            }

            if (transcript == null) {
                sm.transitionTo(PipelineState.RATE_GATE_TRANSCRIPTION);
                transcript = transcription.transcribe(payload, () -> sm.transitionTo(PipelineState.TRANSCRIBING));
            }

            String language = transcript.language() == null || transcript.language().isBlank()
                    ? DEFAULT_LANGUAGE : transcript.language();
            sm.transitionTo(PipelineState.RATE_GATE_EXTRACTION);
            ExtractedContent content = extraction.extract(transcript.text(), language,
                    () -> sm.transitionTo(PipelineState.EXTRACTING));

            VoiceItem item = VoiceItem.create(content, transcript.text(), payload.toDataUrl(), language, now());
            sm.transitionTo(PipelineState.SUCCEEDED);
            metrics.recordLatency(STAGE, System.nanoTime() - t0);
            metrics.incrementSuccess(STAGE);
            publisher.publishEvent(new VoiceItemCreatedEvent(item, now(), replay));
            LOG.info("Pipeline run completed (itemId={}, intent={})", item.id(), item.intent());
            return new PipelineResult.Succeeded(item);
        } catch (VoiceNotesException e) {
            return fail(sm, e, transcript, entryFactory, queueWriter);
        } catch (RuntimeException e) {
            VoiceNotesException wrapped = new VoiceNotesException(ErrorKind.UNKNOWN, ErrorSanitizer.userMessage(e), e);
            return fail(sm, wrapped, transcript, entryFactory, queueWriter);
        } finally {
            ThreadContext.remove(RUN_ID_KEY);
        }
    }

    private PipelineResult fail(PipelineStateMachine sm,
                                VoiceNotesException error,
                                Transcript transcript,
                                Function<Failure, FailedRecording> entryFactory,
                                Predicate<FailedRecording> queueWriter) {
        PipelineState failedIn = sm.getState();
        metrics.incrementFailure(STAGE, error.getKind().name());
        if (isEphemeral(error.getKind())) {
            return reject(sm, error, transcript);
        }

        FailedRecordingErrorType type = classify(error, failedIn);
        FailedRecording entry = entryFactory.apply(
                new Failure(ErrorSanitizer.userMessage(error), type, error.getAttempts(), transcript));
        transitionToFailed(sm);

        boolean persisted = false;
        try {
            persisted = queueWriter.test(entry);
            if (persisted) {
                metrics.incrementFailedRecordingSaved(type.wireName());
            } else {
                LOG.warn("Failed recording {} left the queue during replay; not re-adding it", entry.id());
            }
        } catch (RuntimeException storeError) {
            LOG.error("Could not queue failed recording {}: {}", entry.id(), ErrorSanitizer.describe(storeError));
        }
        LOG.warn("Pipeline run failed in {} (kind={}, attempts={}, failedRecordingId={}): {}",
                failedIn, error.getKind(), error.getAttempts(), entry.id(), ErrorSanitizer.describe(error));
        publisher.publishEvent(new RecordingFailedEvent(entry.id(), type, error.getKind(), persisted, now()));
        return new PipelineResult.Failed(error, entry, persisted);
    }

    private PipelineResult reject(PipelineStateMachine sm, VoiceNotesException error, Transcript partial) {
        transitionToFailed(sm);
        LOG.warn("Pipeline run rejected (kind={}): {}", error.getKind(), ErrorSanitizer.describe(error));
        publisher.publishEvent(new RunRejectedEvent(error.getKind(), ErrorSanitizer.userMessage(error), now()));
        return new PipelineResult.Rejected(error, partial);
    }

    private boolean cancelIfRequested(PipelineRun run) {
        if (run.isCancelRequested() && run.stateMachine().tryCancel()) {
            LOG.info("Pipeline run cancelled before any provider call");
            return true;
        }
        return false;
    }

    private static void transitionToFailed(PipelineStateMachine sm) {
        if (!sm.getState().isTerminal()) {
            sm.transitionTo(PipelineState.FAILED);
        }
    }

    private boolean enqueue(FailedRecording entry) {
        failedRecordings.save(entry);
        return true;
    }

    /**
     * Drops a replayed entry from the queue. On a store failure the entry stays queued and the
     * run still counts as succeeded.
     */
    private void removeReplayed(String id) {
        try {
            failedRecordings.delete(id);
            LOG.info("Replay of failed recording {} succeeded; entry removed", id);
        } catch (RuntimeException e) {
            LOG.error("Replay of failed recording {} succeeded but the entry could not be removed: {}",
                    id, ErrorSanitizer.describe(e));
        }
    }

    private FailedRecording newEntry(AudioPayload payload, Failure failure) {
        Instant createdAt = payload.createdAt() != null ? payload.createdAt() : now();
        Transcript t = failure.transcript();
        return FailedRecording.create(createdAt, now(), payload.toDataUrl(),
                t == null ? null : t.text(), t == null ? null : t.language(),
                failure.message(), failure.errorType(), failure.attempts());
    }

    private Instant now() {
        return clock.instant();
    }

    /**
     * Kinds that end a run without queueing the recording.
     */
    static boolean isEphemeral(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION, RATE_LIMIT, CREDENTIAL_MISSING -> true;
            case CREDENTIAL_INVALID, TRANSIENT_API, SCHEMA_VALIDATION, UNKNOWN -> false;
        };
    }

    /**
     * Maps a failure to the category stored with the queue entry.
     */
    static FailedRecordingErrorType classify(VoiceNotesException error, PipelineState failedIn) {
        if (error instanceof TransientApiException api && api.isNetworkFailure()) {
            return FailedRecordingErrorType.NETWORK;
        }
        return switch (failedIn) {
            case RATE_GATE_TRANSCRIPTION, TRANSCRIBING -> FailedRecordingErrorType.TRANSCRIPTION;
            case RATE_GATE_EXTRACTION, EXTRACTING -> FailedRecordingErrorType.PROCESSING;
            default -> FailedRecordingErrorType.UNKNOWN;
        };
    }

    private record Failure(String message, FailedRecordingErrorType errorType, int attempts, Transcript transcript) {}
}
