package com.phillippitts.voicenotes.service.transcription;

import com.phillippitts.voicenotes.domain.AudioPayload;
import com.phillippitts.voicenotes.domain.Transcript;
import com.phillippitts.voicenotes.exception.RateLimitException;
import com.phillippitts.voicenotes.exception.VoiceNotesException;
import com.phillippitts.voicenotes.service.credential.Credential;
import com.phillippitts.voicenotes.service.credential.CredentialResolver;
import com.phillippitts.voicenotes.service.metrics.PipelineMetrics;
import com.phillippitts.voicenotes.service.ratelimit.RateLimitGate;
import com.phillippitts.voicenotes.service.ratelimit.RateLimiter;
import com.phillippitts.voicenotes.service.retry.RetryOrchestrator;
import com.phillippitts.voicenotes.service.retry.RetryPolicy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;

/**
 * Rate gate, credential resolution and retried provider call for speech-to-text.
 */
public class TranscriptionStage {

    private static final Logger LOG = LogManager.getLogger(TranscriptionStage.class);
    static final String STAGE = "transcription";

    private final RateLimiter rateLimiter;
    private final CredentialResolver credentials;
    private final RetryOrchestrator retry;
    private final RetryPolicy policy;
    private final TranscriptionGateway gateway;
    private final PipelineMetrics metrics;

    public TranscriptionStage(RateLimiter rateLimiter,
                              CredentialResolver credentials,
                              RetryOrchestrator retry,
                              RetryPolicy policy,
                              TranscriptionGateway gateway,
                              PipelineMetrics metrics) {
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter must not be null");
        this.credentials = Objects.requireNonNull(credentials, "credentials must not be null");
        this.retry = Objects.requireNonNull(retry, "retry must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.gateway = Objects.requireNonNull(gateway, "gateway must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    public Transcript transcribe(AudioPayload audio) {
        return transcribe(audio, () -> { });
    }

    /**
     * @param onAdmitted invoked once the rate limiter has admitted the call
     * @throws RateLimitException if the limiter refuses admission (not retried)
     * @throws com.phillippitts.voicenotes.exception.CredentialMissingException if no key is configured
     * @throws VoiceNotesException the last provider error once retries are exhausted
     */
    public Transcript transcribe(AudioPayload audio, Runnable onAdmitted) {
        try {
            RateLimitGate.admitOrThrow(rateLimiter, "transcription");
        } catch (RateLimitException e) {
            metrics.incrementRateLimited(rateLimiter.endpoint());
            LOG.warn("Transcription refused by rate limiter, retry in {} ms", e.getRetryAfterMs());
            throw e;
        }
        onAdmitted.run();

        Credential credential = credentials.resolve();

        long t0 = System.nanoTime();
        try {
            Transcript transcript = retry.run(STAGE, () -> gateway.transcribe(audio, credential), policy);
            metrics.recordLatency(STAGE, System.nanoTime() - t0);
            metrics.incrementSuccess(STAGE);
            LOG.info("Transcribed {} bytes (language={}, chars={})", audio.sizeBytes(),
                    transcript.language(), transcript.text().length());
            return transcript;
        } catch (VoiceNotesException e) {
            metrics.incrementFailure(STAGE, e.getKind().name());
            throw e;
        }
    }
}
