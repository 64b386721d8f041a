package com.phillippitts.voicenotes.service.extraction;

import com.phillippitts.voicenotes.domain.ExtractedContent;
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
 * Rate gate, credential resolution and retried provider call for structured extraction.
 * Schema violations are terminal and reach the caller after a single attempt.
 */
public class ExtractionStage {

    private static final Logger LOG = LogManager.getLogger(ExtractionStage.class);
    static final String STAGE = "extraction";

    private final RateLimiter rateLimiter;
    private final CredentialResolver credentials;
    private final RetryOrchestrator retry;
    private final RetryPolicy policy;
    private final ExtractionGateway gateway;
    private final PipelineMetrics metrics;

    public ExtractionStage(RateLimiter rateLimiter,
                           CredentialResolver credentials,
                           RetryOrchestrator retry,
                           RetryPolicy policy,
                           ExtractionGateway gateway,
                           PipelineMetrics metrics) {
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter must not be null");
        this.credentials = Objects.requireNonNull(credentials, "credentials must not be null");
        this.retry = Objects.requireNonNull(retry, "retry must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
        this.gateway = Objects.requireNonNull(gateway, "gateway must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    public ExtractedContent extract(String transcript, String language) {
        return extract(transcript, language, () -> { });
    }

    /**
     * @param onAdmitted invoked once the rate limiter has admitted the call
     * @throws RateLimitException if the limiter refuses admission (not retried)
     * @throws com.phillippitts.voicenotes.exception.CredentialMissingException if no key is configured
     * @throws VoiceNotesException the last provider error once retries are exhausted
     */
    public ExtractedContent extract(String transcript, String language, Runnable onAdmitted) {
        try {
            RateLimitGate.admitOrThrow(rateLimiter, "content processing");
        } catch (RateLimitException e) {
            metrics.incrementRateLimited(rateLimiter.endpoint());
            LOG.warn("Extraction refused by rate limiter, retry in {} ms", e.getRetryAfterMs());
            throw e;
        }
        onAdmitted.run();

        Credential credential = credentials.resolve();

        long t0 = System.nanoTime();
        try {
            ExtractedContent content = retry.run(STAGE,
                    () -> gateway.extract(transcript, language, credential), policy);
            metrics.recordLatency(STAGE, System.nanoTime() - t0);
            metrics.incrementSuccess(STAGE);
            LOG.info("Extracted item (intent={}, tags={})", content.intent(), content.tags().size());
            return content;
        } catch (VoiceNotesException e) {
            metrics.incrementFailure(STAGE, e.getKind().name());
            throw e;
        }
    }
}
