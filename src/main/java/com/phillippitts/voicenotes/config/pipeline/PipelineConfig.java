package com.phillippitts.voicenotes.config.pipeline;

import com.phillippitts.voicenotes.config.properties.RateLimitProperties;
import com.phillippitts.voicenotes.config.properties.RetryProperties;
import com.phillippitts.voicenotes.service.credential.CredentialResolver;
import com.phillippitts.voicenotes.service.extraction.ExtractionGateway;
import com.phillippitts.voicenotes.service.extraction.ExtractionStage;
import com.phillippitts.voicenotes.service.failed.FailedRecordingStore;
import com.phillippitts.voicenotes.service.metrics.PipelineMetrics;
import com.phillippitts.voicenotes.service.pipeline.DefaultPipelineOrchestrator;
import com.phillippitts.voicenotes.service.pipeline.FailedRecordingReplayService;
import com.phillippitts.voicenotes.service.pipeline.PipelineOrchestrator;
import com.phillippitts.voicenotes.service.ratelimit.RateLimiter;
import com.phillippitts.voicenotes.service.ratelimit.TokenBucketRateLimiter;
import com.phillippitts.voicenotes.service.retry.RetryOrchestrator;
import com.phillippitts.voicenotes.service.retry.RetryPolicy;
import com.phillippitts.voicenotes.service.retry.Sleeper;
import com.phillippitts.voicenotes.service.transcription.TranscriptionGateway;
import com.phillippitts.voicenotes.service.transcription.TranscriptionStage;
import com.phillippitts.voicenotes.service.validation.AudioValidator;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

/**
 * Wires the pipeline explicitly. Each endpoint gets its own limiter instance; the shared
 * {@link Clock} is the seam tests replace.
 */
@Configuration
public class PipelineConfig {

    static final String TRANSCRIPTION_ENDPOINT = "whisper";
    static final String EXTRACTION_ENDPOINT = "gpt-4o";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Sleeper sleeper() {
        return Sleeper.THREAD;
    }

    @Bean
    public RateLimiter transcriptionRateLimiter(RateLimitProperties props, Clock clock) {
        RateLimitProperties.Bucket bucket = props.getTranscription();
        return new TokenBucketRateLimiter(TRANSCRIPTION_ENDPOINT, bucket.getMaxTokens(),
                bucket.refillRatePerSecond(), clock);
    }

    @Bean
    public RateLimiter extractionRateLimiter(RateLimitProperties props, Clock clock) {
        RateLimitProperties.Bucket bucket = props.getExtraction();
        return new TokenBucketRateLimiter(EXTRACTION_ENDPOINT, bucket.getMaxTokens(),
                bucket.refillRatePerSecond(), clock);
    }

    @Bean
    public RetryPolicy retryPolicy(RetryProperties props) {
        return RetryPolicy.of(props.getMaxAttempts(), Duration.ofMillis(props.getInitialDelayMs()),
                Duration.ofMillis(props.getMaxDelayMs()));
    }

    @Bean
    public TranscriptionStage transcriptionStage(@Qualifier("transcriptionRateLimiter") RateLimiter limiter,
                                                 CredentialResolver credentialResolver,
                                                 RetryOrchestrator retryOrchestrator,
                                                 RetryPolicy retryPolicy,
                                                 TranscriptionGateway gateway,
                                                 PipelineMetrics metrics) {
        return new TranscriptionStage(limiter, credentialResolver, retryOrchestrator, retryPolicy, gateway, metrics);
    }

    @Bean
    public ExtractionStage extractionStage(@Qualifier("extractionRateLimiter") RateLimiter limiter,
                                           CredentialResolver credentialResolver,
                                           RetryOrchestrator retryOrchestrator,
                                           RetryPolicy retryPolicy,
                                           ExtractionGateway gateway,
                                           PipelineMetrics metrics) {
        return new ExtractionStage(limiter, credentialResolver, retryOrchestrator, retryPolicy, gateway, metrics);
    }

    @Bean
    public PipelineOrchestrator pipelineOrchestrator(AudioValidator validator,
                                                     TranscriptionStage transcriptionStage,
                                                     ExtractionStage extractionStage,
                                                     FailedRecordingStore failedRecordingStore,
                                                     PipelineMetrics metrics,
                                                     ApplicationEventPublisher publisher,
                                                     Clock clock) {
        return new DefaultPipelineOrchestrator(validator, transcriptionStage, extractionStage,
                failedRecordingStore, metrics, publisher, clock);
    }

    @Bean
    public FailedRecordingReplayService failedRecordingReplayService(FailedRecordingStore failedRecordingStore,
                                                                     PipelineOrchestrator pipelineOrchestrator) {
        return new FailedRecordingReplayService(failedRecordingStore, pipelineOrchestrator);
    }
}
