package com.phillippitts.voicenotes.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for the voice-notes pipeline.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Stage latency (transcription, extraction, pipeline)</li>
 *   <li>Success/failure counts per stage and error kind</li>
 *   <li>Retry attempts and rate-limit refusals per endpoint</li>
 *   <li>Failed-recording writes and replay outcomes</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer under the {@code voicenotes.pipeline} prefix.
 *
 * @see io.micrometer.core.instrument.MeterRegistry
 */
@Component
public class PipelineMetrics {

    private static final String METRIC_PREFIX = "voicenotes.pipeline";

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records how long a stage took.
     *
     * @param stage stage name (transcription, extraction, pipeline)
     * @param durationNanos duration in nanoseconds
     */
    public void recordLatency(String stage, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".latency")
                .description("Time taken by a pipeline stage")
                .tag("stage", stage)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    public void incrementSuccess(String stage) {
        Counter.builder(METRIC_PREFIX + ".success")
                .description("Number of successful stage executions")
                .tag("stage", stage)
                .register(registry)
                .increment();
    }

    /**
     * Increments the failure counter for a stage.
     *
     * @param stage stage name
     * @param kind error kind name (TRANSIENT_API, SCHEMA_VALIDATION, ...)
     */
    public void incrementFailure(String stage, String kind) {
        Counter.builder(METRIC_PREFIX + ".failure")
                .description("Number of failed stage executions")
                .tag("stage", stage)
                .tag("kind", kind)
                .register(registry)
                .increment();
    }

    /**
     * Counts a retry scheduled after a failed attempt.
     *
     * @param operation operation being retried
     */
    public void incrementRetry(String operation) {
        Counter.builder(METRIC_PREFIX + ".retry")
                .description("Number of retries scheduled after a failed attempt")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    public void incrementRateLimited(String endpoint) {
        Counter.builder(METRIC_PREFIX + ".rate_limited")
                .description("Number of calls refused by the local rate limiter")
                .tag("endpoint", endpoint)
                .register(registry)
                .increment();
    }

    public void incrementFailedRecordingSaved(String errorType) {
        Counter.builder(METRIC_PREFIX + ".failed_recording.saved")
                .description("Number of recordings written to the failed-recording queue")
                .tag("errorType", errorType)
                .register(registry)
                .increment();
    }

    /**
     * Counts a manual replay outcome.
     *
     * @param outcome succeeded, failed or rejected
     */
    public void incrementReplay(String outcome) {
        Counter.builder(METRIC_PREFIX + ".replay")
                .description("Number of failed-recording replays by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }
}
