package com.phillippitts.voicenotes.service.retry;

import com.phillippitts.voicenotes.exception.ErrorKind;
import com.phillippitts.voicenotes.exception.VoiceNotesException;
import com.phillippitts.voicenotes.service.metrics.PipelineMetrics;
import com.phillippitts.voicenotes.util.ErrorSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Objects;

/**
 * Runs a call under a {@link RetryPolicy} with pure exponential backoff (no jitter).
 *
 * <p>The error that ends the loop always surfaces as a {@link VoiceNotesException} stamped
 * with the number of attempts made: domain exceptions propagate as the same instance, anything
 * else is wrapped with kind {@link ErrorKind#UNKNOWN}.
 */
@Component
public class RetryOrchestrator {

    private static final Logger LOG = LogManager.getLogger(RetryOrchestrator.class);

    private final Sleeper sleeper;
    private final PipelineMetrics metrics;

    public RetryOrchestrator(Sleeper sleeper, PipelineMetrics metrics) {
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    /**
     * Executes {@code call}, retrying while the policy allows.
     *
     * @param operation name used in logs and metrics
     * @param call      the attempt to run
     * @param policy    retry policy
     * @return the first successful result
     * @throws VoiceNotesException the error of the last attempt
     */
    public <T> T run(String operation, RetryableCall<T> call, RetryPolicy policy) {
        Objects.requireNonNull(call, "call must not be null");
        Objects.requireNonNull(policy, "policy must not be null");

        int attempt = 0;
        while (true) {
            attempt++;
            try {
                T result = call.call();
                if (attempt > 1) {
                    LOG.info("{} succeeded on attempt {}/{}", operation, attempt, policy.maxAttempts());
                }
                return result;
            } catch (Exception e) {
                VoiceNotesException error = asDomainError(e);
                error.recordAttempts(attempt);

                boolean retryable = policy.shouldRetry(error);
                if (!retryable || attempt >= policy.maxAttempts()) {
                    LOG.warn("{} failed on attempt {}/{} ({}), giving up: {}", operation, attempt,
                            policy.maxAttempts(), error.getKind(), ErrorSanitizer.describe(e));
                    throw error;
                }

                Duration delay = policy.delayAfterAttempt(attempt);
                LOG.warn("{} failed on attempt {}/{} ({}), retrying in {} ms: {}", operation, attempt,
                        policy.maxAttempts(), error.getKind(), delay.toMillis(), ErrorSanitizer.describe(e));
                metrics.incrementRetry(operation);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    LOG.warn("{} retry wait interrupted after attempt {}", operation, attempt);
                    throw error;
                }
            }
        }
    }

    private static VoiceNotesException asDomainError(Exception e) {
        if (e instanceof VoiceNotesException vne) {
            return vne;
        }
        return new VoiceNotesException(ErrorKind.UNKNOWN, ErrorSanitizer.userMessage(e), e);
    }
}
