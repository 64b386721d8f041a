package com.phillippitts.voicenotes.service.events;

import com.phillippitts.voicenotes.exception.ErrorKind;
import com.phillippitts.voicenotes.service.pipeline.event.RecordingFailedEvent;
import com.phillippitts.voicenotes.service.pipeline.event.RunRejectedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for user-facing pipeline problems. Privacy-safe and throttled to avoid log spam.
 */
@Component
class PipelineEventsListener {
    private static final Logger LOG = LogManager.getLogger(PipelineEventsListener.class);

    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private final Clock clock;

    PipelineEventsListener(Clock clock) {
        this.clock = clock;
    }

    @EventListener
    void onRecordingFailed(RecordingFailedEvent e) {
        if (!e.persisted()) {
            LOG.error("Failed recording {} could not be queued. Check voicenotes.storage.* and disk space.",
                    e.failedRecordingId());
            return;
        }
        if (e.kind() == ErrorKind.CREDENTIAL_INVALID && shouldLog("credential-invalid")) {
            LOG.warn("The provider rejected the API key. Update it via PUT /api/credentials, "
                    + "then replay queued recordings.");
        } else if (shouldLog("failed-" + e.errorType().wireName())) {
            LOG.warn("Recording queued for replay: errorType={}. Use POST /api/failed-recordings/retry-all "
                    + "once the provider is reachable.", e.errorType().wireName());
        }
    }

    @EventListener
    void onRunRejected(RunRejectedEvent e) {
        if (e.kind() == ErrorKind.CREDENTIAL_MISSING && shouldLog("credential-missing")) {
            LOG.warn("No API key configured. Set it via PUT /api/credentials or the OPENAI_API_KEY variable.");
        } else if (e.kind() == ErrorKind.RATE_LIMIT && shouldLog("rate-limit")) {
            LOG.info("Recording refused by local rate limiter: {}", e.reason());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = clock.instant();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
