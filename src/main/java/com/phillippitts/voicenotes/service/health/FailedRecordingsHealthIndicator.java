package com.phillippitts.voicenotes.service.health;

import com.phillippitts.voicenotes.service.credential.CredentialResolver;
import com.phillippitts.voicenotes.service.failed.FailedRecordingStore;
import com.phillippitts.voicenotes.util.ErrorSanitizer;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the failed-recording queue.
 *
 * <ul>
 *   <li>UP: queue readable and an API key is configured</li>
 *   <li>DEGRADED: queue readable but no API key, so replays cannot run</li>
 *   <li>DOWN: queue unreadable</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class FailedRecordingsHealthIndicator implements HealthIndicator {

    private final FailedRecordingStore store;
    private final CredentialResolver credentials;

    public FailedRecordingsHealthIndicator(FailedRecordingStore store, CredentialResolver credentials) {
        this.store = store;
        this.credentials = credentials;
    }

    @Override
    public Health health() {
        int pending;
        try {
            pending = store.count();
        } catch (RuntimeException e) {
            return Health.down()
                    .withDetail("status", "Failed-recording queue unreadable")
                    .withDetail("error", ErrorSanitizer.describe(e))
                    .build();
        }

        Health.Builder builder = new Health.Builder();
        if (credentials.isConfigured()) {
            builder.up().withDetail("status", "Ready");
        } else {
            builder.status("DEGRADED").withDetail("status", "No API key configured");
        }
        return builder.withDetail("pendingFailedRecordings", pending).build();
    }
}
