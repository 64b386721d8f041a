package com.phillippitts.voicenotes.config.properties;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Token-bucket settings, one bucket per provider endpoint.
 *
 * <p>Defaults: burst of 5, refilled at 3 requests per minute.
 */
@ConfigurationProperties(prefix = "voicenotes.rate-limit")
@Validated
public class RateLimitProperties {

    @Valid
    private Bucket transcription = new Bucket();

    @Valid
    private Bucket extraction = new Bucket();

    public Bucket getTranscription() {
        return transcription;
    }

    public void setTranscription(Bucket transcription) {
        this.transcription = transcription;
    }

    public Bucket getExtraction() {
        return extraction;
    }

    public void setExtraction(Bucket extraction) {
        this.extraction = extraction;
    }

    public static class Bucket {

        /** Bucket capacity (burst size). */
        @Positive(message = "maxTokens must be positive")
        private int maxTokens = 5;

        /** Sustained rate in requests per minute. */
        @Positive(message = "requestsPerMinute must be positive")
        private double requestsPerMinute = 3.0;

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }

        public double getRequestsPerMinute() {
            return requestsPerMinute;
        }

        public void setRequestsPerMinute(double requestsPerMinute) {
            this.requestsPerMinute = requestsPerMinute;
        }

        public double refillRatePerSecond() {
            return requestsPerMinute / 60.0;
        }
    }
}
