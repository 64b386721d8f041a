package com.phillippitts.voicenotes.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

/**
 * Typed properties for provider call retries.
 */
@Validated
@ConfigurationProperties(prefix = "voicenotes.retry")
public class RetryProperties {

    @Min(1)
    private final int maxAttempts;

    @PositiveOrZero
    private final long initialDelayMs;

    @PositiveOrZero
    private final long maxDelayMs;

    @ConstructorBinding
    public RetryProperties(Integer maxAttempts, Long initialDelayMs, Long maxDelayMs) {
        this.maxAttempts = maxAttempts == null ? 3 : maxAttempts;
        this.initialDelayMs = initialDelayMs == null ? 1000L : initialDelayMs;
        this.maxDelayMs = maxDelayMs == null ? 8000L : maxDelayMs;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public long getInitialDelayMs() {
        return initialDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }
}
