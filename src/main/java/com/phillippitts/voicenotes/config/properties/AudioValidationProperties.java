package com.phillippitts.voicenotes.config.properties;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Configurable audio pre-validation thresholds.
 * Defaults follow the provider's upload limit: 25 MB, no duration bounds.
 *
 * <p>Note: Bean created via {@link com.phillippitts.voicenotes.VoiceNotesApplication#EnableConfigurationProperties}.
 */
@ConfigurationProperties(prefix = "voicenotes.audio.validation")
@Validated
public class AudioValidationProperties {

    /** Accepted base MIME types; parameters such as {@code ;codecs=opus} are ignored. */
    @NotEmpty(message = "At least one MIME type must be allowed")
    private List<String> allowedMimeTypes = new ArrayList<>(List.of(
            "audio/webm", "audio/wav", "audio/mp4", "audio/mpeg", "audio/mp3"));

    /** Maximum payload size in bytes (provider upload limit). */
    @Positive(message = "Maximum file size must be positive")
    private long maxFileSizeBytes = 25L * 1024 * 1024;

    /** Minimum duration in seconds, or unset for no lower bound. */
    @PositiveOrZero(message = "Minimum duration must not be negative")
    private Double minDurationSeconds;

    /** Maximum duration in seconds, or unset for no upper bound. */
    @Positive(message = "Maximum duration must be positive")
    private Double maxDurationSeconds;

    public List<String> getAllowedMimeTypes() {
        return allowedMimeTypes;
    }

    public void setAllowedMimeTypes(List<String> allowedMimeTypes) {
        this.allowedMimeTypes = allowedMimeTypes;
    }

    public long getMaxFileSizeBytes() {
        return maxFileSizeBytes;
    }

    public void setMaxFileSizeBytes(long maxFileSizeBytes) {
        this.maxFileSizeBytes = maxFileSizeBytes;
    }

    public Double getMinDurationSeconds() {
        return minDurationSeconds;
    }

    public void setMinDurationSeconds(Double minDurationSeconds) {
        this.minDurationSeconds = minDurationSeconds;
    }

    public Double getMaxDurationSeconds() {
        return maxDurationSeconds;
    }

    public void setMaxDurationSeconds(Double maxDurationSeconds) {
        this.maxDurationSeconds = maxDurationSeconds;
    }

    public boolean hasDurationBounds() {
        return minDurationSeconds != null || maxDurationSeconds != null;
    }
}
