package com.phillippitts.voicenotes.service.validation;

import com.phillippitts.voicenotes.config.properties.AudioValidationProperties;
import com.phillippitts.voicenotes.domain.AudioDetails;
import com.phillippitts.voicenotes.domain.AudioPayload;
import com.phillippitts.voicenotes.domain.ValidationResult;
import com.phillippitts.voicenotes.exception.InvalidAudioException;
import com.phillippitts.voicenotes.util.ErrorSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Pre-flight checks on an audio payload, run before any quota is spent.
 *
 * <p>Checks, in order, stopping at the first failure:
 * <ol>
 *   <li>payload present and non-empty</li>
 *   <li>MIME type present and allowed (parameters such as {@code ;codecs=opus} ignored)</li>
 *   <li>size within the configured maximum</li>
 *   <li>duration within the configured bounds, when any bound is set</li>
 * </ol>
 */
@Component
public class AudioValidator {

    private static final Logger LOG = LogManager.getLogger(AudioValidator.class);
    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    private final AudioValidationProperties props;
    private final AudioDurationProbe durationProbe;

    public AudioValidator(AudioValidationProperties props, AudioDurationProbe durationProbe) {
        this.props = props;
        this.durationProbe = durationProbe;
    }

    /**
     * Validates against the application's configured thresholds.
     */
    public ValidationResult validate(AudioPayload payload) {
        return validate(payload, props);
    }

    /**
     * Validates against the given thresholds.
     *
     * @return a result carrying the observed details whether valid or not
     */
    public ValidationResult validate(AudioPayload payload, AudioValidationProperties config) {
        if (payload == null) {
            return ValidationResult.invalid("Audio payload is null", new AudioDetails(0L, null, null));
        }
        long size = payload.sizeBytes();
        String mimeType = payload.mimeType();
        AudioDetails basic = new AudioDetails(size, mimeType, payload.durationSeconds());

        if (size <= 0) {
            return ValidationResult.invalid("Audio payload is empty", basic);
        }

        if (!isAllowedMimeType(mimeType, config.getAllowedMimeTypes())) {
            return ValidationResult.invalid("Invalid audio format. Allowed types: "
                    + String.join(", ", config.getAllowedMimeTypes()),
                    new AudioDetails(size, mimeType == null || mimeType.isBlank() ? "unknown" : mimeType,
                            payload.durationSeconds()));
        }

        if (size > config.getMaxFileSizeBytes()) {
            return ValidationResult.invalid(String.format(Locale.ROOT,
                    "Audio file size (%.2fMB) exceeds maximum allowed size (%.2fMB)",
                    size / BYTES_PER_MB, config.getMaxFileSizeBytes() / BYTES_PER_MB), basic);
        }

        if (!config.hasDurationBounds()) {
            return ValidationResult.ok(withProbedDuration(payload, basic));
        }

        Double duration;
        try {
            duration = resolveDuration(payload);
        } catch (RuntimeException e) {
            return ValidationResult.invalid("Failed to validate audio duration: "
                    + ErrorSanitizer.userMessage(e), basic);
        }
        if (duration == null) {
            return ValidationResult.invalid("Failed to validate audio duration: unable to determine duration of "
                    + mimeType + " audio", basic);
        }

        AudioDetails details = new AudioDetails(size, mimeType, duration);
        Double min = config.getMinDurationSeconds();
        Double max = config.getMaxDurationSeconds();
        if ((min != null && duration < min) || (max != null && duration > max)) {
            List<String> constraints = new ArrayList<>();
            if (min != null) {
                constraints.add("minimum " + plain(min) + "s");
            }
            if (max != null) {
                constraints.add("maximum " + plain(max) + "s");
            }
            return ValidationResult.invalid(String.format(Locale.ROOT,
                    "Audio duration (%.1fs) does not meet constraints (%s)", duration,
                    String.join(", ", constraints)), details);
        }
        return ValidationResult.ok(details);
    }

    /**
     * Validates presence, MIME type and size only. Used when replaying a stored recording,
     * which already passed the duration check when it was first submitted.
     */
    public ValidationResult validateIgnoringDuration(AudioPayload payload) {
        AudioValidationProperties structural = new AudioValidationProperties();
        structural.setAllowedMimeTypes(props.getAllowedMimeTypes());
        structural.setMaxFileSizeBytes(props.getMaxFileSizeBytes());
        return validate(payload, structural);
    }

    /**
     * Validates and throws on failure.
     *
     * @return details observed on success
     * @throws InvalidAudioException carrying the observed details
     */
    public AudioDetails validateOrThrow(AudioPayload payload) {
        ValidationResult result = validate(payload);
        if (!result.valid()) {
            AudioDetails d = result.details();
            throw new InvalidAudioException(result.error(), d.sizeBytes(), d.mimeType(), d.durationSeconds());
        }
        return result.details();
    }

    /** Strips MIME parameters and compares the base type case-insensitively. */
    static boolean isAllowedMimeType(String mimeType, List<String> allowed) {
        if (mimeType == null || mimeType.isBlank()) {
            return false;
        }
        String base = baseType(mimeType);
        for (String candidate : allowed) {
            if (candidate != null && baseType(candidate).equals(base)) {
                return true;
            }
        }
        return false;
    }

    static String baseType(String mimeType) {
        int semi = mimeType.indexOf(';');
        String base = semi >= 0 ? mimeType.substring(0, semi) : mimeType;
        return base.trim().toLowerCase(Locale.ROOT);
    }

    private Double resolveDuration(AudioPayload payload) {
        if (payload.durationSeconds() != null) {
            return payload.durationSeconds();
        }
        return durationProbe.probe(payload.bytes(), payload.mimeType()).orElse(null);
    }

    /** Best-effort duration for telemetry when no bound requires it. */
    private AudioDetails withProbedDuration(AudioPayload payload, AudioDetails basic) {
        if (basic.durationSeconds() != null) {
            return basic;
        }
        try {
            Optional<Double> probed = durationProbe.probe(payload.bytes(), payload.mimeType());
            return probed.map(d -> new AudioDetails(basic.sizeBytes(), basic.mimeType(), d)).orElse(basic);
        } catch (RuntimeException e) {
            LOG.debug("Could not probe audio duration: {}", ErrorSanitizer.describe(e));
            return basic;
        }
    }

    private static String plain(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }
}
