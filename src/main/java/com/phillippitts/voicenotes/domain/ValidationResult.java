package com.phillippitts.voicenotes.domain;

import java.util.Objects;

/**
 * Outcome of audio pre-validation.
 *
 * @param valid   whether the payload may be sent to the provider
 * @param error   human-readable reason when invalid, {@code null} otherwise
 * @param details facts gathered while validating (never null)
 */
public record ValidationResult(boolean valid, String error, AudioDetails details) {

    public ValidationResult {
        Objects.requireNonNull(details, "details must not be null");
        if (valid && error != null) {
            throw new IllegalArgumentException("A valid result must not carry an error");
        }
        if (!valid && (error == null || error.isBlank())) {
            throw new IllegalArgumentException("An invalid result must carry an error");
        }
    }

    public static ValidationResult ok(AudioDetails details) {
        return new ValidationResult(true, null, details);
    }

    public static ValidationResult invalid(String error, AudioDetails details) {
        return new ValidationResult(false, error, details);
    }
}
