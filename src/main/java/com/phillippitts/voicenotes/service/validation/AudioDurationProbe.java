package com.phillippitts.voicenotes.service.validation;

import java.util.Optional;

/**
 * Determines the playback duration of encoded audio.
 */
public interface AudioDurationProbe {

    /**
     * @param bytes    encoded audio
     * @param mimeType declared MIME type (may carry parameters)
     * @return duration in seconds, or empty if this probe does not understand the container
     * @throws IllegalArgumentException if the container is recognised but malformed
     */
    Optional<Double> probe(byte[] bytes, String mimeType);
}
