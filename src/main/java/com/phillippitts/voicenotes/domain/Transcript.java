package com.phillippitts.voicenotes.domain;

import java.util.Objects;

/**
 * Speech-to-text output.
 *
 * @param text     transcribed text (empty for silence, never null)
 * @param language detected language code (e.g. "en", "german"), or {@code null} when the
 *                 provider did not report one
 */
public record Transcript(String text, String language) {

    public Transcript {
        Objects.requireNonNull(text, "Transcript text must not be null");
    }
}
