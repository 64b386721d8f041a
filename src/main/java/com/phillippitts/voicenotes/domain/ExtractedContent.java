package com.phillippitts.voicenotes.domain;

import java.util.List;
import java.util.Objects;

/**
 * Structured content returned by the extraction endpoint, already checked against the
 * item schema. Becomes a {@link VoiceItem} once identity and transcript are attached.
 */
public record ExtractedContent(
        String title,
        List<String> tags,
        String summary,
        List<String> keyFacts,
        IntentData data
) {

    public ExtractedContent {
        Objects.requireNonNull(title, "title must not be null");
        Objects.requireNonNull(summary, "summary must not be null");
        Objects.requireNonNull(data, "data must not be null");
        tags = List.copyOf(Objects.requireNonNull(tags, "tags must not be null"));
        keyFacts = List.copyOf(Objects.requireNonNull(keyFacts, "keyFacts must not be null"));
    }

    public Intent intent() {
        return data.intent();
    }
}
