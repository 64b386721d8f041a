package com.phillippitts.voicenotes.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable pipeline output: an intent-classified item built from one recording.
 *
 * <p>The {@code data} branch must belong to {@code intent}; together with the sealed
 * {@link IntentData} type this guarantees that exactly one of {@code todos},
 * {@code researchAnswer}, {@code draftContent} is populated for TODO/RESEARCH/DRAFT and none
 * for NOTE.
 *
 * @param id                 unique id generated at creation
 * @param createdAt          creation time
 * @param originalTranscript transcript the item was extracted from
 * @param audioData          recording as a data URL, or {@code null}
 * @param language           language of the transcript and of every generated field
 * @param title              short title
 * @param tags               2 to 5 tags, ordered
 * @param summary            2-3 sentence summary
 * @param keyFacts           ordered key facts
 * @param intent             primary intent
 * @param data               intent-specific payload
 */
public record VoiceItem(
        UUID id,
        Instant createdAt,
        String originalTranscript,
        String audioData,
        String language,
        String title,
        List<String> tags,
        String summary,
        List<String> keyFacts,
        Intent intent,
        IntentData data
) {

    public static final int MIN_TAGS = 2;
    public static final int MAX_TAGS = 5;

    /**
     * @throws IllegalArgumentException if the data branch does not match the intent or the
     *                                  tag count is outside 2..5
     */
    public VoiceItem {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(createdAt, "createdAt must not be null");
        Objects.requireNonNull(originalTranscript, "originalTranscript must not be null");
        Objects.requireNonNull(title, "title must not be null");
        Objects.requireNonNull(summary, "summary must not be null");
        Objects.requireNonNull(intent, "intent must not be null");
        Objects.requireNonNull(data, "data must not be null");
        if (data.intent() != intent) {
            throw new IllegalArgumentException(
                    "Data branch " + data.intent() + " does not match intent " + intent);
        }
        tags = List.copyOf(Objects.requireNonNull(tags, "tags must not be null"));
        if (tags.size() < MIN_TAGS || tags.size() > MAX_TAGS) {
            throw new IllegalArgumentException(
                    "Expected " + MIN_TAGS + "-" + MAX_TAGS + " tags, got: " + tags.size());
        }
        keyFacts = List.copyOf(Objects.requireNonNull(keyFacts, "keyFacts must not be null"));
    }

    /**
     * Creates an item with a fresh id from extracted content.
     */
    public static VoiceItem create(ExtractedContent content, String transcript, String audioData,
                                   String language, Instant createdAt) {
        return new VoiceItem(UUID.randomUUID(), createdAt, transcript, audioData, language,
                content.title(), content.tags(), content.summary(), content.keyFacts(),
                content.intent(), content.data());
    }
}
