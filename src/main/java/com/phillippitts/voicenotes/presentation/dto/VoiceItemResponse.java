package com.phillippitts.voicenotes.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.phillippitts.voicenotes.domain.TodoEntry;
import com.phillippitts.voicenotes.domain.VoiceItem;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Wire shape of a {@link VoiceItem}. The intent payload is flattened into {@code data}, where
 * at most one of {@code todos}, {@code researchAnswer}, {@code draftContent} is present.
 */
public record VoiceItemResponse(
        UUID id,
        Instant createdAt,
        String originalTranscript,
        String audioData,
        String language,
        String title,
        List<String> tags,
        String summary,
        List<String> keyFacts,
        String intent,
        Data data
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Data(List<TodoEntry> todos, String researchAnswer, String draftContent) {}

    public static VoiceItemResponse from(VoiceItem item) {
        return new VoiceItemResponse(item.id(), item.createdAt(), item.originalTranscript(), item.audioData(),
                item.language(), item.title(), item.tags(), item.summary(), item.keyFacts(),
                item.intent().name().toLowerCase(Locale.ROOT),
                new Data(item.data().todos(), item.data().researchAnswer(), item.data().draftContent()));
    }
}
