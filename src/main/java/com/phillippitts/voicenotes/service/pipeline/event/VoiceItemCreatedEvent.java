package com.phillippitts.voicenotes.service.pipeline.event;

import com.phillippitts.voicenotes.domain.VoiceItem;

import java.time.Instant;

/**
 * Emitted when a pipeline run produces an item.
 *
 * @param item      the new item
 * @param timestamp when the run completed
 * @param replayed  {@code true} if the item came from replaying a failed recording
 */
public record VoiceItemCreatedEvent(
        VoiceItem item,
        Instant timestamp,
        boolean replayed
) {}
