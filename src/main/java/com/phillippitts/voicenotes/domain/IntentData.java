package com.phillippitts.voicenotes.domain;

import java.util.List;

/**
 * Intent-specific payload of a {@link VoiceItem}: exactly one branch per {@link Intent}.
 *
 * <p>The flat accessors mirror the wire shape ({@code todos}, {@code researchAnswer},
 * {@code draftContent}). Each returns {@code null} unless this is its owning branch, so at
 * most one of them is ever non-null and NOTE leaves all three null.
 */
public sealed interface IntentData permits TodoData, ResearchData, DraftData, NoteData {

    /** Intent this branch belongs to. */
    Intent intent();

    default List<TodoEntry> todos() {
        return null;
    }

    default String researchAnswer() {
        return null;
    }

    default String draftContent() {
        return null;
    }
}
