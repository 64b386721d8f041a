package com.phillippitts.voicenotes.domain;

import java.util.Objects;

/**
 * DRAFT branch: polished, ready-to-use text.
 */
public record DraftData(String draftContent) implements IntentData {

    public DraftData {
        Objects.requireNonNull(draftContent, "draftContent must not be null");
    }

    @Override
    public Intent intent() {
        return Intent.DRAFT;
    }
}
