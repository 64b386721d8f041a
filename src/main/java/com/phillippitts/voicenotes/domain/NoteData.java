package com.phillippitts.voicenotes.domain;

/**
 * NOTE branch: no intent-specific payload.
 */
public record NoteData() implements IntentData {

    @Override
    public Intent intent() {
        return Intent.NOTE;
    }
}
