package com.phillippitts.voicenotes.domain;

import java.util.Objects;

/**
 * RESEARCH branch: generated answer to the spoken question.
 */
public record ResearchData(String researchAnswer) implements IntentData {

    public ResearchData {
        Objects.requireNonNull(researchAnswer, "researchAnswer must not be null");
    }

    @Override
    public Intent intent() {
        return Intent.RESEARCH;
    }
}
