package com.phillippitts.voicenotes.domain;

import java.util.Locale;

/**
 * Category of a failed pipeline run, shown next to the retry affordance.
 */
public enum FailedRecordingErrorType {
    TRANSCRIPTION,
    PROCESSING,
    NETWORK,
    UNKNOWN;

    /** Lower-case name used in the stored collection and REST bodies. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a stored value leniently: unrecognised or missing values map to {@link #UNKNOWN}.
     */
    public static FailedRecordingErrorType fromWireName(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        for (FailedRecordingErrorType type : values()) {
            if (type.wireName().equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
