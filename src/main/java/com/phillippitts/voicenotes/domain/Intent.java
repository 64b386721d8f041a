package com.phillippitts.voicenotes.domain;

/**
 * Primary intent assigned to a transcript. Determines which {@link IntentData} branch a
 * {@link VoiceItem} carries.
 */
public enum Intent {
    /** Action items or tasks to be done. */
    TODO,
    /** A question or request for information. */
    RESEARCH,
    /** A request to compose something (email, message, document). */
    DRAFT,
    /** General information to remember. */
    NOTE
}
