/**
 * Domain models of the voice-notes pipeline.
 *
 * <p>All models are immutable records that validate themselves in their constructors.
 * {@link com.phillippitts.voicenotes.domain.IntentData} is a sealed type with one branch per
 * {@link com.phillippitts.voicenotes.domain.Intent}, so a
 * {@link com.phillippitts.voicenotes.domain.VoiceItem} cannot carry fields of a foreign intent.
 *
 * @since 1.0
 */
package com.phillippitts.voicenotes.domain;
