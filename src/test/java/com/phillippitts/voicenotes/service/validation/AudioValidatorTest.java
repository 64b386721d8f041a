package com.phillippitts.voicenotes.service.validation;

import com.phillippitts.voicenotes.config.properties.AudioValidationProperties;
import com.phillippitts.voicenotes.domain.AudioDetails;
import com.phillippitts.voicenotes.domain.AudioPayload;
import com.phillippitts.voicenotes.domain.ValidationResult;
import com.phillippitts.voicenotes.exception.InvalidAudioException;
import com.phillippitts.voicenotes.testutil.TestAudio;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class AudioValidatorTest {

    private static final Instant NOW = Instant.parse("2026-02-01T09:00:00Z");

    private AudioValidationProperties props;
    private AudioValidator validator;

    @BeforeEach
    void setUp() {
        props = new AudioValidationProperties();
        validator = new AudioValidator(props, new WavDurationProbe());
    }

    @Test
    void acceptsWebmWithCodecParameter() {
        ValidationResult result = validator.validate(AudioPayload.of(TestAudio.webm(), "audio/webm;codecs=opus", NOW));

        assertThat(result.valid()).isTrue();
        assertThat(result.error()).isNull();
        assertThat(result.details().sizeBytes()).isEqualTo(TestAudio.webm().length);
    }

    @Test
    void rejectsEmptyPayloadFirst() {
        ValidationResult result = validator.validate(AudioPayload.of(new byte[0], "video/mp4", NOW));

        assertThat(result.valid()).isFalse();
        assertThat(result.error()).isEqualTo("Audio payload is empty");
    }

    @Test
    void rejectsUnsupportedMimeTypeListingAllowedTypes() {
        ValidationResult result = validator.validate(AudioPayload.of(TestAudio.webm(), "video/mp4", NOW));

        assertThat(result.valid()).isFalse();
        assertThat(result.error()).startsWith("Invalid audio format. Allowed types: audio/webm");
        assertThat(result.details().mimeType()).isEqualTo("video/mp4");
    }

    @Test
    void missingMimeTypeIsReportedAsUnknown() {
        ValidationResult result = validator.validate(AudioPayload.of(TestAudio.webm(), null, NOW));

        assertThat(result.valid()).isFalse();
        assertThat(result.details().mimeType()).isEqualTo("unknown");
    }

    @Test
    void mimeMatchIsCaseInsensitive() {
        assertThat(AudioValidator.isAllowedMimeType("Audio/WAV", List.of("audio/wav"))).isTrue();
        assertThat(AudioValidator.isAllowedMimeType("audio/ogg", List.of("audio/wav"))).isFalse();
    }

    @Test
    void rejectsOversizedPayload() {
        props.setMaxFileSizeBytes(4);

        ValidationResult result = validator.validate(AudioPayload.of(TestAudio.webm(), "audio/webm", NOW));

        assertThat(result.valid()).isFalse();
        assertThat(result.error()).isEqualTo("Audio file size (0.00MB) exceeds maximum allowed size (0.00MB)");
    }

    @Test
    void enforcesDurationBoundsFromWavHeader() {
        props.setMinDurationSeconds(1.0);
        props.setMaxDurationSeconds(3.0);

        ValidationResult tooShort = validator.validate(AudioPayload.of(TestAudio.wav(0.5), "audio/wav", NOW));
        ValidationResult ok = validator.validate(AudioPayload.of(TestAudio.wav(2.0), "audio/wav", NOW));

        assertThat(tooShort.valid()).isFalse();
        assertThat(tooShort.error()).isEqualTo("Audio duration (0.5s) does not meet constraints (minimum 1s, maximum 3s)");
        assertThat(ok.valid()).isTrue();
        assertThat(ok.details().durationSeconds()).isEqualTo(2.0);
    }

    @Test
    void reportedDurationTakesPrecedence() {
        props.setMaxDurationSeconds(60.0);

        ValidationResult result = validator.validate(
                new AudioPayload(TestAudio.webm(), "audio/webm", 61.0, NOW));

        assertThat(result.valid()).isFalse();
        assertThat(result.details().durationSeconds()).isEqualTo(61.0);
    }

    @Test
    void undecodableDurationFailsWhenBoundsConfigured() {
        props.setMaxDurationSeconds(60.0);

        ValidationResult result = validator.validate(AudioPayload.of(TestAudio.webm(), "audio/webm", NOW));

        assertThat(result.valid()).isFalse();
        assertThat(result.error()).startsWith("Failed to validate audio duration");
    }

    @Test
    void ignoringDurationSkipsBounds() {
        props.setMaxDurationSeconds(1.0);

        ValidationResult result = validator.validateIgnoringDuration(
                new AudioPayload(TestAudio.webm(), "audio/webm", 120.0, NOW));

        assertThat(result.valid()).isTrue();
    }

    @Test
    void validateOrThrowCarriesDetails() {
        InvalidAudioException ex = catchThrowableOfType(
                () -> validator.validateOrThrow(AudioPayload.of(TestAudio.webm(), "text/plain", NOW)),
                InvalidAudioException.class);

        assertThat(ex.getMimeType()).isEqualTo("text/plain");
        assertThat(ex.getAudioSize()).isEqualTo(TestAudio.webm().length);
        AudioDetails details = validator.validateOrThrow(AudioPayload.of(TestAudio.wav(1.0), "audio/wav", NOW));
        assertThat(details.durationSeconds()).isEqualTo(1.0);
    }
}
