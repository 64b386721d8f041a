package com.phillippitts.voicenotes.exception;

import org.junit.jupiter.api.Test;

import java.net.SocketTimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ApiExceptionBuilderTest {

    @Test
    void unauthorizedAndForbiddenBecomeCredentialInvalid() {
        VoiceNotesException unauthorized = ApiExceptionBuilder.create("Transcription failed")
                .endpoint("whisper").status(401).build();
        VoiceNotesException forbidden = ApiExceptionBuilder.create("Content processing failed")
                .endpoint("gpt-4o").status(403).build();

        assertThat(unauthorized).isInstanceOf(CredentialInvalidException.class);
        assertThat(forbidden).isInstanceOf(CredentialInvalidException.class);
        assertThat(((CredentialInvalidException) forbidden).getEndpoint()).isEqualTo("gpt-4o");
    }

    @Test
    void otherStatusesBecomeTransient() {
        VoiceNotesException ex = ApiExceptionBuilder.create("Transcription failed")
                .endpoint("whisper").status(429).durationMs(120).build();

        assertThat(ex).isInstanceOf(TransientApiException.class);
        assertThat(((TransientApiException) ex).getStatusCode()).isEqualTo(429);
        assertThat(ex.getMessage()).isEqualTo("Transcription failed (status=429, durationMs=120)");
    }

    @Test
    void missingStatusIsNetworkFailure() {
        SocketTimeoutException cause = new SocketTimeoutException("Read timed out");

        VoiceNotesException ex = ApiExceptionBuilder.create("Transcription request failed: network error")
                .endpoint("whisper").cause(cause).build();

        assertThat(ex).isInstanceOf(TransientApiException.class);
        assertThat(((TransientApiException) ex).isNetworkFailure()).isTrue();
        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.getMessage()).isEqualTo("Transcription request failed: network error");
    }

    @Test
    void metadataIsSanitizedAndTruncated() {
        VoiceNotesException ex = ApiExceptionBuilder.create("Content processing failed")
                .status(500)
                .metadata("body", "key sk-abcdefghijklmnopqrstuvwxyz0123 " + "x".repeat(300))
                .build();

        assertThat(ex.getMessage()).doesNotContain("sk-abcdefghijklmnopqrstuvwxyz0123");
        assertThat(ex.getMessage().length()).isLessThan(260);
    }

    @Test
    void rejectsEmptyMessage() {
        assertThatThrownBy(() -> ApiExceptionBuilder.create(""))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
