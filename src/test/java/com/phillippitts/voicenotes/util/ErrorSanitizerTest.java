package com.phillippitts.voicenotes.util;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorSanitizerTest {

    @Test
    void redactsBearerTokens() {
        String out = ErrorSanitizer.sanitize("Request failed: Authorization header Bearer sk-proj-abcdefghijklmnopqrstuvwxyz012345");

        assertThat(out).contains("Bearer [REDACTED_API_KEY]");
        assertThat(out).doesNotContain("abcdefghijklmnop");
    }

    @Test
    void redactsBareApiKeys() {
        String out = ErrorSanitizer.sanitize("Incorrect API key provided: sk-abcdefghijklmnopqrstuvwxyz.");

        assertThat(out).isEqualTo("Incorrect API key provided: [REDACTED_API_KEY].");
    }

    @Test
    void redactsKeyAssignmentsAndJsonAuthorization() {
        assertThat(ErrorSanitizer.sanitize("api_key=abcdef0123456789abcdef"))
                .isEqualTo("api_key=[REDACTED]");
        assertThat(ErrorSanitizer.sanitize("{\"Authorization\": \"Basic dXNlcjpwYXNz\"}"))
                .contains("[REDACTED]")
                .doesNotContain("dXNlcjpwYXNz");
    }

    @Test
    void redactsEmailsAndHomePaths() {
        String out = ErrorSanitizer.sanitize("Could not open /Users/alex/Library/key.txt for jane.doe@example.com");

        assertThat(out).isEqualTo("Could not open [PATH_REDACTED] for [EMAIL_REDACTED]");
    }

    @Test
    void leavesOrdinaryTextAlone() {
        String msg = "Transcription failed: HTTP 503 (status=503, durationMs=120)";

        assertThat(ErrorSanitizer.sanitize(msg)).isEqualTo(msg);
        assertThat(ErrorSanitizer.sanitize(null)).isEmpty();
    }

    @Test
    void describeIncludesRootCauseSanitized() {
        Exception error = new IllegalStateException("upload failed",
                new IOException("token=abcdefghijklmnopqrstuv rejected"));

        String out = ErrorSanitizer.describe(error);

        assertThat(out).startsWith("IllegalStateException: upload failed (caused by IOException:");
        assertThat(out).doesNotContain("abcdefghijklmnopqrstuv");
    }

    @Test
    void userMessageFallsBackForEmptyMessage() {
        assertThat(ErrorSanitizer.userMessage(new RuntimeException())).isEqualTo("Unknown error");
        assertThat(ErrorSanitizer.userMessage(null)).isEqualTo("Unknown error");
    }

    @Test
    void truncateHandlesEdgeCases() {
        assertThat(ErrorSanitizer.truncate("abcdef", 3)).isEqualTo("abc");
        assertThat(ErrorSanitizer.truncate("ab", 3)).isEqualTo("ab");
        assertThat(ErrorSanitizer.truncate(null, 3)).isEmpty();
        assertThat(ErrorSanitizer.truncate("abc", 0)).isEmpty();
    }
}
