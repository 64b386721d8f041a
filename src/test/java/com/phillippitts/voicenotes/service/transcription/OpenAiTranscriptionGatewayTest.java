package com.phillippitts.voicenotes.service.transcription;

import com.phillippitts.voicenotes.config.properties.OpenAiProperties;
import com.phillippitts.voicenotes.domain.AudioPayload;
import com.phillippitts.voicenotes.domain.Transcript;
import com.phillippitts.voicenotes.exception.CredentialInvalidException;
import com.phillippitts.voicenotes.exception.ErrorKind;
import com.phillippitts.voicenotes.exception.TransientApiException;
import com.phillippitts.voicenotes.service.credential.Credential;
import com.phillippitts.voicenotes.testutil.TestAudio;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.net.SocketTimeoutException;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OpenAiTranscriptionGatewayTest {

    private static final String URL = "https://api.test/v1/audio/transcriptions";
    private static final Credential KEY = new Credential("sk-test", "secure-store");

    private MockRestServiceServer server;
    private OpenAiTranscriptionGateway gateway;
    private AudioPayload audio;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("https://api.test");
        server = MockRestServiceServer.bindTo(builder).build();
        gateway = new OpenAiTranscriptionGateway(builder.build(), new OpenAiProperties());
        audio = AudioPayload.of(TestAudio.webm(), "audio/webm;codecs=opus", Instant.now());
    }

    @Test
    void postsMultipartWithBearerAndParsesVerboseJson() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer sk-test"))
                .andRespond(withSuccess("{\"text\":\"  Buy milk tomorrow \",\"language\":\"english\",\"duration\":2.1}",
                        MediaType.APPLICATION_JSON));

        Transcript transcript = gateway.transcribe(audio, KEY);

        assertThat(transcript.text()).isEqualTo("Buy milk tomorrow");
        assertThat(transcript.language()).isEqualTo("english");
        server.verify();
    }

    @Test
    void missingLanguageIsNull() {
        assertThat(OpenAiTranscriptionGateway.parse("{\"text\":\"hi\"}").language()).isNull();
        assertThat(OpenAiTranscriptionGateway.parse("{\"text\":\"\",\"language\":null}").text()).isEmpty();
    }

    @Test
    void unreadableSuccessBodyIsTransient() {
        TransientApiException ex = catchThrowableOfType(() -> OpenAiTranscriptionGateway.parse("<html>"),
                TransientApiException.class);

        assertThat(ex.getStatusCode()).isEqualTo(200);
        assertThat(catchThrowableOfType(() -> OpenAiTranscriptionGateway.parse("{}"),
                TransientApiException.class)).isNotNull();
    }

    @Test
    void unauthorizedMapsToCredentialInvalid() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.UNAUTHORIZED)
                .contentType(MediaType.APPLICATION_JSON)
                .body("{\"error\":{\"message\":\"Incorrect API key provided\"}}"));

        CredentialInvalidException ex = catchThrowableOfType(() -> gateway.transcribe(audio, KEY),
                CredentialInvalidException.class);

        assertThat(ex.getKind()).isEqualTo(ErrorKind.CREDENTIAL_INVALID);
        assertThat(ex.getEndpoint()).isEqualTo("whisper");
    }

    @Test
    void rateLimitedByProviderIsTransient() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS).body("slow down"));

        TransientApiException ex = catchThrowableOfType(() -> gateway.transcribe(audio, KEY),
                TransientApiException.class);

        assertThat(ex.getStatusCode()).isEqualTo(429);
        assertThat(ex.getMessage()).contains("non-JSON error body");
    }

    @Test
    void timeoutIsNetworkFailure() {
        server.expect(requestTo(URL)).andRespond(withException(new SocketTimeoutException("Read timed out")));

        TransientApiException ex = catchThrowableOfType(() -> gateway.transcribe(audio, KEY),
                TransientApiException.class);

        assertThat(ex.isNetworkFailure()).isTrue();
        assertThat(ex.getStatusCode()).isNull();
    }

    @Test
    void fileNameFollowsMimeType() {
        assertThat(OpenAiTranscriptionGateway.fileName("audio/wav")).isEqualTo("audio.wav");
        assertThat(OpenAiTranscriptionGateway.fileName("audio/mp4")).isEqualTo("audio.m4a");
        assertThat(OpenAiTranscriptionGateway.fileName("audio/webm;codecs=opus")).isEqualTo("audio.webm");
        assertThat(OpenAiTranscriptionGateway.fileName(null)).isEqualTo("audio.webm");
    }
}
