package com.phillippitts.voicenotes.service.transcription;

import com.phillippitts.voicenotes.config.properties.OpenAiProperties;
import com.phillippitts.voicenotes.domain.AudioPayload;
import com.phillippitts.voicenotes.domain.Transcript;
import com.phillippitts.voicenotes.exception.TransientApiException;
import com.phillippitts.voicenotes.service.credential.Credential;
import com.phillippitts.voicenotes.service.provider.ProviderHttp;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.web.client.RestClient;

import java.util.Locale;

/**
 * Whisper transcription over {@code POST /v1/audio/transcriptions} (multipart,
 * {@code verbose_json} so the detected language comes back with the text).
 */
public class OpenAiTranscriptionGateway implements TranscriptionGateway {

    public static final String ENDPOINT = "whisper";

    private final RestClient restClient;
    private final OpenAiProperties props;

    public OpenAiTranscriptionGateway(RestClient restClient, OpenAiProperties props) {
        this.restClient = restClient;
        this.props = props;
    }

    @Override
    public Transcript transcribe(AudioPayload audio, Credential credential) {
        MultipartBodyBuilder builder = new MultipartBodyBuilder();
        builder.part("file", new ByteArrayResource(audio.bytes()))
                .filename(fileName(audio.mimeType()))
                .contentType(partContentType(audio.mimeType()));
        builder.part("model", props.getTranscriptionModel());
        builder.part("response_format", "verbose_json");

        String body = ProviderHttp.execute(ENDPOINT, "Transcription", () -> restClient.post()
                .uri("/v1/audio/transcriptions")
                .header(HttpHeaders.AUTHORIZATION, ProviderHttp.bearer(credential.value()))
                .contentType(MediaType.MULTIPART_FORM_DATA)
                .body(builder.build())
                .retrieve());

        return parse(body);
    }

    @Override
    public String endpoint() {
        return ENDPOINT;
    }

    /**
     * Reads {@code text} and {@code language} from a verbose_json body. An unreadable 2xx is
     * treated as a transient provider hiccup.
     */
    static Transcript parse(String body) {
        try {
            JSONObject json = new JSONObject(body);
            if (!json.has("text") || json.isNull("text")) {
                throw new TransientApiException("Transcription response missing text", ENDPOINT, 200);
            }
            String language = json.isNull("language") ? null : json.optString("language", null);
            return new Transcript(json.getString("text").trim(), language == null || language.isBlank() ? null : language);
        } catch (JSONException e) {
            throw new TransientApiException("Transcription response is not valid JSON", ENDPOINT, 200, e);
        }
    }

    static String fileName(String mimeType) {
        String base = mimeType == null ? "" : mimeType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
        return switch (base) {
            case "audio/wav", "audio/x-wav", "audio/wave" -> "audio.wav";
            case "audio/mp4", "audio/m4a", "audio/x-m4a" -> "audio.m4a";
            case "audio/mpeg", "audio/mp3" -> "audio.mp3";
            default -> "audio.webm";
        };
    }

    private static MediaType partContentType(String mimeType) {
        if (mimeType == null || mimeType.isBlank()) {
            return MediaType.APPLICATION_OCTET_STREAM;
        }
        try {
            return MediaType.parseMediaType(mimeType);
        } catch (IllegalArgumentException e) {
            return MediaType.APPLICATION_OCTET_STREAM;
        }
    }
}
