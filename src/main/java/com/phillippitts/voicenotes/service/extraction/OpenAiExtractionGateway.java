package com.phillippitts.voicenotes.service.extraction;

import com.phillippitts.voicenotes.config.properties.OpenAiProperties;
import com.phillippitts.voicenotes.domain.ExtractedContent;
import com.phillippitts.voicenotes.exception.SchemaValidationException;
import com.phillippitts.voicenotes.service.credential.Credential;
import com.phillippitts.voicenotes.service.provider.ProviderHttp;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;

/**
 * Chat completion with a strict JSON-schema {@code response_format}
 * ({@code POST /v1/chat/completions}). The returned content is re-validated by
 * {@link ExtractedContentParser}.
 */
public class OpenAiExtractionGateway implements ExtractionGateway {

    public static final String ENDPOINT = "gpt-4o";

    private final RestClient restClient;
    private final OpenAiProperties props;

    public OpenAiExtractionGateway(RestClient restClient, OpenAiProperties props) {
        this.restClient = restClient;
        this.props = props;
    }

    @Override
    public ExtractedContent extract(String transcript, String language, Credential credential) {
        JSONObject payload = new JSONObject()
                .put("model", props.getExtractionModel())
                .put("messages", new JSONArray()
                        .put(new JSONObject()
                                .put("role", "user")
                                .put("content", ExtractionPromptBuilder.build(transcript, language))))
                .put("response_format", VoiceItemSchema.responseFormat());

        String body = ProviderHttp.execute(ENDPOINT, "Content processing", () -> restClient.post()
                .uri("/v1/chat/completions")
                .header(HttpHeaders.AUTHORIZATION, ProviderHttp.bearer(credential.value()))
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload.toString())
                .retrieve());

        return ExtractedContentParser.parse(messageContent(body));
    }

    @Override
    public String endpoint() {
        return ENDPOINT;
    }

    /**
     * Pulls {@code choices[0].message.content} out of a completion body. Refusals and
     * truncated output count as schema violations.
     */
    static String messageContent(String body) {
        try {
            JSONObject json = new JSONObject(body);
            JSONArray choices = json.optJSONArray("choices");
            if (choices == null || choices.isEmpty()) {
                throw new SchemaValidationException("completion has no choices", "choices");
            }
            JSONObject choice = choices.getJSONObject(0);
            if ("length".equals(choice.optString("finish_reason"))) {
                throw new SchemaValidationException("completion was truncated", "choices[0]");
            }
            JSONObject message = choice.optJSONObject("message");
            if (message == null) {
                throw new SchemaValidationException("completion has no message", "choices[0].message");
            }
            if (!message.isNull("refusal") && !message.optString("refusal").isBlank()) {
                throw new SchemaValidationException("model refused: " + message.optString("refusal"),
                        "choices[0].message.refusal");
            }
            if (message.isNull("content")) {
                throw new SchemaValidationException("completion has no content", "choices[0].message.content");
            }
            return message.getString("content");
        } catch (JSONException e) {
            throw new SchemaValidationException("completion body is not valid JSON", null, e);
        }
    }
}
