package com.phillippitts.voicenotes.service.provider;

import com.phillippitts.voicenotes.exception.ApiExceptionBuilder;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.function.Supplier;

/**
 * Executes a provider request and maps the outcome onto the error taxonomy.
 *
 * <p>2xx returns the raw body. 401/403 become credential-invalid errors, any other status a
 * transient error carrying the status, and I/O failures or timeouts a transient error without
 * a status.
 */
public final class ProviderHttp {

    private ProviderHttp() {}

    /**
     * Performs the request built by {@code request} and returns the response body of a 2xx.
     *
     * @param endpoint  logical endpoint name for errors (e.g. "whisper")
     * @param operation human-readable operation for messages (e.g. "Transcription")
     * @param request   builds the request up to {@code retrieve()}; executed lazily here
     */
    public static String execute(String endpoint, String operation, Supplier<RestClient.ResponseSpec> request) {
        long t0 = System.nanoTime();
        ResponseEntity<String> response;
        try {
            response = request.get()
                    .onStatus(HttpStatusCode::isError, (req, res) -> { })
                    .toEntity(String.class);
        } catch (ResourceAccessException e) {
            throw ApiExceptionBuilder.create(operation + " request failed: network error")
                    .endpoint(endpoint)
                    .durationMs(elapsedMs(t0))
                    .cause(e)
                    .build();
        } catch (RestClientException e) {
            throw ApiExceptionBuilder.create(operation + " request failed")
                    .endpoint(endpoint)
                    .durationMs(elapsedMs(t0))
                    .cause(e)
                    .build();
        }

        int status = response.getStatusCode().value();
        if (response.getStatusCode().is2xxSuccessful()) {
            return response.getBody() == null ? "" : response.getBody();
        }
        throw ApiExceptionBuilder.create(operation + " failed: " + providerMessage(response))
                .endpoint(endpoint)
                .status(status)
                .durationMs(elapsedMs(t0))
                .build();
    }

    public static String bearer(String token) {
        return "Bearer " + token;
    }

    /** Provider's {@code error.message}, or the reason phrase when the body carries none. */
    static String providerMessage(ResponseEntity<String> response) {
        String body = response.getBody();
        if (body != null && !body.isBlank()) {
            try {
                JSONObject error = new JSONObject(body).optJSONObject("error");
                if (error != null && !error.optString("message").isBlank()) {
                    return error.optString("message");
                }
            } catch (JSONException notJson) {
                return "HTTP " + response.getStatusCode().value() + " (non-JSON error body)";
            }
        }
        return "HTTP " + response.getStatusCode().value();
    }

    private static long elapsedMs(long t0) {
        return (System.nanoTime() - t0) / 1_000_000L;
    }
}
