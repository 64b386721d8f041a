package com.phillippitts.voicenotes.service.credential;

import com.phillippitts.voicenotes.service.provider.ProviderHttp;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpHeaders;
import org.springframework.web.client.RestClient;

import java.util.Objects;

/**
 * Checks a key against the provider's model-list endpoint.
 *
 * <p>The {@link RestClient} passed in is expected to carry the bounded verification timeout
 * on both connect and read, so a hung provider surfaces as a transient error rather than a
 * stuck Settings dialog.
 */
public class CredentialVerifier {

    private static final Logger LOG = LogManager.getLogger(CredentialVerifier.class);
    static final String ENDPOINT = "models";

    private final RestClient restClient;
    private final CredentialResolver resolver;

    public CredentialVerifier(RestClient restClient, CredentialResolver resolver) {
        this.restClient = Objects.requireNonNull(restClient, "restClient must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
    }

    /**
     * Verifies the currently resolved key.
     *
     * @return the verified credential
     * @throws com.phillippitts.voicenotes.exception.CredentialMissingException if none is configured
     * @throws com.phillippitts.voicenotes.exception.CredentialInvalidException on 401/403
     * @throws com.phillippitts.voicenotes.exception.TransientApiException on timeout, I/O or other status
     */
    public Credential verifyConfigured() {
        Credential credential = resolver.resolve();
        verify(credential.value());
        return credential;
    }

    /**
     * Verifies the given key without storing it.
     */
    public void verify(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("API key must not be blank");
        }
        ProviderHttp.execute(ENDPOINT, "API key verification", () -> restClient.get()
                .uri("/v1/models")
                .header(HttpHeaders.AUTHORIZATION, ProviderHttp.bearer(apiKey.trim()))
                .retrieve());
        LOG.info("API key verified against provider");
    }
}
