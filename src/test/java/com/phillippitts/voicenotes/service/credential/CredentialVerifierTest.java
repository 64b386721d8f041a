package com.phillippitts.voicenotes.service.credential;

import com.phillippitts.voicenotes.exception.CredentialInvalidException;
import com.phillippitts.voicenotes.exception.CredentialMissingException;
import com.phillippitts.voicenotes.exception.TransientApiException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class CredentialVerifierTest {

    private static final String URL = "https://api.test/v1/models";

    private MockRestServiceServer server;
    private RestClient restClient;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl("https://api.test");
        server = MockRestServiceServer.bindTo(builder).build();
        restClient = builder.build();
    }

    private static CredentialResolver resolverWith(String key) {
        return new CredentialResolver(List.of(new CredentialSource() {
            @Override
            public Optional<String> lookup() {
                return Optional.ofNullable(key);
            }

            @Override
            public String name() {
                return "local";
            }
        }));
    }

    @Test
    void acceptedKeyPasses() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header("Authorization", "Bearer sk-good"))
                .andRespond(withSuccess("{\"data\":[]}", MediaType.APPLICATION_JSON));

        Credential verified = new CredentialVerifier(restClient, resolverWith("sk-good")).verifyConfigured();

        assertThat(verified.source()).isEqualTo("local");
        server.verify();
    }

    @Test
    void rejectedKeyIsCredentialInvalid() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.UNAUTHORIZED)
                .contentType(MediaType.APPLICATION_JSON)
                .body("{\"error\":{\"message\":\"Incorrect API key provided\"}}"));

        assertThatThrownBy(() -> new CredentialVerifier(restClient, resolverWith(null)).verify("sk-bad"))
                .isInstanceOf(CredentialInvalidException.class);
    }

    @Test
    void timeoutIsTransient() {
        server.expect(requestTo(URL)).andRespond(withException(new SocketTimeoutException("connect timed out")));

        assertThatThrownBy(() -> new CredentialVerifier(restClient, resolverWith(null)).verify("sk-any"))
                .isInstanceOfSatisfying(TransientApiException.class,
                        ex -> assertThat(ex.isNetworkFailure()).isTrue());
    }

    @Test
    void nothingConfiguredIsMissing() {
        assertThatThrownBy(() -> new CredentialVerifier(restClient, resolverWith(null)).verifyConfigured())
                .isInstanceOf(CredentialMissingException.class);
    }

    @Test
    void blankKeyIsRejectedLocally() {
        assertThatThrownBy(() -> new CredentialVerifier(restClient, resolverWith(null)).verify("  "))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
